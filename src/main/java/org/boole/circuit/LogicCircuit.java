package org.boole.circuit;

import java.util.List;
import java.util.Optional;

/**
 * Circuito combinatorio: porte, collegamenti, riquadro e analisi.
 * Esiste sempre esattamente una porta OUTPUT.
 */
public record LogicCircuit(String expression,
                           List<Gate> gates,
                           List<Connection> connections,
                           Bounds bounds,
                           CircuitAnalysis analysis) {

    public LogicCircuit {
        gates = List.copyOf(gates);
        connections = List.copyOf(connections);
        long outputs = gates.stream().filter(g -> g.type() == GateType.OUTPUT).count();
        if (outputs != 1) {
            throw new IllegalArgumentException("Il circuito deve avere esattamente una porta OUTPUT, trovate " + outputs);
        }
    }

    public Gate output() {
        return gates.stream().filter(g -> g.type() == GateType.OUTPUT).findFirst().orElseThrow();
    }

    public Optional<Gate> gate(String id) {
        return gates.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    public List<Gate> inputs() {
        return gates.stream().filter(g -> g.type() == GateType.INPUT).toList();
    }

    public String toVerilog() {
        return HdlEmitter.verilog(this);
    }

    public String toVhdl() {
        return HdlEmitter.vhdl(this);
    }
}
