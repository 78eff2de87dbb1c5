package org.boole.circuit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializzazione della stessa lista di porte in Verilog (istanze di porte) e
 * VHDL (assegnamenti concorrenti).
 *
 * Ingressi e costanti sono riferiti per segnale: il nome della variabile per gli ingressi,
 * "gate_N_out" per le altre porte.
 */
final class HdlEmitter {

    static final String MODULE_NAME = "boolean_circuit";

    private HdlEmitter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static String verilog(LogicCircuit circuit) {
        Map<String, String> signals = signals(circuit);
        List<String> ports = new ArrayList<>();
        for (Gate input : circuit.inputs()) {
            ports.add("input " + input.label());
        }
        ports.add("output " + circuit.output().label());

        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(MODULE_NAME).append("(\n  ")
                .append(String.join(",\n  ", ports)).append("\n);\n\n");

        List<String> wires = internalSignals(circuit);
        if (!wires.isEmpty()) {
            sb.append("  wire ").append(String.join(", ", wires)).append(";\n\n");
        }

        for (Gate gate : circuit.gates()) {
            switch (gate.type()) {
                case AND, OR, NOT -> sb.append("  ").append(gate.type().name().toLowerCase(Locale.ROOT))
                        .append(' ').append(gate.id()).append('(').append(gate.signal())
                        .append(", ").append(String.join(", ", inputSignals(gate, signals))).append(");\n");
                case CONSTANT -> sb.append("  assign ").append(gate.signal()).append(" = 1'b")
                        .append(gate.label()).append(";\n");
                default -> { /* porte di interfaccia */ }
            }
        }

        Gate output = circuit.output();
        sb.append("  assign ").append(output.label()).append(" = ")
                .append(signals.get(output.inputs().get(0))).append(";\n");
        sb.append("\nendmodule\n");
        return sb.toString();
    }

    static String vhdl(LogicCircuit circuit) {
        Map<String, String> signals = signals(circuit);
        StringBuilder sb = new StringBuilder();
        sb.append("library IEEE;\nuse IEEE.STD_LOGIC_1164.ALL;\n\n");
        sb.append("entity ").append(MODULE_NAME).append(" is\n  Port (\n");
        for (Gate input : circuit.inputs()) {
            sb.append("    ").append(input.label()).append(" : in STD_LOGIC;\n");
        }
        sb.append("    ").append(circuit.output().label()).append(" : out STD_LOGIC\n  );\n");
        sb.append("end ").append(MODULE_NAME).append(";\n\n");
        sb.append("architecture Behavioral of ").append(MODULE_NAME).append(" is\n");

        List<String> internal = internalSignals(circuit);
        if (!internal.isEmpty()) {
            sb.append("  signal ").append(String.join(", ", internal)).append(" : STD_LOGIC;\n");
        }
        sb.append("begin\n\n");

        for (Gate gate : circuit.gates()) {
            List<String> inputs = inputSignals(gate, signals);
            switch (gate.type()) {
                case AND -> sb.append("  ").append(gate.signal()).append(" <= ")
                        .append(String.join(" AND ", inputs)).append(";\n");
                case OR -> sb.append("  ").append(gate.signal()).append(" <= ")
                        .append(String.join(" OR ", inputs)).append(";\n");
                case NOT -> sb.append("  ").append(gate.signal()).append(" <= NOT ")
                        .append(inputs.get(0)).append(";\n");
                case CONSTANT -> sb.append("  ").append(gate.signal()).append(" <= '")
                        .append(gate.label()).append("';\n");
                default -> { /* porte di interfaccia */ }
            }
        }

        Gate output = circuit.output();
        sb.append("  ").append(output.label()).append(" <= ")
                .append(signals.get(output.inputs().get(0))).append(";\n");
        sb.append("\nend Behavioral;\n");
        return sb.toString();
    }

    private static Map<String, String> signals(LogicCircuit circuit) {
        Map<String, String> signals = new HashMap<>();
        for (Gate gate : circuit.gates()) {
            signals.put(gate.id(), gate.signal());
        }
        return signals;
    }

    private static List<String> internalSignals(LogicCircuit circuit) {
        List<String> result = new ArrayList<>();
        for (Gate gate : circuit.gates()) {
            if (gate.type().isLogic() || gate.type() == GateType.CONSTANT) {
                result.add(gate.signal());
            }
        }
        return result;
    }

    private static List<String> inputSignals(Gate gate, Map<String, String> signals) {
        List<String> result = new ArrayList<>();
        for (String input : gate.inputs()) {
            result.add(signals.get(input));
        }
        return result;
    }
}
