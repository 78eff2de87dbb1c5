package org.boole.circuit;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.NodeVisitor;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.ast.Variable;
import org.boole.parser.ParsedExpression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * GENERATORE DI CIRCUITI - Traduzione dell'albero sintattico in una rete di porte
 *
 * COSTRUZIONE (dal basso verso l'alto):
 * • una porta INPUT per variabile, condivisa da tutte le occorrenze
 * • una porta CONSTANT per ogni foglia costante
 * • una porta per ogni nodo NOT, AND, OR, creata dopo le porte dei suoi operandi
 * • un'unica porta OUTPUT collegata alla porta della radice, di nome Y
 *   oppure Y_OUT se Y è una delle variabili
 *
 * Le porte sono create solo dopo i propri ingressi, quindi la rete è aciclica.
 * I collegamenti sono derivati dagli ingressi delle porte dopo la disposizione.
 */
public class CircuitGenerator {

    private static final Logger LOGGER = Logger.getLogger(CircuitGenerator.class.getName());

    private static final int ORIGIN = 50;

    static final String OUTPUT_ID = "output";
    static final String OUTPUT_LABEL = "Y";

    /** Nome della porta d'uscita quando Y è già una variabile d'ingresso */
    static final String OUTPUT_LABEL_FALLBACK = "Y_OUT";

    public LogicCircuit generate(ParsedExpression parsed) {
        return generate(parsed, CircuitOptions.defaults());
    }

    public LogicCircuit generate(ParsedExpression parsed, CircuitOptions options) {
        Builder builder = new Builder(options);
        for (String variable : parsed.variables()) {
            builder.input(variable);
        }
        builder.advanceColumn();

        String root = parsed.ast().accept(builder);
        builder.output(root, outputLabel(parsed.variables()), parsed.variableCount());

        List<Gate> gates = options.layout() == LayoutStrategy.LEVELED
                ? leveled(builder.gates, options)
                : builder.gates;
        List<Connection> connections = connect(gates);

        LogicCircuit circuit = new LogicCircuit(parsed.originalText(), gates, connections,
                Bounds.of(gates), CircuitAnalysis.of(gates));
        LOGGER.fine(() -> "Circuito per '" + parsed.normalizedText() + "': " + circuit.analysis().totalGates()
                + " porte logiche, profondità " + circuit.analysis().depth());
        return circuit;
    }

    /**
     * Le variabili sono lettere singole: un nome di più caratteri non entra mai in conflitto
     * con una porta d'ingresso.
     */
    static String outputLabel(List<String> variables) {
        return variables.contains(OUTPUT_LABEL) ? OUTPUT_LABEL_FALLBACK : OUTPUT_LABEL;
    }

    //region COSTRUZIONE

    /**
     * Visita post-ordine che crea le porte con disposizione in ordine di costruzione.
     * Restituisce l'identificativo della porta che produce il valore del nodo.
     */
    private static final class Builder implements NodeVisitor<String> {

        private final CircuitOptions options;
        private final List<Gate> gates = new ArrayList<>();
        private final Map<String, String> inputIds = new HashMap<>();
        private int counter = 0;
        private double currentX = ORIGIN;
        private double currentY = ORIGIN;

        Builder(CircuitOptions options) {
            this.options = options;
        }

        void input(String variable) {
            String id = nextId();
            Position position = new Position(ORIGIN, ORIGIN + (double) inputIds.size() * options.spacingY());
            gates.add(new Gate(id, GateType.INPUT, variable, variable, List.of(), position));
            inputIds.put(variable, id);
        }

        void advanceColumn() {
            currentX += options.spacingX();
        }

        void output(String root, String label, int variableCount) {
            Position position = new Position(currentX, ORIGIN + (double) (variableCount / 2) * options.spacingY());
            gates.add(new Gate(OUTPUT_ID, GateType.OUTPUT, label, label, List.of(root), position));
        }

        @Override
        public String visitVariable(Variable variable) {
            String id = inputIds.get(variable.name());
            if (id == null) {
                throw new IllegalStateException("Variabile senza porta d'ingresso: " + variable.name());
            }
            return id;
        }

        @Override
        public String visitConstant(Constant constant) {
            String id = nextId();
            String value = constant.value() ? "1" : "0";
            gates.add(new Gate(id, GateType.CONSTANT, value, id + "_out", List.of(),
                    new Position(currentX, currentY)));
            currentY += options.spacingY();
            return id;
        }

        @Override
        public String visitNot(Not not) {
            String operand = not.operand().accept(this);
            return logicGate(GateType.NOT, List.of(operand));
        }

        @Override
        public String visitAnd(And and) {
            String left = and.left().accept(this);
            String right = and.right().accept(this);
            return logicGate(GateType.AND, List.of(left, right));
        }

        @Override
        public String visitOr(Or or) {
            String left = or.left().accept(this);
            String right = or.right().accept(this);
            return logicGate(GateType.OR, List.of(left, right));
        }

        private String logicGate(GateType type, List<String> inputs) {
            String id = nextId();
            gates.add(new Gate(id, type, type.name(), id + "_out", inputs, new Position(currentX, currentY)));
            currentY += options.spacingY();
            currentX += options.spacingX();
            return id;
        }

        private String nextId() {
            return "gate_" + counter++;
        }
    }

    //endregion

    //region DISPOSIZIONE E COLLEGAMENTI

    /**
     * Una colonna per livello, righe nell'ordine di costruzione.
     */
    static List<Gate> leveled(List<Gate> gates, CircuitOptions options) {
        Map<String, Gate> byId = new LinkedHashMap<>();
        for (Gate gate : gates) {
            byId.put(gate.id(), gate);
        }
        Map<String, Integer> memo = new HashMap<>();
        Map<Integer, List<Gate>> levels = new TreeMap<>();
        for (Gate gate : gates) {
            int level = CircuitAnalysis.levelOf(gate, byId, memo);
            levels.computeIfAbsent(level, k -> new ArrayList<>()).add(gate);
        }

        Map<String, Position> positions = new HashMap<>();
        for (Map.Entry<Integer, List<Gate>> entry : levels.entrySet()) {
            double x = ORIGIN + (double) entry.getKey() * options.spacingX();
            double y = ORIGIN;
            for (Gate gate : entry.getValue()) {
                positions.put(gate.id(), new Position(x, y));
                y += options.spacingY();
            }
        }

        List<Gate> result = new ArrayList<>(gates.size());
        for (Gate gate : gates) {
            result.add(gate.withPosition(positions.get(gate.id())));
        }
        return result;
    }

    static List<Connection> connect(List<Gate> gates) {
        Map<String, Gate> byId = new HashMap<>();
        for (Gate gate : gates) {
            byId.put(gate.id(), gate);
        }

        List<Connection> connections = new ArrayList<>();
        for (Gate gate : gates) {
            int count = gate.inputs().size();
            for (int i = 0; i < count; i++) {
                Gate source = byId.get(gate.inputs().get(i));
                Position from = new Position(source.position().x() + source.width(),
                        source.position().y() + source.height() / 2.0);
                Position to = new Position(gate.position().x(),
                        gate.position().y() + (i + 1) * ((double) gate.height() / (count + 1)));
                connections.add(new Connection(source.id(), gate.id(), i, from, to));
            }
        }
        return connections;
    }

    //endregion
}
