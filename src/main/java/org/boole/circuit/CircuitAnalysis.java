package org.boole.circuit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Metriche del circuito e suggerimenti di ottimizzazione puramente informativi.
 *
 * @param totalGates porte logiche (AND, OR, NOT)
 * @param inputCount porte d'ingresso
 * @param depth livelli dalla porta d'uscita agli ingressi, uscita compresa
 */
public record CircuitAnalysis(int totalGates, int inputCount, int depth, Complexity complexity, List<String> suggestions) {

    public enum Complexity {
        LOW("Low"),
        MEDIUM("Medium"),
        HIGH("High");

        private final String label;

        Complexity(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public CircuitAnalysis {
        suggestions = List.copyOf(suggestions);
    }

    static CircuitAnalysis of(List<Gate> gates) {
        int totalGates = 0;
        int inputCount = 0;
        int notCount = 0;
        for (Gate gate : gates) {
            if (gate.type().isLogic()) {
                totalGates++;
            }
            if (gate.type() == GateType.INPUT) {
                inputCount++;
            }
            if (gate.type() == GateType.NOT) {
                notCount++;
            }
        }
        int depth = depth(gates);

        Complexity complexity;
        if (totalGates <= 3 && inputCount <= 2) {
            complexity = Complexity.LOW;
        } else if (totalGates <= 8 && inputCount <= 4 && depth <= 3) {
            complexity = Complexity.MEDIUM;
        } else {
            complexity = Complexity.HIGH;
        }

        List<String> suggestions = new ArrayList<>();
        if (totalGates > 10) {
            suggestions.add("Semplificare l'espressione booleana per ridurre il numero di porte");
        }
        if (depth > 5) {
            suggestions.add("Profondità elevata: valutare una struttura più parallela");
        }
        if (notCount > inputCount) {
            suggestions.add("Molte porte NOT: valutare l'applicazione delle leggi di De Morgan");
        }
        return new CircuitAnalysis(totalGates, inputCount, depth, complexity, suggestions);
    }

    private static int depth(List<Gate> gates) {
        Map<String, Gate> byId = new HashMap<>();
        for (Gate gate : gates) {
            byId.put(gate.id(), gate);
        }
        Map<String, Integer> memo = new HashMap<>();
        for (Gate gate : gates) {
            if (gate.type() == GateType.OUTPUT) {
                return levelOf(gate, byId, memo);
            }
        }
        return 0;
    }

    /**
     * Livello di una porta: 0 per ingressi e costanti, altrimenti 1 + massimo degli ingressi.
     */
    static int levelOf(Gate gate, Map<String, Gate> byId, Map<String, Integer> memo) {
        Integer cached = memo.get(gate.id());
        if (cached != null) {
            return cached;
        }
        int level = 0;
        if (!gate.type().isSource()) {
            int max = 0;
            for (String input : gate.inputs()) {
                Gate source = byId.get(input);
                if (source != null) {
                    max = Math.max(max, levelOf(source, byId, memo));
                }
            }
            level = max + 1;
        }
        memo.put(gate.id(), level);
        return level;
    }
}
