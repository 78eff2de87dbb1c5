package org.boole.parser;

/**
 * Metriche testuali di un'espressione normalizzata.
 *
 * @param complexity classe di complessità
 * @param operatorCount simboli operatore e parentesi presenti nel testo
 * @param depth massimo annidamento di parentesi
 */
public record ExpressionMetadata(Complexity complexity, int operatorCount, int depth) {

    /**
     * Classi di complessità di un'espressione.
     */
    public enum Complexity {
        BASIC,
        INTERMEDIATE,
        ADVANCED;

        public String label() {
            return name().toLowerCase();
        }
    }

    /**
     * Calcola le metriche sul testo normalizzato.
     *
     * SOGLIE:
     * • basic: al più 2 variabili e 3 operatori
     * • intermediate: al più 4 variabili e 8 operatori
     * • advanced: altrimenti
     */
    static ExpressionMetadata of(String normalizedText, int variableCount) {
        int operators = 0;
        int depth = 0;
        int current = 0;
        for (char c : normalizedText.toCharArray()) {
            switch (c) {
                case '+', '\u00B7', '*', '\'', '\u0304', '!' -> operators++;
                case '(' -> {
                    operators++;
                    current++;
                    depth = Math.max(depth, current);
                }
                case ')' -> {
                    operators++;
                    current--;
                }
                default -> { /* variabili, costanti, spazi */ }
            }
        }

        Complexity complexity;
        if (variableCount <= 2 && operators <= 3) {
            complexity = Complexity.BASIC;
        } else if (variableCount <= 4 && operators <= 8) {
            complexity = Complexity.INTERMEDIATE;
        } else {
            complexity = Complexity.ADVANCED;
        }
        return new ExpressionMetadata(complexity, operators, depth);
    }
}
