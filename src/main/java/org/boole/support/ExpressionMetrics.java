package org.boole.support;

/**
 * Metriche testuali condivise da semplificatore e minimizzatori.
 */
public final class ExpressionMetrics {

    private ExpressionMetrics() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Numero di operatori: OR, AND esplicito e barre di negazione.
     */
    public static int gateCount(String expression) {
        int count = 0;
        for (char c : expression.toCharArray()) {
            if (c == '+' || c == '\u00B7' || c == '\u0304') {
                count++;
            }
        }
        return count;
    }

    /**
     * Massimo annidamento di parentesi.
     */
    public static int nestingDepth(String expression) {
        int max = 0;
        int current = 0;
        for (char c : expression.toCharArray()) {
            if (c == '(') {
                max = Math.max(max, ++current);
            } else if (c == ')') {
                current--;
            }
        }
        return max;
    }

    /**
     * Riduzione percentuale di lunghezza, arrotondata; negativa se il risultato è più lungo.
     */
    public static long reductionPercentage(String original, String result) {
        if (original.isEmpty()) {
            return 0;
        }
        return Math.round((original.length() - result.length()) * 100.0 / original.length());
    }
}
