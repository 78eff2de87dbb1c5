package org.boole.minimization;

import org.boole.support.ExpressionMetrics;

/**
 * Esito di un algoritmo di minimizzazione con le metriche di confronto.
 *
 * @param algorithm identificativo dell'algoritmo ("trivial" per funzioni costanti)
 * @param expression espressione SOP minimizzata
 * @param originalExpression testo di partenza
 * @param gateCount operatori (+ e negazioni) nell'espressione minimizzata
 * @param depth massimo annidamento di parentesi
 * @param reductionPercentage riduzione di lunghezza rispetto all'originale, arrotondata
 * @param performance punteggio 0-100 usato per l'ordinamento
 * @param processingTimeMs durata dell'algoritmo
 */
public record MinimizationResult(String algorithm,
                                 String expression,
                                 String originalExpression,
                                 int gateCount,
                                 int depth,
                                 long reductionPercentage,
                                 long performance,
                                 long processingTimeMs,
                                 int mintermCount,
                                 int variableCount) {

    static final String TRIVIAL = "trivial";

    /**
     * Calcola le metriche dell'espressione ottenuta.
     */
    static MinimizationResult of(String algorithm, String expression, String originalExpression,
                                 long processingTimeMs, int mintermCount, int variableCount, boolean scored) {
        long performance = scored ? performanceScore(expression, originalExpression, processingTimeMs) : 0;
        return new MinimizationResult(algorithm, expression, originalExpression,
                ExpressionMetrics.gateCount(expression), ExpressionMetrics.nestingDepth(expression),
                ExpressionMetrics.reductionPercentage(originalExpression, expression),
                performance, processingTimeMs, mintermCount, variableCount);
    }

    /**
     * PUNTEGGIO = 50·riduzione + 30·velocità + 20·lunghezza
     *
     * • riduzione: frazione di lunghezza risparmiata, minimo 0
     * • velocità: 1 - tempo/10s, minimo 0
     * • lunghezza: 1 - caratteri/100, minimo 0
     */
    static long performanceScore(String expression, String originalExpression, long processingTimeMs) {
        double reductionFactor = Math.max(0, (originalExpression.length() - expression.length())
                / (double) Math.max(1, originalExpression.length()));
        double speedFactor = Math.max(0, 1 - processingTimeMs / 10_000.0);
        double lengthFactor = Math.max(0, 1 - expression.length() / 100.0);
        return Math.round(reductionFactor * 50 + speedFactor * 30 + lengthFactor * 20);
    }
}
