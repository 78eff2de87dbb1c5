package org.boole.minimization;

import java.util.List;

/**
 * Confronto dei tre algoritmi sulla stessa espressione.
 *
 * @param bestAlgorithm algoritmo col punteggio più alto, "none" se nessuno è riuscito
 */
public record MinimizationComparison(String originalExpression,
                                     List<MinimizationResult> results,
                                     String bestAlgorithm,
                                     long averageReduction,
                                     long averageGateCount,
                                     long totalProcessingTime) {

    public MinimizationComparison {
        results = List.copyOf(results);
    }
}
