package org.boole.minimization;

import org.boole.parser.ExpressionMetadata.Complexity;

import java.util.List;

/**
 * Algoritmi consigliati per un'espressione, in ordine di priorità di inserimento.
 */
public record MinimizationRecommendation(String expression,
                                         Complexity complexity,
                                         int variableCount,
                                         List<Entry> recommendations) {

    public MinimizationRecommendation {
        recommendations = List.copyOf(recommendations);
    }

    public enum Priority {
        HIGH, MEDIUM, LOW
    }

    public record Entry(MinimizationAlgorithm algorithm, String reason, Priority priority) {
    }
}
