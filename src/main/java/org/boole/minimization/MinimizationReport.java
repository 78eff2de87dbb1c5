package org.boole.minimization;

import java.util.List;
import java.util.Optional;

/**
 * Risultati ordinati per punteggio decrescente e fallimenti per algoritmo.
 */
public record MinimizationReport(List<MinimizationResult> results, List<AlgorithmFailure> failures) {

    public MinimizationReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public Optional<MinimizationResult> best() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
