package org.boole.simplifier;

import java.util.List;

/**
 * Esito di un singolo metodo, in gara con gli altri per la forma più corta.
 */
public record SimplificationCandidate(SimplificationMethod method, String expression, List<SimplificationStep> steps) {

    public SimplificationCandidate {
        steps = List.copyOf(steps);
    }
}
