package org.boole.simplifier;

import java.util.List;

/**
 * RISULTATO DELLA SEMPLIFICAZIONE
 *
 * Contiene la forma scelta (la più corta tra i metodi tentati), il metodo vincente,
 * la storia completa dei passi di quel metodo e le alternative scartate.
 *
 * @param reductionPercentage riduzione di lunghezza rispetto all'originale, arrotondata
 * @param gateCount operatori (+, ·, negazioni) nella forma semplificata
 */
public record SimplificationResult(String originalExpression,
                                   String simplifiedExpression,
                                   SimplificationMethod method,
                                   List<SimplificationStep> steps,
                                   List<SimplificationMethod> methodsAttempted,
                                   List<SimplificationCandidate> alternatives,
                                   long reductionPercentage,
                                   int gateCount) {

    public SimplificationResult {
        steps = List.copyOf(steps);
        methodsAttempted = List.copyOf(methodsAttempted);
        alternatives = List.copyOf(alternatives);
    }

    /**
     * Nomi delle leggi applicate, nell'ordine.
     */
    public List<String> rulesApplied() {
        return steps.stream().map(SimplificationStep::rule).toList();
    }
}
