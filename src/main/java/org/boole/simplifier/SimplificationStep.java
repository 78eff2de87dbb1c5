package org.boole.simplifier;

/**
 * Singola applicazione di una legge.
 *
 * @param expression espressione completa dopo il passo
 * @param law legge applicata
 * @param description forma generale della legge, es. "A + 0 = A"
 * @param before (sotto)espressione prima della riscrittura
 * @param after (sotto)espressione dopo la riscrittura
 */
public record SimplificationStep(String expression, BooleanLaw law, String description, String before, String after) {

    public String rule() {
        return law.displayName();
    }
}
