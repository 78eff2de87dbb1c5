package org.boole.conversion;

/**
 * Confronto tra forma SOP e forma POS della stessa espressione.
 *
 * @param recommendation forma più corta, SOP a parità di lunghezza
 */
public record FormComparison(Summary sop, Summary pos, TargetForm recommendation) {

    public record Summary(String expression, ConversionComplexity complexity, int termCount, int length) {

        static Summary of(ConversionResult result) {
            return new Summary(result.converted(), result.metadata().complexity(),
                    result.metadata().termCount(), result.converted().length());
        }
    }
}
