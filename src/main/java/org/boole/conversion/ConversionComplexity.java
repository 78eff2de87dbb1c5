package org.boole.conversion;

/**
 * Complessità di una forma convertita, da numero di termini e lunghezza.
 */
public enum ConversionComplexity {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    ConversionComplexity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * LOW: ≤2 termini e ≤10 caratteri; MEDIUM: ≤4 termini e ≤25 caratteri; altrimenti HIGH.
     */
    public static ConversionComplexity of(int termCount, int length) {
        if (termCount <= 2 && length <= 10) {
            return LOW;
        }
        if (termCount <= 4 && length <= 25) {
            return MEDIUM;
        }
        return HIGH;
    }
}
