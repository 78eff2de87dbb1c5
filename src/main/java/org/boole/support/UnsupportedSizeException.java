package org.boole.support;

/**
 * Numero di variabili fuori dall'intervallo gestito dalle mappe di Karnaugh.
 */
public class UnsupportedSizeException extends BooleanEngineException {

    private final int variableCount;

    public UnsupportedSizeException(int variableCount, int min, int max) {
        super("Mappe di Karnaugh supportate da " + min + " a " + max + " variabili, richieste " + variableCount);
        this.variableCount = variableCount;
    }

    public int getVariableCount() {
        return variableCount;
    }
}
