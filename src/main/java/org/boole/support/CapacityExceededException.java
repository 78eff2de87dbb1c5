package org.boole.support;

/**
 * Grandezza oltre il limite ammesso: variabili di un'enumerazione esaustiva oppure
 * livelli di annidamento di un'espressione.
 */
public class CapacityExceededException extends BooleanEngineException {

    private final int limit;
    private final int actual;

    public CapacityExceededException(String operation, int limit, int actual) {
        this(operation, limit, actual, "variabili");
    }

    /**
     * @param unit grandezza misurata, al plurale (es. "livelli di annidamento")
     */
    public CapacityExceededException(String operation, int limit, int actual, String unit) {
        super(operation + ": " + actual + " " + unit + " oltre il limite di " + limit);
        this.limit = limit;
        this.actual = actual;
    }

    public int getLimit() {
        return limit;
    }

    public int getActual() {
        return actual;
    }
}
