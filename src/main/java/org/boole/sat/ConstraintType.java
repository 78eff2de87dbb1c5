package org.boole.sat;

/**
 * Tipologie di vincolo ammesse dal solutore.
 */
public enum ConstraintType {

    /** Ogni variabile elencata vale il valore atteso */
    EQUALS,

    /** Nessuna variabile elencata vale il valore atteso */
    NOT_EQUALS,

    AT_LEAST_ONE,

    AT_MOST_ONE,

    EXACTLY_ONE,

    /** L'espressione analizzata deve valere 1 */
    EXPRESSION
}
