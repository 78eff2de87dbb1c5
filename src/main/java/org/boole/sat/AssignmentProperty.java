package org.boole.sat;

/**
 * Proprietà desiderate sugli assegnamenti, tradotte in vincoli di cardinalità.
 */
public enum AssignmentProperty {

    /** Al più una variabile vera */
    MINIMIZE_TRUE,

    /** Almeno una variabile vera */
    MAXIMIZE_TRUE,

    /** Esattamente una variabile vera nella prima metà delle variabili */
    BALANCE
}
