package org.boole.ast;

/**
 * Notazione usata per rappresentare la negazione nel testo prodotto dal motore.
 */
public enum Notation {

    /** Barra combinante U+0304 dopo il letterale o il gruppo: Ā, (AB)̄ */
    OVERBAR("\u0304"),

    /** Apice postfisso: A', (AB)' */
    APOSTROPHE("'");

    private final String negationMark;

    Notation(String negationMark) {
        this.negationMark = negationMark;
    }

    /**
     * Simbolo di negazione postfisso per questa notazione.
     */
    public String negationMark() {
        return negationMark;
    }

    /**
     * Rende un letterale nella notazione corrente.
     *
     * @param variable nome della variabile
     * @param positive true per il letterale diretto, false per quello complementato
     */
    public String literal(String variable, boolean positive) {
        return positive ? variable : variable + negationMark;
    }
}
