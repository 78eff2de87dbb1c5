package org.boole.simplifier;

/**
 * Metodo di semplificazione richiesto. AUTO prova tutti gli altri nell'ordine dichiarato.
 */
public enum SimplificationMethod {

    AUTO("Automatico"),
    BASIC("Leggi di base"),
    DEMORGAN("De Morgan + leggi di base"),
    QUINE_MCCLUSKEY("Quine-McCluskey");

    private final String displayName;

    SimplificationMethod(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    boolean includes(SimplificationMethod candidate) {
        return this == AUTO || this == candidate;
    }
}
