package org.boole.simplifier;

/**
 * Catalogo delle leggi applicate dal semplificatore.
 */
public enum BooleanLaw {

    IDENTITY("Legge di identità"),
    NULL("Legge di annullamento"),
    IDEMPOTENT("Legge di idempotenza"),
    COMPLEMENT("Legge del complemento"),
    DOUBLE_NEGATION("Doppia negazione"),
    ABSORPTION("Legge di assorbimento"),
    DE_MORGAN("Legge di De Morgan"),
    QUINE_MCCLUSKEY("Quine-McCluskey");

    private final String displayName;

    BooleanLaw(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
