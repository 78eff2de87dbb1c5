package org.boole.conversion;

import org.boole.support.UnsupportedAlgorithmException;

/**
 * Forma normale di destinazione.
 */
public enum TargetForm {

    /** Somma di prodotti */
    SOP("sop"),

    /** Prodotto di somme */
    POS("pos");

    private final String id;

    TargetForm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static TargetForm fromId(String id) {
        for (TargetForm form : values()) {
            if (form.id.equalsIgnoreCase(id)) {
                return form;
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }
}
