package org.boole.sat;

import org.boole.support.UnsupportedAlgorithmException;

/**
 * Strategie di ricerca del solutore.
 */
public enum SearchMethod {

    /** DPLL fino al limite di enumerazione, WalkSAT oltre */
    AUTO("auto"),
    DPLL("dpll"),
    WALKSAT("walksat"),
    BRUTE_FORCE("brute-force");

    private final String id;

    SearchMethod(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws UnsupportedAlgorithmException se l'identificativo non corrisponde ad alcun metodo
     */
    public static SearchMethod fromId(String id) {
        for (SearchMethod method : values()) {
            if (method.id.equalsIgnoreCase(id) || method.name().equalsIgnoreCase(id)) {
                return method;
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }
}
