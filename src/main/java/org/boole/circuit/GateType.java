package org.boole.circuit;

/**
 * Tipologie di porta con larghezza di rappresentazione.
 */
public enum GateType {
    INPUT(60),
    OUTPUT(60),
    AND(60),
    OR(60),
    NOT(40),
    CONSTANT(50);

    /** Altezza comune a tutte le porte */
    public static final int HEIGHT = 30;

    private final int width;

    GateType(int width) {
        this.width = width;
    }

    public int width() {
        return width;
    }

    /**
     * @return true per AND, OR e NOT
     */
    public boolean isLogic() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * @return true per le porte senza ingressi
     */
    public boolean isSource() {
        return this == INPUT || this == CONSTANT;
    }
}
