package org.boole;

import org.boole.support.UnsupportedAlgorithmException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Operazioni selezionabili del motore. Il parsing viene sempre eseguito.
 */
public enum Operation {
    PARSE("parse"),
    SIMPLIFY("simplify"),
    TRUTH("truth"),
    KMAP("kmap"),
    MINIMIZE("minimize"),
    SAT("sat"),
    SOP("sop"),
    POS("pos"),
    CIRCUIT("circuit");

    private static final String ALL = "all";

    private final String id;

    Operation(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Operation fromId(String id) {
        for (Operation operation : values()) {
            if (operation.id.equalsIgnoreCase(id)) {
                return operation;
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }

    /**
     * Lista separata da virgole, oppure "all".
     *
     * @throws UnsupportedAlgorithmException per un identificativo sconosciuto
     */
    public static Set<Operation> parseList(String list) {
        if (list == null || list.isBlank() || ALL.equals(list.trim().toLowerCase(Locale.ROOT))) {
            return EnumSet.allOf(Operation.class);
        }
        Set<Operation> result = EnumSet.noneOf(Operation.class);
        for (String token : list.split(",")) {
            if (!token.isBlank()) {
                result.add(fromId(token.trim()));
            }
        }
        return result;
    }
}
