package org.boole.sat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Lettura di vincoli di cardinalità da descrizioni testuali.
 *
 * Riconosce "at most one", "exactly one" e "at least one" (e gli equivalenti
 * "al più uno", "esattamente uno", "almeno uno"); ogni vincolo riconosciuto si applica
 * a tutte le variabili fornite. Le descrizioni non riconosciute vengono ignorate.
 */
public final class ConstraintParser {

    private static final Logger LOGGER = Logger.getLogger(ConstraintParser.class.getName());

    private ConstraintParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static List<SATConstraint> parse(List<String> descriptions, List<String> variables) {
        List<SATConstraint> constraints = new ArrayList<>();
        if (variables.isEmpty()) {
            return constraints;
        }

        for (String description : descriptions) {
            String text = description == null ? "" : description.toLowerCase(Locale.ROOT);

            if (text.contains("at most one") || text.contains("al più uno")) {
                constraints.add(SATConstraint.atMostOne(variables));
            } else if (text.contains("exactly one") || text.contains("esattamente uno")) {
                constraints.add(SATConstraint.exactlyOne(variables));
            } else if (text.contains("at least one") || text.contains("almeno uno")) {
                constraints.add(SATConstraint.atLeastOne(variables));
            } else {
                LOGGER.warning("Vincolo non riconosciuto, ignorato: '" + description + "'");
            }
        }
        return constraints;
    }
}
