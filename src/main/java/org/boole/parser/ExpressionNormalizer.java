package org.boole.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NORMALIZZATORE - Riduce le notazioni alternative alla forma canonica del motore
 *
 * ALIAS RICONOSCIUTI:
 * • AND: {@code ·  *  &  &&  AND}  → {@code ·}
 * • OR:  {@code +  |  ||  OR}      → {@code +}
 * • NOT: {@code '} postfisso, barra combinante, {@code !} o {@code NOT} prefissi
 *
 * La negazione prefissa di una variabile diventa barra postfissa (!A → Ā); davanti
 * a un gruppo tra parentesi resta il {@code !} prefisso, gestito dalla grammatica.
 * Le parole chiave sono riconosciute senza distinzione di maiuscole.
 */
final class ExpressionNormalizer {

    static final char AND = '\u00B7';
    static final char OVERBAR = '\u0304';

    private static final Pattern NOT_KEYWORD = Pattern.compile("(?i)\\bNOT\\b\\s*");
    private static final Pattern AND_KEYWORD = Pattern.compile("(?i)\\bAND\\b");
    private static final Pattern OR_KEYWORD = Pattern.compile("(?i)\\bOR\\b");
    private static final Pattern PREFIX_NOT_ON_VARIABLE = Pattern.compile("!\\s*([A-Z])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ExpressionNormalizer() {
    }

    /**
     * Applica tutte le sostituzioni nell'ordine: apice, parole chiave, simboli, negazioni prefisse.
     *
     * @param text espressione grezza (non null)
     * @return testo normalizzato, spazi compressi
     */
    static String normalize(String text) {
        String result = text.trim().replace('\'', OVERBAR);

        result = NOT_KEYWORD.matcher(result).replaceAll("!");
        result = AND_KEYWORD.matcher(result).replaceAll(String.valueOf(AND));
        result = OR_KEYWORD.matcher(result).replaceAll("+");

        // && e || prima dei simboli singoli
        result = result.replace("&&", String.valueOf(AND))
                .replace("&", String.valueOf(AND))
                .replace("*", String.valueOf(AND))
                .replace("||", "+")
                .replace("|", "+");

        result = rewritePrefixNegations(result);

        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * !A → Ā ripetuto fino a punto fisso, così !!A diventa Ā̄.
     */
    private static String rewritePrefixNegations(String text) {
        String current = text;
        while (true) {
            Matcher matcher = PREFIX_NOT_ON_VARIABLE.matcher(current);
            String next = matcher.replaceAll("$1" + OVERBAR);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }
}
