package org.boole.parser;

import org.boole.support.EngineLimits;
import org.boole.support.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Controlli strutturali sul testo normalizzato, eseguiti prima della grammatica
 * per produrre messaggi che nominano il costrutto violato.
 *
 * Tutti gli errori trovati vengono raccolti e riportati in un'unica eccezione.
 * L'annidamento oltre {@link EngineLimits#MAX_EXPRESSION_DEPTH} viene rifiutato prima di
 * controlli su parentesi e operatori.
 */
final class ExpressionValidator {

    private static final Pattern ALLOWED = Pattern.compile("^[A-Z01\\u0304+\\u00B7()!\\s]*$");
    private static final Pattern DOUBLED_OPERATOR = Pattern.compile("[+\\u00B7]{2,}");
    private static final Pattern OPERATOR_AFTER_OPEN = Pattern.compile("\\([+\\u00B7]");
    private static final Pattern OPERATOR_BEFORE_CLOSE = Pattern.compile("[+\\u00B7]\\)");

    private ExpressionValidator() {
    }

    /**
     * @param original testo fornito dall'utente, usato nel messaggio
     * @param normalized testo già normalizzato
     * @throws ExpressionSyntaxException con l'elenco dei costrutti violati
     * @throws org.boole.support.CapacityExceededException se l'annidamento supera il limite
     */
    static void validate(String original, String normalized) {
        List<String> violations = new ArrayList<>();

        if (normalized.isBlank()) {
            throw new ExpressionSyntaxException(original, "espressione vuota");
        }

        if (!ALLOWED.matcher(normalized).matches()) {
            violations.add("caratteri non ammessi " + invalidCharacters(normalized));
        }

        String compact = normalized.replaceAll("\\s", "");
        EngineLimits.requireNestable("Annidamento dell'espressione", nestingDepth(compact));
        checkParentheses(compact, violations);

        if (compact.contains("()")) {
            violations.add("parentesi vuote '()'");
        }
        if (DOUBLED_OPERATOR.matcher(compact).find()) {
            violations.add("operatori consecutivi");
        }
        if (OPERATOR_AFTER_OPEN.matcher(compact).find()) {
            violations.add("operatore subito dopo '('");
        }
        if (OPERATOR_BEFORE_CLOSE.matcher(compact).find()) {
            violations.add("operatore subito prima di ')'");
        }
        if (isOperator(compact.charAt(0))) {
            violations.add("operatore iniziale '" + compact.charAt(0) + "'");
        }
        if (isOperator(compact.charAt(compact.length() - 1))) {
            violations.add("operatore finale '" + compact.charAt(compact.length() - 1) + "'");
        }

        if (!violations.isEmpty()) {
            throw new ExpressionSyntaxException(original, violations);
        }
    }

    private static void checkParentheses(String compact, List<String> violations) {
        int open = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                open--;
                if (open < 0) {
                    violations.add("parentesi chiusa prima di una aperta in posizione " + i);
                    return;
                }
            }
        }
        if (open > 0) {
            violations.add(open + " parentesi aperte non chiuse");
        }
    }

    /**
     * Parentesi aperte più negazioni prefisse della catena di aperture corrente,
     * massimo sul testo. Una parentesi chiusa in eccesso non porta il conteggio sotto zero.
     */
    static int nestingDepth(String compact) {
        int open = 0;
        int prefixRun = 0;
        int max = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            switch (c) {
                case '!' -> prefixRun++;
                case '(' -> open++;
                case ')' -> {
                    open = Math.max(0, open - 1);
                    prefixRun = 0;
                }
                default -> prefixRun = 0;
            }
            max = Math.max(max, open + prefixRun);
        }
        return max;
    }

    private static boolean isOperator(char c) {
        return c == '+' || c == ExpressionNormalizer.AND;
    }

    private static String invalidCharacters(String text) {
        Set<String> invalid = new LinkedHashSet<>();
        for (char c : text.toCharArray()) {
            String symbol = String.valueOf(c);
            if (!ALLOWED.matcher(symbol).matches()) {
                invalid.add("'" + symbol + "'");
            }
        }
        return String.join(", ", invalid);
    }
}
