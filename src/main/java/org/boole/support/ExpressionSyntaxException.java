package org.boole.support;

import java.util.List;

/**
 * Espressione non valida: carattere non ammesso, parentesi sbilanciate, operatori
 * mal posizionati o struttura non riconosciuta dalla grammatica.
 */
public class ExpressionSyntaxException extends BooleanEngineException {

    /** Testo dell'espressione rifiutata */
    private final String expression;

    /** Costrutti violati, uno per errore rilevato */
    private final List<String> violations;

    public ExpressionSyntaxException(String expression, List<String> violations) {
        super("Espressione non valida '" + expression + "': " + String.join("; ", violations));
        this.expression = expression;
        this.violations = List.copyOf(violations);
    }

    public ExpressionSyntaxException(String expression, String violation) {
        this(expression, List.of(violation));
    }

    public String getExpression() {
        return expression;
    }

    public List<String> getViolations() {
        return violations;
    }
}
