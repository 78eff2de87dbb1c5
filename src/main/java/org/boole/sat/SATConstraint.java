package org.boole.sat;

import org.boole.ast.BooleanNode;
import org.boole.truthtable.Evaluator;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * VINCOLO SAT - Condizione aggiuntiva su un insieme di variabili
 *
 * Oltre ai vincoli di cardinalità e di valore, il solutore aggiunge sempre un vincolo
 * implicito di tipo {@link ConstraintType#EXPRESSION}: l'espressione deve valere 1.
 *
 * VALUTAZIONE:
 * • {@link #evaluate(Map)} su assegnamento completo, variabile assente = 0
 * • {@link #canStillBeSatisfied(Map)} su assegnamento parziale, usato dal DPLL per potare
 */
public final class SATConstraint {

    private final ConstraintType type;
    private final List<String> variables;
    private final boolean value;
    private final BooleanNode expression;

    private SATConstraint(ConstraintType type, List<String> variables, boolean value, BooleanNode expression) {
        this.type = Objects.requireNonNull(type, "Tipo di vincolo mancante");
        this.variables = List.copyOf(variables);
        this.value = value;
        this.expression = expression;
        if (type != ConstraintType.EXPRESSION && this.variables.isEmpty()) {
            throw new IllegalArgumentException("Vincolo " + type + " senza variabili");
        }
    }

    //region FACTORY

    public static SATConstraint equalsTo(List<String> variables, boolean value) {
        return new SATConstraint(ConstraintType.EQUALS, variables, value, null);
    }

    public static SATConstraint notEqualsTo(List<String> variables, boolean value) {
        return new SATConstraint(ConstraintType.NOT_EQUALS, variables, value, null);
    }

    public static SATConstraint atLeastOne(List<String> variables) {
        return new SATConstraint(ConstraintType.AT_LEAST_ONE, variables, true, null);
    }

    public static SATConstraint atMostOne(List<String> variables) {
        return new SATConstraint(ConstraintType.AT_MOST_ONE, variables, true, null);
    }

    public static SATConstraint exactlyOne(List<String> variables) {
        return new SATConstraint(ConstraintType.EXACTLY_ONE, variables, true, null);
    }

    /**
     * Vincolo implicito "l'espressione vale 1" sulle variabili indicate.
     */
    static SATConstraint expression(BooleanNode ast, List<String> variables) {
        return new SATConstraint(ConstraintType.EXPRESSION, variables, true,
                Objects.requireNonNull(ast, "AST mancante"));
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta il vincolo su un assegnamento completo.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case EQUALS -> variables.stream().allMatch(v -> valueOf(assignment, v) == value);
            case NOT_EQUALS -> variables.stream().noneMatch(v -> valueOf(assignment, v) == value);
            case AT_LEAST_ONE -> countTrue(assignment) >= 1;
            case AT_MOST_ONE -> countTrue(assignment) <= 1;
            case EXACTLY_ONE -> countTrue(assignment) == 1;
            case EXPRESSION -> Evaluator.evaluate(expression, assignment);
        };
    }

    /**
     * Verifica se un assegnamento parziale può ancora essere esteso a uno che soddisfa il vincolo.
     * Le variabili assenti dalla mappa sono considerate non ancora decise.
     */
    public boolean canStillBeSatisfied(Map<String, Boolean> partial) {
        int assignedTrue = 0;
        int unassigned = 0;
        for (String variable : variables) {
            Boolean current = partial.get(variable);
            if (current == null) {
                unassigned++;
            } else if (current) {
                assignedTrue++;
            }
        }

        return switch (type) {
            case EQUALS -> variables.stream()
                    .map(partial::get)
                    .allMatch(current -> current == null || current == value);
            case NOT_EQUALS -> variables.stream()
                    .map(partial::get)
                    .allMatch(current -> current == null || current != value);
            case AT_LEAST_ONE -> assignedTrue + unassigned >= 1;
            case AT_MOST_ONE -> assignedTrue <= 1;
            case EXACTLY_ONE -> assignedTrue <= 1 && assignedTrue + unassigned >= 1;
            case EXPRESSION -> !Boolean.FALSE.equals(PartialEvaluator.evaluate(expression, partial));
        };
    }

    private int countTrue(Map<String, Boolean> assignment) {
        int count = 0;
        for (String variable : variables) {
            if (valueOf(assignment, variable)) {
                count++;
            }
        }
        return count;
    }

    private static boolean valueOf(Map<String, Boolean> assignment, String variable) {
        return Boolean.TRUE.equals(assignment.get(variable));
    }

    //endregion

    //region ACCESSORS

    public ConstraintType getType() {
        return type;
    }

    public List<String> getVariables() {
        return variables;
    }

    public boolean getValue() {
        return value;
    }

    public BooleanNode getExpression() {
        return expression;
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SATConstraint other)) return false;
        return type == other.type && value == other.value
                && variables.equals(other.variables) && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, variables, value, expression);
    }

    @Override
    public String toString() {
        return switch (type) {
            case EQUALS, NOT_EQUALS -> type + variables.toString() + "=" + (value ? 1 : 0);
            default -> type + variables.toString();
        };
    }
}
