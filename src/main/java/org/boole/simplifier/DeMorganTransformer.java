package org.boole.simplifier;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.ExpressionFormatter;
import org.boole.ast.Not;
import org.boole.ast.Or;

import java.util.List;

/**
 * Spinge le negazioni verso le foglie usando le leggi di De Morgan.
 *
 * TRASFORMAZIONI APPLICATE:
 * • (AB)̄ → Ā + B̄
 * • (A + B)̄ → ĀB̄
 * • (Ā)̄ → A
 * • Negazioni di letterali e costanti preservate
 *
 * Al termine ogni NOT ha come operando una variabile o una costante.
 */
final class DeMorganTransformer {

    private final List<SimplificationStep> steps;

    private DeMorganTransformer(List<SimplificationStep> steps) {
        this.steps = steps;
    }

    /**
     * @param ast albero di partenza
     * @param steps lista in cui registrare ogni applicazione
     * @return albero in forma normale negata
     */
    static BooleanNode pushNegations(BooleanNode ast, List<SimplificationStep> steps) {
        return new DeMorganTransformer(steps).normalize(ast);
    }

    private BooleanNode normalize(BooleanNode node) {
        return switch (node.type()) {
            case VARIABLE, CONSTANT -> node;
            case NOT -> negate(((Not) node).operand());
            case AND -> new And(normalize(((And) node).left()), normalize(((And) node).right()));
            case OR -> new Or(normalize(((Or) node).left()), normalize(((Or) node).right()));
        };
    }

    /**
     * Forma normale della negazione di {@code inner}.
     */
    private BooleanNode negate(BooleanNode inner) {
        return switch (inner.type()) {
            case VARIABLE, CONSTANT -> new Not(inner);
            case NOT -> {
                BooleanNode result = normalize(((Not) inner).operand());
                record(BooleanLaw.DOUBLE_NEGATION, "(Ā)̄ = A", new Not(inner), result);
                yield result;
            }
            case AND -> {
                And and = (And) inner;
                BooleanNode result = new Or(negate(and.left()), negate(and.right()));
                record(BooleanLaw.DE_MORGAN, "(AB)̄ = Ā + B̄", new Not(inner), result);
                yield result;
            }
            case OR -> {
                Or or = (Or) inner;
                BooleanNode result = new And(negate(or.left()), negate(or.right()));
                record(BooleanLaw.DE_MORGAN, "(A + B)̄ = ĀB̄", new Not(inner), result);
                yield result;
            }
        };
    }

    private void record(BooleanLaw law, String description, BooleanNode before, BooleanNode after) {
        String afterText = ExpressionFormatter.format(after);
        steps.add(new SimplificationStep(afterText, law, description, ExpressionFormatter.format(before), afterText));
    }
}
