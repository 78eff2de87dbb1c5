package org.boole.truthtable;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.NodeVisitor;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.ast.Variable;

import java.util.Map;

/**
 * Valutazione di un albero sotto un assegnamento.
 *
 * Una variabile assente dall'assegnamento vale false. AND e OR valutano sempre
 * entrambi gli operandi.
 */
public final class Evaluator implements NodeVisitor<Boolean> {

    private final Map<String, Boolean> assignment;

    private Evaluator(Map<String, Boolean> assignment) {
        this.assignment = assignment;
    }

    /**
     * @param node albero da valutare
     * @param assignment valori delle variabili, eventualmente parziale
     * @return valore dell'espressione
     */
    public static boolean evaluate(BooleanNode node, Map<String, Boolean> assignment) {
        return node.accept(new Evaluator(assignment));
    }

    @Override
    public Boolean visitVariable(Variable variable) {
        return Boolean.TRUE.equals(assignment.get(variable.name()));
    }

    @Override
    public Boolean visitConstant(Constant constant) {
        return constant.value();
    }

    @Override
    public Boolean visitNot(Not not) {
        return !not.operand().accept(this);
    }

    @Override
    public Boolean visitAnd(And and) {
        boolean left = and.left().accept(this);
        boolean right = and.right().accept(this);
        return left && right;
    }

    @Override
    public Boolean visitOr(Or or) {
        boolean left = or.left().accept(this);
        boolean right = or.right().accept(this);
        return left || right;
    }
}
