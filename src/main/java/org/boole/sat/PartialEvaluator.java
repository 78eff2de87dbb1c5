package org.boole.sat;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.NodeVisitor;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.ast.Variable;

import java.util.Map;

/**
 * Valutazione a tre valori (Kleene) su assegnamento parziale.
 * {@code null} indica un valore non ancora determinato.
 */
final class PartialEvaluator implements NodeVisitor<Boolean> {

    private final Map<String, Boolean> partial;

    private PartialEvaluator(Map<String, Boolean> partial) {
        this.partial = partial;
    }

    static Boolean evaluate(BooleanNode node, Map<String, Boolean> partial) {
        return node.accept(new PartialEvaluator(partial));
    }

    @Override
    public Boolean visitVariable(Variable variable) {
        return partial.get(variable.name());
    }

    @Override
    public Boolean visitConstant(Constant constant) {
        return constant.value();
    }

    @Override
    public Boolean visitNot(Not not) {
        Boolean operand = not.operand().accept(this);
        return operand == null ? null : !operand;
    }

    @Override
    public Boolean visitAnd(And and) {
        Boolean left = and.left().accept(this);
        Boolean right = and.right().accept(this);
        if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
            return false;
        }
        return left == null || right == null ? null : true;
    }

    @Override
    public Boolean visitOr(Or or) {
        Boolean left = or.left().accept(this);
        Boolean right = or.right().accept(this);
        if (Boolean.TRUE.equals(left) || Boolean.TRUE.equals(right)) {
            return true;
        }
        return left == null || right == null ? null : false;
    }
}
