package org.boole.simplifier;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.ExpressionFormatter;
import org.boole.ast.Not;
import org.boole.ast.Or;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * APPLICAZIONE DELLE LEGGI DI BASE fino a punto fisso
 *
 * A ogni passata viene applicata una sola riscrittura, cercata dal basso verso
 * l'alto (prima i figli, poi il nodo). Ogni riscrittura riduce il numero di nodi,
 * quindi il ciclo termina sempre.
 *
 * LEGGI:
 * • Identità: A + 0 = A, A · 1 = A
 * • Annullamento: A + 1 = 1, A · 0 = 0
 * • Idempotenza: A + A = A, A · A = A
 * • Complemento: A + Ā = 1, A · Ā = 0, 1̄ = 0, 0̄ = 1
 * • Doppia negazione: (Ā)̄ = A
 * • Assorbimento: A + AB = A, A(A + B) = A
 */
final class LawRewriter {

    private static final Logger LOGGER = Logger.getLogger(LawRewriter.class.getName());

    private LawRewriter() {
    }

    /**
     * Risultato di una riscrittura puntuale.
     */
    private record Rewrite(BooleanNode node, BooleanLaw law, String description) {
    }

    /**
     * Applica le leggi fino a quando nessuna è più applicabile.
     *
     * @param ast albero di partenza (non modificato)
     * @param steps lista in cui registrare i passi
     * @return albero semplificato
     */
    static BooleanNode applyToFixpoint(BooleanNode ast, List<SimplificationStep> steps) {
        BooleanNode current = ast;
        Rewrite rewrite;
        while ((rewrite = rewriteOnce(current)) != null) {
            String before = ExpressionFormatter.format(current);
            String after = ExpressionFormatter.format(rewrite.node());
            LOGGER.finest(rewrite.law().displayName() + ": " + before + " → " + after);
            steps.add(new SimplificationStep(after, rewrite.law(), rewrite.description(), before, after));
            current = rewrite.node();
        }
        return current;
    }

    static BooleanNode applyToFixpoint(BooleanNode ast) {
        return applyToFixpoint(ast, new ArrayList<>());
    }

    //region RICERCA BOTTOM-UP

    private static Rewrite rewriteOnce(BooleanNode node) {
        switch (node.type()) {
            case NOT -> {
                Not not = (Not) node;
                Rewrite inner = rewriteOnce(not.operand());
                if (inner != null) {
                    return new Rewrite(new Not(inner.node()), inner.law(), inner.description());
                }
                return rewriteNot(not);
            }
            case AND -> {
                And and = (And) node;
                Rewrite left = rewriteOnce(and.left());
                if (left != null) {
                    return new Rewrite(new And(left.node(), and.right()), left.law(), left.description());
                }
                Rewrite right = rewriteOnce(and.right());
                if (right != null) {
                    return new Rewrite(new And(and.left(), right.node()), right.law(), right.description());
                }
                return rewriteAnd(and);
            }
            case OR -> {
                Or or = (Or) node;
                Rewrite left = rewriteOnce(or.left());
                if (left != null) {
                    return new Rewrite(new Or(left.node(), or.right()), left.law(), left.description());
                }
                Rewrite right = rewriteOnce(or.right());
                if (right != null) {
                    return new Rewrite(new Or(or.left(), right.node()), right.law(), right.description());
                }
                return rewriteOr(or);
            }
            default -> {
                return null;
            }
        }
    }

    //endregion

    //region LEGGI PER TIPO DI NODO

    private static Rewrite rewriteNot(Not not) {
        BooleanNode operand = not.operand();
        if (operand instanceof Not inner) {
            return new Rewrite(inner.operand(), BooleanLaw.DOUBLE_NEGATION, "(Ā)̄ = A");
        }
        if (operand instanceof Constant constant) {
            return new Rewrite(Constant.of(!constant.value()), BooleanLaw.COMPLEMENT,
                    constant.value() ? "1̄ = 0" : "0̄ = 1");
        }
        return null;
    }

    private static Rewrite rewriteOr(Or or) {
        BooleanNode left = or.left();
        BooleanNode right = or.right();

        if (isConstant(left, false)) {
            return new Rewrite(right, BooleanLaw.IDENTITY, "A + 0 = A");
        }
        if (isConstant(right, false)) {
            return new Rewrite(left, BooleanLaw.IDENTITY, "A + 0 = A");
        }
        if (isConstant(left, true) || isConstant(right, true)) {
            return new Rewrite(Constant.TRUE, BooleanLaw.NULL, "A + 1 = 1");
        }
        if (NodeEquality.equal(left, right)) {
            return new Rewrite(left, BooleanLaw.IDEMPOTENT, "A + A = A");
        }
        if (NodeEquality.complementary(left, right)) {
            return new Rewrite(Constant.TRUE, BooleanLaw.COMPLEMENT, "A + Ā = 1");
        }
        // x + y = x quando y contiene come fattore un addendo di x
        if (absorbs(NodeEquality.disjuncts(left), NodeEquality.conjuncts(right))) {
            return new Rewrite(left, BooleanLaw.ABSORPTION, "A + AB = A");
        }
        if (absorbs(NodeEquality.disjuncts(right), NodeEquality.conjuncts(left))) {
            return new Rewrite(right, BooleanLaw.ABSORPTION, "A + AB = A");
        }
        return null;
    }

    private static Rewrite rewriteAnd(And and) {
        BooleanNode left = and.left();
        BooleanNode right = and.right();

        if (isConstant(left, true)) {
            return new Rewrite(right, BooleanLaw.IDENTITY, "A · 1 = A");
        }
        if (isConstant(right, true)) {
            return new Rewrite(left, BooleanLaw.IDENTITY, "A · 1 = A");
        }
        if (isConstant(left, false) || isConstant(right, false)) {
            return new Rewrite(Constant.FALSE, BooleanLaw.NULL, "A · 0 = 0");
        }
        if (NodeEquality.equal(left, right)) {
            return new Rewrite(left, BooleanLaw.IDEMPOTENT, "A · A = A");
        }
        if (NodeEquality.complementary(left, right)) {
            return new Rewrite(Constant.FALSE, BooleanLaw.COMPLEMENT, "A · Ā = 0");
        }
        // x · y = x quando y contiene come addendo un fattore di x
        if (absorbs(NodeEquality.conjuncts(left), NodeEquality.disjuncts(right))) {
            return new Rewrite(left, BooleanLaw.ABSORPTION, "A(A + B) = A");
        }
        if (absorbs(NodeEquality.conjuncts(right), NodeEquality.disjuncts(left))) {
            return new Rewrite(right, BooleanLaw.ABSORPTION, "A(A + B) = A");
        }
        return null;
    }

    /**
     * Vero se la catena assorbita ha più di un elemento e ne condivide almeno uno con la catena che resta.
     */
    private static boolean absorbs(List<BooleanNode> kept, List<BooleanNode> absorbed) {
        if (absorbed.size() < 2) {
            return false;
        }
        for (BooleanNode candidate : kept) {
            if (NodeEquality.containsEqual(absorbed, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isConstant(BooleanNode node, boolean value) {
        return node instanceof Constant constant && constant.value() == value;
    }

    //endregion
}
