package org.boole.simplifier;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.ast.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Uguaglianza strutturale con commutatività di AND e OR al singolo livello,
 * più appiattimento delle catene associative.
 */
final class NodeEquality {

    private NodeEquality() {
    }

    static boolean equal(BooleanNode first, BooleanNode second) {
        if (first.type() != second.type()) {
            return false;
        }
        return switch (first.type()) {
            case VARIABLE -> ((Variable) first).name().equals(((Variable) second).name());
            case CONSTANT -> ((Constant) first).value() == ((Constant) second).value();
            case NOT -> equal(((Not) first).operand(), ((Not) second).operand());
            case AND -> equalPair(((And) first).left(), ((And) first).right(),
                    ((And) second).left(), ((And) second).right());
            case OR -> equalPair(((Or) first).left(), ((Or) first).right(),
                    ((Or) second).left(), ((Or) second).right());
        };
    }

    private static boolean equalPair(BooleanNode l1, BooleanNode r1, BooleanNode l2, BooleanNode r2) {
        return (equal(l1, l2) && equal(r1, r2)) || (equal(l1, r2) && equal(r1, l2));
    }

    /**
     * Vero se uno dei due nodi è la negazione dell'altro.
     */
    static boolean complementary(BooleanNode first, BooleanNode second) {
        return (second instanceof Not notSecond && equal(first, notSecond.operand()))
                || (first instanceof Not notFirst && equal(second, notFirst.operand()));
    }

    /**
     * Operandi di una catena AND, es. (AB)C → [A, B, C]. Un nodo non AND è una catena di un elemento.
     */
    static List<BooleanNode> conjuncts(BooleanNode node) {
        List<BooleanNode> result = new ArrayList<>();
        flatten(node, true, result);
        return result;
    }

    /**
     * Operandi di una catena OR.
     */
    static List<BooleanNode> disjuncts(BooleanNode node) {
        List<BooleanNode> result = new ArrayList<>();
        flatten(node, false, result);
        return result;
    }

    private static void flatten(BooleanNode node, boolean conjunction, List<BooleanNode> sink) {
        if (conjunction && node instanceof And and) {
            flatten(and.left(), true, sink);
            flatten(and.right(), true, sink);
        } else if (!conjunction && node instanceof Or or) {
            flatten(or.left(), false, sink);
            flatten(or.right(), false, sink);
        } else {
            sink.add(node);
        }
    }

    static boolean containsEqual(List<BooleanNode> nodes, BooleanNode target) {
        for (BooleanNode node : nodes) {
            if (equal(node, target)) {
                return true;
            }
        }
        return false;
    }
}
