package org.boole.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Utility strutturali sull'albero sintattico: costruzione, metriche e raccolta variabili.
 */
public final class Nodes {

    private Nodes() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region COSTRUZIONE

    /**
     * Congiunzione associata a sinistra di una lista di operandi.
     * Lista vuota -> costante 1 (congiunzione vuota).
     */
    public static BooleanNode conjunction(List<? extends BooleanNode> operands) {
        if (operands.isEmpty()) {
            return Constant.TRUE;
        }
        BooleanNode result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new And(result, operands.get(i));
        }
        return result;
    }

    /**
     * Disgiunzione associata a sinistra di una lista di operandi.
     * Lista vuota -> costante 0 (disgiunzione vuota).
     */
    public static BooleanNode disjunction(List<? extends BooleanNode> operands) {
        if (operands.isEmpty()) {
            return Constant.FALSE;
        }
        BooleanNode result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new Or(result, operands.get(i));
        }
        return result;
    }

    /**
     * Letterale diretto o complementato.
     */
    public static BooleanNode literal(String variable, boolean positive) {
        Variable node = new Variable(variable);
        return positive ? node : new Not(node);
    }

    //endregion

    //region METRICHE

    /**
     * Profondità dell'albero (una foglia ha profondità 1).
     * Visita iterativa con pila esplicita: usata per verificare il limite di annidamento
     * prima che i visitor ricorsivi percorrano l'albero.
     */
    public static int depth(BooleanNode node) {
        Deque<BooleanNode> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(node);
        levels.push(1);
        int max = 0;
        while (!nodes.isEmpty()) {
            BooleanNode current = nodes.pop();
            int level = levels.pop();
            max = Math.max(max, level);
            switch (current.type()) {
                case VARIABLE, CONSTANT -> { /* foglia */ }
                case NOT -> {
                    nodes.push(((Not) current).operand());
                    levels.push(level + 1);
                }
                case AND -> {
                    nodes.push(((And) current).left());
                    levels.push(level + 1);
                    nodes.push(((And) current).right());
                    levels.push(level + 1);
                }
                case OR -> {
                    nodes.push(((Or) current).left());
                    levels.push(level + 1);
                    nodes.push(((Or) current).right());
                    levels.push(level + 1);
                }
            }
        }
        return max;
    }

    /**
     * Numero totale di nodi dell'albero.
     */
    public static int size(BooleanNode node) {
        return switch (node.type()) {
            case VARIABLE, CONSTANT -> 1;
            case NOT -> 1 + size(((Not) node).operand());
            case AND -> 1 + size(((And) node).left()) + size(((And) node).right());
            case OR -> 1 + size(((Or) node).left()) + size(((Or) node).right());
        };
    }

    /**
     * Variabili libere dell'albero, ordinate alfabeticamente.
     */
    public static SortedSet<String> variables(BooleanNode node) {
        SortedSet<String> result = new TreeSet<>();
        collectVariables(node, result);
        return result;
    }

    private static void collectVariables(BooleanNode node, SortedSet<String> sink) {
        switch (node.type()) {
            case VARIABLE -> sink.add(((Variable) node).name());
            case CONSTANT -> { /* nessuna variabile */ }
            case NOT -> collectVariables(((Not) node).operand(), sink);
            case AND -> {
                collectVariables(((And) node).left(), sink);
                collectVariables(((And) node).right(), sink);
            }
            case OR -> {
                collectVariables(((Or) node).left(), sink);
                collectVariables(((Or) node).right(), sink);
            }
        }
    }

    //endregion
}
