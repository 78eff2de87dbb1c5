package org.boole.ast;

/**
 * Variabile booleana identificata da una singola lettera maiuscola.
 *
 * @param name nome della variabile (A-Z)
 */
public record Variable(String name) implements BooleanNode {

    public Variable {
        if (name == null || !name.matches("[A-Z]")) {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
    }

    @Override
    public NodeType type() {
        return NodeType.VARIABLE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
