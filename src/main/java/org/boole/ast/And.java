package org.boole.ast;

import java.util.Objects;

/**
 * Congiunzione binaria.
 *
 * @param left operando sinistro (non null)
 * @param right operando destro (non null)
 */
public record And(BooleanNode left, BooleanNode right) implements BooleanNode {

    public And {
        Objects.requireNonNull(left, "Operando sinistro AND non può essere null");
        Objects.requireNonNull(right, "Operando destro AND non può essere null");
    }

    @Override
    public NodeType type() {
        return NodeType.AND;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
