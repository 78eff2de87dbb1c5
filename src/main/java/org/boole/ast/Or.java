package org.boole.ast;

import java.util.Objects;

/**
 * Disgiunzione binaria.
 *
 * @param left operando sinistro (non null)
 * @param right operando destro (non null)
 */
public record Or(BooleanNode left, BooleanNode right) implements BooleanNode {

    public Or {
        Objects.requireNonNull(left, "Operando sinistro OR non può essere null");
        Objects.requireNonNull(right, "Operando destro OR non può essere null");
    }

    @Override
    public NodeType type() {
        return NodeType.OR;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
