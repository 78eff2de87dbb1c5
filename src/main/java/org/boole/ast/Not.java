package org.boole.ast;

import java.util.Objects;

/**
 * Negazione di un sottoalbero.
 *
 * @param operand operando negato (non null)
 */
public record Not(BooleanNode operand) implements BooleanNode {

    public Not {
        Objects.requireNonNull(operand, "Operando per negazione non può essere null");
    }

    @Override
    public NodeType type() {
        return NodeType.NOT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
