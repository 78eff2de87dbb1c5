package org.boole.ast;

/**
 * Costante logica 0 o 1.
 *
 * @param value valore della costante
 */
public record Constant(boolean value) implements BooleanNode {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public NodeType type() {
        return NodeType.CONSTANT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
