package org.boole.ast;

/**
 * Visitor esaustivo sulle cinque varianti di {@link BooleanNode}.
 *
 * @param <R> tipo del risultato prodotto dall'attraversamento
 */
public interface NodeVisitor<R> {

    R visitVariable(Variable variable);

    R visitConstant(Constant constant);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);
}
