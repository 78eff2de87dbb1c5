package org.boole.ast;

/**
 * NODO DELL'ALBERO SINTATTICO - Tipo somma chiuso per espressioni booleane
 *
 * Ogni espressione è rappresentata da un albero persistente composto da esattamente
 * cinque varianti: {@link Variable}, {@link Constant}, {@link Not}, {@link And}, {@link Or}.
 * Le riscritture costruiscono sempre nuovi nodi: nessun nodo viene mai modificato dopo
 * la costruzione, quindi sottoalberi condivisi tra passi diversi non creano aliasing.
 *
 * DISPATCH:
 * • {@link #accept(NodeVisitor)} per attraversamenti esaustivi controllati dal compilatore
 * • {@link #type()} per confronti rapidi sul tipo di nodo
 */
public sealed interface BooleanNode permits Variable, Constant, Not, And, Or {

    /**
     * Tipo del nodo corrente.
     */
    NodeType type();

    /**
     * Applica il visitor alla variante concreta del nodo.
     *
     * @param visitor visitor da applicare
     * @param <R> tipo del risultato
     * @return risultato calcolato dal visitor
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Verifica se il nodo è un letterale (variabile o variabile negata).
     */
    default boolean isLiteral() {
        return this instanceof Variable
                || (this instanceof Not not && not.operand() instanceof Variable);
    }
}
