package org.boole.ast;

/**
 * Serializzazione testuale dell'albero sintattico.
 *
 * REGOLE DI RAPPRESENTAZIONE:
 * • AND per giustapposizione, operandi OR racchiusi tra parentesi: A(B + C)
 * • OR con separatore " + "
 * • NOT postfisso sul letterale (Ā) oppure sul gruppo tra parentesi ((AB)̄)
 *
 * Il testo prodotto è sempre accettato da {@code ExpressionParser}, quindi una
 * serializzazione può essere rianalizzata senza perdita di significato.
 */
public final class ExpressionFormatter implements NodeVisitor<String> {

    private static final ExpressionFormatter OVERBAR_FORMATTER = new ExpressionFormatter(Notation.OVERBAR);
    private static final ExpressionFormatter APOSTROPHE_FORMATTER = new ExpressionFormatter(Notation.APOSTROPHE);

    private final Notation notation;

    private ExpressionFormatter(Notation notation) {
        this.notation = notation;
    }

    /**
     * Serializza il nodo nella notazione predefinita del motore (barra sopra).
     */
    public static String format(BooleanNode node) {
        return format(node, Notation.OVERBAR);
    }

    /**
     * Serializza il nodo nella notazione richiesta.
     *
     * @param node radice da serializzare
     * @param notation notazione della negazione
     * @return rappresentazione testuale
     */
    public static String format(BooleanNode node, Notation notation) {
        if (node == null) {
            return "";
        }
        ExpressionFormatter formatter = notation == Notation.APOSTROPHE ? APOSTROPHE_FORMATTER : OVERBAR_FORMATTER;
        return node.accept(formatter);
    }

    @Override
    public String visitVariable(Variable variable) {
        return variable.name();
    }

    @Override
    public String visitConstant(Constant constant) {
        return constant.value() ? "1" : "0";
    }

    @Override
    public String visitNot(Not not) {
        String operand = not.operand().accept(this);
        if (not.operand() instanceof Variable) {
            return operand + notation.negationMark();
        }
        return "(" + operand + ")" + notation.negationMark();
    }

    @Override
    public String visitAnd(And and) {
        return wrapDisjunction(and.left()) + wrapDisjunction(and.right());
    }

    @Override
    public String visitOr(Or or) {
        return or.left().accept(this) + " + " + or.right().accept(this);
    }

    private String wrapDisjunction(BooleanNode node) {
        String text = node.accept(this);
        return node.type() == NodeType.OR ? "(" + text + ")" : text;
    }
}
