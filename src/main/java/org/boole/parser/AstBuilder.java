package org.boole.parser;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.boole.antlr.BooleanExpressionBaseVisitor;
import org.boole.antlr.BooleanExpressionParser.ConjunctionContext;
import org.boole.antlr.BooleanExpressionParser.DisjunctionContext;
import org.boole.antlr.BooleanExpressionParser.ExpressionContext;
import org.boole.antlr.BooleanExpressionParser.FalseConstantContext;
import org.boole.antlr.BooleanExpressionParser.GroupContext;
import org.boole.antlr.BooleanExpressionParser.NegatedVariableContext;
import org.boole.antlr.BooleanExpressionParser.NegationContext;
import org.boole.antlr.BooleanExpressionParser.PostfixNotContext;
import org.boole.antlr.BooleanExpressionParser.PrefixNotContext;
import org.boole.antlr.BooleanExpressionParser.TrueConstantContext;
import org.boole.antlr.BooleanExpressionParser.VariableContext;
import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.Constant;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.ast.Variable;

import java.util.logging.Logger;

/**
 * COSTRUTTORE AST - Visitor dall'albero sintattico ANTLR all'albero {@link BooleanNode}
 *
 * PRECEDENZE (dalla più bassa):
 * • Disgiunzione (+): associativa a sinistra
 * • Congiunzione (· o giustapposizione): associativa a sinistra
 * • Negazione: prefissa (!) su qualunque operando, postfissa (barra) su letterale o gruppo
 * • Primari: gruppi, costanti 0/1, variabili, variabili negate
 *
 * Conversione bottom-up: ogni metodo visit restituisce il sottoalbero del proprio costrutto.
 */
class AstBuilder extends BooleanExpressionBaseVisitor<BooleanNode> {

    private static final Logger LOGGER = Logger.getLogger(AstBuilder.class.getName());

    //region RADICE E OPERATORI BINARI

    @Override
    public BooleanNode visitExpression(ExpressionContext ctx) {
        LOGGER.fine("Costruzione AST da albero sintattico ANTLR");
        return visit(ctx.disjunction());
    }

    /**
     * A + B + C → Or(Or(A, B), C)
     */
    @Override
    public BooleanNode visitDisjunction(DisjunctionContext ctx) {
        BooleanNode result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = new Or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * ABC e A·B·C → And(And(A, B), C)
     */
    @Override
    public BooleanNode visitConjunction(ConjunctionContext ctx) {
        BooleanNode result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = new And(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI

    @Override
    public BooleanNode visitPrefixNot(PrefixNotContext ctx) {
        NegationContext operand = ctx.negation();
        return new Not(visit(operand));
    }

    /**
     * Ogni barra postfissa aggiunge un livello di negazione: (AB)̄̄ → Not(Not(AB)).
     */
    @Override
    public BooleanNode visitPostfixNot(PostfixNotContext ctx) {
        BooleanNode result = visit(ctx.primary());
        for (TerminalNode ignored : ctx.POSTFIX_NOT()) {
            result = new Not(result);
        }
        return result;
    }

    //endregion

    //region PRIMARI

    @Override
    public BooleanNode visitGroup(GroupContext ctx) {
        return visit(ctx.disjunction());
    }

    @Override
    public BooleanNode visitFalseConstant(FalseConstantContext ctx) {
        return Constant.FALSE;
    }

    @Override
    public BooleanNode visitTrueConstant(TrueConstantContext ctx) {
        return Constant.TRUE;
    }

    @Override
    public BooleanNode visitNegatedVariable(NegatedVariableContext ctx) {
        String name = ctx.NEGATED_VARIABLE().getText().substring(0, 1);
        LOGGER.finest("Variabile negata: " + name);
        return new Not(new Variable(name));
    }

    @Override
    public BooleanNode visitVariable(VariableContext ctx) {
        return new Variable(ctx.VARIABLE().getText());
    }

    //endregion
}
