package org.boole.truthtable;

import org.boole.ast.And;
import org.boole.ast.BooleanNode;
import org.boole.ast.ExpressionFormatter;
import org.boole.ast.Not;
import org.boole.ast.Or;
import org.boole.parser.ParsedExpression;
import org.boole.support.EngineLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * GENERATORE TABELLE DI VERITÀ
 *
 * Enumera i 2^n assegnamenti in ordine binario e valuta l'albero su ciascuno.
 * Il limite di {@value EngineLimits#MAX_ENUMERATION_VARIABLES} variabili è verificato
 * prima di qualsiasi allocazione.
 */
public class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    /**
     * Genera la tabella di un'espressione analizzata.
     *
     * @throws org.boole.support.CapacityExceededException oltre il limite di variabili
     */
    public TruthTable generate(ParsedExpression parsed) {
        return generate(parsed.ast(), parsed.variables());
    }

    /**
     * Genera la tabella di un albero sulle variabili indicate, nell'ordine dato.
     */
    public TruthTable generate(BooleanNode ast, List<String> variables) {
        EngineLimits.requireEnumerable("Tabella di verità", variables.size());
        LOGGER.fine("Generazione tabella di verità su " + variables.size() + " variabili");

        int rowCount = 1 << variables.size();
        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        List<Integer> minterms = new ArrayList<>();
        List<Integer> maxterms = new ArrayList<>();

        for (int index = 0; index < rowCount; index++) {
            Map<String, Boolean> assignment = EngineLimits.assignmentOf(variables, index);
            boolean output = Evaluator.evaluate(ast, assignment);
            rows.add(new TruthTableRow(assignment, output, index));
            if (output) {
                minterms.add(index);
            } else {
                maxterms.add(index);
            }
        }

        LOGGER.fine("Tabella completata: " + minterms.size() + " mintermini, " + maxterms.size() + " maxtermini");
        return new TruthTable(variables, rows, minterms, maxterms);
    }

    /**
     * Tabelle parziali di ogni sottoespressione composta (NOT, AND, OR), in pre-ordine.
     * Le foglie non producono passi.
     */
    public List<IntermediateStep> intermediateSteps(ParsedExpression parsed) {
        List<String> variables = parsed.variables();
        EngineLimits.requireEnumerable("Passi intermedi", variables.size());

        List<BooleanNode> subExpressions = new ArrayList<>();
        collectCompound(parsed.ast(), subExpressions);

        int rowCount = 1 << variables.size();
        List<IntermediateStep> steps = new ArrayList<>();
        for (BooleanNode sub : subExpressions) {
            List<Boolean> outputs = new ArrayList<>(rowCount);
            for (int index = 0; index < rowCount; index++) {
                outputs.add(Evaluator.evaluate(sub, EngineLimits.assignmentOf(variables, index)));
            }
            steps.add(new IntermediateStep(ExpressionFormatter.format(sub), outputs));
        }
        return steps;
    }

    private void collectCompound(BooleanNode node, List<BooleanNode> sink) {
        if (node instanceof Not not) {
            sink.add(node);
            collectCompound(not.operand(), sink);
        } else if (node instanceof And and) {
            sink.add(node);
            collectCompound(and.left(), sink);
            collectCompound(and.right(), sink);
        } else if (node instanceof Or or) {
            sink.add(node);
            collectCompound(or.left(), sink);
            collectCompound(or.right(), sink);
        }
    }
}
