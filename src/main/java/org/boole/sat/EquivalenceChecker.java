package org.boole.sat;

import org.boole.parser.ParsedExpression;
import org.boole.support.EngineLimits;
import org.boole.truthtable.Evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Verifica di equivalenza per enumerazione sull'unione delle variabili.
 * Una variabile presente in una sola espressione è irrilevante per l'altra.
 */
public final class EquivalenceChecker {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceChecker.class.getName());

    private EquivalenceChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @throws org.boole.support.CapacityExceededException se l'unione supera il limite di enumerazione
     */
    public static EquivalenceResult check(ParsedExpression first, ParsedExpression second) {
        SortedSet<String> union = new TreeSet<>(first.variables());
        union.addAll(second.variables());
        List<String> variables = new ArrayList<>(union);
        EngineLimits.requireEnumerable("Equivalenza", variables.size());

        int total = 1 << variables.size();
        List<EquivalenceResult.CounterExample> counterExamples = new ArrayList<>();
        for (int index = 0; index < total; index++) {
            Map<String, Boolean> assignment = EngineLimits.assignmentOf(variables, index);
            boolean firstResult = Evaluator.evaluate(first.ast(), assignment);
            boolean secondResult = Evaluator.evaluate(second.ast(), assignment);
            if (firstResult != secondResult) {
                counterExamples.add(new EquivalenceResult.CounterExample(assignment, firstResult, secondResult));
            }
        }

        LOGGER.fine(() -> "Equivalenza '" + first.normalizedText() + "' / '" + second.normalizedText() + "': "
                + counterExamples.size() + " controesempi su " + total);
        return new EquivalenceResult(counterExamples.isEmpty(), counterExamples, total);
    }
}
