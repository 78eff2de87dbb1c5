package org.boole.sat;

import org.boole.support.EngineLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Enumerazione di tutti i 2^n assegnamenti in ordine di indice.
 */
class BruteForceSolver {

    private final List<String> variables;
    private final List<SATConstraint> constraints;
    private final SATStatistics statistics;

    BruteForceSolver(List<String> variables, List<SATConstraint> constraints, SATStatistics statistics) {
        this.variables = List.copyOf(variables);
        this.constraints = List.copyOf(constraints);
        this.statistics = statistics;
    }

    List<Map<String, Boolean>> solve(boolean findAllSolutions) {
        List<Map<String, Boolean>> solutions = new ArrayList<>();
        int total = 1 << variables.size();

        for (int index = 0; index < total; index++) {
            statistics.incrementCandidates();
            Map<String, Boolean> candidate = EngineLimits.assignmentOf(variables, index);
            if (constraints.stream().allMatch(c -> c.evaluate(candidate))) {
                solutions.add(candidate);
                if (!findAllSolutions) {
                    break;
                }
            }
        }
        return solutions;
    }
}
