package org.boole.sat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SOLUTORE DPLL - Backtracking cronologico con potatura per consistenza parziale
 *
 * Le variabili sono decise nell'ordine fornito, prima a true e poi a false.
 * Dopo ogni decisione ogni vincolo verifica se l'assegnamento parziale può ancora
 * essere completato; in caso contrario il ramo viene abbandonato.
 */
class DPLLSolver {

    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    //region STATO

    /** Ordine di decisione delle variabili */
    private final List<String> variables;

    /** Vincoli espliciti più il vincolo implicito sull'espressione */
    private final List<SATConstraint> constraints;

    private final SATStatistics statistics;

    /** Assegnamento parziale corrente, in ordine di decisione */
    private final Map<String, Boolean> assignment = new LinkedHashMap<>();

    private final List<Map<String, Boolean>> solutions = new ArrayList<>();

    private boolean findAll;

    //endregion

    DPLLSolver(List<String> variables, List<SATConstraint> constraints, SATStatistics statistics) {
        this.variables = List.copyOf(variables);
        this.constraints = List.copyOf(constraints);
        this.statistics = statistics;
    }

    /**
     * @param findAllSolutions enumera tutti i modelli invece di fermarsi al primo
     * @return modelli trovati, vuota se nessuno
     */
    List<Map<String, Boolean>> solve(boolean findAllSolutions) {
        this.findAll = findAllSolutions;
        solutions.clear();
        assignment.clear();

        search(0);

        LOGGER.fine(() -> "DPLL completato: " + solutions.size() + " modelli, "
                + statistics.getDecisions() + " decisioni, " + statistics.getBacktracks() + " backtrack");
        return new ArrayList<>(solutions);
    }

    /**
     * @return true se la ricerca deve terminare
     */
    private boolean search(int depth) {
        if (depth == variables.size()) {
            if (constraints.stream().allMatch(c -> c.evaluate(assignment))) {
                solutions.add(new LinkedHashMap<>(assignment));
                return !findAll;
            }
            return false;
        }

        String variable = variables.get(depth);
        for (boolean value : new boolean[]{true, false}) {
            statistics.incrementDecisions();
            assignment.put(variable, value);

            if (isConsistent()) {
                if (search(depth + 1)) {
                    return true;
                }
            } else {
                statistics.incrementBacktracks();
            }
            assignment.remove(variable);
        }
        return false;
    }

    private boolean isConsistent() {
        for (SATConstraint constraint : constraints) {
            if (!constraint.canStillBeSatisfied(assignment)) {
                return false;
            }
        }
        return true;
    }
}
