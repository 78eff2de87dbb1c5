package org.boole.sat;

import org.boole.parser.ParsedExpression;
import org.boole.support.EngineLimits;
import org.boole.truthtable.Evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * SOLUTORE SAT - Ricerca di assegnamenti che rendono vera un'espressione sotto vincoli
 *
 * SELEZIONE DEL METODO:
 * • AUTO: DPLL fino a {@link EngineLimits#MAX_ENUMERATION_VARIABLES} variabili, WalkSAT oltre
 * • DPLL e forza bruta sono esaustivi e soggetti al limite di enumerazione
 * • WalkSAT non ha limite ma trova al più un modello
 *
 * Ogni soluzione prodotta viene rivalidata contro l'espressione e tutti i vincoli prima
 * di essere restituita; il troncamento a maxSolutions avviene dopo la validazione.
 */
public class SATSolver {

    private static final Logger LOGGER = Logger.getLogger(SATSolver.class.getName());

    //region RISOLUZIONE

    public SATResult solve(ParsedExpression parsed) {
        return solve(parsed, List.of(), SatOptions.defaults());
    }

    /**
     * @param parsed espressione da soddisfare
     * @param constraints vincoli aggiuntivi, anche su variabili assenti dall'espressione
     * @param options strategia e limiti della ricerca
     * @throws org.boole.support.CapacityExceededException se un metodo esaustivo supera il limite
     */
    public SATResult solve(ParsedExpression parsed, List<SATConstraint> constraints, SatOptions options) {
        List<String> variables = searchVariables(parsed, constraints);
        SearchMethod method = resolveMethod(options.method(), variables.size());

        List<SATConstraint> all = new ArrayList<>(constraints);
        all.add(SATConstraint.expression(parsed.ast(), variables));

        LOGGER.fine(() -> "Ricerca SAT su '" + parsed.normalizedText() + "' con " + method.id()
                + " (" + variables.size() + " variabili, " + constraints.size() + " vincoli)");

        SATStatistics statistics = new SATStatistics();
        List<Map<String, Boolean>> candidates = switch (method) {
            case DPLL -> {
                EngineLimits.requireEnumerable("DPLL", variables.size());
                yield new DPLLSolver(variables, all, statistics).solve(options.findAllSolutions());
            }
            case BRUTE_FORCE -> {
                EngineLimits.requireEnumerable("Forza bruta", variables.size());
                yield new BruteForceSolver(variables, all, statistics).solve(options.findAllSolutions());
            }
            case WALKSAT -> new WalkSATSolver(variables, all, statistics, options.maxFlips(),
                    options.noiseProbability(), randomFor(options)).solve();
            case AUTO -> throw new IllegalStateException("Metodo AUTO non risolto");
        };
        statistics.stopTimer();

        List<Map<String, Boolean>> solutions = new ArrayList<>();
        for (Map<String, Boolean> candidate : candidates) {
            if (isValid(candidate, parsed, constraints)) {
                solutions.add(candidate);
            } else {
                LOGGER.warning("Soluzione scartata in fase di validazione: " + candidate);
            }
        }
        if (solutions.size() > options.maxSolutions()) {
            solutions = new ArrayList<>(solutions.subList(0, options.maxSolutions()));
        }

        boolean exhaustive = method != SearchMethod.WALKSAT;
        SATResult result = solutions.isEmpty()
                ? SATResult.unsatisfiable(method, exhaustive, statistics, variables.size(), constraints.size())
                : SATResult.satisfiable(solutions, method, exhaustive, statistics, variables.size(), constraints.size());
        LOGGER.fine(result::toCompactString);
        return result;
    }

    /**
     * Traduce le proprietà in vincoli di cardinalità e raccoglie tutte le soluzioni.
     */
    public SATResult findAssignmentsWithProperties(ParsedExpression parsed, List<AssignmentProperty> properties) {
        List<String> variables = parsed.variables();
        List<SATConstraint> constraints = new ArrayList<>();

        for (AssignmentProperty property : properties) {
            switch (property) {
                case MINIMIZE_TRUE -> {
                    if (!variables.isEmpty()) {
                        constraints.add(SATConstraint.atMostOne(variables));
                    }
                }
                case MAXIMIZE_TRUE -> {
                    if (!variables.isEmpty()) {
                        constraints.add(SATConstraint.atLeastOne(variables));
                    }
                }
                case BALANCE -> {
                    List<String> half = variables.subList(0, variables.size() / 2);
                    if (!half.isEmpty()) {
                        constraints.add(SATConstraint.exactlyOne(half));
                    }
                }
            }
        }

        return solve(parsed, constraints, SatOptions.defaults().withFindAllSolutions(true));
    }

    //endregion

    //region SUPPORTO

    private static List<String> searchVariables(ParsedExpression parsed, List<SATConstraint> constraints) {
        SortedSet<String> union = new TreeSet<>(parsed.variables());
        for (SATConstraint constraint : constraints) {
            union.addAll(constraint.getVariables());
        }
        return new ArrayList<>(union);
    }

    private static SearchMethod resolveMethod(SearchMethod requested, int variableCount) {
        if (requested != SearchMethod.AUTO) {
            return requested;
        }
        return variableCount <= EngineLimits.MAX_ENUMERATION_VARIABLES ? SearchMethod.DPLL : SearchMethod.WALKSAT;
    }

    private static Random randomFor(SatOptions options) {
        return options.seed() != null ? new Random(options.seed()) : new Random();
    }

    private static boolean isValid(Map<String, Boolean> candidate,
                                   ParsedExpression parsed,
                                   List<SATConstraint> constraints) {
        if (!Evaluator.evaluate(parsed.ast(), candidate)) {
            return false;
        }
        return constraints.stream().allMatch(c -> c.evaluate(candidate));
    }

    //endregion
}
