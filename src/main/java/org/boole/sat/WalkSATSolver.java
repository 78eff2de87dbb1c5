package org.boole.sat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * SOLUTORE WALKSAT - Ricerca locale stocastica
 *
 * ALGORITMO:
 * • Assegnamento iniziale casuale
 * • A ogni passo sceglie a caso un vincolo violato
 * • Con probabilità p inverte una sua variabile scelta a caso, altrimenti quella
 *   che lascia il minor numero di vincoli violati
 * • Termina al primo modello o a budget di flip esaurito
 *
 * Non è completo: l'esaurimento del budget non dimostra l'insoddisfacibilità.
 */
class WalkSATSolver {

    private static final Logger LOGGER = Logger.getLogger(WalkSATSolver.class.getName());

    private final List<String> variables;
    private final List<SATConstraint> constraints;
    private final SATStatistics statistics;
    private final int maxFlips;
    private final double noiseProbability;
    private final Random random;

    WalkSATSolver(List<String> variables,
                  List<SATConstraint> constraints,
                  SATStatistics statistics,
                  int maxFlips,
                  double noiseProbability,
                  Random random) {
        this.variables = List.copyOf(variables);
        this.constraints = List.copyOf(constraints);
        this.statistics = statistics;
        this.maxFlips = maxFlips;
        this.noiseProbability = noiseProbability;
        this.random = random;
    }

    /**
     * @return al più un modello
     */
    List<Map<String, Boolean>> solve() {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (String variable : variables) {
            assignment.put(variable, random.nextBoolean());
        }

        for (int flip = 0; flip <= maxFlips; flip++) {
            List<SATConstraint> unsatisfied = unsatisfied(assignment);
            if (unsatisfied.isEmpty()) {
                LOGGER.fine("WalkSAT: modello trovato dopo " + flip + " flip");
                return List.of(assignment);
            }
            if (flip == maxFlips) {
                break;
            }

            SATConstraint target = unsatisfied.get(random.nextInt(unsatisfied.size()));
            List<String> candidates = flippable(target);
            if (candidates.isEmpty()) {
                // vincolo senza variabili libere: nessun flip può soddisfarlo
                break;
            }

            String chosen;
            if (random.nextDouble() < noiseProbability) {
                chosen = candidates.get(random.nextInt(candidates.size()));
                statistics.incrementRandomFlips();
            } else {
                chosen = bestFlip(candidates, assignment);
            }
            assignment.put(chosen, !assignment.get(chosen));
            statistics.incrementFlips();
        }

        LOGGER.fine("WalkSAT: budget di " + maxFlips + " flip esaurito senza modello");
        return List.of();
    }

    private List<SATConstraint> unsatisfied(Map<String, Boolean> assignment) {
        List<SATConstraint> result = new ArrayList<>();
        for (SATConstraint constraint : constraints) {
            if (!constraint.evaluate(assignment)) {
                result.add(constraint);
            }
        }
        return result;
    }

    private List<String> flippable(SATConstraint constraint) {
        List<String> result = new ArrayList<>();
        for (String variable : constraint.getVariables()) {
            if (variables.contains(variable)) {
                result.add(variable);
            }
        }
        return result;
    }

    /**
     * Variabile il cui flip minimizza i vincoli violati; a parità vince la prima.
     */
    private String bestFlip(List<String> candidates, Map<String, Boolean> assignment) {
        String best = candidates.get(0);
        int bestScore = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            assignment.put(candidate, !assignment.get(candidate));
            int score = unsatisfied(assignment).size();
            assignment.put(candidate, !assignment.get(candidate));
            if (score < bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }
}
