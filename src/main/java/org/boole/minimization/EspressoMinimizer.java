package org.boole.minimization;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESPRESSO EURISTICO
 *
 * ALGORITMO:
 * 1. Copertura iniziale: un cubo unitario per mintermine
 * 2. EXPAND: per ogni cubo libera una variabile alla volta, finché il cubo resta
 *    interamente contenuto nell'insieme on
 * 3. REDUCE: elimina i cubi i cui mintermini sono già coperti dagli altri
 * 4. Ripete 2-3 finché la copertura non cambia
 */
public class EspressoMinimizer implements Minimizer {

    private static final Logger LOGGER = Logger.getLogger(EspressoMinimizer.class.getName());

    @Override
    public MinimizationAlgorithm algorithm() {
        return MinimizationAlgorithm.ESPRESSO;
    }

    @Override
    public List<Implicant> cover(List<Integer> minterms, int variableCount) {
        Set<Integer> onSet = new HashSet<>(minterms);

        List<Implicant> cover = new ArrayList<>();
        for (int minterm : minterms) {
            cover.add(Implicant.ofMinterm(minterm, variableCount));
        }

        int iteration = 0;
        while (true) {
            List<Implicant> expanded = expand(cover, onSet);
            List<Implicant> reduced = reduce(expanded);
            iteration++;
            LOGGER.finest("Iterazione " + iteration + ": " + cover.size() + " → " + reduced.size() + " cubi");
            if (reduced.equals(cover)) {
                break;
            }
            cover = reduced;
        }

        LOGGER.fine("Espresso: " + cover.size() + " cubi dopo " + iteration + " iterazioni");
        return cover;
    }

    private List<Implicant> expand(List<Implicant> cover, Set<Integer> onSet) {
        Set<Implicant> expanded = new LinkedHashSet<>();
        for (Implicant cube : cover) {
            expanded.add(expandCube(cube, onSet));
        }
        return new ArrayList<>(expanded);
    }

    private Implicant expandCube(Implicant cube, Set<Integer> onSet) {
        Implicant current = cube;
        for (int i = 0; i < cube.getVariableCount(); i++) {
            if (!current.isFixed(i)) {
                continue;
            }
            Implicant candidate = current.raise(i);
            if (onSet.containsAll(candidate.getMinterms())) {
                current = candidate;
            }
        }
        return current;
    }

    /**
     * Rimozione sequenziale: un cubo è ridondante rispetto ai cubi ancora presenti.
     */
    private List<Implicant> reduce(List<Implicant> cover) {
        List<Implicant> kept = new ArrayList<>(cover);
        int i = 0;
        while (i < kept.size()) {
            Implicant cube = kept.get(i);
            if (isRedundant(cube, kept)) {
                kept.remove(i);
            } else {
                i++;
            }
        }
        return kept;
    }

    private boolean isRedundant(Implicant cube, List<Implicant> cover) {
        for (int minterm : cube.getMinterms()) {
            boolean coveredElsewhere = false;
            for (Implicant other : cover) {
                if (other != cube && other.covers(minterm)) {
                    coveredElsewhere = true;
                    break;
                }
            }
            if (!coveredElsewhere) {
                return false;
            }
        }
        return true;
    }
}
