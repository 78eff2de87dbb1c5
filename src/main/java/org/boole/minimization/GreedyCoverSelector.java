package org.boole.minimization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Copertura greedy: aggiunge ogni volta il candidato che copre più mintermini
 * ancora scoperti. A parità vince il primo in ordine di lista.
 */
final class GreedyCoverSelector {

    private GreedyCoverSelector() {
    }

    /**
     * @param candidates implicanti selezionabili
     * @param preselected implicanti già scelti (es. essenziali)
     * @param minterms mintermini da coprire
     * @return preselezionati seguiti dai candidati aggiunti
     */
    static List<Implicant> select(List<Implicant> candidates, List<Implicant> preselected, List<Integer> minterms) {
        List<Implicant> selected = new ArrayList<>(preselected);
        Set<Integer> remaining = new LinkedHashSet<>(minterms);
        for (Implicant implicant : preselected) {
            implicant.getMinterms().forEach(remaining::remove);
        }

        while (!remaining.isEmpty()) {
            Implicant best = null;
            int bestCoverage = 0;
            for (Implicant candidate : candidates) {
                if (selected.contains(candidate)) {
                    continue;
                }
                int coverage = 0;
                for (int minterm : candidate.getMinterms()) {
                    if (remaining.contains(minterm)) {
                        coverage++;
                    }
                }
                if (coverage > bestCoverage) {
                    bestCoverage = coverage;
                    best = candidate;
                }
            }
            if (best == null) {
                throw new IllegalStateException("Mintermini non coperti da alcun implicante: " + remaining);
            }
            selected.add(best);
            best.getMinterms().forEach(remaining::remove);
        }
        return selected;
    }
}
