package org.boole.karnaugh;

import java.util.List;

/**
 * Soluzione passo per passo: mappa, passi, mintermini e forma SOP.
 */
public record KarnaughSolution(KarnaughMap map, List<KarnaughStep> steps, List<Integer> minterms, String simplifiedSop) {

    public KarnaughSolution {
        steps = List.copyOf(steps);
        minterms = List.copyOf(minterms);
    }
}
