package org.boole.karnaugh;

import org.boole.minimization.Implicant;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RAGGRUPPAMENTO GREEDY delle celle con un dato valore
 *
 * Prova le dimensioni 8, 4, 2, 1 nell'ordine e accetta un rettangolo se tutte le sue
 * celle hanno il valore cercato, nessuna è già stata presa e le celle formano un
 * sottocubo (le variabili costanti sul gruppo individuano esattamente quelle celle).
 * L'ultimo vincolo serve sulle mappe a 5 e 6 variabili, dove quattro colonne Gray
 * consecutive non sempre formano un sottocubo.
 */
final class KarnaughGrouper {

    private static final Logger LOGGER = Logger.getLogger(KarnaughGrouper.class.getName());

    private static final int[] GROUP_SIZES = {8, 4, 2, 1};

    /**
     * Gruppo trovato: celle e cubo corrispondente.
     */
    record Found(List<CellPosition> cells, Implicant cube) {
    }

    private KarnaughGrouper() {
    }

    /**
     * @param values griglia dei valori
     * @param indices griglia degli indici di mintermine
     * @param target valore da raggruppare (true per SOP, false per POS)
     * @param variableCount numero di variabili
     */
    static List<Found> group(boolean[][] values, int[][] indices, boolean target, int variableCount) {
        int rows = values.length;
        int cols = values[0].length;
        boolean[][] claimed = new boolean[rows][cols];
        List<Found> groups = new ArrayList<>();

        for (int size : GROUP_SIZES) {
            for (List<CellPosition> pattern : GroupPatterns.forSize(size, rows, cols)) {
                if (!available(pattern, values, claimed, target)) {
                    continue;
                }
                List<Integer> cellIndices = new ArrayList<>();
                for (CellPosition cell : pattern) {
                    cellIndices.add(indices[cell.row()][cell.col()]);
                }
                Implicant cube = Implicant.spanning(cellIndices, variableCount);
                if (cube.getMinterms().size() != size) {
                    continue;
                }
                for (CellPosition cell : pattern) {
                    claimed[cell.row()][cell.col()] = true;
                }
                groups.add(new Found(pattern, cube));
                LOGGER.finest("Gruppo di " + size + " celle: " + cube.pattern());
            }
        }
        return groups;
    }

    private static boolean available(List<CellPosition> pattern, boolean[][] values, boolean[][] claimed,
                                     boolean target) {
        for (CellPosition cell : pattern) {
            if (values[cell.row()][cell.col()] != target || claimed[cell.row()][cell.col()]) {
                return false;
            }
        }
        return true;
    }
}
