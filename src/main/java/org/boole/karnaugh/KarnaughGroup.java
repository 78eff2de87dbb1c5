package org.boole.karnaugh;

import java.util.List;

/**
 * Gruppo rettangolare (toroidale) di celle della mappa.
 *
 * @param cells celle del gruppo
 * @param size numero di celle, potenza di due
 * @param minterms indici coperti, crescenti
 * @param literal prodotto delle variabili costanti sul gruppo, es. "AB'"
 * @param primeImplicant indicazione euristica: vero per gruppi di più celle
 */
public record KarnaughGroup(int id, List<CellPosition> cells, int size, List<Integer> minterms, String literal,
                            boolean primeImplicant) {

    public KarnaughGroup {
        cells = List.copyOf(cells);
        minterms = List.copyOf(minterms);
        if (Integer.bitCount(size) != 1) {
            throw new IllegalArgumentException("Dimensione del gruppo non potenza di due: " + size);
        }
    }
}
