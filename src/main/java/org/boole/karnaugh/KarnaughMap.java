package org.boole.karnaugh;

import java.util.List;

/**
 * MAPPA DI KARNAUGH
 *
 * INVARIANTI:
 * • rows × cols == 2^n
 * • ogni gruppo contiene solo celle a 1 e ha dimensione potenza di due
 * • nessuna cella appartiene a due gruppi
 *
 * @param cells griglia per righe
 * @param simplifiedSop somma dei letterali dei gruppi, vuota se non richiesta
 * @param simplifiedPos prodotto di somme ricavato dai gruppi di zeri, vuoto se non richiesto
 */
public record KarnaughMap(List<String> variables,
                          int rows,
                          int cols,
                          List<List<KarnaughCell>> cells,
                          List<KarnaughGroup> groups,
                          String simplifiedSop,
                          String simplifiedPos,
                          GrayCodeLabels labels,
                          KarnaughAnalysis analysis) {

    public KarnaughMap {
        variables = List.copyOf(variables);
        cells = cells.stream().map(List::copyOf).toList();
        groups = List.copyOf(groups);
    }

    public KarnaughCell cell(int row, int col) {
        return cells.get(row).get(col);
    }
}
