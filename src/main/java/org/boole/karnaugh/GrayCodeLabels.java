package org.boole.karnaugh;

import java.util.List;

/**
 * Etichette Gray di righe e colonne e variabili che le selezionano.
 */
public record GrayCodeLabels(List<String> rowLabels, List<String> colLabels,
                             List<String> rowVariables, List<String> colVariables) {

    public GrayCodeLabels {
        rowLabels = List.copyOf(rowLabels);
        colLabels = List.copyOf(colLabels);
        rowVariables = List.copyOf(rowVariables);
        colVariables = List.copyOf(colVariables);
    }
}
