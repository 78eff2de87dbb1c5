package org.boole.truthtable;

import java.util.List;

/**
 * Tabella parziale di una sottoespressione composta.
 *
 * @param expression sottoespressione in notazione con barra
 * @param outputs valore per ogni riga, nell'ordine della tabella principale
 */
public record IntermediateStep(String expression, List<Boolean> outputs) {

    public IntermediateStep {
        outputs = List.copyOf(outputs);
    }
}
