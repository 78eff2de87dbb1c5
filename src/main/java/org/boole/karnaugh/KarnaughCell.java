package org.boole.karnaugh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cella della mappa.
 *
 * @param value valore della funzione
 * @param inputs assegnamento delle variabili corrispondente alla cella
 * @param index indice del mintermine (prima variabile = bit più significativo)
 * @param groupIds gruppi che includono la cella
 */
public record KarnaughCell(int row, int col, boolean value, Map<String, Boolean> inputs, int index,
                           List<Integer> groupIds) {

    public KarnaughCell {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        groupIds = List.copyOf(groupIds);
    }
}
