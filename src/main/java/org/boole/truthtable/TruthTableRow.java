package org.boole.truthtable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Riga della tabella di verità.
 *
 * @param assignment valori delle variabili, nell'ordine della tabella
 * @param output valore dell'espressione
 * @param index indice binario della riga (prima variabile = bit più significativo)
 */
public record TruthTableRow(Map<String, Boolean> assignment, boolean output, int index) {

    public TruthTableRow {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * Ingressi come stringa binaria, es. "101".
     */
    public String binaryInput() {
        StringBuilder sb = new StringBuilder();
        for (Boolean value : assignment.values()) {
            sb.append(value ? '1' : '0');
        }
        return sb.toString();
    }
}
