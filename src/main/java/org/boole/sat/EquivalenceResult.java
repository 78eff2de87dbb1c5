package org.boole.sat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito del confronto esaustivo tra due espressioni.
 *
 * @param equivalent true se nessun assegnamento le distingue
 * @param counterExamples assegnamenti su cui differiscono, in ordine di indice
 * @param totalChecked assegnamenti esaminati, 2^n sull'unione delle variabili
 */
public record EquivalenceResult(boolean equivalent, List<CounterExample> counterExamples, int totalChecked) {

    public EquivalenceResult {
        counterExamples = List.copyOf(counterExamples);
        if (equivalent != counterExamples.isEmpty()) {
            throw new IllegalArgumentException("Esito incoerente con i controesempi");
        }
    }

    /**
     * @param firstResult valore della prima espressione
     * @param secondResult valore della seconda espressione
     */
    public record CounterExample(Map<String, Boolean> assignment, boolean firstResult, boolean secondResult) {

        public CounterExample {
            assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        }
    }
}
