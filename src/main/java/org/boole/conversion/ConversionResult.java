package org.boole.conversion;

import java.util.List;
import java.util.Objects;

/**
 * Esito di una conversione SOP o POS.
 *
 * @param original testo originale dell'espressione
 * @param converted forma prodotta
 * @param form forma di destinazione
 * @param steps passi registrati, vuota se non richiesti
 * @param metadata complessità, termini e indici di origine
 */
public record ConversionResult(String original,
                               String converted,
                               TargetForm form,
                               List<ConversionStep> steps,
                               Metadata metadata) {

    public ConversionResult {
        Objects.requireNonNull(converted, "Forma convertita mancante");
        Objects.requireNonNull(form, "Forma di destinazione mancante");
        steps = List.copyOf(steps);
    }

    /**
     * @param termCount prodotti (SOP) o clausole (POS) nella forma prodotta, 0 per una costante
     * @param terms mintermini (SOP) o maxtermini (POS) di partenza
     * @param canonical true se la forma è quella canonica
     */
    public record Metadata(ConversionComplexity complexity, int termCount, List<Integer> terms, boolean canonical) {

        public Metadata {
            terms = List.copyOf(terms);
        }
    }
}
