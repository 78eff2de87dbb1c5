package org.boole.minimization;

import org.boole.ast.Notation;

import java.util.ArrayList;
import java.util.List;

/**
 * Algoritmo che produce una copertura a due livelli (somma di prodotti) dell'insieme on.
 */
public interface Minimizer {

    MinimizationAlgorithm algorithm();

    /**
     * Copertura dell'insieme on. Chiamato solo con insiemi né vuoti né completi.
     *
     * @param minterms mintermini a valore 1, crescenti
     * @param variableCount numero di variabili
     * @return implicanti la cui unione è esattamente l'insieme on
     */
    List<Implicant> cover(List<Integer> minterms, int variableCount);

    /**
     * Espressione SOP minimizzata. Insieme on vuoto → "0", completo → "1".
     */
    default String minimize(List<String> variables, List<Integer> minterms, Notation notation) {
        if (minterms.isEmpty()) {
            return "0";
        }
        if (minterms.size() == 1 << variables.size()) {
            return "1";
        }
        List<String> terms = new ArrayList<>();
        for (Implicant implicant : cover(minterms, variables.size())) {
            terms.add(implicant.toTerm(variables, notation));
        }
        return String.join(" + ", terms);
    }

    default String minimize(List<String> variables, List<Integer> minterms) {
        return minimize(variables, minterms, Notation.OVERBAR);
    }
}
