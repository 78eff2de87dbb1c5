package org.boole.minimization;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * METODO DI PETRICK (approssimato)
 *
 * Costruisce la funzione di Petrick come prodotto di somme: per ogni mintermine la
 * somma degli implicanti primi che lo coprono. La funzione non viene espansa: si
 * sceglie ogni volta l'implicante presente nel maggior numero di clausole ancora
 * insoddisfatte, fino a soddisfarle tutte. Il risultato è una copertura valida ma
 * non necessariamente minima.
 */
public class PetrickMinimizer implements Minimizer {

    private static final Logger LOGGER = Logger.getLogger(PetrickMinimizer.class.getName());

    @Override
    public MinimizationAlgorithm algorithm() {
        return MinimizationAlgorithm.PETRICK;
    }

    @Override
    public List<Implicant> cover(List<Integer> minterms, int variableCount) {
        List<Implicant> primes = PrimeImplicantGenerator.generate(minterms, variableCount);
        List<List<Integer>> clauses = coveringClauses(primes, minterms);
        LOGGER.finest("Funzione di Petrick: " + clauses.size() + " clausole su " + primes.size() + " primi");

        boolean[] satisfied = new boolean[clauses.size()];
        List<Implicant> selected = new ArrayList<>();
        int open = clauses.size();

        while (open > 0) {
            int[] occurrences = new int[primes.size()];
            for (int c = 0; c < clauses.size(); c++) {
                if (!satisfied[c]) {
                    for (int p : clauses.get(c)) {
                        occurrences[p]++;
                    }
                }
            }

            int best = 0;
            for (int p = 1; p < primes.size(); p++) {
                if (occurrences[p] > occurrences[best]) {
                    best = p;
                }
            }
            if (occurrences[best] == 0) {
                throw new IllegalStateException("Funzione di Petrick non soddisfacibile");
            }

            selected.add(primes.get(best));
            for (int c = 0; c < clauses.size(); c++) {
                if (!satisfied[c] && clauses.get(c).contains(best)) {
                    satisfied[c] = true;
                    open--;
                }
            }
        }

        LOGGER.fine("Petrick: selezionati " + selected.size() + " implicanti");
        return selected;
    }

    /**
     * Per ogni mintermine, indici degli implicanti primi che lo coprono.
     */
    static List<List<Integer>> coveringClauses(List<Implicant> primes, List<Integer> minterms) {
        List<List<Integer>> clauses = new ArrayList<>();
        for (int minterm : minterms) {
            List<Integer> clause = new ArrayList<>();
            for (int p = 0; p < primes.size(); p++) {
                if (primes.get(p).covers(minterm)) {
                    clause.add(p);
                }
            }
            clauses.add(clause);
        }
        return clauses;
    }
}
