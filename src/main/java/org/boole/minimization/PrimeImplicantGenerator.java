package org.boole.minimization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Generazione degli implicanti primi per fusione a coppie (Quine-McCluskey)
 * e individuazione degli implicanti primi essenziali.
 */
public final class PrimeImplicantGenerator {

    private static final Logger LOGGER = Logger.getLogger(PrimeImplicantGenerator.class.getName());

    private PrimeImplicantGenerator() {
    }

    /**
     * Fonde ripetutamente implicanti della stessa dimensione che differiscono in un solo
     * bit fissato. Gli implicanti di un livello che non partecipano ad alcuna fusione sono primi.
     *
     * @param minterms insieme on della funzione
     * @param variableCount numero di variabili
     * @return implicanti primi senza duplicati, in ordine di scoperta
     */
    public static List<Implicant> generate(List<Integer> minterms, int variableCount) {
        List<Implicant> level = new ArrayList<>();
        for (int minterm : minterms) {
            level.add(Implicant.ofMinterm(minterm, variableCount));
        }

        Set<Implicant> primes = new LinkedHashSet<>();
        int round = 0;
        while (!level.isEmpty()) {
            Set<Implicant> next = new LinkedHashSet<>();
            boolean[] used = new boolean[level.size()];

            for (int i = 0; i < level.size(); i++) {
                for (int j = i + 1; j < level.size(); j++) {
                    Implicant merged = level.get(i).mergeWith(level.get(j));
                    if (merged != null) {
                        next.add(merged);
                        used[i] = true;
                        used[j] = true;
                    }
                }
            }

            for (int i = 0; i < level.size(); i++) {
                if (!used[i]) {
                    primes.add(level.get(i));
                }
            }

            LOGGER.finest("Livello " + round++ + ": " + level.size() + " implicanti, " + next.size() + " fusi");
            level = new ArrayList<>(next);
        }

        LOGGER.fine("Implicanti primi trovati: " + primes.size());
        return new ArrayList<>(primes);
    }

    /**
     * Implicanti primi che sono gli unici a coprire almeno un mintermine.
     */
    public static List<Implicant> essentials(List<Implicant> primes, List<Integer> minterms) {
        Set<Implicant> essentials = new LinkedHashSet<>();
        for (int minterm : minterms) {
            Implicant only = null;
            int coverCount = 0;
            for (Implicant prime : primes) {
                if (prime.covers(minterm)) {
                    coverCount++;
                    only = prime;
                }
            }
            if (coverCount == 1) {
                essentials.add(only);
            }
        }
        return new ArrayList<>(essentials);
    }
}
