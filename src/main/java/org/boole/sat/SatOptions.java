package org.boole.sat;

import org.boole.support.EngineLimits;

import java.util.Objects;

/**
 * Opzioni di ricerca.
 *
 * @param method strategia di ricerca
 * @param findAllSolutions enumera tutte le soluzioni invece di fermarsi alla prima
 * @param maxSolutions soluzioni restituite al massimo, applicato dopo la validazione
 * @param maxFlips budget di flip per WalkSAT
 * @param noiseProbability probabilità di flip casuale in WalkSAT, in [0, 1]
 * @param seed seme del generatore casuale di WalkSAT, {@code null} per uno non deterministico
 */
public record SatOptions(SearchMethod method,
                         boolean findAllSolutions,
                         int maxSolutions,
                         int maxFlips,
                         double noiseProbability,
                         Long seed) {

    public SatOptions {
        Objects.requireNonNull(method, "Metodo di ricerca mancante");
        if (maxSolutions < 1) {
            throw new IllegalArgumentException("maxSolutions deve essere positivo: " + maxSolutions);
        }
        if (maxFlips < 0) {
            throw new IllegalArgumentException("maxFlips non può essere negativo: " + maxFlips);
        }
        if (noiseProbability < 0.0 || noiseProbability > 1.0) {
            throw new IllegalArgumentException("Probabilità di rumore fuori da [0, 1]: " + noiseProbability);
        }
    }

    public static SatOptions defaults() {
        return new SatOptions(SearchMethod.AUTO, false, EngineLimits.DEFAULT_MAX_SOLUTIONS,
                EngineLimits.DEFAULT_MAX_FLIPS, EngineLimits.DEFAULT_NOISE, null);
    }

    public SatOptions withMethod(SearchMethod value) {
        return new SatOptions(value, findAllSolutions, maxSolutions, maxFlips, noiseProbability, seed);
    }

    public SatOptions withFindAllSolutions(boolean value) {
        return new SatOptions(method, value, maxSolutions, maxFlips, noiseProbability, seed);
    }

    public SatOptions withMaxSolutions(int value) {
        return new SatOptions(method, findAllSolutions, value, maxFlips, noiseProbability, seed);
    }

    public SatOptions withMaxFlips(int value) {
        return new SatOptions(method, findAllSolutions, maxSolutions, value, noiseProbability, seed);
    }

    public SatOptions withNoiseProbability(double value) {
        return new SatOptions(method, findAllSolutions, maxSolutions, maxFlips, value, seed);
    }

    public SatOptions withSeed(Long value) {
        return new SatOptions(method, findAllSolutions, maxSolutions, maxFlips, noiseProbability, value);
    }
}
