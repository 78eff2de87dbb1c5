package org.boole.minimization;

import org.boole.support.UnsupportedAlgorithmException;

/**
 * Algoritmi di minimizzazione disponibili, con il nome usato nelle richieste.
 */
public enum MinimizationAlgorithm {

    QUINE_MCCLUSKEY("quine-mccluskey"),
    PETRICK("petrick"),
    ESPRESSO("espresso");

    private final String id;

    MinimizationAlgorithm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Nuova istanza del minimizzatore corrispondente.
     */
    public Minimizer newMinimizer() {
        return switch (this) {
            case QUINE_MCCLUSKEY -> new QuineMcCluskeyMinimizer();
            case PETRICK -> new PetrickMinimizer();
            case ESPRESSO -> new EspressoMinimizer();
        };
    }

    /**
     * @throws UnsupportedAlgorithmException se il nome non corrisponde ad alcun algoritmo
     */
    public static MinimizationAlgorithm fromId(String id) {
        for (MinimizationAlgorithm algorithm : values()) {
            if (algorithm.id.equalsIgnoreCase(id)) {
                return algorithm;
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }
}
