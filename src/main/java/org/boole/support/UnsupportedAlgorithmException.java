package org.boole.support;

/**
 * Nome di algoritmo (minimizzazione o metodo SAT) non riconosciuto.
 */
public class UnsupportedAlgorithmException extends BooleanEngineException {

    private final String algorithm;

    public UnsupportedAlgorithmException(String algorithm) {
        super("Algoritmo non supportato: " + algorithm);
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
