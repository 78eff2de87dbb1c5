package org.boole.minimization;

/**
 * Algoritmo richiesto ma non eseguito o fallito; gli altri algoritmi proseguono.
 */
public record AlgorithmFailure(String algorithm, String message) {
}
