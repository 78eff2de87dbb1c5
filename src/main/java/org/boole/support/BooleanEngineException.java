package org.boole.support;

/**
 * Radice della gerarchia di eccezioni del motore booleano.
 *
 * Tutte le eccezioni di dominio sono unchecked: un errore di parsing o un limite
 * superato interrompono la pipeline dell'espressione corrente, mentre i livelli
 * batch e di minimizzazione le isolano per singolo elemento.
 */
public class BooleanEngineException extends RuntimeException {

    public BooleanEngineException(String message) {
        super(message);
    }

    public BooleanEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
