package org.boole.circuit;

/**
 * Collegamento dall'uscita di una porta a un ingresso di un'altra.
 *
 * @param inputIndex posizione dell'ingresso sulla porta di destinazione
 * @param from punto di uscita, al centro del lato destro della sorgente
 * @param to punto d'ingresso sul lato sinistro della destinazione
 */
public record Connection(String fromGate, String toGate, int inputIndex, Position from, Position to) {
}
