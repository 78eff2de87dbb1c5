package org.boole.circuit;

/**
 * Coordinate nel piano di disegno.
 */
public record Position(double x, double y) {
}
