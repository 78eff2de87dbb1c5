package org.boole.karnaugh;

/**
 * Coordinate di una cella nella mappa.
 */
public record CellPosition(int row, int col) {
}
