package org.boole.karnaugh;

/**
 * Passo della soluzione guidata.
 */
public record KarnaughStep(int step, String description, String action) {
}
