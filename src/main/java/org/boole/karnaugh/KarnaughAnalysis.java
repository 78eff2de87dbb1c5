package org.boole.karnaugh;

import org.boole.parser.ExpressionMetadata.Complexity;

/**
 * Statistiche della mappa.
 *
 * @param density percentuale di celle a 1, arrotondata
 * @param hasAdjacentOnes esiste una coppia di 1 adiacenti, considerando i bordi ciclici
 * @param minimizationEfficiency percentuale di termini risparmiati rispetto ai mintermini
 */
public record KarnaughAnalysis(int totalCells,
                               int oneCells,
                               int zeroCells,
                               long density,
                               Complexity complexity,
                               boolean hasAdjacentOnes,
                               int groupCount,
                               long minimizationEfficiency) {
}
