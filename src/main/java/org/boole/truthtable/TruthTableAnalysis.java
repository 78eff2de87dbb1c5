package org.boole.truthtable;

import org.boole.parser.ExpressionMetadata.Complexity;

/**
 * Statistiche di una tabella di verità.
 *
 * @param percentageTrue percentuale di righe vere, arrotondata all'intero
 * @param percentageFalse percentuale di righe false, arrotondata all'intero
 */
public record TruthTableAnalysis(int totalCombinations,
                                 int trueCombinations,
                                 int falseCombinations,
                                 long percentageTrue,
                                 long percentageFalse,
                                 boolean tautology,
                                 boolean contradiction,
                                 boolean contingency,
                                 Complexity complexity) {

    /**
     * Calcola le statistiche.
     *
     * La complessità considera il numero di variabili e lo sbilanciamento tra righe
     * vere e false: fino a 2 variabili basic, fino a 4 con sbilanciamento sotto 0.5
     * intermediate, altrimenti advanced.
     */
    static TruthTableAnalysis of(int variableCount, int totalRows, int trueRows) {
        int falseRows = totalRows - trueRows;
        double balance = Math.abs(trueRows - falseRows) / (double) totalRows;

        Complexity complexity;
        if (variableCount <= 2) {
            complexity = Complexity.BASIC;
        } else if (variableCount <= 4 && balance < 0.5) {
            complexity = Complexity.INTERMEDIATE;
        } else {
            complexity = Complexity.ADVANCED;
        }

        return new TruthTableAnalysis(
                totalRows,
                trueRows,
                falseRows,
                Math.round(trueRows * 100.0 / totalRows),
                Math.round(falseRows * 100.0 / totalRows),
                trueRows == totalRows,
                trueRows == 0,
                trueRows > 0 && trueRows < totalRows,
                complexity);
    }
}
