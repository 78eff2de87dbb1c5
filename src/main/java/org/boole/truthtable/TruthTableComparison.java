package org.boole.truthtable;

/**
 * Esito del confronto tra due tabelle di verità.
 *
 * @param differingRow indice della prima riga discordante, -1 se non applicabile
 */
public record TruthTableComparison(boolean equivalent, String reason, int differingRow) {
}
