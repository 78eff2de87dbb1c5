package org.boole.conversion;

/**
 * @param description cosa è stato fatto
 * @param expression espressione o termine prodotto dal passo
 * @param rule nome della regola, vuoto se non pertinente
 */
public record ConversionStep(String description, String expression, String rule) {
}
