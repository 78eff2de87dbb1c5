package org.boole.circuit;

import java.util.Objects;

/**
 * @param layout strategia di disposizione
 * @param spacingX distanza orizzontale tra colonne
 * @param spacingY distanza verticale tra righe
 */
public record CircuitOptions(LayoutStrategy layout, int spacingX, int spacingY) {

    public CircuitOptions {
        Objects.requireNonNull(layout, "Strategia di disposizione mancante");
        if (spacingX <= 0 || spacingY <= 0) {
            throw new IllegalArgumentException("Spaziature devono essere positive: " + spacingX + ", " + spacingY);
        }
    }

    public static CircuitOptions defaults() {
        return new CircuitOptions(LayoutStrategy.LEVELED, 100, 60);
    }

    public CircuitOptions withLayout(LayoutStrategy value) {
        return new CircuitOptions(value, spacingX, spacingY);
    }

    public CircuitOptions withSpacing(int x, int y) {
        return new CircuitOptions(layout, x, y);
    }
}
