package org.boole.circuit;

import java.util.List;

/**
 * Riquadro di disegno con margine di 40 unità su larghezza e altezza.
 */
public record Bounds(double minX, double minY, double maxX, double maxY, double width, double height) {

    private static final double MARGIN = 40;

    /** Riquadro 100x100 per un circuito senza porte */
    public static final Bounds EMPTY = new Bounds(0, 0, 100, 100, 100, 100);

    public static Bounds of(List<Gate> gates) {
        if (gates.isEmpty()) {
            return EMPTY;
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Gate gate : gates) {
            minX = Math.min(minX, gate.position().x());
            minY = Math.min(minY, gate.position().y());
            maxX = Math.max(maxX, gate.position().x() + gate.width());
            maxY = Math.max(maxY, gate.position().y() + gate.height());
        }
        return new Bounds(minX, minY, maxX, maxY, maxX - minX + MARGIN, maxY - minY + MARGIN);
    }
}
