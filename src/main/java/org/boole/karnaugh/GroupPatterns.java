package org.boole.karnaugh;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rettangoli candidati per ogni dimensione di gruppo, con avvolgimento ai bordi.
 *
 * ORDINE DI PROVA:
 * • 1: celle singole
 * • 2: coppie orizzontali, poi verticali
 * • 4: quadrati 2×2, poi strisce 1×4 e 4×1
 * • 8: rettangoli 2×4 e 4×2, poi strisce 1×8 e 8×1
 *
 * I rettangoli più grandi della mappa vengono scartati; quelli che per avvolgimento
 * ripeterebbero una cella non vengono generati.
 */
final class GroupPatterns {

    private GroupPatterns() {
    }

    static List<List<CellPosition>> forSize(int size, int rows, int cols) {
        List<List<CellPosition>> patterns = new ArrayList<>();
        switch (size) {
            case 1 -> patterns.addAll(rectangles(1, 1, rows, cols));
            case 2 -> {
                patterns.addAll(rectangles(1, 2, rows, cols));
                patterns.addAll(rectangles(2, 1, rows, cols));
            }
            case 4 -> {
                patterns.addAll(rectangles(2, 2, rows, cols));
                patterns.addAll(rectangles(1, 4, rows, cols));
                patterns.addAll(rectangles(4, 1, rows, cols));
            }
            case 8 -> {
                patterns.addAll(rectangles(2, 4, rows, cols));
                patterns.addAll(rectangles(4, 2, rows, cols));
                patterns.addAll(rectangles(1, 8, rows, cols));
                patterns.addAll(rectangles(8, 1, rows, cols));
            }
            default -> throw new IllegalArgumentException("Dimensione di gruppo non gestita: " + size);
        }
        return patterns;
    }

    /**
     * Tutti i rettangoli height×width con origine in ogni cella.
     */
    private static List<List<CellPosition>> rectangles(int height, int width, int rows, int cols) {
        List<List<CellPosition>> result = new ArrayList<>();
        if (height > rows || width > cols) {
            return result;
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Set<CellPosition> cells = new LinkedHashSet<>();
                for (int i = 0; i < height; i++) {
                    for (int j = 0; j < width; j++) {
                        cells.add(new CellPosition((r + i) % rows, (c + j) % cols));
                    }
                }
                if (cells.size() == height * width) {
                    result.add(new ArrayList<>(cells));
                }
            }
        }
        return result;
    }
}
