package org.boole.karnaugh;

import java.util.ArrayList;
import java.util.List;

/**
 * Codice Gray riflesso: etichette consecutive (anche in modo ciclico) differiscono di un bit.
 */
public final class GrayCode {

    private GrayCode() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Sequenza dei valori Gray su {@code bits} bit, es. 2 → [0, 1, 3, 2].
     */
    public static int[] sequence(int bits) {
        int length = 1 << bits;
        int[] codes = new int[length];
        for (int i = 0; i < length; i++) {
            codes[i] = i ^ (i >> 1);
        }
        return codes;
    }

    /**
     * Etichette binarie, es. 2 → ["00", "01", "11", "10"].
     */
    public static List<String> labels(int bits) {
        List<String> labels = new ArrayList<>();
        for (int code : sequence(bits)) {
            StringBuilder sb = new StringBuilder();
            for (int b = bits - 1; b >= 0; b--) {
                sb.append((code >> b) & 1);
            }
            labels.add(sb.toString());
        }
        return labels;
    }
}
