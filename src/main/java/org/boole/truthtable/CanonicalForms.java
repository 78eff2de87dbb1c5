package org.boole.truthtable;

import org.boole.ast.Notation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Forme canoniche SOP e POS derivate dai soli insiemi di indici.
 *
 * CONVENZIONI:
 * • mintermine: prodotto di letterali, variabile complementata dove il bit vale 0
 * • maxtermine: somma di letterali, variabile complementata dove il bit vale 1
 * • SOP senza mintermini → "0", POS senza maxtermini → "1"
 */
public final class CanonicalForms {

    private CanonicalForms() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Prodotto del mintermine, es. indice 2 su [A, B] → "AB̄".
     */
    public static String mintermProduct(List<String> variables, int index, Notation notation) {
        int n = variables.size();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            boolean bit = ((index >> (n - 1 - i)) & 1) == 1;
            sb.append(notation.literal(variables.get(i), bit));
        }
        return sb.toString();
    }

    /**
     * Somma del maxtermine racchiusa tra parentesi, es. indice 1 su [A, B] → "(A + B̄)".
     */
    public static String maxtermSum(List<String> variables, int index, Notation notation) {
        int n = variables.size();
        List<String> literals = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            boolean bit = ((index >> (n - 1 - i)) & 1) == 1;
            literals.add(notation.literal(variables.get(i), !bit));
        }
        return "(" + String.join(" + ", literals) + ")";
    }

    /**
     * Somma canonica di prodotti.
     *
     * @param variables variabili in ordine
     * @param minterms indici a valore 1
     * @param rowCount righe totali (2^n)
     */
    public static String sop(List<String> variables, Collection<Integer> minterms, int rowCount, Notation notation) {
        if (minterms.isEmpty()) {
            return "0";
        }
        if (minterms.size() == rowCount) {
            return "1";
        }
        List<String> terms = new ArrayList<>();
        for (int minterm : minterms) {
            terms.add(mintermProduct(variables, minterm, notation));
        }
        return String.join(" + ", terms);
    }

    /**
     * Prodotto canonico di somme.
     */
    public static String pos(List<String> variables, Collection<Integer> maxterms, int rowCount, Notation notation) {
        if (maxterms.isEmpty()) {
            return "1";
        }
        if (maxterms.size() == rowCount) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (int maxterm : maxterms) {
            sb.append(maxtermSum(variables, maxterm, notation));
        }
        return sb.toString();
    }
}
