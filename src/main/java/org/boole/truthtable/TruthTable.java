package org.boole.truthtable;

import org.boole.ast.Notation;

import java.util.List;

/**
 * TABELLA DI VERITÀ - Enumerazione completa degli assegnamenti di un'espressione
 *
 * INVARIANTI:
 * • rows.size() == 2^n, in ordine di indice binario
 * • mintermini e maxtermini partizionano [0, 2^n)
 * • la prima variabile è il bit più significativo dell'indice
 *
 * @param variables variabili in ordine alfabetico
 * @param rows righe in ordine di indice
 * @param minterms indici delle righe a valore 1, crescenti
 * @param maxterms indici delle righe a valore 0, crescenti
 */
public record TruthTable(List<String> variables,
                         List<TruthTableRow> rows,
                         List<Integer> minterms,
                         List<Integer> maxterms) {

    public TruthTable {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
        minterms = List.copyOf(minterms);
        maxterms = List.copyOf(maxterms);
        if (rows.size() != 1 << variables.size()) {
            throw new IllegalArgumentException("Numero di righe incoerente: attese " + (1 << variables.size())
                    + ", trovate " + rows.size());
        }
        if (minterms.size() + maxterms.size() != rows.size()) {
            throw new IllegalArgumentException("Mintermini e maxtermini non partizionano le righe");
        }
    }

    public int variableCount() {
        return variables.size();
    }

    /**
     * Valore della funzione all'indice dato.
     */
    public boolean outputAt(int index) {
        return rows.get(index).output();
    }

    public String canonicalSop() {
        return CanonicalForms.sop(variables, minterms, rows.size(), Notation.OVERBAR);
    }

    public String canonicalPos() {
        return CanonicalForms.pos(variables, maxterms, rows.size(), Notation.OVERBAR);
    }

    public TruthTableAnalysis analysis() {
        return TruthTableAnalysis.of(variables.size(), rows.size(), minterms.size());
    }
}
