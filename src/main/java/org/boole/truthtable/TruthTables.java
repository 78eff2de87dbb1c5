package org.boole.truthtable;

import org.boole.support.EngineLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Costruzione di tabelle da insiemi di indici e confronto tra tabelle.
 */
public final class TruthTables {

    private TruthTables() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tabella vera esattamente sugli indici indicati.
     */
    public static TruthTable fromMinterms(List<String> variables, Set<Integer> minterms) {
        return build(variables, minterms, true);
    }

    /**
     * Tabella falsa esattamente sugli indici indicati.
     */
    public static TruthTable fromMaxterms(List<String> variables, Set<Integer> maxterms) {
        return build(variables, maxterms, false);
    }

    private static TruthTable build(List<String> variables, Set<Integer> indices, boolean valueOnIndices) {
        EngineLimits.requireEnumerable("Tabella da indici", variables.size());
        int rowCount = 1 << variables.size();
        for (int index : indices) {
            if (index < 0 || index >= rowCount) {
                throw new IllegalArgumentException("Indice " + index + " fuori da [0, " + rowCount + ")");
            }
        }

        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        List<Integer> minterms = new ArrayList<>();
        List<Integer> maxterms = new ArrayList<>();
        for (int index = 0; index < rowCount; index++) {
            boolean output = indices.contains(index) == valueOnIndices;
            Map<String, Boolean> assignment = EngineLimits.assignmentOf(variables, index);
            rows.add(new TruthTableRow(assignment, output, index));
            (output ? minterms : maxterms).add(index);
        }
        return new TruthTable(variables, rows, minterms, maxterms);
    }

    /**
     * Confronta due tabelle: stesse variabili (in qualunque ordine) e stesse uscite riga per riga.
     */
    public static TruthTableComparison compare(TruthTable first, TruthTable second) {
        if (first.variableCount() != second.variableCount()) {
            return new TruthTableComparison(false, "Numero di variabili diverso", -1);
        }
        if (!new TreeSet<>(first.variables()).equals(new TreeSet<>(second.variables()))) {
            return new TruthTableComparison(false, "Variabili diverse", -1);
        }

        for (int i = 0; i < first.rows().size(); i++) {
            TruthTableRow row = first.rows().get(i);
            boolean other = second.rows().get(indexIn(second, row.assignment())).output();
            if (row.output() != other) {
                return new TruthTableComparison(false, "Uscite diverse per l'ingresso " + row.binaryInput(), i);
            }
        }
        return new TruthTableComparison(true, "Tabelle equivalenti", -1);
    }

    private static int indexIn(TruthTable table, Map<String, Boolean> assignment) {
        int n = table.variableCount();
        int index = 0;
        for (int i = 0; i < n; i++) {
            if (assignment.get(table.variables().get(i))) {
                index |= 1 << (n - 1 - i);
            }
        }
        return index;
    }
}
