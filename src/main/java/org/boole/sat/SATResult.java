package org.boole.sat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RISULTATO SAT - Contenitore immutabile per l'esito di una ricerca
 *
 * COMPONENTI:
 * • Esito: soddisfacibile se e solo se esiste almeno una soluzione validata
 * • Soluzioni: assegnamenti completi, già verificati contro espressione e vincoli
 * • Metadati: metodo effettivo, passi di ricerca, tempo, variabili e vincoli
 * • Esaustività: false per WalkSAT, il cui esito negativo non è una prova
 */
public class SATResult {

    //region ATTRIBUTI

    private final boolean satisfiable;
    private final List<Map<String, Boolean>> solutions;
    private final SearchMethod method;
    private final boolean exhaustive;
    private final int searchSteps;
    private final long searchTime;
    private final int variableCount;
    private final int constraintCount;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    private SATResult(boolean satisfiable,
                      List<Map<String, Boolean>> solutions,
                      SearchMethod method,
                      boolean exhaustive,
                      int searchSteps,
                      long searchTime,
                      int variableCount,
                      int constraintCount) {
        Objects.requireNonNull(solutions, "Lista soluzioni mancante");
        if (satisfiable == solutions.isEmpty()) {
            throw new IllegalArgumentException(satisfiable
                    ? "Risultato SAT richiede almeno una soluzione"
                    : "Risultato UNSAT non può avere soluzioni");
        }
        if (method == SearchMethod.AUTO) {
            throw new IllegalArgumentException("Il risultato deve riportare il metodo effettivamente usato");
        }

        List<Map<String, Boolean>> copies = new ArrayList<>(solutions.size());
        for (Map<String, Boolean> solution : solutions) {
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(solution)));
        }

        this.satisfiable = satisfiable;
        this.solutions = Collections.unmodifiableList(copies);
        this.method = Objects.requireNonNull(method, "Metodo di ricerca mancante");
        this.exhaustive = exhaustive;
        this.searchSteps = searchSteps;
        this.searchTime = searchTime;
        this.variableCount = variableCount;
        this.constraintCount = constraintCount;
    }

    //endregion

    //region FACTORY METHODS

    /**
     * @param solutions soluzioni validate, non vuote
     * @param statistics contatori della ricerca, con timer già fermato
     */
    public static SATResult satisfiable(List<Map<String, Boolean>> solutions,
                                        SearchMethod method,
                                        boolean exhaustive,
                                        SATStatistics statistics,
                                        int variableCount,
                                        int constraintCount) {
        return new SATResult(true, solutions, method, exhaustive, statistics.getSearchSteps(),
                statistics.getExecutionTimeMs(), variableCount, constraintCount);
    }

    public static SATResult unsatisfiable(SearchMethod method,
                                          boolean exhaustive,
                                          SATStatistics statistics,
                                          int variableCount,
                                          int constraintCount) {
        return new SATResult(false, List.of(), method, exhaustive, statistics.getSearchSteps(),
                statistics.getExecutionTimeMs(), variableCount, constraintCount);
    }

    //endregion

    //region ACCESSORS

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public List<Map<String, Boolean>> getSolutions() {
        return solutions;
    }

    /**
     * @return prima soluzione, null se insoddisfacibile
     */
    public Map<String, Boolean> solution() {
        return solutions.isEmpty() ? null : solutions.get(0);
    }

    public int solutionCount() {
        return solutions.size();
    }

    public SearchMethod getMethod() {
        return method;
    }

    /**
     * @return true se un esito negativo dimostra l'insoddisfacibilità
     */
    public boolean isExhaustive() {
        return exhaustive;
    }

    public int getSearchSteps() {
        return searchSteps;
    }

    public long getSearchTime() {
        return searchTime;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getConstraintCount() {
        return constraintCount;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (satisfiable) {
            output.append("SAT (").append(solutions.size()).append(" soluzioni)\n");
            for (Map<String, Boolean> solution : solutions) {
                output.append("  ");
                solution.forEach((name, value) ->
                        output.append(name).append("=").append(value ? 1 : 0).append(" "));
                output.append("\n");
            }
        } else if (exhaustive) {
            output.append("UNSAT\n");
        } else {
            output.append("UNSAT (nessuna soluzione trovata entro il budget di flip)\n");
        }
        return output.toString();
    }

    /**
     * Rappresentazione sintetica per il logging.
     */
    public String toCompactString() {
        return String.format("SATResult{%s, method=%s, solutions=%d, steps=%d, time=%dms}",
                satisfiable ? "SAT" : "UNSAT", method.id(), solutions.size(), searchSteps, searchTime);
    }

    //endregion
}
