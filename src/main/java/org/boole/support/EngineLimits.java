package org.boole.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LIMITI DEL MOTORE - Soglie globali verificate prima di ogni enumerazione
 *
 * Ogni operazione esaustiva (tabella di verità, DPLL, forza bruta, equivalenza)
 * controlla il numero di variabili all'ingresso e fallisce subito con
 * {@link CapacityExceededException} invece di esaurire tempo o memoria.
 */
public final class EngineLimits {

    /** Variabili massime per enumerazioni 2^n */
    public static final int MAX_ENUMERATION_VARIABLES = 10;

    /** Intervallo di variabili gestito dalle mappe di Karnaugh */
    public static final int MIN_KARNAUGH_VARIABLES = 2;
    public static final int MAX_KARNAUGH_VARIABLES = 6;

    /** Parametri predefiniti di WalkSAT */
    public static final int DEFAULT_MAX_FLIPS = 1000;
    public static final double DEFAULT_NOISE = 0.5;

    /** Soluzioni restituite al massimo da una ricerca SAT */
    public static final int DEFAULT_MAX_SOLUTIONS = 100;

    /**
     * Annidamento massimo: livelli di parentesi e negazioni prefisse nel testo,
     * profondità dell'albero sintattico dopo il parsing. I visitor sono ricorsivi.
     */
    public static final int MAX_EXPRESSION_DEPTH = 256;

    private EngineLimits() {
        throw new UnsupportedOperationException("Classe di costanti non istanziabile");
    }

    /**
     * Verifica il limite di enumerazione.
     *
     * @param operation nome dell'operazione, riportato nel messaggio d'errore
     * @param variableCount numero di variabili richiesto
     * @throws CapacityExceededException se oltre {@link #MAX_ENUMERATION_VARIABLES}
     */
    public static void requireEnumerable(String operation, int variableCount) {
        if (variableCount > MAX_ENUMERATION_VARIABLES) {
            throw new CapacityExceededException(operation, MAX_ENUMERATION_VARIABLES, variableCount);
        }
    }

    /**
     * Verifica il limite di annidamento.
     *
     * @throws CapacityExceededException se oltre {@link #MAX_EXPRESSION_DEPTH}
     */
    public static void requireNestable(String operation, int depth) {
        if (depth > MAX_EXPRESSION_DEPTH) {
            throw new CapacityExceededException(operation, MAX_EXPRESSION_DEPTH, depth, "livelli di annidamento");
        }
    }

    /**
     * Assegnamento corrispondente a un indice binario, prima variabile come bit più significativo.
     */
    public static Map<String, Boolean> assignmentOf(List<String> variables, int index) {
        int n = variables.size();
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            assignment.put(variables.get(i), ((index >> (n - 1 - i)) & 1) == 1);
        }
        return assignment;
    }
}
