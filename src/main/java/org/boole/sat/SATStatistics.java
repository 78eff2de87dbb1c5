package org.boole.sat;

/**
 * STATISTICHE SAT - Contatori e tempi raccolti durante una ricerca
 *
 * Ogni strategia incrementa i contatori pertinenti:
 * • DPLL: decisioni e backtrack
 * • WalkSAT: flip e passi casuali
 * • Forza bruta: candidati esaminati
 *
 * Il numero di passi di ricerca riportato nel risultato è la somma di decisioni,
 * flip e candidati.
 */
public class SATStatistics {

    //region CONTATORI

    /** Assegnamenti di variabile tentati dal DPLL */
    private int decisions = 0;

    /** Rami abbandonati per inconsistenza */
    private int backtracks = 0;

    /** Flip eseguiti da WalkSAT */
    private int flips = 0;

    /** Flip scelti a caso per effetto del rumore */
    private int randomFlips = 0;

    /** Assegnamenti completi esaminati */
    private int candidates = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;
    private long startTime;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementBacktracks() {
        backtracks++;
    }

    public synchronized void incrementFlips() {
        flips++;
    }

    public synchronized void incrementRandomFlips() {
        randomFlips++;
    }

    public synchronized void incrementCandidates() {
        candidates++;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma la misurazione. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, o parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    //region ACCESSORS

    public int getDecisions() {
        return decisions;
    }

    public int getBacktracks() {
        return backtracks;
    }

    public int getFlips() {
        return flips;
    }

    public int getRandomFlips() {
        return randomFlips;
    }

    public int getCandidates() {
        return candidates;
    }

    public int getSearchSteps() {
        return decisions + flips + candidates;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("==========================[ SEARCH STATS ]==========================\n");
        if (decisions > 0) {
            output.append("    Decisioni: ").append(decisions).append("\n");
            output.append("    Backtrack: ").append(backtracks).append("\n");
        }
        if (flips > 0) {
            output.append("    Flip: ").append(flips)
                    .append(" (casuali: ").append(randomFlips).append(")\n");
        }
        if (candidates > 0) {
            output.append("    Candidati esaminati: ").append(candidates).append("\n");
        }
        output.append("    Tempo di ricerca: ").append(getExecutionTimeMs()).append(" ms\n");
        output.append("====================================================================\n");
        return output.toString();
    }
}
