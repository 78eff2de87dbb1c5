package org.boole.minimization;

import org.boole.parser.ExpressionMetadata.Complexity;
import org.boole.parser.ParsedExpression;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableGenerator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * SUITE DI MINIMIZZAZIONE - Esecuzione, confronto e raccomandazione degli algoritmi
 *
 * Ogni algoritmo richiesto gira in isolamento: un nome sconosciuto o un errore interno
 * produce un {@link AlgorithmFailure} e non interrompe gli altri. Funzioni costanti
 * (insieme on vuoto o completo) producono un unico risultato "trivial".
 */
public class MinimizationSuite {

    private static final Logger LOGGER = Logger.getLogger(MinimizationSuite.class.getName());

    private static final List<String> ALL_ALGORITHMS = List.of(
            MinimizationAlgorithm.QUINE_MCCLUSKEY.id(),
            MinimizationAlgorithm.PETRICK.id(),
            MinimizationAlgorithm.ESPRESSO.id());

    private final TruthTableGenerator truthTableGenerator = new TruthTableGenerator();

    //region MINIMIZZAZIONE

    /**
     * Esegue tutti gli algoritmi.
     */
    public MinimizationReport minimize(ParsedExpression parsed) {
        return minimize(parsed, ALL_ALGORITHMS);
    }

    /**
     * Esegue gli algoritmi richiesti per nome.
     *
     * @param parsed espressione analizzata
     * @param algorithms nomi come "quine-mccluskey", "petrick", "espresso"
     * @return risultati ordinati per punteggio e fallimenti isolati
     * @throws org.boole.support.CapacityExceededException se la tabella non è enumerabile
     */
    public MinimizationReport minimize(ParsedExpression parsed, List<String> algorithms) {
        TruthTable table = truthTableGenerator.generate(parsed);
        return minimize(table, parsed.originalText(), algorithms);
    }

    /**
     * Esegue gli algoritmi richiesti su una tabella già calcolata.
     */
    public MinimizationReport minimize(TruthTable table, String originalExpression, List<String> algorithms) {
        long start = System.currentTimeMillis();
        List<Integer> minterms = table.minterms();
        List<String> variables = table.variables();

        if (minterms.isEmpty() || minterms.size() == table.rows().size()) {
            String constant = minterms.isEmpty() ? "0" : "1";
            LOGGER.fine("Funzione costante, minimizzazione banale: " + constant);
            MinimizationResult trivial = MinimizationResult.of(MinimizationResult.TRIVIAL, constant, originalExpression,
                    0, minterms.size(), variables.size(), false);
            return new MinimizationReport(List.of(trivial), List.of());
        }

        List<MinimizationResult> results = new ArrayList<>();
        List<AlgorithmFailure> failures = new ArrayList<>();

        for (String name : algorithms) {
            long algorithmStart = System.currentTimeMillis();
            try {
                Minimizer minimizer = MinimizationAlgorithm.fromId(name).newMinimizer();
                String minimized = minimizer.minimize(variables, minterms);
                long elapsed = System.currentTimeMillis() - algorithmStart;
                results.add(MinimizationResult.of(minimizer.algorithm().id(), minimized, originalExpression,
                        elapsed, minterms.size(), variables.size(), true));
            } catch (RuntimeException e) {
                LOGGER.warning("Algoritmo " + name + " fallito: " + e.getMessage());
                failures.add(new AlgorithmFailure(name, e.getMessage()));
            }
        }

        results.sort(Comparator.comparingLong(MinimizationResult::performance).reversed());
        LOGGER.info("Minimizzazione completata in " + (System.currentTimeMillis() - start) + " ms: "
                + results.size() + " risultati, " + failures.size() + " fallimenti");
        return new MinimizationReport(results, failures);
    }

    //endregion

    //region CONFRONTO E RACCOMANDAZIONI

    /**
     * Esegue i tre algoritmi e riassume: migliore, riduzione media, porte medie, tempo totale.
     */
    public MinimizationComparison compare(ParsedExpression parsed) {
        long start = System.currentTimeMillis();
        MinimizationReport report = minimize(parsed, ALL_ALGORITHMS);
        long total = System.currentTimeMillis() - start;

        List<MinimizationResult> results = report.results();
        String best = results.isEmpty() ? "none" : results.get(0).algorithm();
        long averageReduction = Math.round(results.stream()
                .mapToLong(MinimizationResult::reductionPercentage).average().orElse(0));
        long averageGates = Math.round(results.stream()
                .mapToInt(MinimizationResult::gateCount).average().orElse(0));

        return new MinimizationComparison(parsed.originalText(), results, best, averageReduction, averageGates, total);
    }

    /**
     * REGOLE:
     * • fino a 4 variabili: Quine-McCluskey, priorità alta
     * • da 5 a 8 variabili: Espresso, priorità alta
     * • complessità advanced: Espresso, priorità media
     * • sempre: Petrick, priorità bassa
     */
    public MinimizationRecommendation recommend(ParsedExpression parsed) {
        int n = parsed.variableCount();
        Complexity complexity = parsed.metadata().complexity();
        List<MinimizationRecommendation.Entry> entries = new ArrayList<>();

        if (n <= 4) {
            entries.add(new MinimizationRecommendation.Entry(MinimizationAlgorithm.QUINE_MCCLUSKEY,
                    "Ottimale per poche variabili", MinimizationRecommendation.Priority.HIGH));
        }
        if (n > 4 && n <= 8) {
            entries.add(new MinimizationRecommendation.Entry(MinimizationAlgorithm.ESPRESSO,
                    "Buon compromesso euristico per complessità media", MinimizationRecommendation.Priority.HIGH));
        }
        if (complexity == Complexity.ADVANCED) {
            entries.add(new MinimizationRecommendation.Entry(MinimizationAlgorithm.ESPRESSO,
                    "Gestisce bene le espressioni complesse", MinimizationRecommendation.Priority.MEDIUM));
        }
        entries.add(new MinimizationRecommendation.Entry(MinimizationAlgorithm.PETRICK,
                "Copertura basata sulla funzione di Petrick", MinimizationRecommendation.Priority.LOW));

        return new MinimizationRecommendation(parsed.originalText(), complexity, n, entries);
    }

    //endregion
}
