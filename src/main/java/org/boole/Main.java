package org.boole;

import org.boole.circuit.LogicCircuit;
import org.boole.conversion.ConversionResult;
import org.boole.karnaugh.KarnaughCell;
import org.boole.karnaugh.KarnaughGroup;
import org.boole.karnaugh.KarnaughMap;
import org.boole.minimization.AlgorithmFailure;
import org.boole.minimization.MinimizationReport;
import org.boole.minimization.MinimizationResult;
import org.boole.parser.ParsedExpression;
import org.boole.sat.SATResult;
import org.boole.simplifier.SimplificationResult;
import org.boole.simplifier.SimplificationStep;
import org.boole.support.BooleanEngineException;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableRow;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * MOTORE BOOLEANO - Interfaccia a riga di comando
 *
 * PIPELINE:
 * 1. INPUT: espressione singola (-e) o file con un'espressione per riga (-f)
 * 2. ELABORAZIONE: ogni espressione in un task con timeout (-t secondi)
 * 3. OUTPUT: sezioni del report per le operazioni richieste (-op=)
 *
 * Nei file le righe vuote e quelle che iniziano con '#' vengono ignorate.
 *
 * @author Amos Lo Verde
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OP_PARAM = "-op=";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Righe della tabella di verità stampate al massimo */
    private static final int MAX_PRINTED_ROWS = 64;

    private static final String LOGGING_CONFIG = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO MOTORE BOOLEANO <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            EngineConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            executePipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE MOTORE BOOLEANO <---");
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    private static EngineConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException | BooleanEngineException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(EngineConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE MOTORE BOOLEANO <<--");
        System.out.println("Input: " + (config.filePath != null ? "File " + config.filePath : "Espressione singola"));
        System.out.println("Operazioni: " + config.operations);
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("========================================\n");
    }

    //endregion

    //region ELABORAZIONE

    private static void executePipeline(EngineConfiguration config) throws IOException {
        List<String> expressions = config.filePath != null
                ? readExpressions(Paths.get(config.filePath))
                : List.of(config.expression);
        if (expressions.isEmpty()) {
            System.out.println("[W] Nessuna espressione trovata nell'input.");
            return;
        }

        System.out.println("[I] Elaborazione di " + expressions.size() + " espressioni...");
        List<BatchItemResult> results = new BatchProcessor().process(expressions, config.operations, config.timeoutSeconds);

        int success = 0;
        int failed = 0;
        int unknown = 0;
        for (BatchItemResult result : results) {
            System.out.println("\n=== [" + (result.index() + 1) + "] " + result.expression() + " ===");
            if (result.isSuccess()) {
                printReport(result.report(), config.operations);
                success++;
            } else if (result.timedOut()) {
                System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi: esito sconosciuto");
                unknown++;
            } else {
                System.out.println("[E] " + result.error());
                failed++;
            }
        }

        System.out.println("\n-->> RIEPILOGO <<--");
        System.out.println("Elaborate: " + success + ", errori: " + failed + ", timeout: " + unknown);
    }

    private static List<String> readExpressions(Path path) throws IOException {
        List<String> expressions = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                expressions.add(trimmed);
            }
        }
        return expressions;
    }

    //endregion

    //region STAMPA DEL REPORT

    private static void printReport(ExpressionReport report, Set<Operation> operations) {
        if (operations.contains(Operation.PARSE)) {
            printParsed(report.parsed());
        }
        report.simplifiedResult().ifPresent(Main::printSimplification);
        report.truthTableResult().ifPresent(Main::printTruthTable);
        report.karnaughResult().ifPresent(Main::printKarnaugh);
        report.minimizationResult().ifPresent(Main::printMinimization);
        report.satResult().ifPresent(Main::printSat);
        if (report.sop() != null) {
            printConversion(report.sop());
        }
        if (report.pos() != null) {
            printConversion(report.pos());
        }
        report.circuitResult().ifPresent(Main::printCircuit);
        for (String note : report.notes()) {
            System.out.println("[W] " + note);
        }
    }

    private static void printParsed(ParsedExpression parsed) {
        System.out.println("-- Parsing --");
        System.out.println("Normalizzata: " + parsed.normalizedText());
        System.out.println("Variabili: " + parsed.variables());
        System.out.println("Complessità: " + parsed.metadata().complexity().label()
                + " (operatori: " + parsed.metadata().operatorCount()
                + ", annidamento: " + parsed.metadata().depth() + ")");
    }

    private static void printSimplification(SimplificationResult result) {
        System.out.println("-- Semplificazione --");
        for (SimplificationStep step : result.steps()) {
            System.out.println("  " + step.rule() + ": " + step.before() + " → " + step.after());
        }
        System.out.println("Risultato: " + result.simplifiedExpression()
                + " (metodo: " + result.method().displayName()
                + ", riduzione: " + result.reductionPercentage() + "%)");
    }

    private static void printTruthTable(TruthTable table) {
        System.out.println("-- Tabella di verità --");
        System.out.println("  " + String.join(" ", table.variables()) + " | Y");
        int printed = 0;
        for (TruthTableRow row : table.rows()) {
            if (printed++ == MAX_PRINTED_ROWS) {
                System.out.println("  ... (" + (table.rows().size() - MAX_PRINTED_ROWS) + " righe omesse)");
                break;
            }
            System.out.println("  " + String.join(" ", row.binaryInput().split("")) + " | " + (row.output() ? 1 : 0));
        }
        System.out.println("Mintermini: " + table.minterms());
        System.out.println("SOP canonica: " + table.canonicalSop());
        System.out.println("POS canonica: " + table.canonicalPos());
    }

    private static void printKarnaugh(KarnaughMap map) {
        System.out.println("-- Mappa di Karnaugh " + map.rows() + "x" + map.cols() + " --");
        System.out.println("  " + String.join(" ", map.labels().colLabels()));
        for (int r = 0; r < map.rows(); r++) {
            StringBuilder line = new StringBuilder("  ");
            for (KarnaughCell cell : map.cells().get(r)) {
                line.append(cell.value() ? '1' : '0').append(' ');
            }
            System.out.println(line.append("  ").append(map.labels().rowLabels().get(r)));
        }
        for (KarnaughGroup group : map.groups()) {
            System.out.println("  Gruppo " + group.id() + " (" + group.size() + " celle): " + group.literal());
        }
        System.out.println("SOP semplificata: " + map.simplifiedSop());
        System.out.println("POS semplificata: " + map.simplifiedPos());
    }

    private static void printMinimization(MinimizationReport report) {
        System.out.println("-- Minimizzazione --");
        for (MinimizationResult result : report.results()) {
            System.out.println("  " + result.algorithm() + ": " + result.expression()
                    + " (porte: " + result.gateCount() + ", punteggio: " + result.performance() + ")");
        }
        for (AlgorithmFailure failure : report.failures()) {
            System.out.println("[W] " + failure.algorithm() + " non riuscito: " + failure.message());
        }
        report.best().ifPresent(best -> System.out.println("Migliore: " + best.expression()));
    }

    private static void printSat(SATResult result) {
        System.out.println("-- SAT (" + result.getMethod().id() + ", " + result.getSearchSteps() + " passi) --");
        System.out.print(result);
    }

    private static void printConversion(ConversionResult result) {
        System.out.println("-- " + result.form().name() + " --");
        System.out.println(result.converted() + " (complessità: " + result.metadata().complexity().label() + ")");
    }

    private static void printCircuit(LogicCircuit circuit) {
        System.out.println("-- Circuito --");
        System.out.println("Porte logiche: " + circuit.analysis().totalGates()
                + ", profondità: " + circuit.analysis().depth()
                + ", complessità: " + circuit.analysis().complexity().label());
        for (String suggestion : circuit.analysis().suggestions()) {
            System.out.println("[I] " + suggestion);
        }
        System.out.print(circuit.toVerilog());
    }

    //endregion

    //region PARSING ARGOMENTI

    /**
     * Configurazione validata della riga di comando.
     */
    private static class EngineConfiguration {
        final String expression;
        final String filePath;
        final Set<Operation> operations;
        final int timeoutSeconds;

        EngineConfiguration(String expression, String filePath, Set<Operation> operations, int timeoutSeconds) {
            this.expression = expression;
            this.filePath = filePath;
            this.operations = operations;
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: mostra l'help e termina
         * -e <espressione>: espressione singola (esclusivo con -f)
         * -f <file>: un'espressione per riga (esclusivo con -e)
         * -op=<lista>: operazioni separate da virgola, oppure all
         * -t <sec>: timeout per espressione
         *
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException per parametri non validi
         */
        EngineConfiguration parse(String[] args) {
            String expression = null;
            String filePath = null;
            Set<Operation> operations = Operation.parseList(null);
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case EXPRESSION_PARAM -> {
                        if (filePath != null) {
                            throw new IllegalArgumentException("-e e -f sono mutualmente esclusivi");
                        }
                        expression = getNextArgument(args, ++i, "espressione");
                    }
                    case FILE_PARAM -> {
                        if (expression != null) {
                            throw new IllegalArgumentException("-e e -f sono mutualmente esclusivi");
                        }
                        filePath = getNextArgument(args, ++i, "file");
                        if (!Files.isRegularFile(Paths.get(filePath))) {
                            throw new IllegalArgumentException("File non trovato: " + filePath);
                        }
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseTimeout(getNextArgument(args, ++i, "timeout"));
                    default -> {
                        if (args[i].startsWith(OP_PARAM)) {
                            operations = Operation.parseList(args[i].substring(OP_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (expression == null && filePath == null) {
                throw new IllegalArgumentException("Specificare un'espressione (-e) o un file (-f)");
            }
            return new EngineConfiguration(expression, filePath, operations, timeoutSeconds);
        }

        private String getNextArgument(String[] args, int index, String name) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per il parametro " + name);
            }
            return args[index];
        }

        private int parseTimeout(String value) {
            try {
                int timeout = Integer.parseInt(value);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Timeout non numerico: " + value, e);
            }
        }

        private void printApplicationHelp() {
            System.out.println("\n::>> MOTORE BOOLEANO <<::");
            System.out.println("Analisi, semplificazione e sintesi di espressioni booleane\n");

            System.out.println("UTILIZZO:");
            System.out.println("  java -jar boolean-engine.jar [opzioni]\n");

            System.out.println("OPZIONI:");
            System.out.println("  -e <espressione>  Elabora una singola espressione, es. \"AB + A'C\"");
            System.out.println("  -f <file>         Elabora un'espressione per riga (righe '#' ignorate)");
            System.out.println("  -op=<lista>       Operazioni: parse,simplify,truth,kmap,minimize,sat,sop,pos,circuit");
            System.out.println("                    oppure all (default)");
            System.out.println("  -t <secondi>      Timeout per espressione (min: 1, default: 10)");
            System.out.println("  -h                Mostra questo messaggio\n");

            System.out.println("OPERATORI ACCETTATI:");
            System.out.println("  AND: giustapposizione, \u00B7, *, &, &&, AND");
            System.out.println("  OR:  +, |, ||, OR");
            System.out.println("  NOT: A', A\u0304, !A, NOT A");
        }
    }

    //endregion
}
