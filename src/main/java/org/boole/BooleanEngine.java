package org.boole;

import org.boole.circuit.CircuitGenerator;
import org.boole.circuit.LogicCircuit;
import org.boole.conversion.ConversionOptions;
import org.boole.conversion.ConversionResult;
import org.boole.conversion.SopPosConverter;
import org.boole.karnaugh.KarnaughMap;
import org.boole.karnaugh.KarnaughMapGenerator;
import org.boole.minimization.MinimizationReport;
import org.boole.minimization.MinimizationSuite;
import org.boole.parser.ExpressionParser;
import org.boole.parser.ParsedExpression;
import org.boole.sat.SATResult;
import org.boole.sat.SATSolver;
import org.boole.simplifier.LawBasedSimplifier;
import org.boole.simplifier.SimplificationResult;
import org.boole.support.BooleanEngineException;
import org.boole.support.EngineLimits;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableGenerator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * MOTORE BOOLEANO - Punto d'accesso unico alla pipeline
 *
 * PIPELINE:
 * 1. Parsing (sempre eseguito, un errore di sintassi viene propagato)
 * 2. Semplificazione per leggi
 * 3. Tabella di verità
 * 4. Mappa di Karnaugh (solo da 2 a 6 variabili)
 * 5. Minimizzazione con tutti gli algoritmi
 * 6. Ricerca SAT
 * 7. Forme SOP e POS canoniche
 * 8. Circuito
 *
 * Un limite di capacità superato in una fase lascia l'artefatto assente e aggiunge una
 * nota al report; le fasi successive proseguono.
 */
public class BooleanEngine {

    private static final Logger LOGGER = Logger.getLogger(BooleanEngine.class.getName());

    private final ExpressionParser parser = new ExpressionParser();
    private final LawBasedSimplifier simplifier = new LawBasedSimplifier();
    private final TruthTableGenerator truthTableGenerator = new TruthTableGenerator();
    private final KarnaughMapGenerator karnaughGenerator = new KarnaughMapGenerator();
    private final MinimizationSuite minimizationSuite = new MinimizationSuite();
    private final SATSolver satSolver = new SATSolver();
    private final SopPosConverter converter = new SopPosConverter();
    private final CircuitGenerator circuitGenerator = new CircuitGenerator();

    public ExpressionReport process(String expression) {
        return process(expression, EnumSet.allOf(Operation.class));
    }

    /**
     * @throws org.boole.support.ExpressionSyntaxException se l'espressione non è valida
     */
    public ExpressionReport process(String expression, Set<Operation> operations) {
        ParsedExpression parsed = parser.parse(expression);
        List<String> notes = new ArrayList<>();
        LOGGER.fine(() -> "Elaborazione di '" + parsed.normalizedText() + "' con " + operations);

        SimplificationResult simplified = operations.contains(Operation.SIMPLIFY)
                ? attempt("Semplificazione", notes, () -> simplifier.simplify(parsed))
                : null;
        TruthTable truthTable = operations.contains(Operation.TRUTH)
                ? attempt("Tabella di verità", notes, () -> truthTableGenerator.generate(parsed))
                : null;

        KarnaughMap karnaughMap = null;
        if (operations.contains(Operation.KMAP)) {
            int n = parsed.variableCount();
            if (n < EngineLimits.MIN_KARNAUGH_VARIABLES || n > EngineLimits.MAX_KARNAUGH_VARIABLES) {
                notes.add("Mappa di Karnaugh non disponibile per " + n + " variabili (supportate da "
                        + EngineLimits.MIN_KARNAUGH_VARIABLES + " a " + EngineLimits.MAX_KARNAUGH_VARIABLES + ")");
            } else {
                karnaughMap = attempt("Mappa di Karnaugh", notes, () -> karnaughGenerator.generate(parsed));
            }
        }

        MinimizationReport minimization = operations.contains(Operation.MINIMIZE)
                ? attempt("Minimizzazione", notes, () -> minimizationSuite.minimize(parsed))
                : null;
        SATResult sat = operations.contains(Operation.SAT)
                ? attempt("Ricerca SAT", notes, () -> satSolver.solve(parsed))
                : null;

        ConversionOptions conversionOptions = ConversionOptions.defaults().withShowSteps(false);
        ConversionResult sop = operations.contains(Operation.SOP)
                ? attempt("Conversione SOP", notes, () -> converter.toSop(parsed, conversionOptions))
                : null;
        ConversionResult pos = operations.contains(Operation.POS)
                ? attempt("Conversione POS", notes, () -> converter.toPos(parsed, conversionOptions))
                : null;
        LogicCircuit circuit = operations.contains(Operation.CIRCUIT)
                ? attempt("Circuito", notes, () -> circuitGenerator.generate(parsed))
                : null;

        ExpressionReport report = new ExpressionReport(parsed, simplified, truthTable, karnaughMap,
                minimization, sat, sop, pos, circuit, notes);
        LOGGER.info("Elaborata '" + parsed.normalizedText() + "': " + parsed.variableCount()
                + " variabili, " + notes.size() + " note");
        return report;
    }

    /**
     * Esegue una fase; un errore del motore diventa una nota, altri errori si propagano.
     */
    private static <T> T attempt(String stage, List<String> notes, Supplier<T> action) {
        try {
            return action.get();
        } catch (BooleanEngineException e) {
            LOGGER.warning(stage + " non eseguita: " + e.getMessage());
            notes.add(stage + ": " + e.getMessage());
            return null;
        }
    }
}
