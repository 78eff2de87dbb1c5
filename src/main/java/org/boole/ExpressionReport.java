package org.boole;

import org.boole.circuit.LogicCircuit;
import org.boole.conversion.ConversionResult;
import org.boole.karnaugh.KarnaughMap;
import org.boole.minimization.MinimizationReport;
import org.boole.parser.ParsedExpression;
import org.boole.sat.SATResult;
import org.boole.simplifier.SimplificationResult;
import org.boole.truthtable.TruthTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Artefatti prodotti per una singola espressione.
 *
 * Ogni artefatto è assente quando l'operazione non è stata richiesta oppure non è
 * applicabile all'espressione; in quest'ultimo caso {@link #notes()} ne riporta il motivo.
 */
public record ExpressionReport(ParsedExpression parsed,
                               SimplificationResult simplified,
                               TruthTable truthTable,
                               KarnaughMap karnaughMap,
                               MinimizationReport minimization,
                               SATResult sat,
                               ConversionResult sop,
                               ConversionResult pos,
                               LogicCircuit circuit,
                               List<String> notes) {

    public ExpressionReport {
        Objects.requireNonNull(parsed, "Espressione analizzata mancante");
        notes = List.copyOf(notes);
    }

    public Optional<SimplificationResult> simplifiedResult() {
        return Optional.ofNullable(simplified);
    }

    public Optional<TruthTable> truthTableResult() {
        return Optional.ofNullable(truthTable);
    }

    public Optional<KarnaughMap> karnaughResult() {
        return Optional.ofNullable(karnaughMap);
    }

    public Optional<MinimizationReport> minimizationResult() {
        return Optional.ofNullable(minimization);
    }

    public Optional<SATResult> satResult() {
        return Optional.ofNullable(sat);
    }

    public Optional<LogicCircuit> circuitResult() {
        return Optional.ofNullable(circuit);
    }
}
