package org.boole.conversion;

import org.boole.ast.Notation;
import org.boole.parser.ParsedExpression;
import org.boole.truthtable.CanonicalForms;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableGenerator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONVERTITORE SOP/POS - Forme normali derivate dalla tabella di verità
 *
 * PROCESSO:
 * 1. Tabella di verità dell'espressione
 * 2. Tautologia o contraddizione: risultato costante immediato
 * 3. Espansione di ogni mintermine (SOP) o maxtermine (POS)
 * 4. Combinazione dei termini
 * 5. Facoltativa riduzione: eliminazione dei duplicati e sussunzione fino a punto fisso
 *
 * Un termine è sussunto quando i suoi letterali includono strettamente quelli di un altro
 * termine: AB + A = A in SOP, (A + B)(A) = A in POS. Il teorema del consenso non viene applicato,
 * per cui la forma ridotta di una forma canonica coincide con quest'ultima.
 */
public class SopPosConverter {

    private static final Logger LOGGER = Logger.getLogger(SopPosConverter.class.getName());

    private static final Notation NOTATION = Notation.OVERBAR;

    private final TruthTableGenerator truthTableGenerator = new TruthTableGenerator();

    //region INTERFACCIA PUBBLICA

    public ConversionResult convert(ParsedExpression parsed, TargetForm form) {
        return convert(parsed, form, ConversionOptions.defaults());
    }

    public ConversionResult convert(ParsedExpression parsed, TargetForm form, ConversionOptions options) {
        return switch (form) {
            case SOP -> toSop(parsed, options);
            case POS -> toPos(parsed, options);
        };
    }

    public ConversionResult toSop(ParsedExpression parsed, ConversionOptions options) {
        return convert(parsed, truthTableGenerator.generate(parsed), TargetForm.SOP, options);
    }

    public ConversionResult toPos(ParsedExpression parsed, ConversionOptions options) {
        return convert(parsed, truthTableGenerator.generate(parsed), TargetForm.POS, options);
    }

    /**
     * Entrambe le forme canoniche, senza passi, con la raccomandazione della più corta.
     */
    public FormComparison compare(ParsedExpression parsed) {
        TruthTable table = truthTableGenerator.generate(parsed);
        ConversionOptions options = ConversionOptions.defaults().withShowSteps(false);
        ConversionResult sop = convert(parsed, table, TargetForm.SOP, options);
        ConversionResult pos = convert(parsed, table, TargetForm.POS, options);

        TargetForm recommendation = sop.converted().length() <= pos.converted().length()
                ? TargetForm.SOP
                : TargetForm.POS;
        return new FormComparison(FormComparison.Summary.of(sop), FormComparison.Summary.of(pos), recommendation);
    }

    //endregion

    //region CONVERSIONE

    private ConversionResult convert(ParsedExpression parsed, TruthTable table, TargetForm form, ConversionOptions options) {
        boolean sop = form == TargetForm.SOP;
        List<String> variables = table.variables();
        List<Integer> indices = sop ? table.minterms() : table.maxterms();
        int rowCount = table.rows().size();
        List<ConversionStep> steps = new ArrayList<>();

        if (options.showSteps()) {
            steps.add(new ConversionStep("Inizio conversione in forma " + form.name(), parsed.originalText(), ""));
        }

        // Tautologia e contraddizione: costante senza espansione
        if (indices.isEmpty() || indices.size() == rowCount) {
            boolean alwaysTrue = sop ? !indices.isEmpty() : indices.isEmpty();
            String constant = alwaysTrue ? "1" : "0";
            if (options.showSteps()) {
                steps.add(new ConversionStep(alwaysTrue ? "L'espressione è sempre vera" : "L'espressione è sempre falsa",
                        constant, alwaysTrue ? "Tautologia" : "Contraddizione"));
            }
            return result(parsed, constant, form, steps, 0, indices, options.canonical());
        }

        List<Set<String>> terms = new ArrayList<>();
        for (int index : indices) {
            Set<String> literals = literalsOf(variables, index, sop);
            terms.add(literals);
            if (options.showSteps()) {
                String term = sop
                        ? CanonicalForms.mintermProduct(variables, index, NOTATION)
                        : CanonicalForms.maxtermSum(variables, index, NOTATION);
                steps.add(new ConversionStep((sop ? "Mintermine " : "Maxtermine ") + index + ": "
                        + binary(index, variables.size()) + " → " + term,
                        term, sop ? "Espansione mintermine" : "Espansione maxtermine"));
            }
        }

        String combined = render(terms, sop);
        if (options.showSteps()) {
            steps.add(new ConversionStep(sop ? "Combinazione dei mintermini in OR" : "Combinazione dei maxtermini in AND",
                    combined, sop ? "Formazione SOP" : "Formazione POS"));
        }

        if (!options.canonical()) {
            terms = reduce(terms, sop, steps, options.showSteps());
        }

        String converted = render(terms, sop);
        if (options.showSteps()) {
            steps.add(new ConversionStep("Espressione " + form.name() + " finale", converted, "Conversione completata"));
        }

        LOGGER.fine(() -> "Conversione " + form.id() + " di '" + parsed.normalizedText() + "': " + converted);
        return result(parsed, converted, form, steps, terms.size(), indices, options.canonical());
    }

    private static ConversionResult result(ParsedExpression parsed,
                                           String converted,
                                           TargetForm form,
                                           List<ConversionStep> steps,
                                           int termCount,
                                           List<Integer> indices,
                                           boolean canonical) {
        ConversionResult.Metadata metadata = new ConversionResult.Metadata(
                ConversionComplexity.of(termCount, converted.length()), termCount, indices, canonical);
        return new ConversionResult(parsed.originalText(), converted, form, steps, metadata);
    }

    //endregion

    //region RIDUZIONE PER SUSSUNZIONE

    /**
     * Duplicati e termini sussunti eliminati ripetutamente fino a punto fisso.
     */
    static List<Set<String>> reduce(List<Set<String>> terms, boolean sop, List<ConversionStep> steps, boolean showSteps) {
        List<Set<String>> current = new ArrayList<>(new LinkedHashSet<>(terms));
        if (current.size() < terms.size() && showSteps) {
            steps.add(new ConversionStep("Rimossi " + (terms.size() - current.size()) + " termini duplicati",
                    render(current, sop), "Idempotenza"));
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < current.size() && !changed; i++) {
                for (int j = 0; j < current.size(); j++) {
                    if (i != j && current.get(i).containsAll(current.get(j))) {
                        current.remove(i);
                        changed = true;
                        break;
                    }
                }
            }
            if (changed && showSteps) {
                steps.add(new ConversionStep("Eliminato un termine sussunto", render(current, sop), "Assorbimento"));
            }
        }

        if (current.size() == terms.size() && showSteps) {
            steps.add(new ConversionStep("Nessun termine ridondante", render(current, sop),
                    sop ? "Minimizzazione SOP" : "Minimizzazione POS"));
        }
        return current;
    }

    private static Set<String> literalsOf(List<String> variables, int index, boolean sop) {
        int n = variables.size();
        Set<String> literals = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            boolean bit = ((index >> (n - 1 - i)) & 1) == 1;
            literals.add(NOTATION.literal(variables.get(i), sop == bit));
        }
        return literals;
    }

    //endregion

    //region RAPPRESENTAZIONE

    private static String render(List<Set<String>> terms, boolean sop) {
        if (sop) {
            List<String> products = new ArrayList<>();
            for (Set<String> term : terms) {
                products.add(String.join("", term));
            }
            return String.join(" + ", products);
        }
        StringBuilder sb = new StringBuilder();
        for (Set<String> clause : terms) {
            sb.append('(').append(String.join(" + ", clause)).append(')');
        }
        return sb.toString();
    }

    private static String binary(int index, int width) {
        StringBuilder sb = new StringBuilder(Integer.toBinaryString(index));
        while (sb.length() < width) {
            sb.insert(0, '0');
        }
        return sb.toString();
    }

    //endregion
}
