package org.boole.simplifier;

import org.boole.ast.BooleanNode;
import org.boole.ast.ExpressionFormatter;
import org.boole.minimization.QuineMcCluskeyMinimizer;
import org.boole.parser.ParsedExpression;
import org.boole.support.CapacityExceededException;
import org.boole.support.ExpressionMetrics;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * SEMPLIFICATORE ALGEBRICO - Confronto tra leggi di base, De Morgan e Quine-McCluskey
 *
 * METODI (nell'ordine di tentativo):
 * 1. BASIC: leggi di base fino a punto fisso
 * 2. DEMORGAN: negazioni spinte alle foglie, poi leggi di base
 * 3. QUINE_MCCLUSKEY: minimizzazione sulla tabella di verità
 *
 * Vince l'espressione più corta; a parità di lunghezza vince il metodo tentato prima.
 * In modalità AUTO, se la tabella supera il limite di variabili, il passo
 * Quine-McCluskey viene saltato e gli altri metodi restano validi.
 */
public class LawBasedSimplifier {

    private static final Logger LOGGER = Logger.getLogger(LawBasedSimplifier.class.getName());

    private final TruthTableGenerator truthTableGenerator = new TruthTableGenerator();

    public SimplificationResult simplify(ParsedExpression parsed) {
        return simplify(parsed, SimplificationMethod.AUTO);
    }

    /**
     * @param parsed espressione analizzata
     * @param method metodo richiesto, AUTO per provarli tutti
     * @throws CapacityExceededException se è richiesto esplicitamente Quine-McCluskey oltre il limite
     */
    public SimplificationResult simplify(ParsedExpression parsed, SimplificationMethod method) {
        String original = ExpressionFormatter.format(parsed.ast());
        LOGGER.fine("Semplificazione di " + original + " con metodo " + method);

        List<SimplificationCandidate> candidates = new ArrayList<>();

        if (method.includes(SimplificationMethod.BASIC)) {
            candidates.add(basicLaws(parsed.ast()));
        }
        if (method.includes(SimplificationMethod.DEMORGAN)) {
            candidates.add(deMorganThenBasic(parsed.ast()));
        }
        if (method.includes(SimplificationMethod.QUINE_MCCLUSKEY)) {
            try {
                candidates.add(quineMcCluskey(parsed, original));
            } catch (CapacityExceededException e) {
                if (method != SimplificationMethod.AUTO) {
                    throw e;
                }
                LOGGER.warning("Passo Quine-McCluskey saltato: " + e.getMessage());
            }
        }

        SimplificationCandidate best = candidates.get(0);
        for (SimplificationCandidate candidate : candidates) {
            if (candidate.expression().length() < best.expression().length()) {
                best = candidate;
            }
        }

        List<SimplificationCandidate> alternatives = new ArrayList<>(candidates);
        alternatives.remove(best);

        SimplificationResult result = new SimplificationResult(
                original,
                best.expression(),
                best.method(),
                best.steps(),
                candidates.stream().map(SimplificationCandidate::method).toList(),
                alternatives,
                ExpressionMetrics.reductionPercentage(original, best.expression()),
                ExpressionMetrics.gateCount(best.expression()));

        LOGGER.info("Semplificazione: " + original + " → " + result.simplifiedExpression()
                + " (" + best.method().displayName() + ")");
        return result;
    }

    //region METODI

    private SimplificationCandidate basicLaws(BooleanNode ast) {
        List<SimplificationStep> steps = new ArrayList<>();
        BooleanNode simplified = LawRewriter.applyToFixpoint(ast, steps);
        return new SimplificationCandidate(SimplificationMethod.BASIC, ExpressionFormatter.format(simplified), steps);
    }

    private SimplificationCandidate deMorganThenBasic(BooleanNode ast) {
        List<SimplificationStep> steps = new ArrayList<>();
        BooleanNode pushed = DeMorganTransformer.pushNegations(ast, steps);
        BooleanNode simplified = LawRewriter.applyToFixpoint(pushed, steps);
        return new SimplificationCandidate(SimplificationMethod.DEMORGAN, ExpressionFormatter.format(simplified), steps);
    }

    private SimplificationCandidate quineMcCluskey(ParsedExpression parsed, String original) {
        TruthTable table = truthTableGenerator.generate(parsed);
        String minimized = new QuineMcCluskeyMinimizer().minimize(table.variables(), table.minterms());
        SimplificationStep step = new SimplificationStep(minimized, BooleanLaw.QUINE_MCCLUSKEY,
                "Minimizzazione Quine-McCluskey sulla tabella di verità", original, minimized);
        return new SimplificationCandidate(SimplificationMethod.QUINE_MCCLUSKEY, minimized, List.of(step));
    }

    //endregion
}
