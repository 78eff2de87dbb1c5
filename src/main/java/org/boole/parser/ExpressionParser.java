package org.boole.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.boole.antlr.BooleanExpressionLexer;
import org.boole.antlr.BooleanExpressionParser;
import org.boole.ast.BooleanNode;
import org.boole.ast.Nodes;
import org.boole.support.EngineLimits;
import org.boole.support.ExpressionSyntaxException;

import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * PARSER DI ESPRESSIONI BOOLEANE - Punto di ingresso della pipeline
 *
 * PIPELINE:
 * 1. Normalizzazione degli alias di AND, OR, NOT
 * 2. Validazione strutturale con messaggi per costrutto
 * 3. Lexer e parser ANTLR con listener che rifiuta qualsiasi errore
 * 4. Visitor {@link AstBuilder} verso l'albero {@link BooleanNode}
 * 5. Controllo della profondità dell'albero
 * 6. Estrazione variabili e metriche
 *
 * Ogni errore produce {@link ExpressionSyntaxException}: non viene mai restituito
 * un albero parziale. Un annidamento oltre {@link EngineLimits#MAX_EXPRESSION_DEPTH},
 * nel testo o nell'albero, produce {@link org.boole.support.CapacityExceededException}. La classe non ha stato e può essere condivisa tra thread.
 */
public class ExpressionParser {

    private static final Logger LOGGER = Logger.getLogger(ExpressionParser.class.getName());

    /**
     * Analizza un'espressione testuale.
     *
     * @param expression testo dell'espressione, es. "A·B + C'" o "A AND NOT B"
     * @return espressione analizzata
     * @throws ExpressionSyntaxException se il testo non è un'espressione valida
     * @throws org.boole.support.CapacityExceededException se l'annidamento supera il limite
     */
    public ParsedExpression parse(String expression) {
        if (expression == null) {
            throw new ExpressionSyntaxException("null", "espressione assente");
        }
        LOGGER.fine("Parsing espressione: " + expression);

        String normalized = ExpressionNormalizer.normalize(expression);
        ExpressionValidator.validate(expression, normalized);
        LOGGER.finest("Testo normalizzato: " + normalized);

        BooleanNode ast = buildAst(expression, normalized);
        EngineLimits.requireNestable("Profondità dell'albero sintattico", Nodes.depth(ast));
        List<String> variables = extractVariables(normalized);
        ExpressionMetadata metadata = ExpressionMetadata.of(normalized, variables.size());

        LOGGER.fine("Parsing completato: " + variables.size() + " variabili, complessità " + metadata.complexity().label());
        return new ParsedExpression(expression, normalized, ast, variables, metadata);
    }

    private BooleanNode buildAst(String original, String normalized) {
        ThrowingErrorListener errorListener = new ThrowingErrorListener(original);

        BooleanExpressionLexer lexer = new BooleanExpressionLexer(CharStreams.fromString(normalized));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        BooleanExpressionParser parser = new BooleanExpressionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        return new AstBuilder().visit(parser.expression());
    }

    private List<String> extractVariables(String normalized) {
        TreeSet<String> letters = new TreeSet<>();
        for (char c : normalized.toCharArray()) {
            if (c >= 'A' && c <= 'Z') {
                letters.add(String.valueOf(c));
            }
        }
        return List.copyOf(letters);
    }
}
