package org.boole.parser;

import org.boole.ast.BooleanNode;

import java.util.List;
import java.util.Objects;

/**
 * Espressione analizzata: testo originale, testo normalizzato, albero e variabili.
 *
 * Immutabile. Le variabili sono le lettere del testo normalizzato, ordinate e senza
 * duplicati, e non vengono mai modificate dopo il parsing.
 */
public record ParsedExpression(String originalText,
                               String normalizedText,
                               BooleanNode ast,
                               List<String> variables,
                               ExpressionMetadata metadata) {

    public ParsedExpression {
        Objects.requireNonNull(ast, "AST mancante");
        Objects.requireNonNull(metadata, "Metadati mancanti");
        variables = List.copyOf(variables);
    }

    public int variableCount() {
        return variables.size();
    }
}
