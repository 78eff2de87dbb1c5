package org.boole.ast;

/**
 * Tipi di nodo supportati nell'albero sintattico.
 */
public enum NodeType {
    VARIABLE,   // Variabile: A, B, C, ...
    CONSTANT,   // Costante: 0 o 1
    NOT,        // Negazione: Ā
    AND,        // Congiunzione: A·B
    OR          // Disgiunzione: A + B
}
