package org.boole.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodesTest {

    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Variable C = new Variable("C");

    @Nested
    @DisplayName("Costruzione e metriche")
    class StructureTests {

        @Test
        @DisplayName("Congiunzione e disgiunzione vuote sono le costanti neutre")
        void testEmptyOperands() {
            assertAll("Liste vuote",
                    () -> assertEquals(Constant.TRUE, Nodes.conjunction(List.of())),
                    () -> assertEquals(Constant.FALSE, Nodes.disjunction(List.of()))
            );
        }

        @Test
        @DisplayName("Gli operandi vengono associati a sinistra")
        void testLeftAssociation() {
            assertEquals(new And(new And(A, B), C), Nodes.conjunction(List.of(A, B, C)));
            assertEquals(new Or(new Or(A, B), C), Nodes.disjunction(List.of(A, B, C)));
        }

        @Test
        @DisplayName("Profondità, dimensione e variabili di (AB)' + C")
        void testMetrics() {
            BooleanNode node = new Or(new Not(new And(A, B)), C);
            assertAll("Metriche",
                    () -> assertEquals(4, Nodes.depth(node)),
                    () -> assertEquals(6, Nodes.size(node)),
                    () -> assertEquals(List.of("A", "B", "C"), List.copyOf(Nodes.variables(node)))
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "AB", "1", ""})
        @DisplayName("Una variabile è una sola lettera maiuscola")
        void testInvalidVariable(String name) {
            assertThrows(IllegalArgumentException.class, () -> new Variable(name));
        }
    }

    @Nested
    @DisplayName("Serializzazione")
    class FormatterTests {

        @Test
        @DisplayName("AND per giustapposizione con gli OR tra parentesi")
        void testConjunctionOfDisjunction() {
            BooleanNode node = new And(A, new Or(B, C));
            assertEquals("A(B + C)", ExpressionFormatter.format(node));
        }

        @Test
        @DisplayName("La negazione segue il letterale o il gruppo")
        void testNegation() {
            assertAll("Negazioni",
                    () -> assertEquals("A\u0304", ExpressionFormatter.format(Nodes.literal("A", false))),
                    () -> assertEquals("A'", ExpressionFormatter.format(new Not(A), Notation.APOSTROPHE)),
                    () -> assertEquals("(AB)'", ExpressionFormatter.format(new Not(new And(A, B)), Notation.APOSTROPHE)),
                    () -> assertEquals("(A + B)\u0304", ExpressionFormatter.format(new Not(new Or(A, B))))
            );
        }

        @Test
        @DisplayName("Un nodo assente produce il testo vuoto")
        void testNullNode() {
            assertEquals("", ExpressionFormatter.format(null));
        }

        @Test
        @DisplayName("Le notazioni rendono i letterali")
        void testNotationLiteral() {
            assertAll("Letterali",
                    () -> assertEquals("B", Notation.OVERBAR.literal("B", true)),
                    () -> assertEquals("B'", Notation.APOSTROPHE.literal("B", false))
            );
        }
    }
}
