package org.boole.simplifier;

import org.boole.parser.ExpressionParser;
import org.boole.parser.ParsedExpression;
import org.boole.support.CapacityExceededException;
import org.boole.truthtable.Evaluator;
import org.boole.truthtable.TruthTable;
import org.boole.truthtable.TruthTableGenerator;
import org.boole.truthtable.TruthTableRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LawBasedSimplifierTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final LawBasedSimplifier simplifier = new LawBasedSimplifier();

    private SimplificationResult simplify(String expression) {
        return simplifier.simplify(parser.parse(expression));
    }

    @Nested
    @DisplayName("Leggi di base")
    class BasicLawTests {

        @Test
        @DisplayName("A + A' si riduce a 1 per complemento")
        void testComplement() {
            SimplificationResult result = simplify("A + A'");
            assertAll("A + A'",
                    () -> assertEquals("1", result.simplifiedExpression()),
                    () -> assertTrue(result.rulesApplied().contains(BooleanLaw.COMPLEMENT.displayName()),
                            "regole applicate: " + result.rulesApplied())
            );
        }

        @Test
        @DisplayName("A + AB si riduce ad A per assorbimento")
        void testAbsorption() {
            SimplificationResult result = simplifier.simplify(parser.parse("A + AB"), SimplificationMethod.BASIC);
            assertAll("A + AB",
                    () -> assertEquals("A", result.simplifiedExpression()),
                    () -> assertEquals(SimplificationMethod.BASIC, result.method()),
                    () -> assertTrue(result.rulesApplied().contains(BooleanLaw.ABSORPTION.displayName()))
            );
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "AA       | A",
                "A + A    | A",
                "A1       | A",
                "A + 0    | A",
                "A0       | 0",
                "A + 1    | 1",
                "AA'      | 0",
                "A''      | A",
                "A(A + B) | A"
        })
        @DisplayName("Ogni legge elementare produce la forma attesa")
        void testElementaryLaws(String expression, String expected) {
            SimplificationResult result = simplifier.simplify(parser.parse(expression), SimplificationMethod.BASIC);
            assertEquals(expected, result.simplifiedExpression());
        }

        @Test
        @DisplayName("L'assorbimento non elimina termini non contenuti")
        void testNoUnsoundAbsorption() {
            SimplificationResult result = simplifier.simplify(parser.parse("AB + AC"), SimplificationMethod.BASIC);
            assertEquals("AB + AC", result.simplifiedExpression());
        }

        @Test
        @DisplayName("Ogni passo registra forma precedente e successiva")
        void testStepsRecorded() {
            SimplificationResult result = simplifier.simplify(parser.parse("A + A + AB"), SimplificationMethod.BASIC);
            assertAll("Passi",
                    () -> assertFalse(result.steps().isEmpty()),
                    () -> assertEquals("A", result.steps().get(result.steps().size() - 1).after()),
                    () -> assertTrue(result.steps().stream().allMatch(s -> s.law() != null))
            );
        }
    }

    @Nested
    @DisplayName("De Morgan e selezione del metodo")
    class MethodTests {

        @Test
        @DisplayName("De Morgan spinge la negazione sui letterali")
        void testDeMorgan() {
            SimplificationResult result = simplifier.simplify(parser.parse("(AB)'"), SimplificationMethod.DEMORGAN);
            assertAll("(AB)'",
                    () -> assertEquals("A\u0304 + B\u0304", result.simplifiedExpression()),
                    () -> assertTrue(result.rulesApplied().contains(BooleanLaw.DE_MORGAN.displayName()))
            );
        }

        @Test
        @DisplayName("In modalità automatica vengono tentati tutti i metodi")
        void testAutoTriesAllMethods() {
            SimplificationResult result = simplify("AB + AB'");
            assertAll("AB + AB'",
                    () -> assertEquals(3, result.methodsAttempted().size()),
                    () -> assertEquals(2, result.alternatives().size()),
                    () -> assertEquals("A", result.simplifiedExpression()),
                    () -> assertEquals(SimplificationMethod.QUINE_MCCLUSKEY, result.method()),
                    () -> assertTrue(result.reductionPercentage() > 0)
            );
        }

        @Test
        @DisplayName("Oltre il limite di variabili il passo Quine-McCluskey viene saltato")
        void testQuineSkippedOverLimit() {
            SimplificationResult result = simplify("ABCDEFGHIJK + A");
            assertAll("Undici variabili",
                    () -> assertFalse(result.methodsAttempted().contains(SimplificationMethod.QUINE_MCCLUSKEY)),
                    () -> assertEquals("A", result.simplifiedExpression())
            );
        }

        @Test
        @DisplayName("Quine-McCluskey richiesto esplicitamente oltre il limite fallisce")
        void testExplicitQuineOverLimit() {
            ParsedExpression parsed = parser.parse("ABCDEFGHIJK");
            assertThrows(CapacityExceededException.class,
                    () -> simplifier.simplify(parsed, SimplificationMethod.QUINE_MCCLUSKEY));
        }
    }

    @Nested
    @DisplayName("Correttezza")
    class SoundnessTests {

        @ParameterizedTest
        @ValueSource(strings = {"A + AB", "(A + B)(A + C)", "(AB + C)'", "A'B + AB' + AB", "(A + B')'(C + 1)", "ABC + AB'C + A'"})
        @DisplayName("La forma semplificata è equivalente all'originale")
        void testEquivalence(String expression) {
            ParsedExpression original = parser.parse(expression);
            SimplificationResult result = simplifier.simplify(original);
            ParsedExpression simplified = parser.parse(result.simplifiedExpression());

            TruthTable table = new TruthTableGenerator().generate(original);
            for (TruthTableRow row : table.rows()) {
                assertEquals(row.output(), Evaluator.evaluate(simplified.ast(), row.assignment()),
                        expression + " → " + result.simplifiedExpression() + " diverge su " + row.binaryInput());
            }
        }
    }
}
