package org.boole.minimization;

import org.boole.parser.ExpressionParser;
import org.boole.parser.ParsedExpression;
import org.boole.support.CapacityExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MinimizationSuiteTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final MinimizationSuite suite = new MinimizationSuite();

    @Nested
    @DisplayName("Esecuzione degli algoritmi")
    class MinimizeTests {

        @Test
        @DisplayName("AB + AB' viene ridotta ad A da tutti gli algoritmi")
        void testAllAlgorithms() {
            MinimizationReport report = suite.minimize(parser.parse("AB + AB'"));

            assertAll("Report di AB + AB'",
                    () -> assertEquals(3, report.results().size()),
                    () -> assertTrue(report.failures().isEmpty()),
                    () -> assertTrue(report.results().stream().allMatch(r -> r.expression().equals("A"))),
                    () -> assertTrue(report.results().stream().allMatch(r -> r.mintermCount() == 2)),
                    () -> assertTrue(report.best().isPresent())
            );
        }

        @Test
        @DisplayName("I risultati sono ordinati per punteggio decrescente")
        void testOrderedByPerformance() {
            List<MinimizationResult> results = suite.minimize(parser.parse("A'B'C + A'BC + AB'C' + ABC")).results();
            for (int i = 1; i < results.size(); i++) {
                assertTrue(results.get(i - 1).performance() >= results.get(i).performance());
            }
        }

        @Test
        @DisplayName("Un algoritmo sconosciuto diventa un fallimento isolato")
        void testUnknownAlgorithm() {
            MinimizationReport report = suite.minimize(parser.parse("AB + C"), List.of("petrick", "genetico"));

            assertAll("Fallimento isolato",
                    () -> assertEquals(1, report.results().size()),
                    () -> assertEquals("petrick", report.results().get(0).algorithm()),
                    () -> assertEquals(1, report.failures().size()),
                    () -> assertEquals("genetico", report.failures().get(0).algorithm())
            );
        }

        @Test
        @DisplayName("Una funzione costante produce un solo risultato banale")
        void testTrivialFunction() {
            MinimizationReport report = suite.minimize(parser.parse("A + A'"));
            assertAll("Tautologia",
                    () -> assertEquals(1, report.results().size()),
                    () -> assertEquals("trivial", report.results().get(0).algorithm()),
                    () -> assertEquals("1", report.results().get(0).expression())
            );
        }

        @Test
        @DisplayName("Oltre il limite di variabili la minimizzazione fallisce")
        void testCapacity() {
            ParsedExpression parsed = parser.parse("ABCDEFGHIJK");
            assertThrows(CapacityExceededException.class, () -> suite.minimize(parsed));
        }
    }

    @Nested
    @DisplayName("Confronto e raccomandazioni")
    class ComparisonTests {

        @Test
        @DisplayName("Il confronto indica il migliore e le medie")
        void testCompare() {
            MinimizationComparison comparison = suite.compare(parser.parse("AB + AB'"));
            assertAll("Confronto",
                    () -> assertEquals(3, comparison.results().size()),
                    () -> assertEquals(comparison.results().get(0).algorithm(), comparison.bestAlgorithm()),
                    () -> assertEquals(0, comparison.averageGateCount()),
                    () -> assertTrue(comparison.averageReduction() > 0)
            );
        }

        @Test
        @DisplayName("Per poche variabili è consigliato Quine-McCluskey")
        void testRecommendSmall() {
            MinimizationRecommendation recommendation = suite.recommend(parser.parse("AB + C"));
            assertAll("Raccomandazione",
                    () -> assertEquals(MinimizationAlgorithm.QUINE_MCCLUSKEY,
                            recommendation.recommendations().get(0).algorithm()),
                    () -> assertEquals(MinimizationRecommendation.Priority.HIGH,
                            recommendation.recommendations().get(0).priority()),
                    () -> assertEquals(MinimizationAlgorithm.PETRICK,
                            recommendation.recommendations().get(recommendation.recommendations().size() - 1).algorithm())
            );
        }

        @Test
        @DisplayName("Da 5 a 8 variabili è consigliato Espresso")
        void testRecommendMedium() {
            MinimizationRecommendation recommendation = suite.recommend(parser.parse("ABCDE + F"));
            assertEquals(MinimizationAlgorithm.ESPRESSO, recommendation.recommendations().get(0).algorithm());
        }
    }
}
