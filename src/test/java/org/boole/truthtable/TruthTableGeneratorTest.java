package org.boole.truthtable;

import org.boole.parser.ExpressionParser;
import org.boole.parser.ExpressionMetadata;
import org.boole.parser.ParsedExpression;
import org.boole.support.CapacityExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableGeneratorTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final TruthTableGenerator generator = new TruthTableGenerator();

    private TruthTable tableOf(String expression) {
        return generator.generate(parser.parse(expression));
    }

    @Nested
    @DisplayName("Enumerazione")
    class EnumerationTests {

        @ParameterizedTest
        @ValueSource(strings = {"A", "AB + C", "(A + B)(C + D')", "A'B'C'D'E'"})
        @DisplayName("Le righe sono 2^n e mintermini e maxtermini le partizionano")
        void testRowCountAndPartition(String expression) {
            TruthTable table = tableOf(expression);
            int expectedRows = 1 << table.variableCount();

            Set<Integer> union = new TreeSet<>(table.minterms());
            union.addAll(table.maxterms());

            assertAll("Partizione di " + expression,
                    () -> assertEquals(expectedRows, table.rows().size()),
                    () -> assertEquals(expectedRows, union.size()),
                    () -> assertEquals(expectedRows, table.minterms().size() + table.maxterms().size())
            );
        }

        @Test
        @DisplayName("La prima variabile è il bit più significativo")
        void testRowOrdering() {
            TruthTable table = tableOf("AB'");
            TruthTableRow row = table.rows().get(2);

            assertAll("Riga 2 su [A, B]",
                    () -> assertEquals(2, row.index()),
                    () -> assertEquals("10", row.binaryInput()),
                    () -> assertTrue(row.assignment().get("A")),
                    () -> assertFalse(row.assignment().get("B")),
                    () -> assertTrue(row.output())
            );
        }

        @Test
        @DisplayName("AB + AB' è vera sugli indici 2 e 3")
        void testMintermsOfSimpleFunction() {
            TruthTable table = tableOf("AB + AB'");

            assertAll("Tabella di AB + AB'",
                    () -> assertEquals(List.of("A", "B"), table.variables()),
                    () -> assertEquals(List.of(2, 3), table.minterms()),
                    () -> assertEquals(List.of(0, 1), table.maxterms()),
                    () -> assertEquals("AB\u0304 + AB", table.canonicalSop()),
                    () -> assertEquals("(A + B)(A + B\u0304)", table.canonicalPos())
            );
        }

        @Test
        @DisplayName("Un'espressione costante ha una sola riga")
        void testConstantExpression() {
            TruthTable table = tableOf("1");
            assertAll("Tabella della costante 1",
                    () -> assertEquals(1, table.rows().size()),
                    () -> assertEquals(List.of(0), table.minterms()),
                    () -> assertEquals("1", table.canonicalSop())
            );
        }

        @Test
        @DisplayName("Oltre 10 variabili la tabella non viene generata")
        void testCapacityLimit() {
            ParsedExpression parsed = parser.parse("ABCDEFGHIJK");
            CapacityExceededException e = assertThrows(CapacityExceededException.class,
                    () -> generator.generate(parsed));
            assertAll("Limite",
                    () -> assertEquals(10, e.getLimit()),
                    () -> assertEquals(11, e.getActual())
            );
        }

        @Test
        @DisplayName("Dieci variabili sono ancora ammesse")
        void testLimitIsInclusive() {
            assertEquals(1024, tableOf("ABCDEFGHIJ").rows().size());
        }
    }

    @Nested
    @DisplayName("Analisi")
    class AnalysisTests {

        @Test
        @DisplayName("A + A' è una tautologia")
        void testTautology() {
            TruthTableAnalysis analysis = tableOf("A + A'").analysis();
            assertAll("Tautologia",
                    () -> assertTrue(analysis.tautology()),
                    () -> assertFalse(analysis.contradiction()),
                    () -> assertFalse(analysis.contingency()),
                    () -> assertEquals(100, analysis.percentageTrue())
            );
        }

        @Test
        @DisplayName("AA' è una contraddizione con forme canoniche costanti")
        void testContradiction() {
            TruthTable table = tableOf("AA'");
            assertAll("Contraddizione",
                    () -> assertTrue(table.analysis().contradiction()),
                    () -> assertEquals("0", table.canonicalSop()),
                    () -> assertEquals("0", table.canonicalPos())
            );
        }

        @Test
        @DisplayName("Le percentuali sono arrotondate all'intero")
        void testPercentages() {
            TruthTableAnalysis analysis = tableOf("A + B + C").analysis();
            assertAll("Percentuali di A + B + C",
                    () -> assertEquals(8, analysis.totalCombinations()),
                    () -> assertEquals(7, analysis.trueCombinations()),
                    () -> assertEquals(88, analysis.percentageTrue()),
                    () -> assertEquals(13, analysis.percentageFalse()),
                    () -> assertTrue(analysis.contingency())
            );
        }

        @Test
        @DisplayName("La complessità dipende da variabili e sbilanciamento")
        void testComplexity() {
            assertAll("Complessità",
                    () -> assertEquals(ExpressionMetadata.Complexity.BASIC, tableOf("AB").analysis().complexity()),
                    () -> assertEquals(ExpressionMetadata.Complexity.INTERMEDIATE, tableOf("A + BC").analysis().complexity()),
                    () -> assertEquals(ExpressionMetadata.Complexity.ADVANCED, tableOf("ABC").analysis().complexity())
            );
        }
    }

    @Nested
    @DisplayName("Passi intermedi e confronto")
    class StepsAndComparisonTests {

        @Test
        @DisplayName("Ogni sottoespressione composta produce un passo")
        void testIntermediateSteps() {
            ParsedExpression parsed = parser.parse("AB + C'");
            List<IntermediateStep> steps = generator.intermediateSteps(parsed);

            List<String> expressions = new ArrayList<>();
            for (IntermediateStep step : steps) {
                expressions.add(step.expression());
            }

            assertAll("Passi di AB + C'",
                    () -> assertEquals(3, steps.size()),
                    () -> assertTrue(expressions.contains("AB")),
                    () -> assertTrue(expressions.contains("C\u0304")),
                    () -> assertTrue(steps.stream().allMatch(s -> s.outputs().size() == 8))
            );
        }

        @Test
        @DisplayName("Tabelle di espressioni equivalenti coincidono")
        void testCompareEquivalent() {
            TruthTableComparison comparison = TruthTables.compare(tableOf("(AB)'"), tableOf("A' + B'"));
            assertAll("Confronto",
                    () -> assertTrue(comparison.equivalent()),
                    () -> assertEquals(-1, comparison.differingRow())
            );
        }

        @Test
        @DisplayName("Il confronto indica la prima riga diversa")
        void testCompareDifferent() {
            TruthTableComparison comparison = TruthTables.compare(tableOf("A + B"), tableOf("AB"));
            assertAll("Confronto",
                    () -> assertFalse(comparison.equivalent()),
                    () -> assertEquals(1, comparison.differingRow())
            );
        }

        @Test
        @DisplayName("Variabili diverse rendono le tabelle non confrontabili")
        void testCompareDifferentVariables() {
            assertFalse(TruthTables.compare(tableOf("AB"), tableOf("AC")).equivalent());
        }

        @Test
        @DisplayName("Tabella da mintermini e da maxtermini complementari coincidono")
        void testFromIndices() {
            List<String> variables = List.of("A", "B", "C");
            TruthTable fromMinterms = TruthTables.fromMinterms(variables, Set.of(1, 4, 7));
            TruthTable fromMaxterms = TruthTables.fromMaxterms(variables, Set.of(0, 2, 3, 5, 6));

            assertAll("Costruzione da indici",
                    () -> assertEquals(List.of(1, 4, 7), fromMinterms.minterms()),
                    () -> assertTrue(TruthTables.compare(fromMinterms, fromMaxterms).equivalent()),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> TruthTables.fromMinterms(variables, Set.of(8)))
            );
        }
    }
}
