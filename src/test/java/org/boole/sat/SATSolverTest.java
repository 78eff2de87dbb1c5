package org.boole.sat;

import org.boole.parser.ExpressionParser;
import org.boole.parser.ParsedExpression;
import org.boole.support.CapacityExceededException;
import org.boole.support.UnsupportedAlgorithmException;
import org.boole.truthtable.Evaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SATSolverTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final SATSolver solver = new SATSolver();

    private static SatOptions allSolutions(SearchMethod method) {
        return SatOptions.defaults().withMethod(method).withFindAllSolutions(true);
    }

    @Nested
    @DisplayName("Ricerca di base")
    class BasicSearchTests {

        @Test
        @DisplayName("AB' ha l'unica soluzione A=1, B=0")
        void testUniqueSolution() {
            SATResult result = solver.solve(parser.parse("AB'"), List.of(), allSolutions(SearchMethod.AUTO));

            assertAll("Soluzioni di AB'",
                    () -> assertTrue(result.isSatisfiable()),
                    () -> assertEquals(1, result.solutionCount()),
                    () -> assertEquals(Map.of("A", true, "B", false), result.solution()),
                    () -> assertEquals(SearchMethod.DPLL, result.getMethod()),
                    () -> assertTrue(result.isExhaustive()),
                    () -> assertEquals(2, result.getVariableCount()),
                    () -> assertEquals(0, result.getConstraintCount())
            );
        }

        @Test
        @DisplayName("Con le opzioni predefinite viene restituito un solo modello")
        void testDefaultOptions() {
            SATResult result = solver.solve(parser.parse("A + B"));
            assertAll("A + B",
                    () -> assertTrue(result.isSatisfiable()),
                    () -> assertEquals(1, result.solutionCount()),
                    () -> assertTrue(result.getSearchSteps() > 0)
            );
        }

        @ParameterizedTest
        @EnumSource(value = SearchMethod.class, names = {"DPLL", "BRUTE_FORCE", "WALKSAT"})
        @DisplayName("Una contraddizione non ha soluzioni")
        void testUnsatisfiable(SearchMethod method) {
            SATResult result = solver.solve(parser.parse("AA'"), List.of(),
                    SatOptions.defaults().withMethod(method).withSeed(7L));
            assertAll("AA' con " + method.id(),
                    () -> assertFalse(result.isSatisfiable()),
                    () -> assertNull(result.solution()),
                    () -> assertEquals(method != SearchMethod.WALKSAT, result.isExhaustive())
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"A + B", "(A + B)(A' + C)(B' + C')", "A'B'C + AB'C' + ABC", "(AB)' + CD", "1", "A + A'"})
        @DisplayName("DPLL e forza bruta trovano gli stessi modelli")
        void testDpllMatchesBruteForce(String expression) {
            ParsedExpression parsed = parser.parse(expression);
            SATResult dpll = solver.solve(parsed, List.of(), allSolutions(SearchMethod.DPLL));
            SATResult bruteForce = solver.solve(parsed, List.of(), allSolutions(SearchMethod.BRUTE_FORCE));

            assertEquals(new HashSet<>(bruteForce.getSolutions()), new HashSet<>(dpll.getSolutions()));
        }

        @ParameterizedTest
        @ValueSource(strings = {"(A + B)(A' + C)(B' + C')", "A'B'C + AB'C' + ABC", "ABCD + A'B'"})
        @DisplayName("Ogni soluzione soddisfa l'espressione")
        void testSolutionsAreModels(String expression) {
            ParsedExpression parsed = parser.parse(expression);
            SATResult result = solver.solve(parsed, List.of(), allSolutions(SearchMethod.AUTO));
            for (Map<String, Boolean> solution : result.getSolutions()) {
                assertTrue(Evaluator.evaluate(parsed.ast(), solution), "non è un modello: " + solution);
            }
        }

        @Test
        @DisplayName("Le soluzioni sono troncate a maxSolutions")
        void testMaxSolutions() {
            SATResult result = solver.solve(parser.parse("A + B + C"), List.of(),
                    allSolutions(SearchMethod.DPLL).withMaxSolutions(3));
            assertEquals(3, result.solutionCount());
        }
    }

    @Nested
    @DisplayName("WalkSAT")
    class WalkSatTests {

        @Test
        @DisplayName("Con seme fissato trova un modello di un'espressione soddisfacibile")
        void testFindsModel() {
            ParsedExpression parsed = parser.parse("(A + B)(A' + C)(B' + C')(C + D)");
            SATResult result = solver.solve(parsed, List.of(),
                    SatOptions.defaults().withMethod(SearchMethod.WALKSAT).withSeed(42L));
            assertAll("WalkSAT",
                    () -> assertTrue(result.isSatisfiable()),
                    () -> assertEquals(1, result.solutionCount()),
                    () -> assertFalse(result.isExhaustive()),
                    () -> assertTrue(Evaluator.evaluate(parsed.ast(), result.solution()))
            );
        }

        @Test
        @DisplayName("Lo stesso seme produce lo stesso modello")
        void testDeterministicWithSeed() {
            ParsedExpression parsed = parser.parse("A + B + C + D");
            SatOptions options = SatOptions.defaults().withMethod(SearchMethod.WALKSAT).withSeed(3L);
            assertEquals(solver.solve(parsed, List.of(), options).getSolutions(),
                    solver.solve(parsed, List.of(), options).getSolutions());
        }

        @Test
        @DisplayName("Oltre 10 variabili il metodo automatico usa WalkSAT")
        void testAutoSelectsWalkSat() {
            ParsedExpression parsed = parser.parse("A + B + C + D + E + F + G + H + I + J + K");
            SATResult result = solver.solve(parsed, List.of(), SatOptions.defaults().withSeed(1L));
            assertAll("Undici variabili",
                    () -> assertEquals(SearchMethod.WALKSAT, result.getMethod()),
                    () -> assertEquals(11, result.getVariableCount()),
                    () -> assertTrue(result.isSatisfiable()),
                    () -> assertTrue(Evaluator.evaluate(parsed.ast(), result.solution()))
            );
        }

        @Test
        @DisplayName("I metodi esaustivi oltre 10 variabili falliscono")
        void testExhaustiveCapacity() {
            ParsedExpression parsed = parser.parse("ABCDEFGHIJK");
            assertAll("Limite di enumerazione",
                    () -> assertThrows(CapacityExceededException.class, () -> solver.solve(parsed, List.of(),
                            SatOptions.defaults().withMethod(SearchMethod.DPLL))),
                    () -> assertThrows(CapacityExceededException.class, () -> solver.solve(parsed, List.of(),
                            SatOptions.defaults().withMethod(SearchMethod.BRUTE_FORCE)))
            );
        }
    }

    @Nested
    @DisplayName("Vincoli")
    class ConstraintTests {

        @Test
        @DisplayName("Esattamente uno tra A, B, C")
        void testExactlyOne() {
            SATResult result = solver.solve(parser.parse("A + B + C"),
                    List.of(SATConstraint.exactlyOne(List.of("A", "B", "C"))), allSolutions(SearchMethod.DPLL));
            assertAll("Esattamente uno",
                    () -> assertEquals(3, result.solutionCount()),
                    () -> assertEquals(1, result.getConstraintCount()),
                    () -> assertTrue(result.getSolutions().stream()
                            .allMatch(s -> s.values().stream().filter(v -> v).count() == 1))
            );
        }

        @Test
        @DisplayName("Un vincolo su una variabile nuova estende lo spazio di ricerca")
        void testConstraintOnNewVariable() {
            SATResult result = solver.solve(parser.parse("A"),
                    List.of(SATConstraint.equalsTo(List.of("B"), true)), allSolutions(SearchMethod.BRUTE_FORCE));
            assertAll("Variabile B aggiunta",
                    () -> assertEquals(2, result.getVariableCount()),
                    () -> assertEquals(List.of(Map.of("A", true, "B", true)), result.getSolutions())
            );
        }

        @Test
        @DisplayName("Vincoli incompatibili rendono insoddisfacibile")
        void testConflictingConstraints() {
            SATResult result = solver.solve(parser.parse("A + B"),
                    List.of(SATConstraint.equalsTo(List.of("A", "B"), false)), allSolutions(SearchMethod.DPLL));
            assertFalse(result.isSatisfiable());
        }

        @Test
        @DisplayName("Le proprietà diventano vincoli di cardinalità")
        void testAssignmentProperties() {
            ParsedExpression parsed = parser.parse("A + B + C");
            SATResult minimizeTrue = solver.findAssignmentsWithProperties(parsed, List.of(AssignmentProperty.MINIMIZE_TRUE));
            SATResult balance = solver.findAssignmentsWithProperties(parsed, List.of(AssignmentProperty.BALANCE));

            assertAll("Proprietà",
                    () -> assertEquals(3, minimizeTrue.solutionCount()),
                    () -> assertEquals(4, balance.solutionCount()),
                    () -> assertTrue(balance.getSolutions().stream().allMatch(s -> s.get("A")))
            );
        }
    }

    @Nested
    @DisplayName("Vincoli e opzioni")
    class ModelTests {

        @Test
        @DisplayName("La valutazione parziale riconosce i vincoli ancora soddisfacibili")
        void testCanStillBeSatisfied() {
            SATConstraint atMostOne = SATConstraint.atMostOne(List.of("A", "B", "C"));
            SATConstraint atLeastOne = SATConstraint.atLeastOne(List.of("A", "B"));
            assertAll("Assegnamenti parziali",
                    () -> assertTrue(atMostOne.canStillBeSatisfied(Map.of("A", true))),
                    () -> assertFalse(atMostOne.canStillBeSatisfied(Map.of("A", true, "C", true))),
                    () -> assertTrue(atLeastOne.canStillBeSatisfied(Map.of("A", false))),
                    () -> assertFalse(atLeastOne.canStillBeSatisfied(Map.of("A", false, "B", false)))
            );
        }

        @Test
        @DisplayName("Un vincolo di cardinalità senza variabili è rifiutato")
        void testEmptyConstraint() {
            assertThrows(IllegalArgumentException.class, () -> SATConstraint.exactlyOne(List.of()));
        }

        @Test
        @DisplayName("Le opzioni fuori intervallo sono rifiutate")
        void testInvalidOptions() {
            assertAll("Opzioni",
                    () -> assertThrows(IllegalArgumentException.class, () -> SatOptions.defaults().withMaxSolutions(0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> SatOptions.defaults().withMaxFlips(-1)),
                    () -> assertThrows(IllegalArgumentException.class, () -> SatOptions.defaults().withNoiseProbability(1.5))
            );
        }

        @Test
        @DisplayName("I metodi sono riconosciuti per identificativo o nome")
        void testSearchMethodIds() {
            assertAll("Metodi",
                    () -> assertEquals(SearchMethod.BRUTE_FORCE, SearchMethod.fromId("brute-force")),
                    () -> assertEquals(SearchMethod.WALKSAT, SearchMethod.fromId("WALKSAT")),
                    () -> assertThrows(UnsupportedAlgorithmException.class, () -> SearchMethod.fromId("cdcl"))
            );
        }

        @Test
        @DisplayName("Le descrizioni testuali diventano vincoli")
        void testConstraintParser() {
            List<String> variables = List.of("A", "B");
            List<SATConstraint> constraints = ConstraintParser.parse(
                    List.of("At most one true", "esattamente uno vero", "almeno uno", "qualcosa"), variables);

            Set<ConstraintType> types = new HashSet<>();
            constraints.forEach(c -> types.add(c.getType()));
            assertAll("Vincoli riconosciuti",
                    () -> assertEquals(3, constraints.size()),
                    () -> assertEquals(Set.of(ConstraintType.AT_MOST_ONE, ConstraintType.EXACTLY_ONE,
                            ConstraintType.AT_LEAST_ONE), types),
                    () -> assertTrue(ConstraintParser.parse(List.of("at least one"), List.of()).isEmpty())
            );
        }
    }
}
