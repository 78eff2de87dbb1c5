package org.boole.minimization;

import org.boole.ast.Notation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Correttezza delle coperture prodotte dai tre minimizzatori: l'unione dei cubi
 * deve coincidere esattamente con l'insieme on.
 */
class MinimizerTest {

    private static final List<String> VARIABLES = List.of("A", "B", "C", "D");

    private static List<Integer> onSet(int truthBits, int variableCount) {
        List<Integer> minterms = new ArrayList<>();
        for (int index = 0; index < 1 << variableCount; index++) {
            if ((truthBits >> index & 1) == 1) {
                minterms.add(index);
            }
        }
        return minterms;
    }

    private static Set<Integer> covered(List<Implicant> cover) {
        Set<Integer> result = new TreeSet<>();
        for (Implicant implicant : cover) {
            result.addAll(implicant.getMinterms());
        }
        return result;
    }

    @Nested
    @DisplayName("Coperture esatte")
    class CoverTests {

        @ParameterizedTest
        @EnumSource(MinimizationAlgorithm.class)
        @DisplayName("Tutte le funzioni non costanti di 3 variabili sono coperte esattamente")
        void testAllThreeVariableFunctions(MinimizationAlgorithm algorithm) {
            Minimizer minimizer = algorithm.newMinimizer();
            for (int bits = 1; bits < 255; bits++) {
                List<Integer> minterms = onSet(bits, 3);
                List<Implicant> cover = minimizer.cover(minterms, 3);
                assertEquals(new TreeSet<>(minterms), covered(cover),
                        algorithm.id() + " su " + minterms);
            }
        }

        @ParameterizedTest
        @EnumSource(MinimizationAlgorithm.class)
        @DisplayName("Funzioni casuali di 4 variabili sono coperte esattamente")
        void testRandomFourVariableFunctions(MinimizationAlgorithm algorithm) {
            Minimizer minimizer = algorithm.newMinimizer();
            Random random = new Random(42);
            for (int trial = 0; trial < 300; trial++) {
                int bits = random.nextInt(0xFFFF - 1) + 1;
                List<Integer> minterms = onSet(bits, 4);
                List<Implicant> cover = minimizer.cover(minterms, 4);
                assertEquals(new TreeSet<>(minterms), covered(cover),
                        algorithm.id() + " su " + minterms);
            }
        }

        @ParameterizedTest
        @EnumSource(value = MinimizationAlgorithm.class, names = {"QUINE_MCCLUSKEY", "PETRICK"})
        @DisplayName("Le coperture basate sui primi usano solo implicanti primi")
        void testCoverUsesPrimes(MinimizationAlgorithm algorithm) {
            List<Integer> minterms = List.of(0, 1, 2, 5, 6, 7, 8, 10, 15);
            List<Implicant> primes = PrimeImplicantGenerator.generate(minterms, 4);
            for (Implicant implicant : algorithm.newMinimizer().cover(minterms, 4)) {
                assertTrue(primes.contains(implicant), implicant.pattern() + " non è primo");
            }
        }
    }

    @Nested
    @DisplayName("Espressioni minimizzate")
    class ExpressionTests {

        @ParameterizedTest
        @EnumSource(MinimizationAlgorithm.class)
        @DisplayName("I mintermini 2 e 3 su [A, B] si riducono ad A")
        void testSingleLiteral(MinimizationAlgorithm algorithm) {
            assertEquals("A", algorithm.newMinimizer().minimize(List.of("A", "B"), List.of(2, 3)));
        }

        @ParameterizedTest
        @EnumSource(MinimizationAlgorithm.class)
        @DisplayName("Insieme on vuoto o completo produce una costante")
        void testConstants(MinimizationAlgorithm algorithm) {
            Minimizer minimizer = algorithm.newMinimizer();
            assertAll("Costanti con " + algorithm.id(),
                    () -> assertEquals("0", minimizer.minimize(List.of("A", "B"), List.of())),
                    () -> assertEquals("1", minimizer.minimize(List.of("A", "B"), List.of(0, 1, 2, 3)))
            );
        }

        @Test
        @DisplayName("Quine-McCluskey sceglie gli essenziali della funzione maggioranza")
        void testMajorityFunction() {
            String minimized = new QuineMcCluskeyMinimizer().minimize(List.of("A", "B", "C"), List.of(3, 5, 6, 7));
            Set<String> terms = new TreeSet<>(List.of(minimized.split(" \\+ ")));
            assertEquals(Set.of("AB", "AC", "BC"), terms);
        }

        @Test
        @DisplayName("La notazione con apice è rispettata")
        void testApostropheNotation() {
            String minimized = new QuineMcCluskeyMinimizer()
                    .minimize(List.of("A", "B"), List.of(0, 1), Notation.APOSTROPHE);
            assertEquals("A'", minimized);
        }

        @Test
        @DisplayName("Una seconda minimizzazione non aumenta i termini")
        void testIdempotentMinimization() {
            List<Integer> minterms = List.of(0, 2, 5, 7, 8, 10, 13, 15);
            Minimizer minimizer = new EspressoMinimizer();
            List<Implicant> first = minimizer.cover(minterms, 4);
            List<Integer> coveredAgain = new ArrayList<>(covered(first));
            List<Implicant> second = minimizer.cover(coveredAgain, 4);

            assertAll("Riminimizzazione",
                    () -> assertTrue(second.size() <= first.size()),
                    () -> assertEquals("BD + B\u0304D\u0304", minimizedTerms(new QuineMcCluskeyMinimizer(), minterms))
            );
        }

        private String minimizedTerms(Minimizer minimizer, List<Integer> minterms) {
            List<String> terms = new ArrayList<>(List.of(minimizer.minimize(VARIABLES, minterms).split(" \\+ ")));
            terms.sort(null);
            return String.join(" + ", terms);
        }
    }
}
