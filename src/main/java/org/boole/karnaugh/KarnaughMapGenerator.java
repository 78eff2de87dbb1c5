package org.boole.karnaugh;

import org.boole.ast.Notation;
import org.boole.parser.ExpressionMetadata.Complexity;
import org.boole.parser.ParsedExpression;
import org.boole.support.EngineLimits;
import org.boole.support.UnsupportedSizeException;
import org.boole.truthtable.Evaluator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * GENERATORE MAPPE DI KARNAUGH (2-6 variabili)
 *
 * DIMENSIONI:
 * • 2 variabili → 2×2, 3 → 2×4, 4 → 4×4, 5 → 4×8, 6 → 8×8
 *
 * Le prime log2(righe) variabili selezionano la riga, le altre la colonna; entrambe
 * le intestazioni seguono il codice Gray riflesso. La forma SOP si ottiene dai gruppi
 * di 1, la forma POS dai gruppi di 0 complementando i letterali (De Morgan).
 *
 * I termini delle forme semplificate sono ordinati per dimensione del gruppo
 * decrescente, poi per numero di letterali complementati crescente.
 */
public class KarnaughMapGenerator {

    private static final Logger LOGGER = Logger.getLogger(KarnaughMapGenerator.class.getName());

    private static final Notation NOTATION = Notation.APOSTROPHE;

    public KarnaughMap generate(ParsedExpression parsed) {
        return generate(parsed, KarnaughOptions.defaults());
    }

    /**
     * @throws UnsupportedSizeException se le variabili non sono tra 2 e 6
     */
    public KarnaughMap generate(ParsedExpression parsed, KarnaughOptions options) {
        List<String> variables = parsed.variables();
        int n = variables.size();
        if (n < EngineLimits.MIN_KARNAUGH_VARIABLES || n > EngineLimits.MAX_KARNAUGH_VARIABLES) {
            throw new UnsupportedSizeException(n, EngineLimits.MIN_KARNAUGH_VARIABLES, EngineLimits.MAX_KARNAUGH_VARIABLES);
        }
        LOGGER.fine("Generazione mappa di Karnaugh a " + n + " variabili");

        int rows = rowsFor(n);
        int cols = (1 << n) / rows;
        int rowBits = Integer.numberOfTrailingZeros(rows);
        int colBits = Integer.numberOfTrailingZeros(cols);
        int[] rowCodes = GrayCode.sequence(rowBits);
        int[] colCodes = GrayCode.sequence(colBits);

        boolean[][] values = new boolean[rows][cols];
        int[][] indices = new int[rows][cols];
        int ones = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int index = (rowCodes[r] << colBits) | colCodes[c];
                indices[r][c] = index;
                values[r][c] = Evaluator.evaluate(parsed.ast(), EngineLimits.assignmentOf(variables, index));
                if (values[r][c]) {
                    ones++;
                }
            }
        }

        List<KarnaughGrouper.Found> oneGroups = KarnaughGrouper.group(values, indices, true, n);
        List<KarnaughGroup> groups = new ArrayList<>();
        for (KarnaughGrouper.Found found : oneGroups) {
            groups.add(toGroup(groups.size(), found, variables));
        }

        String sop = "";
        String pos = "";
        if (options.findMinimizedForm()) {
            int total = rows * cols;
            sop = simplifiedSop(oneGroups, variables, ones, total);
            pos = simplifiedPos(values, indices, variables, ones, total);
        }

        List<KarnaughGroup> reported = options.autoGroup() ? groups : List.of();
        List<List<KarnaughCell>> cells = buildCells(values, indices, variables, reported);

        GrayCodeLabels labels = new GrayCodeLabels(GrayCode.labels(rowBits), GrayCode.labels(colBits),
                variables.subList(0, rowBits), variables.subList(rowBits, n));
        KarnaughAnalysis analysis = analyze(values, n, ones, reported.size(), oneGroups.size());

        LOGGER.info("Mappa di Karnaugh " + rows + "×" + cols + ": " + oneGroups.size() + " gruppi, SOP = " + sop);
        return new KarnaughMap(variables, rows, cols, cells, reported, sop, pos, labels, analysis);
    }

    /**
     * Soluzione guidata in quattro passi: riempimento, mintermini, gruppi, forma SOP.
     */
    public KarnaughSolution solveStepByStep(ParsedExpression parsed) {
        KarnaughMap map = generate(parsed);

        List<Integer> minterms = map.cells().stream()
                .flatMap(List::stream)
                .filter(KarnaughCell::value)
                .map(KarnaughCell::index)
                .sorted()
                .toList();

        List<KarnaughStep> steps = List.of(
                new KarnaughStep(1, "Costruzione della mappa dall'espressione",
                        "Celle riempite con i valori della tabella di verità"),
                new KarnaughStep(2, "Individuazione dei mintermini (celle a 1)",
                        "Mintermini: " + minterms.stream().map(String::valueOf).collect(Collectors.joining(", "))),
                new KarnaughStep(3, "Ricerca dei gruppi di 1 adiacenti",
                        "Trovati " + map.groups().size() + " gruppi"),
                new KarnaughStep(4, "Forma SOP semplificata dai gruppi",
                        "Forma semplificata: " + map.simplifiedSop()));

        return new KarnaughSolution(map, steps, minterms, map.simplifiedSop());
    }

    //region FORME SEMPLIFICATE

    private String simplifiedSop(List<KarnaughGrouper.Found> oneGroups, List<String> variables, int ones, int total) {
        if (ones == 0) {
            return "0";
        }
        if (ones == total) {
            return "1";
        }
        return ordered(oneGroups, false).stream()
                .map(found -> found.cube().toTerm(variables, NOTATION))
                .collect(Collectors.joining(" + "));
    }

    private String simplifiedPos(boolean[][] values, int[][] indices, List<String> variables, int ones, int total) {
        if (ones == total) {
            return "1";
        }
        if (ones == 0) {
            return "0";
        }
        List<KarnaughGrouper.Found> zeroGroups = KarnaughGrouper.group(values, indices, false, variables.size());
        return ordered(zeroGroups, true).stream()
                .map(found -> found.cube().toClause(variables, NOTATION))
                .collect(Collectors.joining());
    }

    /**
     * Gruppi più grandi prima, poi quelli con meno letterali complementati nel termine
     * (per le clausole POS i complementati sono le variabili fissate a 1).
     */
    private List<KarnaughGrouper.Found> ordered(List<KarnaughGrouper.Found> groups, boolean clauses) {
        List<KarnaughGrouper.Found> sorted = new ArrayList<>(groups);
        sorted.sort(Comparator
                .comparingInt((KarnaughGrouper.Found found) -> -found.cells().size())
                .thenComparingInt(found -> complementedLiterals(found, clauses)));
        return sorted;
    }

    private static int complementedLiterals(KarnaughGrouper.Found found, boolean clause) {
        int fixed = found.cube().getCareMask();
        int value = found.cube().getValue();
        return Integer.bitCount(clause ? value : fixed & ~value);
    }

    //endregion

    //region COSTRUZIONE STRUTTURE

    private KarnaughGroup toGroup(int id, KarnaughGrouper.Found found, List<String> variables) {
        int size = found.cells().size();
        return new KarnaughGroup(id, found.cells(), size, found.cube().getMinterms(),
                found.cube().toTerm(variables, NOTATION), size > 1);
    }

    private List<List<KarnaughCell>> buildCells(boolean[][] values, int[][] indices, List<String> variables,
                                                List<KarnaughGroup> groups) {
        List<List<KarnaughCell>> grid = new ArrayList<>();
        for (int r = 0; r < values.length; r++) {
            List<KarnaughCell> row = new ArrayList<>();
            for (int c = 0; c < values[r].length; c++) {
                List<Integer> groupIds = new ArrayList<>();
                CellPosition position = new CellPosition(r, c);
                for (KarnaughGroup group : groups) {
                    if (group.cells().contains(position)) {
                        groupIds.add(group.id());
                    }
                }
                Map<String, Boolean> inputs = EngineLimits.assignmentOf(variables, indices[r][c]);
                row.add(new KarnaughCell(r, c, values[r][c], inputs, indices[r][c], groupIds));
            }
            grid.add(row);
        }
        return grid;
    }

    private KarnaughAnalysis analyze(boolean[][] values, int n, int ones, int reportedGroups, int foundGroups) {
        int rows = values.length;
        int cols = values[0].length;
        int total = rows * cols;

        Complexity complexity;
        if (n <= 2) {
            complexity = Complexity.BASIC;
        } else if (n <= 4 && foundGroups <= 4) {
            complexity = Complexity.INTERMEDIATE;
        } else {
            complexity = Complexity.ADVANCED;
        }

        long efficiency = ones == 0 ? 100 : Math.round((ones - foundGroups) * 100.0 / ones);

        return new KarnaughAnalysis(total, ones, total - ones, Math.round(ones * 100.0 / total), complexity,
                hasAdjacentOnes(values), reportedGroups, efficiency);
    }

    private boolean hasAdjacentOnes(boolean[][] values) {
        int rows = values.length;
        int cols = values[0].length;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (!values[r][c]) {
                    continue;
                }
                if (values[r][(c + 1) % cols] || values[(r + 1) % rows][c]) {
                    return true;
                }
            }
        }
        return false;
    }

    private static int rowsFor(int variableCount) {
        return switch (variableCount) {
            case 2, 3 -> 2;
            case 4, 5 -> 4;
            default -> 8;
        };
    }

    //endregion
}
