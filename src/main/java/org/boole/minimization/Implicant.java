package org.boole.minimization;

import org.boole.ast.Notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * IMPLICANTE - Cubo dello spazio booleano come coppia (valore, maschera)
 *
 * Un bit a 1 in {@code careMask} indica una variabile fissata, il cui valore è il bit
 * corrispondente di {@code value}; un bit a 0 indica una posizione libera ("-").
 * La variabile di indice 0 corrisponde al bit più significativo.
 *
 * ESEMPIO su [A, B, C]:
 * • value=0b100, careMask=0b110 → "10-" → AB̄, copre {4, 5}
 */
public final class Implicant {

    private final int value;
    private final int careMask;
    private final int variableCount;
    private final List<Integer> minterms;

    public Implicant(int value, int careMask, int variableCount) {
        if (variableCount < 0 || variableCount > 30) {
            throw new IllegalArgumentException("Numero di variabili non valido: " + variableCount);
        }
        int full = (1 << variableCount) - 1;
        if ((careMask & ~full) != 0) {
            throw new IllegalArgumentException("Maschera oltre le " + variableCount + " variabili");
        }
        this.value = value & careMask;
        this.careMask = careMask;
        this.variableCount = variableCount;
        this.minterms = enumerateMinterms();
    }

    /**
     * Implicante unitario di un singolo mintermine.
     */
    public static Implicant ofMinterm(int minterm, int variableCount) {
        return new Implicant(minterm, (1 << variableCount) - 1, variableCount);
    }

    //region OPERAZIONI SUI CUBI

    /**
     * Fusione con un implicante della stessa forma che differisce in un solo bit fissato.
     *
     * @return implicante fuso, oppure null se i due cubi non sono adiacenti
     */
    public Implicant mergeWith(Implicant other) {
        if (other.careMask != careMask || other.variableCount != variableCount) {
            return null;
        }
        int difference = value ^ other.value;
        if (Integer.bitCount(difference) != 1) {
            return null;
        }
        return new Implicant(value & ~difference, careMask & ~difference, variableCount);
    }

    /**
     * Cubo con la posizione della variabile indicata resa libera.
     */
    public Implicant raise(int variableIndex) {
        int bit = 1 << (variableCount - 1 - variableIndex);
        return new Implicant(value & ~bit, careMask & ~bit, variableCount);
    }

    public boolean isFixed(int variableIndex) {
        return (careMask & (1 << (variableCount - 1 - variableIndex))) != 0;
    }

    public boolean covers(int minterm) {
        return (minterm & careMask) == value;
    }

    public int literalCount() {
        return Integer.bitCount(careMask);
    }

    private List<Integer> enumerateMinterms() {
        List<Integer> result = new ArrayList<>();
        int full = (1 << variableCount) - 1;
        int free = full & ~careMask;
        // enumerazione dei sottoinsiemi dei bit liberi in ordine crescente
        int subset = 0;
        do {
            result.add(value | subset);
            subset = (subset - free) & free;
        } while (subset != 0);
        Collections.sort(result);
        return Collections.unmodifiableList(result);
    }

    //endregion

    //region RAPPRESENTAZIONE

    /**
     * Prodotto di letterali, es. "AB̄". Un cubo senza variabili fissate vale "1".
     */
    public String toTerm(List<String> variables, Notation notation) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < variableCount; i++) {
            if (isFixed(i)) {
                boolean positive = (value & (1 << (variableCount - 1 - i))) != 0;
                sb.append(notation.literal(variables.get(i), positive));
            }
        }
        return sb.length() == 0 ? "1" : sb.toString();
    }

    /**
     * Somma dei letterali complementati, es. cubo "10-" → "(Ā + B)".
     * Descrive il cubo come insieme di zeri in una forma POS. Un solo letterale non
     * viene racchiuso tra parentesi; un cubo senza variabili fissate vale "0".
     */
    public String toClause(List<String> variables, Notation notation) {
        List<String> literals = new ArrayList<>();
        for (int i = 0; i < variableCount; i++) {
            if (isFixed(i)) {
                boolean one = (value & (1 << (variableCount - 1 - i))) != 0;
                literals.add(notation.literal(variables.get(i), !one));
            }
        }
        if (literals.isEmpty()) {
            return "0";
        }
        return literals.size() == 1 ? literals.get(0) : "(" + String.join(" + ", literals) + ")";
    }

    /**
     * Cubo minimo che contiene tutti gli indici dati: fissa le posizioni su cui concordano.
     */
    public static Implicant spanning(List<Integer> indices, int variableCount) {
        int full = (1 << variableCount) - 1;
        int allOnes = full;
        int anyOne = 0;
        for (int index : indices) {
            allOnes &= index;
            anyOne |= index;
        }
        int careMask = ~(allOnes ^ anyOne) & full;
        return new Implicant(allOnes, careMask, variableCount);
    }

    /**
     * Forma a trattini, es. "10-".
     */
    public String pattern() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < variableCount; i++) {
            int bit = 1 << (variableCount - 1 - i);
            if ((careMask & bit) == 0) {
                sb.append('-');
            } else {
                sb.append((value & bit) != 0 ? '1' : '0');
            }
        }
        return sb.toString();
    }

    //endregion

    public int getValue() {
        return value;
    }

    public int getCareMask() {
        return careMask;
    }

    public int getVariableCount() {
        return variableCount;
    }

    /**
     * Mintermini coperti, in ordine crescente.
     */
    public List<Integer> getMinterms() {
        return minterms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Implicant other)) return false;
        return value == other.value && careMask == other.careMask && variableCount == other.variableCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, careMask, variableCount);
    }

    @Override
    public String toString() {
        return pattern() + " " + minterms;
    }
}
