package org.boole;

import org.boole.support.UnsupportedAlgorithmException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class OperationTest {

    @ParameterizedTest
    @EnumSource(Operation.class)
    @DisplayName("Ogni operazione si riconosce dal proprio identificativo")
    void testFromId(Operation operation) {
        assertAll("Identificativo " + operation.id(),
                () -> assertEquals(operation, Operation.fromId(operation.id())),
                () -> assertEquals(operation, Operation.fromId(operation.id().toUpperCase()))
        );
    }

    @Test
    @DisplayName("Un identificativo sconosciuto è rifiutato")
    void testUnknownId() {
        assertThrows(UnsupportedAlgorithmException.class, () -> Operation.fromId("espresso"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "  ", "all", " ALL "})
    @DisplayName("Lista assente o 'all' seleziona tutte le operazioni")
    void testParseAll(String list) {
        assertEquals(EnumSet.allOf(Operation.class), Operation.parseList(list));
    }

    @Test
    @DisplayName("La lista ignora spazi e voci vuote")
    void testParseList() {
        assertAll("Liste",
                () -> assertEquals(EnumSet.of(Operation.TRUTH, Operation.SAT), Operation.parseList("truth, sat")),
                () -> assertEquals(EnumSet.of(Operation.KMAP, Operation.SOP), Operation.parseList("kmap,,sop,")),
                () -> assertThrows(UnsupportedAlgorithmException.class, () -> Operation.parseList("truth,cnf"))
        );
    }
}
