package org.boole.circuit;

import org.boole.parser.ExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitGeneratorTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final CircuitGenerator generator = new CircuitGenerator();

    private LogicCircuit circuitOf(String expression) {
        return generator.generate(parser.parse(expression));
    }

    @Nested
    @DisplayName("Struttura del circuito")
    class StructureTests {

        @Test
        @DisplayName("AB + C' usa tre porte logiche su due livelli")
        void testGateStructure() {
            LogicCircuit circuit = circuitOf("AB + C'");
            assertAll("Circuito di AB + C'",
                    () -> assertEquals(7, circuit.gates().size()),
                    () -> assertEquals(List.of("A", "B", "C"),
                            circuit.inputs().stream().map(Gate::label).toList()),
                    () -> assertEquals(GateType.AND, circuit.gate("gate_3").orElseThrow().type()),
                    () -> assertEquals(List.of("gate_0", "gate_1"), circuit.gate("gate_3").orElseThrow().inputs()),
                    () -> assertEquals(GateType.NOT, circuit.gate("gate_4").orElseThrow().type()),
                    () -> assertEquals("gate_5_out", circuit.gate("gate_5").orElseThrow().signal()),
                    () -> assertEquals(List.of("gate_5"), circuit.output().inputs()),
                    () -> assertEquals("Y", circuit.output().label()),
                    () -> assertEquals(6, circuit.connections().size())
            );
        }

        @Test
        @DisplayName("L'analisi conta porte logiche, ingressi e profondità")
        void testAnalysis() {
            CircuitAnalysis analysis = circuitOf("AB + C'").analysis();
            assertAll("Analisi",
                    () -> assertEquals(3, analysis.totalGates()),
                    () -> assertEquals(3, analysis.inputCount()),
                    () -> assertEquals(3, analysis.depth()),
                    () -> assertEquals(CircuitAnalysis.Complexity.MEDIUM, analysis.complexity()),
                    () -> assertTrue(analysis.suggestions().isEmpty())
            );
        }

        @Test
        @DisplayName("Le porte NOT più numerose degli ingressi suggeriscono De Morgan")
        void testNotSuggestion() {
            CircuitAnalysis analysis = circuitOf("A'' + A'").analysis();
            assertTrue(analysis.suggestions().stream().anyMatch(s -> s.contains("De Morgan")));
        }

        @Test
        @DisplayName("Ogni variabile ha una sola porta d'ingresso condivisa")
        void testSharedInputs() {
            LogicCircuit circuit = circuitOf("AB + AB'");
            assertAll("Ingressi condivisi",
                    () -> assertEquals(2, circuit.inputs().size()),
                    () -> assertEquals(List.of("gate_0", "gate_1"), circuit.gate("gate_2").orElseThrow().inputs())
            );
        }

        @Test
        @DisplayName("Una costante produce una porta CONSTANT collegata all'uscita")
        void testConstant() {
            LogicCircuit circuit = circuitOf("1");
            Gate constant = circuit.gate("gate_0").orElseThrow();
            assertAll("Circuito costante",
                    () -> assertEquals(GateType.CONSTANT, constant.type()),
                    () -> assertEquals("1", constant.label()),
                    () -> assertTrue(circuit.inputs().isEmpty()),
                    () -> assertEquals(0, circuit.analysis().totalGates()),
                    () -> assertEquals(1, circuit.analysis().depth())
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"A", "AB + C'", "(A + B)(C + D)'", "A'B'C' + 0"})
        @DisplayName("Ogni circuito ha esattamente una porta OUTPUT")
        void testSingleOutput(String expression) {
            LogicCircuit circuit = circuitOf(expression);
            assertEquals(1, circuit.gates().stream().filter(g -> g.type() == GateType.OUTPUT).count());
        }

        @Test
        @DisplayName("Un circuito senza uscita è rifiutato")
        void testMissingOutput() {
            Gate input = new Gate("gate_0", GateType.INPUT, "A", "A", List.of(), new Position(0, 0));
            assertThrows(IllegalArgumentException.class,
                    () -> new LogicCircuit("A", List.of(input), List.of(), Bounds.EMPTY, null));
        }

        @Test
        @DisplayName("Una porta d'ingresso non accetta collegamenti in entrata")
        void testSourceWithInputs() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Gate("gate_0", GateType.INPUT, "A", "A", List.of("gate_1"), new Position(0, 0)));
        }
    }

    @Nested
    @DisplayName("Disposizione")
    class LayoutTests {

        @Test
        @DisplayName("La disposizione per livelli assegna una colonna a ogni livello")
        void testLeveledLayout() {
            LogicCircuit circuit = circuitOf("AB + C'");
            assertAll("Colonne",
                    () -> assertEquals(new Position(50, 50), circuit.gate("gate_0").orElseThrow().position()),
                    () -> assertEquals(new Position(50, 170), circuit.gate("gate_2").orElseThrow().position()),
                    () -> assertEquals(new Position(150, 50), circuit.gate("gate_3").orElseThrow().position()),
                    () -> assertEquals(new Position(150, 110), circuit.gate("gate_4").orElseThrow().position()),
                    () -> assertEquals(new Position(250, 50), circuit.gate("gate_5").orElseThrow().position()),
                    () -> assertEquals(new Position(350, 50), circuit.output().position())
            );
        }

        @Test
        @DisplayName("Il riquadro include tutte le porte più il margine")
        void testBounds() {
            Bounds bounds = circuitOf("AB + C'").bounds();
            assertAll("Riquadro",
                    () -> assertEquals(50, bounds.minX()),
                    () -> assertEquals(50, bounds.minY()),
                    () -> assertEquals(410, bounds.maxX()),
                    () -> assertEquals(200, bounds.maxY()),
                    () -> assertEquals(400, bounds.width()),
                    () -> assertEquals(190, bounds.height())
            );
        }

        @Test
        @DisplayName("Senza porte il riquadro è quello predefinito")
        void testEmptyBounds() {
            assertEquals(Bounds.EMPTY, Bounds.of(List.of()));
        }

        @Test
        @DisplayName("In ordine di costruzione gli ingressi sono impilati nella prima colonna")
        void testBuildOrderLayout() {
            LogicCircuit circuit = generator.generate(parser.parse("AB + C'"),
                    CircuitOptions.defaults().withLayout(LayoutStrategy.BUILD_ORDER).withSpacing(80, 40));
            assertAll("Ordine di costruzione",
                    () -> assertEquals(new Position(50, 50), circuit.gate("gate_0").orElseThrow().position()),
                    () -> assertEquals(new Position(50, 130), circuit.gate("gate_2").orElseThrow().position()),
                    () -> assertEquals(new Position(130, 50), circuit.gate("gate_3").orElseThrow().position()),
                    () -> assertEquals(new Position(210, 90), circuit.gate("gate_4").orElseThrow().position())
            );
        }

        @ParameterizedTest
        @EnumSource(LayoutStrategy.class)
        @DisplayName("I collegamenti partono dal lato destro della sorgente")
        void testConnections(LayoutStrategy layout) {
            LogicCircuit circuit = generator.generate(parser.parse("A + B"), CircuitOptions.defaults().withLayout(layout));
            for (Connection connection : circuit.connections()) {
                Gate source = circuit.gate(connection.fromGate()).orElseThrow();
                assertEquals(source.position().x() + source.width(), connection.from().x());
                assertEquals(circuit.gate(connection.toGate()).orElseThrow().position().x(), connection.to().x());
            }
        }

        @Test
        @DisplayName("Spaziature non positive sono rifiutate")
        void testInvalidSpacing() {
            CircuitOptions defaults = CircuitOptions.defaults();
            assertAll("Spaziature",
                    () -> assertThrows(IllegalArgumentException.class, () -> defaults.withSpacing(0, 60)),
                    () -> assertThrows(IllegalArgumentException.class, () -> defaults.withSpacing(100, -1))
            );
        }
    }

    @Nested
    @DisplayName("Descrizioni HDL")
    class HdlTests {

        @Test
        @DisplayName("Il Verilog istanzia le porte e assegna l'uscita")
        void testVerilog() {
            String verilog = circuitOf("AB + C'").toVerilog();
            assertAll("Verilog",
                    () -> assertTrue(verilog.startsWith("module boolean_circuit(\n  input A,\n  input B,\n  input C,\n  output Y\n);")),
                    () -> assertTrue(verilog.contains("wire gate_3_out, gate_4_out, gate_5_out;")),
                    () -> assertTrue(verilog.contains("and gate_3(gate_3_out, A, B);")),
                    () -> assertTrue(verilog.contains("not gate_4(gate_4_out, C);")),
                    () -> assertTrue(verilog.contains("or gate_5(gate_5_out, gate_3_out, gate_4_out);")),
                    () -> assertTrue(verilog.contains("assign Y = gate_5_out;")),
                    () -> assertTrue(verilog.endsWith("endmodule\n"))
            );
        }

        @Test
        @DisplayName("Le costanti diventano assegnamenti letterali")
        void testVerilogConstant() {
            String verilog = circuitOf("A + 0").toVerilog();
            assertAll("Costante",
                    () -> assertTrue(verilog.contains("assign gate_1_out = 1'b0;")),
                    () -> assertTrue(verilog.contains("or gate_2(gate_2_out, A, gate_1_out);"))
            );
        }

        @Test
        @DisplayName("Il VHDL dichiara entità e assegnamenti concorrenti")
        void testVhdl() {
            String vhdl = circuitOf("AB + C'").toVhdl();
            assertAll("VHDL",
                    () -> assertTrue(vhdl.startsWith("library IEEE;\nuse IEEE.STD_LOGIC_1164.ALL;")),
                    () -> assertTrue(vhdl.contains("entity boolean_circuit is")),
                    () -> assertTrue(vhdl.contains("    A : in STD_LOGIC;")),
                    () -> assertTrue(vhdl.contains("    Y : out STD_LOGIC")),
                    () -> assertTrue(vhdl.contains("architecture Behavioral of boolean_circuit is")),
                    () -> assertTrue(vhdl.contains("gate_3_out <= A AND B;")),
                    () -> assertTrue(vhdl.contains("gate_4_out <= NOT C;")),
                    () -> assertTrue(vhdl.contains("gate_5_out <= gate_3_out OR gate_4_out;")),
                    () -> assertTrue(vhdl.contains("Y <= gate_5_out;")),
                    () -> assertTrue(vhdl.endsWith("end Behavioral;\n"))
            );
        }

        @Test
        @DisplayName("Con una variabile Y l'uscita prende un nome distinto dagli ingressi")
        void testOutputNameClash() {
            LogicCircuit circuit = circuitOf("X + Y");
            String verilog = circuit.toVerilog();
            String vhdl = circuit.toVhdl();
            assertAll("Circuito di X + Y",
                    () -> assertEquals("Y_OUT", circuit.output().label()),
                    () -> assertTrue(verilog.startsWith("module boolean_circuit(\n  input X,\n  input Y,\n  output Y_OUT\n);")),
                    () -> assertTrue(verilog.contains("assign Y_OUT = gate_2_out;")),
                    () -> assertFalse(verilog.contains("assign Y =")),
                    () -> assertTrue(vhdl.contains("    Y : in STD_LOGIC;\n    Y_OUT : out STD_LOGIC")),
                    () -> assertTrue(vhdl.contains("Y_OUT <= gate_2_out;")),
                    () -> assertFalse(vhdl.contains("  Y <= "))
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"A + B", "XZ", "1"})
        @DisplayName("Senza una variabile Y l'uscita si chiama Y")
        void testDefaultOutputName(String expression) {
            assertEquals("Y", circuitOf(expression).output().label());
        }

        @Test
        @DisplayName("Un ingresso collegato direttamente all'uscita")
        void testPassThrough() {
            LogicCircuit circuit = circuitOf("A");
            assertAll("Passante",
                    () -> assertTrue(circuit.toVerilog().contains("assign Y = A;")),
                    () -> assertFalse(circuit.toVerilog().contains("wire")),
                    () -> assertTrue(circuit.toVhdl().contains("Y <= A;"))
            );
        }
    }
}
