package org.boole.circuit;

import java.util.List;
import java.util.Objects;

/**
 * Porta del circuito.
 *
 * @param id identificativo univoco, "gate_N" oppure "output"
 * @param type tipologia
 * @param label etichetta mostrata: nome variabile, costante, operatore, "Y" o "Y_OUT" per l'uscita
 * @param signal nome del segnale prodotto, usato nei testi HDL
 * @param inputs identificativi delle porte collegate agli ingressi, in ordine
 * @param position angolo superiore sinistro
 */
public record Gate(String id, GateType type, String label, String signal, List<String> inputs, Position position) {

    public Gate {
        Objects.requireNonNull(id, "Identificativo mancante");
        Objects.requireNonNull(type, "Tipo mancante");
        inputs = List.copyOf(inputs);
        if (type.isSource() && !inputs.isEmpty()) {
            throw new IllegalArgumentException("La porta " + id + " di tipo " + type + " non ha ingressi");
        }
    }

    public int width() {
        return type.width();
    }

    public int height() {
        return GateType.HEIGHT;
    }

    public Gate withPosition(Position value) {
        return new Gate(id, type, label, signal, inputs, value);
    }
}
