package org.boole;

/**
 * Esito di un elemento del batch.
 *
 * Esattamente uno tra: report presente, errore presente, timeout. Un timeout non è un
 * fallimento dell'espressione: l'esito è sconosciuto.
 *
 * @param index posizione nell'input, da 0
 */
public record BatchItemResult(int index, String expression, ExpressionReport report, String error, boolean timedOut) {

    public BatchItemResult {
        int outcomes = (report != null ? 1 : 0) + (error != null ? 1 : 0) + (timedOut ? 1 : 0);
        if (outcomes != 1) {
            throw new IllegalArgumentException("Esito del batch ambiguo per l'elemento " + index);
        }
    }

    public static BatchItemResult success(int index, String expression, ExpressionReport report) {
        return new BatchItemResult(index, expression, report, null, false);
    }

    public static BatchItemResult failure(int index, String expression, String error) {
        return new BatchItemResult(index, expression, null, error, false);
    }

    public static BatchItemResult timeout(int index, String expression) {
        return new BatchItemResult(index, expression, null, null, true);
    }

    public boolean isSuccess() {
        return report != null;
    }
}
