package org.boole;

import org.boole.support.BooleanEngineException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ELABORAZIONE BATCH - Una scadenza esterna per ogni espressione
 *
 * Ogni espressione viene elaborata in un task dedicato su un executor a thread singolo;
 * l'attesa è limitata con {@link Future#get(long, TimeUnit)}. Il motore non viene mai
 * interrotto dall'interno: allo scadere del tempo il task viene abbandonato e l'elemento
 * riportato come timeout.
 */
public class BatchProcessor {

    private static final Logger LOGGER = Logger.getLogger(BatchProcessor.class.getName());

    private final BooleanEngine engine;

    public BatchProcessor() {
        this(new BooleanEngine());
    }

    public BatchProcessor(BooleanEngine engine) {
        this.engine = engine;
    }

    /**
     * @param expressions espressioni da elaborare, nell'ordine
     * @param operations operazioni richieste per ogni espressione
     * @param timeoutSeconds tempo massimo per singola espressione
     * @return un esito per espressione, nello stesso ordine
     */
    public List<BatchItemResult> process(List<String> expressions, Set<Operation> operations, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout deve essere positivo: " + timeoutSeconds);
        }

        List<BatchItemResult> results = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            BatchItemResult result = processItem(i, expressions.get(i), operations, timeoutSeconds);
            results.add(result);
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Batch interrotto dopo " + results.size() + " elementi");
                break;
            }
        }
        return results;
    }

    private BatchItemResult processItem(int index, String expression, Set<Operation> operations, long timeoutSeconds) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ExpressionReport> future = executor.submit(() -> engine.process(expression, operations));
            return BatchItemResult.success(index, expression, future.get(timeoutSeconds, TimeUnit.SECONDS));

        } catch (TimeoutException e) {
            LOGGER.warning("Timeout dopo " + timeoutSeconds + "s per l'elemento " + index + ": '" + expression + "'");
            return BatchItemResult.timeout(index, expression);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BooleanEngineException) {
                LOGGER.warning("Elemento " + index + " non elaborato: " + cause.getMessage());
            } else {
                LOGGER.log(Level.SEVERE, "Errore inatteso sull'elemento " + index, cause);
            }
            return BatchItemResult.failure(index, expression, String.valueOf(cause.getMessage()));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BatchItemResult.failure(index, expression, "Elaborazione interrotta");

        } finally {
            executor.shutdownNow();
        }
    }
}
