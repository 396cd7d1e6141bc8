package io.deltaflow.engine.ingest;

import io.deltaflow.core.EngineClosedException;
import io.deltaflow.core.SchemaException;
import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.connector.Schema;
import io.deltaflow.engine.connector.SourceConnector;
import io.deltaflow.engine.connector.SourceEvent;
import io.deltaflow.engine.connector.Update;
import io.deltaflow.engine.scheduler.FailureMonitor;
import io.deltaflow.engine.scheduler.OperatorFailure;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls events from one {@link SourceConnector} on a dedicated thread and
 * hands them to the {@link IngestionBoundary}.
 * <p>
 * After ending an epoch the driver waits until the engine opens the next one,
 * so a fast source cannot run ahead of slower ones. A schema violation stops
 * this source only; any other error fails the dataflow.
 */
public final class SourceDriver implements Runnable {
    private static final Logger log = Logger.getLogger(SourceDriver.class.getName());

    private final String sourceId;
    private final SourceConnector connector;
    private final RetryPolicy retry;
    private final IngestionBoundary boundary;
    private final EpochCounter counter;
    private final FailureMonitor failures;

    private volatile Thread thread;

    public SourceDriver(String sourceId, SourceConnector connector, RetryPolicy defaultRetry,
                        IngestionBoundary boundary, EpochCounter counter, FailureMonitor failures) {
        this.sourceId = sourceId;
        this.connector = connector;
        this.retry = connector.retryPolicy().orElse(defaultRetry);
        this.boundary = boundary;
        this.counter = counter;
        this.failures = failures;
    }

    public synchronized void start() {
        if (thread != null) throw new IllegalStateException("already started");
        Thread t = new Thread(this, "deltaflow-source-" + sourceId);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /** Interrupt the driver and wait for it to exit. */
    public void stop(long timeoutMillis) throws InterruptedException {
        Thread t = thread;
        if (t == null || t == Thread.currentThread()) return;
        t.interrupt();
        t.join(timeoutMillis);
        if (t.isAlive()) log.log(Level.WARNING, "Source driver {0} did not stop in time", sourceId);
    }

    @Override
    public void run() {
        Schema schema = connector.schema().orElse(null);
        long epoch = -1;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                SourceEvent event = retry.execute("source " + sourceId, connector::next);
                if (event instanceof SourceEvent.Data d) {
                    if (schema != null) {
                        for (Update u : d.updates()) schema.validate(sourceId, u);
                    }
                    epoch = boundary.ingest(sourceId, d.updates());
                } else if (event instanceof SourceEvent.EndOfEpoch) {
                    epoch = boundary.endEpoch(sourceId);
                    counter.awaitEpochAfter(epoch);
                } else {
                    log.log(Level.INFO, "Source {0} reached end of stream", sourceId);
                    boundary.finish(sourceId);
                    return;
                }
            }
        } catch (SchemaException e) {
            log.log(Level.WARNING, "Stopping source " + sourceId + " after schema violation", e);
            finishQuietly();
        } catch (EngineClosedException e) {
            log.log(Level.FINE, "Source {0} stopped: {1}", new Object[]{sourceId, e.getMessage()});
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failures.report(new OperatorFailure(sourceId, 0, Math.max(epoch, counter.current()), e));
        } finally {
            closeConnector();
        }
    }

    private void finishQuietly() {
        try {
            boundary.finish(sourceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeConnector() {
        try {
            connector.close();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to close source " + sourceId, e);
        }
    }
}
