package io.deltaflow.engine.connector;

import io.deltaflow.core.ConnectorException;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded exponential backoff for transient connector failures.
 * Non-transient {@link ConnectorException}s and other exceptions are not retried.
 */
public final class RetryPolicy {
    private static final Logger log = Logger.getLogger(RetryPolicy.class.getName());

    /** An action that may block. */
    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("need 0 <= initialBackoff <= maxBackoff");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Run {@code attempt}, retrying transient failures.
     *
     * @throws ConnectorException the last failure once attempts are exhausted
     */
    public <T> T execute(String what, Attempt<T> attempt) throws InterruptedException {
        long backoff = initialBackoff.toMillis();
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (ConnectorException e) {
                if (!e.isTransient() || i >= maxAttempts) throw e;
                log.log(Level.WARNING, "Transient failure in " + what + " (attempt " + i + "/" + maxAttempts
                        + "), retrying in " + backoff + "ms", e);
                Thread.sleep(backoff);
                backoff = Math.min(Math.max(1, backoff * 2), maxBackoff.toMillis());
            }
        }
    }
}
