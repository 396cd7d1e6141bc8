package io.deltaflow.engine.scheduler;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Wake-up signal of one worker: producers signal after every put, the worker
 * waits when none of its readable inputs has a message.
 */
final class Mailbox {
    private final Semaphore signals = new Semaphore(0);

    void signal() {
        signals.release();
    }

    /** Wait for a signal (or the timeout), then forget any others already pending. */
    void await(long timeoutMillis) throws InterruptedException {
        if (signals.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS)) {
            signals.drainPermits();
        }
    }
}
