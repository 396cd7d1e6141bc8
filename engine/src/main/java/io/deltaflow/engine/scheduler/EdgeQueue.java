package io.deltaflow.engine.scheduler;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between one producer instance and one consumer instance.
 * A full queue blocks the producer: backpressure, never a dropped batch.
 */
final class EdgeQueue {
    private final String name;
    private final BlockingQueue<Message> queue;
    private final Mailbox consumer;

    EdgeQueue(String name, int capacity, Mailbox consumer) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumer = consumer;
    }

    void put(Message m) throws InterruptedException {
        queue.put(m);
        consumer.signal();
    }

    /** Put unless the queue stays full for {@code timeoutMillis}. */
    boolean offer(Message m, long timeoutMillis) throws InterruptedException {
        if (!queue.offer(m, timeoutMillis, TimeUnit.MILLISECONDS)) return false;
        consumer.signal();
        return true;
    }

    Message poll() {
        return queue.poll();
    }

    int size() {
        return queue.size();
    }

    @Override
    public String toString() {
        return name;
    }
}
