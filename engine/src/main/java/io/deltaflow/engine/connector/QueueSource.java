package io.deltaflow.engine.connector;

import io.deltaflow.core.Value;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-memory source fed by the embedding application (and by tests).
 * Producers call {@link #push}, {@link #endEpoch()} and {@link #finish()};
 * the engine drains the events in order.
 */
public final class QueueSource implements SourceConnector {
    private final BlockingQueue<SourceEvent> events = new LinkedBlockingQueue<>();
    private final Schema schema;

    public QueueSource() {
        this(null);
    }

    public QueueSource(Schema schema) {
        this.schema = schema;
    }

    public QueueSource push(Update... updates) {
        events.add(new SourceEvent.Data(Arrays.asList(updates)));
        return this;
    }

    public QueueSource insert(String key, Value value) {
        return push(Update.insert(key, value));
    }

    public QueueSource retract(String key, Value value) {
        return push(Update.retract(key, value));
    }

    public QueueSource endEpoch() {
        events.add(new SourceEvent.EndOfEpoch());
        return this;
    }

    public QueueSource finish() {
        events.add(new SourceEvent.EndOfStream());
        return this;
    }

    @Override
    public SourceEvent next() throws InterruptedException {
        return events.take();
    }

    @Override
    public Optional<Schema> schema() {
        return Optional.ofNullable(schema);
    }
}
