package io.deltaflow.engine.connector;

import java.util.List;

/** What a source hands to the engine on each {@link SourceConnector#next()}. */
public sealed interface SourceEvent permits SourceEvent.Data, SourceEvent.EndOfEpoch, SourceEvent.EndOfStream {

    /** Updates belonging to the source's current epoch. */
    record Data(List<Update> updates) implements SourceEvent {
        public Data {
            updates = List.copyOf(updates);
        }
    }

    /** The source has nothing more for the current epoch. */
    record EndOfEpoch() implements SourceEvent {}

    /** The source is exhausted; it no longer holds epochs open. */
    record EndOfStream() implements SourceEvent {}
}
