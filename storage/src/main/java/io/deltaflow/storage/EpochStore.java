package io.deltaflow.storage;

import java.util.function.UnaryOperator;

/**
 * Durable home of {@link EpochMetadata}.
 * Updates are read-modify-write and must be durable when {@link #update} returns.
 */
public interface EpochStore {

    /** Current metadata, {@link EpochMetadata#INITIAL} if nothing was stored yet. */
    EpochMetadata load();

    /** Apply {@code change} to the current metadata, persist and return the result. */
    EpochMetadata update(UnaryOperator<EpochMetadata> change);
}
