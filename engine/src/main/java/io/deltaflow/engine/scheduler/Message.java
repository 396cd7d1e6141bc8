package io.deltaflow.engine.scheduler;

import io.deltaflow.core.DeltaBatch;

/** What travels on an edge: data of the current epoch, or the end of that epoch. */
public sealed interface Message permits Message.Data, Message.EpochEnd {

    record Data(DeltaBatch batch) implements Message {}

    /** The producer instance will send nothing more for {@code epoch}. */
    record EpochEnd(long epoch) implements Message {}
}
