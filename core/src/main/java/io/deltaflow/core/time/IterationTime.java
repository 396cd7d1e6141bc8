package io.deltaflow.core.time;

/**
 * Timestamp inside a fixpoint scope: the outer epoch plus the iteration round.
 * Ordered lexicographically, so every round of epoch e sorts before epoch e + 1.
 */
public record IterationTime(long epoch, int iteration) implements Comparable<IterationTime> {

    public IterationTime {
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0");
        if (iteration < 0) throw new IllegalArgumentException("iteration must be >= 0");
    }

    public static IterationTime start(long epoch) {
        return new IterationTime(epoch, 0);
    }

    public IterationTime next() {
        return new IterationTime(epoch, iteration + 1);
    }

    @Override
    public int compareTo(IterationTime o) {
        int c = Long.compare(epoch, o.epoch);
        return c != 0 ? c : Integer.compare(iteration, o.iteration);
    }

    @Override
    public String toString() {
        return epoch + "." + iteration;
    }
}
