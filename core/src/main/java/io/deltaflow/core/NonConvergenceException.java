package io.deltaflow.core;

/** A fixpoint scope hit its iteration bound without reaching an empty delta. */
public class NonConvergenceException extends DataflowException {
    private final int iterations;

    public NonConvergenceException(String operatorId, long epoch, int iterations) {
        super("iteration did not converge within " + iterations + " rounds", operatorId, epoch, null);
        this.iterations = iterations;
    }

    public int iterations() { return iterations; }
}
