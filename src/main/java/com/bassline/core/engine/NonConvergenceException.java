package com.bassline.core.engine;

/**
 * A propagation pass exceeded its step budget. The pass was rolled back; no
 * contact keeps a value written during it.
 */
public class NonConvergenceException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int steps;

    public NonConvergenceException(long epoch, int steps) {
        super("Propagation pass " + epoch + " did not converge within " + steps + " steps");
        this.steps = steps;
    }

    public int steps() {
        return steps;
    }
}
