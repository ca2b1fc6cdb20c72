package com.dynamics.sfg.api;

/**
 * A runtime numeric failure inside one repetition of a run.
 *
 * Carries the qualified name of the reference being evaluated, the time step
 * and the repetition index so the failure can be reproduced from the same model
 * and seed. A repetition that raises this exception is discarded as a whole.
 */
public class SimulationException extends RuntimeException {
    private final String reference;
    private final int step;
    private final int repetition;

    public SimulationException(String reference, int step, int repetition, Throwable cause) {
        super(String.format("Evaluation of '%s' failed at t=%d (repetition %d): %s",
                reference, step, repetition, cause.getMessage()), cause);
        this.reference = reference;
        this.step = step;
        this.repetition = repetition;
    }

    public String reference() {
        return reference;
    }

    public int step() {
        return step;
    }

    public int repetition() {
        return repetition;
    }
}
