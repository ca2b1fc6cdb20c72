package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.SimulationException;

/**
 * A repetition dropped under {@link BatchFailurePolicy#SKIP}. Carries the
 * same context as the {@link SimulationException} that ended it, so it can be
 * replayed with the same seed.
 */
public record RepetitionFailure(int repetition, String reference, int step, String message) {

    public static RepetitionFailure of(SimulationException e) {
        return new RepetitionFailure(e.repetition(), e.reference(), e.step(), e.getCause().getMessage());
    }
}
