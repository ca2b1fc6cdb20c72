package com.dynamics.sfg.engine;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Settings of one simulation batch. Unset {@code steps} and
 * {@code repetitions} fall back to the defaults stored on the model.
 */
@Data
@Accessors(chain = true)
public final class RunSettings {
    private Integer steps;
    private Integer repetitions;
    private long seed = 42L;
    private int threads = 1;
    private BatchFailurePolicy failurePolicy = BatchFailurePolicy.ABORT;

    public static RunSettings defaults() {
        return new RunSettings();
    }
}
