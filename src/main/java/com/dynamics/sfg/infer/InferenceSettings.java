package com.dynamics.sfg.infer;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Settings of one inference run. An unset {@code steps} falls back to the
 * model default; a {@code timeoutMillis} of 0 waits indefinitely.
 */
@Data
@Accessors(chain = true)
public final class InferenceSettings {
    private Integer steps;
    private int draws = 2000;
    private long seed = 42L;
    private double minEffectiveSampleSize = 10;
    private long timeoutMillis;
    /** Draws evaluated between two cancellation checks. */
    private int chunkSize = 256;

    public static InferenceSettings defaults() {
        return new InferenceSettings();
    }
}
