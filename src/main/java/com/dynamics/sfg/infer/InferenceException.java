package com.dynamics.sfg.infer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A failure of probabilistic inference, distinct from the numeric errors of
 * a single simulation run.
 *
 * Carries the diagnostic state the engine had when it failed (e.g. effective
 * sample size, number of finite weights). Inference never returns an empty or
 * partial trace in place of this exception.
 */
public class InferenceException extends RuntimeException {

    public enum Reason {
        /** No draw has a finite likelihood. */
        DIVERGED,
        /** The weighted sample is too degenerate to represent the posterior. */
        NOT_CONVERGED,
        /** An observation does not fit the model. */
        MALFORMED_OBSERVATION,
        CANCELLED,
        TIMEOUT
    }

    private final Reason reason;
    private final Map<String, Object> diagnostics;

    public InferenceException(Reason reason, String message) {
        this(reason, message, Map.of(), null);
    }

    public InferenceException(Reason reason, String message, Map<String, ?> diagnostics) {
        this(reason, message, diagnostics, null);
    }

    public InferenceException(Reason reason, String message, Map<String, ?> diagnostics, Throwable cause) {
        super(reason + ": " + message + (diagnostics.isEmpty() ? "" : " " + diagnostics), cause);
        this.reason = reason;
        this.diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public Reason reason() {
        return reason;
    }

    public Map<String, Object> diagnostics() {
        return diagnostics;
    }
}
