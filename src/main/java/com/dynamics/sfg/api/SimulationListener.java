package com.dynamics.sfg.api;

/**
 * Observability interface for monitoring simulation runs.
 *
 * Implementations can be registered with the batch runner to receive callbacks
 * for every repetition. Callbacks for different repetitions may arrive from
 * different worker threads, so implementations must be thread-safe.
 *
 * These callbacks run inside the stepping loop of a repetition. Keep them
 * lightweight: blocking I/O here slows every repetition down.
 */
public interface SimulationListener {

    /**
     * Called before the first step of a repetition.
     *
     * @param repetition Index of the repetition (0-based).
     * @param steps      Last time step of the run (the run covers 0..steps).
     */
    void onRunStart(int repetition, int steps);

    /**
     * Called when a reference fails to evaluate. The repetition is discarded
     * right after this callback.
     *
     * @param repetition Index of the failing repetition.
     * @param step       Time step at which the failure happened.
     * @param reference  Qualified name of the failing reference.
     * @param error      The failure.
     */
    void onReferenceError(int repetition, int step, String reference, Throwable error);

    /**
     * Called after a repetition completed every step and all metrics.
     *
     * @param repetition    Index of the repetition.
     * @param durationNanos Wall time spent on the repetition.
     */
    void onRunEnd(int repetition, long durationNanos);
}
