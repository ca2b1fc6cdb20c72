package com.dynamics.sfg.wiring;

import com.dynamics.sfg.engine.RunBuffer;

/**
 * A mutable holder for the outcome of one repetition, used within the LMAX
 * Disruptor RingBuffer.
 *
 * Instances are pre-allocated by the ring buffer and reused; the collector
 * clears an event after copying its payload so finished buffers are not
 * retained by the ring.
 */
public final class RepetitionEvent {

    public enum Outcome {
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private Outcome outcome;
    private int repetition = -1;
    private RunBuffer buffer;
    private Throwable error;

    public void setCompleted(RunBuffer buffer) {
        this.outcome = Outcome.COMPLETED;
        this.repetition = buffer.repetition();
        this.buffer = buffer;
        this.error = null;
    }

    public void setFailed(int repetition, Throwable error) {
        this.outcome = Outcome.FAILED;
        this.repetition = repetition;
        this.buffer = null;
        this.error = error;
    }

    /** The repetition was never started because the batch was aborted. */
    public void setCancelled(int repetition) {
        this.outcome = Outcome.CANCELLED;
        this.repetition = repetition;
        this.buffer = null;
        this.error = null;
    }

    public Outcome outcome() {
        return outcome;
    }

    public int repetition() {
        return repetition;
    }

    public RunBuffer buffer() {
        return buffer;
    }

    public Throwable error() {
        return error;
    }

    public void clear() {
        outcome = null;
        repetition = -1;
        buffer = null;
        error = null;
    }
}
