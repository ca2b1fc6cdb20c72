package com.dynamics.sfg.infer;

import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.infer.InferenceException.Reason;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A running inference. Yields either the complete trace or an
 * {@link InferenceException}; a cancelled or timed-out run never yields a
 * partial trace.
 */
public final class InferenceHandle {
    private final Future<Trace> future;
    private final long timeoutMillis;

    InferenceHandle(Future<Trace> future, long timeoutMillis) {
        this.future = future;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Waits for the result, up to the configured timeout.
     *
     * @throws InferenceException on engine failure, cancellation or timeout.
     */
    public Trace await() {
        try {
            return timeoutMillis > 0 ? future.get(timeoutMillis, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new InferenceException(Reason.TIMEOUT, "no result within " + timeoutMillis + " ms",
                    Map.of("timeoutMillis", timeoutMillis), e);
        } catch (CancellationException e) {
            throw new InferenceException(Reason.CANCELLED, "inference was cancelled", Map.of(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new InferenceException(Reason.CANCELLED, "interrupted while waiting", Map.of(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException("Inference failed", cause);
        }
    }

    /** Requests cancellation; {@link #await()} then raises CANCELLED. */
    public boolean cancel() {
        return future.cancel(true);
    }

    public boolean isDone() {
        return future.isDone();
    }
}
