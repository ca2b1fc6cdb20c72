package com.dynamics.sfg.util;

import com.dynamics.sfg.api.SimulationListener;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that tracks per-repetition wall time.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average time per repetition.</li>
 * <li><b>Throughput:</b> completed and failed repetitions.</li>
 * </ul>
 *
 * Safe to share between the worker threads of a batch.
 */
public final class RunTimingListener implements SimulationListener {
    private static final Logger log = LogManager.getLogger(RunTimingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();
    private final LongAccumulator minNanos = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxNanos = new LongAccumulator(Math::max, Long.MIN_VALUE);

    @Override
    public void onRunStart(int repetition, int steps) {
        // Timing comes with onRunEnd
    }

    @Override
    public void onReferenceError(int repetition, int step, String reference, Throwable error) {
        failed.incrementAndGet();
        errLimiter.warn(String.format("Repetition %d failed at '%s' (t=%d): %s",
                repetition, reference, step, error.getMessage()));
    }

    @Override
    public void onRunEnd(int repetition, long durationNanos) {
        completed.incrementAndGet();
        totalNanos.addAndGet(durationNanos);
        minNanos.accumulate(durationNanos);
        maxNanos.accumulate(durationNanos);
    }

    public long completedRuns() {
        return completed.get();
    }

    public long failedRuns() {
        return failed.get();
    }

    public double avgLatencyNanos() {
        long n = completed.get();
        return n > 0 ? (double) totalNanos.get() / n : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        long v = minNanos.get();
        return v == Long.MAX_VALUE ? 0 : v;
    }

    public long maxLatencyNanos() {
        long v = maxNanos.get();
        return v == Long.MIN_VALUE ? 0 : v;
    }

    public void reset() {
        completed.set(0);
        failed.set(0);
        totalNanos.set(0);
        minNanos.reset();
        maxNanos.reset();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f\n",
                "Repetitions",
                completedRuns(),
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |\n", "Failed", failedRuns()));
        return sb.toString();
    }
}
