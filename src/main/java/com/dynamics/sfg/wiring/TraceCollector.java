package com.dynamics.sfg.wiring;

import com.dynamics.sfg.engine.RunBuffer;
import com.lmax.disruptor.EventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that gathers the outcomes of a batch on the single
 * consumer thread.
 *
 * Outcomes arrive in completion order and are slotted by repetition index, so
 * the assembled result is independent of scheduling. {@link #await()} returns
 * once every repetition of the batch reported exactly one outcome; the latch
 * also publishes the collected state to the waiting thread.
 */
public final class TraceCollector implements EventHandler<RepetitionEvent> {
    private static final Logger log = LogManager.getLogger(TraceCollector.class);

    private final RunBuffer[] buffers;
    private final Throwable[] errors;
    private final boolean[] cancelled;
    private final CountDownLatch remaining;

    public TraceCollector(int repetitions) {
        this.buffers = new RunBuffer[repetitions];
        this.errors = new Throwable[repetitions];
        this.cancelled = new boolean[repetitions];
        this.remaining = new CountDownLatch(repetitions);
    }

    @Override
    public void onEvent(RepetitionEvent event, long sequence, boolean endOfBatch) {
        final int rep = event.repetition();
        if (rep < 0 || rep >= buffers.length) {
            log.error("Received outcome for invalid repetition: {} (max={})", rep, buffers.length - 1);
            event.clear();
            return;
        }
        switch (event.outcome()) {
            case COMPLETED -> buffers[rep] = event.buffer();
            case FAILED -> errors[rep] = event.error();
            case CANCELLED -> cancelled[rep] = true;
        }
        event.clear();
        remaining.countDown();
    }

    public void await() throws InterruptedException {
        remaining.await();
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return remaining.await(timeout, unit);
    }

    /** Completed buffers in repetition order. */
    public List<RunBuffer> completed() {
        List<RunBuffer> out = new ArrayList<>();
        for (RunBuffer b : buffers)
            if (b != null)
                out.add(b);
        return out;
    }

    /** Failures in repetition order. */
    public List<Throwable> failures() {
        List<Throwable> out = new ArrayList<>();
        for (Throwable t : errors)
            if (t != null)
                out.add(t);
        return out;
    }

    public int cancelledCount() {
        int n = 0;
        for (boolean c : cancelled)
            if (c)
                n++;
        return n;
    }
}
