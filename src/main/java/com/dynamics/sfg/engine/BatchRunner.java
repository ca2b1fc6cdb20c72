package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.api.SimulationListener;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.util.CompositeSimulationListener;
import com.dynamics.sfg.util.ErrorRateLimiter;
import com.dynamics.sfg.wiring.RepetitionEvent;
import com.dynamics.sfg.wiring.RepetitionPublisher;
import com.dynamics.sfg.wiring.TraceCollector;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the repetitions of a simulation batch.
 *
 * Repetitions are independent: each owns its buffers and a random source
 * derived from {@code (seed, repetition)}. They run on a fixed worker pool and
 * hand their outcome to a single {@link TraceCollector} through an LMAX
 * Disruptor ring buffer. Only completed repetitions ever reach the trace.
 *
 * Failure handling follows {@link RunSettings#getFailurePolicy()}: under ABORT
 * no new repetition starts after the first failure and the failure with the
 * lowest repetition index is rethrown; under SKIP failed repetitions are
 * dropped and listed in {@link Trace#failures()}.
 */
public final class BatchRunner {
    private static final Logger log = LogManager.getLogger(BatchRunner.class);
    private static final int RING_BUFFER_SIZE = 1024;

    private final ErrorRateLimiter skipLimiter = new ErrorRateLimiter(log, 1000);
    private final CompositeSimulationListener listeners = new CompositeSimulationListener();

    public BatchRunner addListener(SimulationListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * @throws com.dynamics.sfg.api.ModelDefinitionException before any
     *                                                       repetition runs.
     * @throws SimulationException                           under ABORT, for
     *                                                       the first failed
     *                                                       repetition.
     */
    public Trace run(Model model, RunSettings settings) {
        final int steps = settings.getSteps() != null ? settings.getSteps() : model.steps();
        final int repetitions = settings.getRepetitions() != null ? settings.getRepetitions() : model.repetitions();
        if (repetitions < 1)
            throw new IllegalArgumentException("repetitions must be >= 1, got " + repetitions);
        if (settings.getThreads() < 1)
            throw new IllegalArgumentException("threads must be >= 1, got " + settings.getThreads());
        final BatchFailurePolicy policy = settings.getFailurePolicy();
        final SimulationListener listener = listeners.isEmpty() ? null : listeners;

        SimulationEngine engine = new SimulationEngine(model);
        log.info("Simulating {}: steps={}, n={}, threads={}, policy={}", model.name(), steps, repetitions,
                settings.getThreads(), policy);
        long start = System.nanoTime();

        Disruptor<RepetitionEvent> disruptor = new Disruptor<>(
                RepetitionEvent::new,
                RING_BUFFER_SIZE,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        TraceCollector collector = new TraceCollector(repetitions);
        disruptor.handleEventsWith(collector);
        RingBuffer<RepetitionEvent> ringBuffer = disruptor.start();
        RepetitionPublisher publisher = new RepetitionPublisher(ringBuffer);

        ExecutorService pool = Executors.newFixedThreadPool(settings.getThreads(), DaemonThreadFactory.INSTANCE);
        AtomicBoolean aborted = new AtomicBoolean();
        try {
            for (int rep = 0; rep < repetitions; rep++) {
                final int r = rep;
                pool.execute(() -> runRepetition(engine, steps, r, settings.getSeed(), policy, listener,
                        aborted, publisher));
            }
            collector.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new CancellationException("Simulation of " + model.name() + " interrupted");
        } finally {
            pool.shutdown();
            disruptor.shutdown();
        }

        List<RepetitionFailure> failures = new ArrayList<>();
        for (Throwable error : collector.failures()) {
            if (!(error instanceof SimulationException se))
                throw error instanceof RuntimeException re ? re : new IllegalStateException(error);
            if (policy == BatchFailurePolicy.ABORT)
                throw se;
            failures.add(RepetitionFailure.of(se));
        }

        List<RunBuffer> completed = collector.completed();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (failures.isEmpty())
            log.info("Simulated {}: {} repetitions in {} ms", model.name(), completed.size(), elapsedMs);
        else
            log.warn("Simulated {}: {} repetitions in {} ms, {} skipped", model.name(), completed.size(),
                    elapsedMs, failures.size());
        return Trace.of(engine.order(), Trace.Provenance.SIMULATION, steps, completed, failures);
    }

    private void runRepetition(SimulationEngine engine, int steps, int rep, long seed, BatchFailurePolicy policy,
            SimulationListener listener, AtomicBoolean aborted, RepetitionPublisher publisher) {
        if (aborted.get()) {
            publisher.publishCancelled(rep);
            return;
        }
        try {
            publisher.publishCompleted(engine.runOnce(steps, rep, SimulationEngine.random(seed, rep), listener));
        } catch (SimulationException e) {
            if (policy == BatchFailurePolicy.ABORT)
                aborted.set(true);
            else
                skipLimiter.warn("Skipping repetition " + rep + ": " + e.getMessage());
            publisher.publishFailed(rep, e);
        } catch (RuntimeException | Error e) {
            aborted.set(true);
            log.error("Repetition {} failed unexpectedly", rep, e);
            publisher.publishFailed(rep, e);
        }
    }
}
