package com.dynamics.sfg.infer;

import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.infer.InferenceException.Reason;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import lombok.extern.log4j.Log4j2;

/**
 * Hands a compiled model to an {@link InferenceEngine} on a worker thread and
 * post-processes the draws into a {@link Trace}.
 *
 * Prior-only runs skip the engine: the prior draws are the sample.
 */
@Log4j2
public final class InferenceRunner implements AutoCloseable {
    private final InferenceEngine engine;
    private final ExecutorService executor = Executors.newCachedThreadPool(DaemonThreadFactory.INSTANCE);

    public InferenceRunner() {
        this(new ImportanceSamplingEngine());
    }

    public InferenceRunner(InferenceEngine engine) {
        this.engine = engine;
    }

    public InferenceHandle submit(ForwardModel model, boolean priorOnly, InferenceSettings settings) {
        if (settings.getDraws() < 1)
            throw new IllegalArgumentException("draws must be >= 1, got " + settings.getDraws());
        log.info("Inference on {}: {} free variables, {} observations, {} draws{}", model.model().name(),
                model.freeVariables().size(), model.observations().size(), settings.getDraws(),
                priorOnly ? " (prior only)" : "");
        return new InferenceHandle(executor.submit(() -> run(model, priorOnly, settings)),
                settings.getTimeoutMillis());
    }

    /** Submits and waits. */
    public Trace infer(ForwardModel model, boolean priorOnly, InferenceSettings settings) {
        return submit(model, priorOnly, settings).await();
    }

    private Trace run(ForwardModel model, boolean priorOnly, InferenceSettings settings) {
        long start = System.nanoTime();
        SampleSet samples = priorOnly
                ? new SampleSet(settings.getDraws(), model.samplePrior(settings.getDraws(),
                        new Random(settings.getSeed())), Map.of("draws", settings.getDraws()))
                : engine.sample(model, settings);
        if (Thread.currentThread().isInterrupted())
            throw new InferenceException(Reason.CANCELLED, "interrupted before the trace was built",
                    samples.diagnostics());
        Trace trace = model.trace(samples, priorOnly ? Trace.Provenance.PRIOR : Trace.Provenance.POSTERIOR);
        log.info("Inference on {} finished in {} ms", model.model().name(), (System.nanoTime() - start) / 1_000_000);
        return trace;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
