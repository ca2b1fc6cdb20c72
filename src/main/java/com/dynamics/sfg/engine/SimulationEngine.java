package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.api.SimulationListener;
import com.dynamics.sfg.node.Model;

import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Discrete-time simulation of one model over concrete numbers.
 *
 * The evaluation order is resolved once, at construction, so definition errors
 * surface before the first repetition. A single engine may run repetitions
 * from several threads at once: every repetition owns its buffers and its
 * random source, and the model is only read.
 *
 * Precondition: the model's equations, priors and wiring are not changed while
 * a run is in flight. A change made between runs is detected through the
 * model revision and rejected; build a new engine instead.
 */
public final class SimulationEngine {
    private static final Logger log = LogManager.getLogger(SimulationEngine.class);

    private final Model model;
    private final long revision;
    private final Stepper<double[]> stepper;

    public SimulationEngine(Model model) {
        this.model = model;
        this.revision = model.revision();
        this.stepper = new Stepper<>(DependencyResolver.resolve(model), ArrayAlgebra.INSTANCE);
    }

    public Model model() {
        return model;
    }

    public EvaluationOrder order() {
        return stepper.order();
    }

    /** True when the model was changed after this engine resolved it. */
    public boolean isStale() {
        return model.revision() != revision;
    }

    /**
     * Runs one repetition.
     *
     * @param random   source for the prior draws of this repetition.
     * @param listener may be null.
     * @throws SimulationException on a numeric failure; nothing of the
     *                             repetition is kept.
     */
    public RunBuffer runOnce(int steps, int repetition, Random random, SimulationListener listener) {
        if (isStale())
            throw new IllegalStateException("Model " + model.name() + " changed since this engine was built");
        var run = stepper.run(steps, repetition, ref -> ref.prior().sample(random, ref.dim()), listener);
        if (log.isTraceEnabled())
            log.trace("Repetition {} of {} finished ({} steps)", repetition, model.name(), steps);
        return RunBuffer.of(repetition, run);
    }

    /** Convenience single deterministic run (repetition 0, seed 42). */
    public Trace simulate(int steps) {
        RunBuffer run = runOnce(steps, 0, random(42L, 0), null);
        return Trace.of(order(), Trace.Provenance.SIMULATION, steps, List.of(run), List.of());
    }

    /**
     * Random source of one repetition. Depends only on the batch seed and the
     * repetition index, so results do not depend on thread scheduling.
     *
     * {@link Random} seeded with neighbouring values starts with nearly equal
     * outputs, so the pair is run through the SplitMix64 finalizer first.
     */
    public static Random random(long seed, int repetition) {
        return new Random(mix(seed + (repetition + 1L) * 0x9E3779B97F4A7C15L));
    }

    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
