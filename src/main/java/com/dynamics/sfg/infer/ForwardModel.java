package com.dynamics.sfg.infer;

import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.engine.EvaluationOrder;
import com.dynamics.sfg.engine.RepetitionFailure;
import com.dynamics.sfg.engine.Stepper;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * A compiled model: maps draws of the free variables to the recorded series,
 * metrics and log-likelihood of the observations.
 *
 * A whole batch of draws is evaluated in one pass of the stepping recurrence.
 * Each draw plays the part of one repetition: a numeric failure ends only its
 * own draw, which then has no likelihood and is left out of traces. Failures
 * that do not depend on the draws (a series index out of range) still fail the
 * pass with a {@link SimulationException} whose repetition is -1.
 */
public final class ForwardModel {
    /** Repetition index reported for failures of a compiled pass. */
    public static final int ENSEMBLE = -1;

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2 * Math.PI);

    private final Model model;
    private final EvaluationOrder order;
    private final List<Observation> observations;
    private final int steps;
    private final Map<String, Reference> free = new LinkedHashMap<>();

    ForwardModel(Model model, EvaluationOrder order, List<Observation> observations, int steps) {
        this.model = model;
        this.order = order;
        this.observations = List.copyOf(observations);
        this.steps = steps;
        for (int i = 0; i < order.size(); i++)
            if (order.ref(i).prior() != null)
                free.put(order.name(i), order.ref(i));
    }

    public Model model() {
        return model;
    }

    public EvaluationOrder order() {
        return order;
    }

    public int steps() {
        return steps;
    }

    public List<Observation> observations() {
        return observations;
    }

    /** Qualified names of the random variables (prior-backed variables). */
    public List<String> freeVariables() {
        return Collections.unmodifiableList(new ArrayList<>(free.keySet()));
    }

    public Distribution prior(String name) {
        return reference(name).prior();
    }

    public int dim(String name) {
        return reference(name).dim();
    }

    private Reference reference(String name) {
        Reference r = free.get(name);
        if (r == null)
            throw new IllegalArgumentException("Not a free variable: " + name);
        return r;
    }

    /** Draws {@code count} independent samples from the priors. */
    public Map<String, double[][]> samplePrior(int count, Random random) {
        Map<String, double[][]> out = new LinkedHashMap<>();
        for (var e : free.entrySet()) {
            Reference r = e.getValue();
            double[][] d = new double[count][];
            for (int k = 0; k < count; k++)
                d[k] = r.prior().sample(random, r.dim());
            out.put(e.getKey(), d);
        }
        return out;
    }

    /** The recorded output of one pass and the draws that failed in it. */
    public static final class Pass {
        private final Stepper.Run<Ensemble> run;
        private final EnsembleAlgebra algebra;

        Pass(Stepper.Run<Ensemble> run, EnsembleAlgebra algebra) {
            this.run = run;
            this.algebra = algebra;
        }

        public Stepper.Run<Ensemble> run() {
            return run;
        }

        public int count() {
            return algebra.draws();
        }

        public boolean failed(int draw) {
            return algebra.failed(draw);
        }

        /** The failure that ended {@code draw}, or null. */
        public SimulationException failure(int draw) {
            return algebra.failure(draw);
        }

        public int failureCount() {
            return algebra.failureCount();
        }
    }

    /**
     * Runs the recurrence for {@code count} draws at once.
     *
     * @param draws {@code [draw][element]} per free variable.
     */
    public Pass run(Map<String, double[][]> draws, int count) {
        Map<Reference, Ensemble> values = new IdentityHashMap<>();
        for (var e : free.entrySet()) {
            double[][] d = draws.get(e.getKey());
            if (d == null || d.length != count)
                throw new IllegalArgumentException("Need " + count + " draws of " + e.getKey());
            values.put(e.getValue(), Ensemble.of(d));
        }
        EnsembleAlgebra algebra = new EnsembleAlgebra(count);
        var run = new Stepper<>(order, algebra).run(steps, ENSEMBLE, values::get, null);
        return new Pass(run, algebra);
    }

    /** Log-likelihood of the observations for every draw of a pass; failed draws get -inf. */
    public double[] logLikelihood(Pass pass) {
        int count = pass.count();
        double[] ll = new double[count];
        for (int d = 0; d < count; d++)
            if (pass.failed(d))
                ll[d] = Double.NEGATIVE_INFINITY;
        for (Observation obs : observations) {
            Ensemble m = pass.run().metric(order.index(obs.metric()));
            double sigma = obs.sigma();
            List<Double> data = obs.data();
            for (int d = 0; d < count; d++) {
                if (pass.failed(d))
                    continue;
                for (int j = 0; j < data.size(); j++) {
                    double mu = m.get(d, m.dim() == 1 ? 0 : j);
                    double z = (data.get(j) - mu) / sigma;
                    ll[d] += Double.isFinite(mu)
                            ? -0.5 * z * z - Math.log(sigma) - LOG_SQRT_2PI
                            : Double.NEGATIVE_INFINITY;
                }
            }
        }
        return ll;
    }

    /**
     * Re-runs the model on the sampled draws and keys the result like a
     * simulation trace, one draw per sample. Failed draws are left out and
     * listed as failures under their sample index, like skipped repetitions.
     */
    public Trace trace(SampleSet samples, Trace.Provenance provenance) {
        Pass pass = run(samples.draws(), samples.count());
        Stepper.Run<Ensemble> run = pass.run();
        List<Integer> kept = new ArrayList<>(samples.count());
        List<RepetitionFailure> failures = new ArrayList<>();
        for (int d = 0; d < samples.count(); d++) {
            if (pass.failed(d))
                failures.add(RepetitionFailure.of(pass.failure(d)));
            else
                kept.add(d);
        }
        int count = kept.size();
        Map<String, double[][][]> series = new LinkedHashMap<>();
        Map<String, double[][]> metrics = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            if (order.isRecorded(i)) {
                double[][][] s = new double[count][steps + 1][];
                for (int t = 0; t <= steps; t++) {
                    Ensemble e = run.value(i, t);
                    for (int k = 0; k < count; k++)
                        s[k][t] = e.draw(kept.get(k));
                }
                series.put(order.name(i), s);
            } else if (order.isMetric(i)) {
                Ensemble e = run.metric(i);
                double[][] m = new double[count][];
                for (int k = 0; k < count; k++)
                    m[k] = e.draw(kept.get(k));
                metrics.put(order.name(i), m);
            }
        }
        return new Trace(provenance, steps, count, series, metrics, failures);
    }
}
