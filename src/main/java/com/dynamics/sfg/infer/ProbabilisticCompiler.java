package com.dynamics.sfg.infer;

import com.dynamics.sfg.engine.DependencyResolver;
import com.dynamics.sfg.engine.EvaluationOrder;
import com.dynamics.sfg.infer.InferenceException.Reason;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;

import java.util.List;
import java.util.Map;

/**
 * Re-expresses a model as a probabilistic forward model.
 *
 * Uses the same dependency resolution and the same stepping recurrence as the
 * simulation engine; only the value semantics change. Every prior becomes a
 * random variable represented by its draws, every other reference a
 * deterministic transform of them.
 */
public final class ProbabilisticCompiler {
    private ProbabilisticCompiler() {
        // Utility class
    }

    /**
     * @throws com.dynamics.sfg.api.ModelDefinitionException for an invalid model.
     * @throws InferenceException                            with reason
     *                                                       MALFORMED_OBSERVATION
     *                                                       for an observation
     *                                                       that does not fit.
     */
    public static ForwardModel compile(Model model, List<Observation> observations, int steps) {
        if (steps < 0)
            throw new IllegalArgumentException("steps must be >= 0, got " + steps);
        EvaluationOrder order = DependencyResolver.resolve(model);
        for (Observation obs : observations)
            check(order, obs);
        return new ForwardModel(model, order, observations, steps);
    }

    public static ForwardModel compile(Model model, List<Observation> observations) {
        return compile(model, observations, model.steps());
    }

    private static void check(EvaluationOrder order, Observation obs) {
        int i;
        try {
            i = order.index(obs.metric());
        } catch (IllegalArgumentException e) {
            throw malformed(obs, "unknown reference");
        }
        if (order.kind(i) != RefKind.METRIC)
            throw malformed(obs, "observations attach to metrics, not to a " + order.kind(i));
        if (!(obs.sigma() > 0) || Double.isInfinite(obs.sigma()))
            throw malformed(obs, "sigma must be positive and finite");
        if (obs.data().isEmpty())
            throw malformed(obs, "no observed values");
        for (Double v : obs.data())
            if (v == null || !Double.isFinite(v))
                throw malformed(obs, "observed values must be finite numbers");
        int dim = order.ref(i).dim();
        if (dim > 1 && obs.data().size() != dim)
            throw malformed(obs, "a metric of dimension " + dim + " needs " + dim + " values, got "
                    + obs.data().size());
    }

    private static InferenceException malformed(Observation obs, String why) {
        return new InferenceException(Reason.MALFORMED_OBSERVATION, "observation of " + obs.metric() + ": " + why,
                Map.of("metric", obs.metric(), "values", obs.data().size()));
    }
}
