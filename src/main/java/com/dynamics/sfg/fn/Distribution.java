package com.dynamics.sfg.fn;

import com.dynamics.sfg.api.ModelDefinitionException;

import java.util.Arrays;
import java.util.Random;

/**
 * A prior distribution attached to a free Variable.
 *
 * Drawn once per repetition by the simulation engine and represented as an
 * ensemble of draws by the probabilistic compiler.
 */
public record Distribution(Family family, double[] params) {

    public enum Family {
        NORMAL("Normal", 2),
        UNIFORM("Uniform", 2),
        DISCRETE_UNIFORM("DiscreteUniform", 2),
        BERNOULLI("Bernoulli", 1),
        EXPONENTIAL("Exponential", 1);

        private final String displayName;
        private final int arity;

        Family(String displayName, int arity) {
            this.displayName = displayName;
            this.arity = arity;
        }

        public String displayName() {
            return displayName;
        }

        public int arity() {
            return arity;
        }

        public static Family byName(String name) {
            for (Family f : values())
                if (f.displayName.equals(name))
                    return f;
            return null;
        }
    }

    public Distribution {
        params = params.clone();
        if (params.length != family.arity)
            throw new ModelDefinitionException(family.displayName + " takes " + family.arity
                    + " parameters, got " + params.length);
        switch (family) {
            case NORMAL -> require(params[1] > 0, "Normal sigma must be positive");
            case UNIFORM -> require(params[0] < params[1], "Uniform needs lower < upper");
            case DISCRETE_UNIFORM -> require(params[0] <= params[1]
                    && params[0] == Math.rint(params[0]) && params[1] == Math.rint(params[1]),
                    "DiscreteUniform needs integer bounds with lower <= upper");
            case BERNOULLI -> require(params[0] >= 0 && params[0] <= 1, "Bernoulli p must lie in [0, 1]");
            case EXPONENTIAL -> require(params[0] > 0, "Exponential rate must be positive");
        }
    }

    public static Distribution normal(double mu, double sigma) {
        return new Distribution(Family.NORMAL, new double[] { mu, sigma });
    }

    public static Distribution uniform(double lower, double upper) {
        return new Distribution(Family.UNIFORM, new double[] { lower, upper });
    }

    public static Distribution discreteUniform(int lower, int upper) {
        return new Distribution(Family.DISCRETE_UNIFORM, new double[] { lower, upper });
    }

    public static Distribution bernoulli(double p) {
        return new Distribution(Family.BERNOULLI, new double[] { p });
    }

    public static Distribution exponential(double rate) {
        return new Distribution(Family.EXPONENTIAL, new double[] { rate });
    }

    @Override
    public double[] params() {
        return params.clone();
    }

    public double sample(Random random) {
        return switch (family) {
            case NORMAL -> params[0] + params[1] * random.nextGaussian();
            case UNIFORM -> params[0] + (params[1] - params[0]) * random.nextDouble();
            case DISCRETE_UNIFORM -> params[0] + random.nextInt((int) (params[1] - params[0]) + 1);
            case BERNOULLI -> random.nextDouble() < params[0] ? 1.0 : 0.0;
            case EXPONENTIAL -> -Math.log(1.0 - random.nextDouble()) / params[0];
        };
    }

    /** Draws {@code dim} independent values. */
    public double[] sample(Random random, int dim) {
        double[] out = new double[dim];
        for (int i = 0; i < dim; i++)
            out[i] = sample(random);
        return out;
    }

    public double mean() {
        return switch (family) {
            case NORMAL -> params[0];
            case UNIFORM, DISCRETE_UNIFORM -> (params[0] + params[1]) / 2.0;
            case BERNOULLI -> params[0];
            case EXPONENTIAL -> 1.0 / params[0];
        };
    }

    private static void require(boolean ok, String message) {
        if (!ok)
            throw new ModelDefinitionException(message);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Distribution d && d.family == family && Arrays.equals(d.params, params);
    }

    @Override
    public int hashCode() {
        return 31 * family.hashCode() + Arrays.hashCode(params);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(family.displayName).append('(');
        for (int i = 0; i < params.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(params[i]);
        }
        return sb.append(')').toString();
    }
}
