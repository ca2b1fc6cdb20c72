package com.dynamics.sfg.infer;

import com.dynamics.sfg.api.NumericException;
import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.ReduceOp;
import com.dynamics.sfg.fn.UnaryFn;
import com.dynamics.sfg.fn.ValueAlgebra;

import java.util.List;

/**
 * Random-variable semantics: every operation is applied draw by draw, so a
 * derived reference becomes a deterministic transform of the upstream draws.
 * Broadcasting runs along both axes (single draw, scalar element).
 *
 * Each draw stands for one repetition, so a numeric failure ends only the draw
 * it happens in: the first failure of a draw is recorded with the reference
 * and step being evaluated, the draw's values turn NaN, and later operations
 * skip it. A failure of a deterministic value ends every draw that needs it.
 * One instance serves one pass over {@code draws} draws.
 */
public final class EnsembleAlgebra implements ValueAlgebra<Ensemble> {
    private final Failures failures;
    // null: every element of every draw is computed
    private final Ensemble mask;

    public EnsembleAlgebra(int draws) {
        this(new Failures(draws), null);
    }

    private EnsembleAlgebra(Failures failures, Ensemble mask) {
        this.failures = failures;
        this.mask = mask;
    }

    /** Number of draws of the pass. */
    public int draws() {
        return failures.errors.length;
    }

    /** The failure that ended {@code draw}, or null when it is intact. */
    public SimulationException failure(int draw) {
        return failures.errors[draw];
    }

    public boolean failed(int draw) {
        return failures.errors[draw] != null;
    }

    public int failureCount() {
        int n = 0;
        for (SimulationException e : failures.errors)
            if (e != null)
                n++;
        return n;
    }

    @Override
    public void locate(String reference, int step) {
        failures.reference = reference;
        failures.step = step;
    }

    @Override
    public Ensemble constant(double[] values) {
        return Ensemble.constant(values);
    }

    @Override
    public Ensemble binary(BinaryOp op, Ensemble left, Ensemble right) {
        int draws = width(width(left.draws(), right.draws()), maskDraws());
        int dim = width(left.dim(), right.dim());
        double[] out = new double[draws * dim];
        for (int d = 0; d < draws; d++) {
            for (int i = 0; i < dim; i++) {
                if (!active(d, i, draws, dim)) {
                    out[d * dim + i] = skipped(d, draws);
                    continue;
                }
                double a = left.get(d, i);
                double b = right.get(d, i);
                if (b == 0.0 && op.dividesByRight()) {
                    out[d * dim + i] = fail(d, draws, i, dim,
                            "division by zero (" + a + " " + op.symbol() + " 0)");
                    continue;
                }
                double r = op.apply(a, b);
                if (op == BinaryOp.POW && Double.isNaN(r) && !Double.isNaN(a) && !Double.isNaN(b))
                    r = fail(d, draws, i, dim, "power out of domain (" + a + " ^ " + b + ")");
                out[d * dim + i] = r;
            }
        }
        return new Ensemble(draws, dim, out);
    }

    @Override
    public Ensemble unary(UnaryFn fn, Ensemble arg) {
        int draws = width(arg.draws(), maskDraws());
        int dim = arg.dim();
        double[] out = new double[draws * dim];
        for (int d = 0; d < draws; d++) {
            for (int i = 0; i < dim; i++) {
                if (!active(d, i, draws, dim)) {
                    out[d * dim + i] = skipped(d, draws);
                    continue;
                }
                try {
                    out[d * dim + i] = fn.apply(arg.get(d, i));
                } catch (NumericException e) {
                    out[d * dim + i] = fail(d, draws, i, dim, e.getMessage());
                }
            }
        }
        return new Ensemble(draws, dim, out);
    }

    @Override
    public Ensemble piecewise(List<Ensemble> branches, List<Ensemble> conditions) {
        int draws = maskDraws(), dim = 1;
        for (Ensemble c : conditions) {
            draws = width(draws, c.draws());
            dim = width(dim, c.dim());
        }
        for (Ensemble b : branches) {
            if (b != null) {
                draws = width(draws, b.draws());
                dim = width(dim, b.dim());
            }
        }
        double[] out = new double[draws * dim];
        for (int d = 0; d < draws; d++) {
            for (int i = 0; i < dim; i++) {
                if (!active(d, i, draws, dim)) {
                    out[d * dim + i] = skipped(d, draws);
                    continue;
                }
                int match = -1;
                boolean overlap = false;
                for (int k = 0; k < conditions.size() && !overlap; k++) {
                    if (conditions.get(k).get(d, i) != 0.0) {
                        if (match >= 0) {
                            out[d * dim + i] = fail(d, draws, i, dim, "piecewise conditions " + match + " and "
                                    + k + " both hold at element " + i);
                            overlap = true;
                        }
                        match = k;
                    }
                }
                if (!overlap && match >= 0)
                    out[d * dim + i] = branches.get(match).get(d, i);
            }
        }
        return new Ensemble(draws, dim, out);
    }

    @Override
    public Ensemble interpolate(Ensemble x, Expr.Interpolate table) {
        double[] out = new double[x.draws() * x.dim()];
        for (int d = 0; d < x.draws(); d++)
            for (int i = 0; i < x.dim(); i++)
                out[d * x.dim() + i] = table.lookup(x.get(d, i));
        return new Ensemble(x.draws(), x.dim(), out);
    }

    @Override
    public Ensemble reduce(ReduceOp op, Ensemble arg) {
        double[] out = new double[arg.draws()];
        for (int d = 0; d < arg.draws(); d++) {
            double acc = op.identity();
            for (int i = 0; i < arg.dim(); i++)
                acc = op.accumulate(acc, arg.get(d, i));
            out[d] = op.finish(acc, arg.dim());
        }
        return new Ensemble(arg.draws(), 1, out);
    }

    @Override
    public Ensemble reduceSeries(ReduceOp op, List<Ensemble> series) {
        int draws = 1, dim = 1;
        for (Ensemble e : series) {
            draws = width(draws, e.draws());
            dim = width(dim, e.dim());
        }
        double[] out = new double[draws * dim];
        for (int d = 0; d < draws; d++) {
            for (int i = 0; i < dim; i++) {
                double acc = op.identity();
                for (Ensemble e : series)
                    acc = op.accumulate(acc, e.get(d, i));
                out[d * dim + i] = op.finish(acc, series.size());
            }
        }
        return new Ensemble(draws, dim, out);
    }

    @Override
    public boolean anyNonZero(Ensemble value) {
        for (int d = 0; d < value.draws(); d++)
            for (int i = 0; i < value.dim(); i++)
                if (active(d, i, value.draws(), value.dim()) && value.get(d, i) != 0.0)
                    return true;
        return false;
    }

    @Override
    public Ensemble broadcast(Ensemble value, int dim) {
        if (value.dim() == dim)
            return value;
        if (value.dim() != 1)
            throw new IllegalStateException("Cannot broadcast " + value.dim() + " elements to " + dim);
        double[] out = new double[value.draws() * dim];
        for (int d = 0; d < value.draws(); d++)
            for (int i = 0; i < dim; i++)
                out[d * dim + i] = value.get(d, 0);
        return new Ensemble(value.draws(), dim, out);
    }

    @Override
    public EnsembleAlgebra restrict(Ensemble condition) {
        int draws = width(condition.draws(), maskDraws());
        int dim = mask == null ? condition.dim() : width(mask.dim(), condition.dim());
        double[] combined = new double[draws * dim];
        for (int d = 0; d < draws; d++)
            for (int i = 0; i < dim; i++)
                combined[d * dim + i] = condition.get(d, i) != 0.0 && active(d, i, draws, dim) ? 1.0 : 0.0;
        return new EnsembleAlgebra(failures, new Ensemble(draws, dim, combined));
    }

    private int maskDraws() {
        return mask == null ? 1 : mask.draws();
    }

    /**
     * Whether element {@code i} of draw {@code d} of a {@code draws x dim}
     * result is computed: the draw is intact and the mask selects it.
     */
    private boolean active(int d, int i, int draws, int dim) {
        if (draws > 1 && failures.errors[d] != null)
            return false;
        if (mask == null)
            return true;
        if (dim == 1 && mask.dim() > 1) {
            for (int k = 0; k < mask.dim(); k++)
                if (mask.get(d, k) != 0.0)
                    return true;
            return false;
        }
        return mask.get(d, i) != 0.0;
    }

    private double skipped(int d, int draws) {
        return draws > 1 && failures.errors[d] != null ? Double.NaN : 0.0;
    }

    /** Records a failure of draw {@code d}, or of every draw needing a deterministic value. */
    private double fail(int d, int draws, int i, int dim, String message) {
        if (draws > 1) {
            failures.record(d, message);
        } else {
            int total = failures.errors.length;
            for (int k = 0; k < total; k++)
                if (active(k, i, total, dim))
                    failures.record(k, message);
        }
        return Double.NaN;
    }

    private static int width(int a, int b) {
        if (a == b || b == 1)
            return a;
        if (a == 1)
            return b;
        throw new IllegalStateException("Shape mismatch at runtime: " + a + " vs " + b);
    }

    /** Per-draw failure record shared by an algebra and its restricted views. */
    private static final class Failures {
        private final SimulationException[] errors;
        private String reference = "?";
        private int step;

        Failures(int draws) {
            if (draws < 1)
                throw new IllegalArgumentException("draws must be >= 1, got " + draws);
            this.errors = new SimulationException[draws];
        }

        void record(int draw, String message) {
            if (errors[draw] == null)
                errors[draw] = new SimulationException(reference, step, draw, new NumericException(message));
        }
    }
}
