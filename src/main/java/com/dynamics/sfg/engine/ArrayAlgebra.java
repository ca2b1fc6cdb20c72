package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.NumericException;
import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.ReduceOp;
import com.dynamics.sfg.fn.UnaryFn;
import com.dynamics.sfg.fn.ValueAlgebra;

import java.util.Arrays;
import java.util.List;

/**
 * Concrete semantics: every value is a {@code double[]} of length 1 (scalar)
 * or {@code dim}. Results are always fresh arrays, inputs are never written.
 *
 * A restricted view ({@link #restrict(double[])}) leaves the masked-out
 * elements at 0 and never raises for them.
 */
public final class ArrayAlgebra implements ValueAlgebra<double[]> {
    public static final ArrayAlgebra INSTANCE = new ArrayAlgebra(null);

    // null: every element is computed
    private final double[] mask;

    private ArrayAlgebra(double[] mask) {
        this.mask = mask;
    }

    @Override
    public double[] constant(double[] values) {
        return values.clone();
    }

    @Override
    public double[] binary(BinaryOp op, double[] left, double[] right) {
        int n = width(left.length, right.length);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (!active(i, n))
                continue;
            double a = left[left.length == 1 ? 0 : i];
            double b = right[right.length == 1 ? 0 : i];
            if (b == 0.0 && op.dividesByRight())
                throw new NumericException("division by zero (" + a + " " + op.symbol() + " 0)");
            double r = op.apply(a, b);
            if (op == BinaryOp.POW && Double.isNaN(r) && !Double.isNaN(a) && !Double.isNaN(b))
                throw new NumericException("power out of domain (" + a + " ^ " + b + ")");
            out[i] = r;
        }
        return out;
    }

    @Override
    public double[] unary(UnaryFn fn, double[] arg) {
        double[] out = new double[arg.length];
        for (int i = 0; i < arg.length; i++)
            if (active(i, arg.length))
                out[i] = fn.apply(arg[i]);
        return out;
    }

    @Override
    public double[] piecewise(List<double[]> branches, List<double[]> conditions) {
        int n = 1;
        for (double[] c : conditions)
            n = width(n, c.length);
        for (double[] b : branches)
            if (b != null)
                n = width(n, b.length);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (!active(i, n))
                continue;
            int match = -1;
            for (int k = 0; k < conditions.size(); k++) {
                double[] c = conditions.get(k);
                if (c[c.length == 1 ? 0 : i] != 0.0) {
                    if (match >= 0)
                        throw new NumericException("piecewise conditions " + match + " and " + k
                                + " both hold at element " + i);
                    match = k;
                }
            }
            if (match >= 0) {
                double[] b = branches.get(match);
                out[i] = b[b.length == 1 ? 0 : i];
            }
        }
        return out;
    }

    @Override
    public double[] interpolate(double[] x, Expr.Interpolate table) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++)
            out[i] = table.lookup(x[i]);
        return out;
    }

    @Override
    public double[] reduce(ReduceOp op, double[] arg) {
        double acc = op.identity();
        for (double v : arg)
            acc = op.accumulate(acc, v);
        return new double[] { op.finish(acc, arg.length) };
    }

    @Override
    public double[] reduceSeries(ReduceOp op, List<double[]> series) {
        int n = 1;
        for (double[] v : series)
            n = width(n, v.length);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = op.identity();
            for (double[] v : series)
                acc = op.accumulate(acc, v[v.length == 1 ? 0 : i]);
            out[i] = op.finish(acc, series.size());
        }
        return out;
    }

    @Override
    public boolean anyNonZero(double[] value) {
        for (int i = 0; i < value.length; i++)
            if (active(i, value.length) && value[i] != 0.0)
                return true;
        return false;
    }

    @Override
    public double[] broadcast(double[] value, int dim) {
        if (value.length == dim)
            return value;
        if (value.length != 1)
            throw new IllegalStateException("Cannot broadcast " + value.length + " elements to " + dim);
        double[] out = new double[dim];
        Arrays.fill(out, value[0]);
        return out;
    }

    @Override
    public ArrayAlgebra restrict(double[] condition) {
        int n = mask == null ? condition.length : width(mask.length, condition.length);
        double[] combined = new double[n];
        for (int i = 0; i < n; i++) {
            boolean selected = condition[condition.length == 1 ? 0 : i] != 0.0;
            combined[i] = selected && active(i, n) ? 1.0 : 0.0;
        }
        return new ArrayAlgebra(combined);
    }

    /** Whether element {@code i} of an {@code n}-wide result is computed. */
    private boolean active(int i, int n) {
        if (mask == null)
            return true;
        if (mask.length == 1)
            return mask[0] != 0.0;
        if (n == 1) {
            // a scalar feeding a masked vector is needed if any element is
            for (double m : mask)
                if (m != 0.0)
                    return true;
            return false;
        }
        return mask[i] != 0.0;
    }

    private static int width(int a, int b) {
        if (a == b || b == 1)
            return a;
        if (a == 1)
            return b;
        throw new IllegalStateException("Dimension mismatch at runtime: " + a + " vs " + b);
    }
}
