package com.dynamics.sfg.fn;

import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree.
 *
 * One record per node kind; {@link #kind()} is the tag used by
 * {@link Evaluator} to dispatch. Construction never evaluates anything: the
 * same tree is interpreted either over concrete arrays (simulation) or over
 * ensembles of random draws (probabilistic compilation).
 *
 * Leaves are literal constants, the time leaf, or references to other
 * {@link Reference}s. Use the static helpers in
 * {@link com.dynamics.sfg.dsl.Eq} to build trees.
 */
public interface Expr {

    Kind kind();

    /** Direct sub-expressions, in evaluation order. */
    List<Expr> children();

    enum Kind {
        CONSTANT,
        REF,
        TIME,
        BINARY,
        UNARY,
        PIECEWISE,
        INTERPOLATE,
        PULSE,
        LAG,
        REDUCE,
        SERIES_INDEX,
        SERIES_REDUCE
    }

    /** Literal scalar (length 1) or vector. */
    record Constant(double[] values) implements Expr {
        public Constant {
            Objects.requireNonNull(values, "values");
            if (values.length == 0)
                throw new IllegalArgumentException("Constant needs at least one value");
            values = values.clone();
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        public int dim() {
            return values.length;
        }

        public double value(int i) {
            return values[values.length == 1 ? 0 : i];
        }

        public boolean isZero() {
            for (double v : values)
                if (v != 0.0)
                    return false;
            return true;
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant c && Arrays.equals(values, c.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return values.length == 1 ? Double.toString(values[0]) : Arrays.toString(values);
        }
    }

    /** Current value of another reference. */
    record Ref(Reference ref) implements Expr {
        public Ref {
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public Kind kind() {
            return Kind.REF;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref r && r.ref == ref;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(ref);
        }

        @Override
        public String toString() {
            return ref.qualifiedName();
        }
    }

    /** The current time step. */
    record Time() implements Expr {
        @Override
        public Kind kind() {
            return Kind.TIME;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return "t";
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }
    }

    record Unary(UnaryFn fn, Expr arg) implements Expr {
        public Unary {
            Objects.requireNonNull(fn, "fn");
            Objects.requireNonNull(arg, "arg");
        }

        @Override
        public Kind kind() {
            return Kind.UNARY;
        }

        @Override
        public List<Expr> children() {
            return List.of(arg);
        }
    }

    /**
     * Per element, the branch whose condition is non-zero. Conditions must be
     * mutually exclusive per element; when none matches the element is 0.
     */
    record Piecewise(List<Expr> branches, List<Expr> conditions) implements Expr {
        public Piecewise {
            branches = List.copyOf(branches);
            conditions = List.copyOf(conditions);
            if (branches.size() != conditions.size())
                throw new IllegalArgumentException("Piecewise needs one condition per branch: "
                        + branches.size() + " branches, " + conditions.size() + " conditions");
            if (branches.isEmpty())
                throw new IllegalArgumentException("Piecewise needs at least one branch");
        }

        @Override
        public Kind kind() {
            return Kind.PIECEWISE;
        }

        @Override
        public List<Expr> children() {
            var all = new ArrayList<Expr>(conditions);
            all.addAll(branches);
            return all;
        }
    }

    /** Piecewise-linear lookup table; values outside the table take the edge value. */
    record Interpolate(Expr x, double[] xs, double[] ys) implements Expr {
        public Interpolate {
            Objects.requireNonNull(x, "x");
            xs = xs.clone();
            ys = ys.clone();
        }

        @Override
        public double[] xs() {
            return xs.clone();
        }

        @Override
        public double[] ys() {
            return ys.clone();
        }

        public double lookup(double v) {
            if (v <= xs[0])
                return ys[0];
            int last = xs.length - 1;
            if (v >= xs[last])
                return ys[last];
            int i = Arrays.binarySearch(xs, v);
            if (i >= 0)
                return ys[i];
            int hi = -i - 1;
            int lo = hi - 1;
            double w = (v - xs[lo]) / (xs[hi] - xs[lo]);
            return ys[lo] + w * (ys[hi] - ys[lo]);
        }

        @Override
        public Kind kind() {
            return Kind.INTERPOLATE;
        }

        @Override
        public List<Expr> children() {
            return List.of(x);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Interpolate i && x.equals(i.x)
                    && Arrays.equals(xs, i.xs) && Arrays.equals(ys, i.ys);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * x.hashCode() + Arrays.hashCode(xs)) + Arrays.hashCode(ys);
        }

        @Override
        public String toString() {
            return "Interpolate[x=" + x + ", xs=" + Arrays.toString(xs) + ", ys=" + Arrays.toString(ys) + "]";
        }
    }

    /** {@code magnitude} when {@code t >= start} and {@code (t - start) mod interval == 0}, else 0. */
    record Pulse(Expr start, Expr interval, Expr magnitude) implements Expr {
        public Pulse {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(interval, "interval");
            Objects.requireNonNull(magnitude, "magnitude");
        }

        @Override
        public Kind kind() {
            return Kind.PULSE;
        }

        @Override
        public List<Expr> children() {
            return List.of(start, interval, magnitude);
        }
    }

    /**
     * Value of a reference {@code steps} time steps back. Before the start of
     * the run a stock reads its initial value and anything else reads 0.
     */
    record Lag(Reference ref, int steps) implements Expr {
        public Lag {
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public Kind kind() {
            return Kind.LAG;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lag l && l.ref == ref && l.steps == steps;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(ref) + steps;
        }
    }

    /** Reduction across the vector dimension; the result is a scalar. */
    record Reduce(ReduceOp op, Expr arg) implements Expr {
        public Reduce {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(arg, "arg");
        }

        @Override
        public Kind kind() {
            return Kind.REDUCE;
        }

        @Override
        public List<Expr> children() {
            return List.of(arg);
        }
    }

    /** Metric-only: value of a recorded series at an index, negative indices count from the end. */
    record SeriesIndex(Reference ref, int index) implements Expr {
        public SeriesIndex {
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public Kind kind() {
            return Kind.SERIES_INDEX;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SeriesIndex s && s.ref == ref && s.index == index;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(ref) + index;
        }
    }

    /** Metric-only: reduction of a recorded series over the time axis. */
    record SeriesReduce(ReduceOp op, Reference ref) implements Expr {
        public SeriesReduce {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public Kind kind() {
            return Kind.SERIES_REDUCE;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SeriesReduce s && s.ref == ref && s.op == op;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(ref) + op.hashCode();
        }
    }
}
