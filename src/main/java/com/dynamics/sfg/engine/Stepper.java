package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.NumericException;
import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.api.SimulationListener;
import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Environment;
import com.dynamics.sfg.fn.Evaluator;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.ValueAlgebra;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * The discrete-time recurrence, generic over the value representation.
 *
 * The simulation engine runs it over concrete arrays and the probabilistic
 * compiler over ensembles of draws, so both share one definition of a step:
 *
 * <ol>
 * <li>Priors are drawn once per run. Stock inits are evaluated at t=0, after
 * the static references they read.</li>
 * <li>At every step t in 0..steps, stocks hold their carried value (the init
 * at t=0, otherwise {@code stock[t-1] + inflows[t-1] - outflows[t-1]}).</li>
 * <li>Flows, variables and scalars are evaluated in resolver order against
 * the current stock values and t. Flows are then clamped: raw value raised to
 * {@code min}, then lowered to {@code max}.</li>
 * <li>Every recorded reference is appended to its series.</li>
 * <li>After the last step, metrics are evaluated over the recorded series.</li>
 * </ol>
 *
 * A numeric failure raised by the algebra aborts the run with a
 * {@link SimulationException}; the partially filled buffers are dropped with
 * it. Algebras that record failures per draw instead keep the run going.
 *
 * @param <V> value representation.
 */
public final class Stepper<V> {

    /** Supplies the value of a prior-backed variable for one run. */
    @FunctionalInterface
    public interface PriorSampler<V> {
        V draw(Reference ref);
    }

    private final EvaluationOrder order;
    private final ValueAlgebra<V> algebra;

    public Stepper(EvaluationOrder order, ValueAlgebra<V> algebra) {
        this.order = order;
        this.algebra = algebra;
    }

    public EvaluationOrder order() {
        return order;
    }

    /**
     * Runs the recurrence over {@code 0..steps}.
     *
     * @param repetition index reported in errors and listener callbacks.
     * @param listener   may be null.
     * @throws SimulationException on a numeric failure.
     */
    public Run<V> run(int steps, int repetition, PriorSampler<V> priors, SimulationListener listener) {
        if (steps < 0)
            throw new IllegalArgumentException("steps must be >= 0, got " + steps);
        final boolean hasListener = listener != null;
        if (hasListener)
            listener.onRunStart(repetition, steps);
        long start = System.nanoTime();

        var state = new State(steps, repetition, listener);
        state.drawPriors(priors);
        state.initialize();
        for (int t = 0; t <= steps; t++)
            state.step(t);
        state.metrics();

        if (hasListener)
            listener.onRunEnd(repetition, System.nanoTime() - start);
        return new Run<>(order, steps, state.series, state.metricValues);
    }

    /** The recorded output of one run. */
    public static final class Run<V> {
        private final EvaluationOrder order;
        private final int steps;
        private final Object[][] series;
        private final Object[] metrics;

        Run(EvaluationOrder order, int steps, Object[][] series, Object[] metrics) {
            this.order = order;
            this.steps = steps;
            this.series = series;
            this.metrics = metrics;
        }

        public EvaluationOrder order() {
            return order;
        }

        public int steps() {
            return steps;
        }

        /** Value of recorded reference {@code i} at step {@code t}. */
        @SuppressWarnings("unchecked")
        public V value(int i, int t) {
            if (series[i] == null)
                throw new IllegalArgumentException(order.name(i) + " is not recorded");
            return (V) series[i][t];
        }

        @SuppressWarnings("unchecked")
        public V metric(int i) {
            if (!order.isMetric(i))
                throw new IllegalArgumentException(order.name(i) + " is not a metric");
            return (V) metrics[i];
        }
    }

    private final class State implements Environment<V> {
        private final int steps;
        private final int repetition;
        private final SimulationListener listener;

        private final Object[][] series;
        private final Object[] current;
        private final Object[] initValues;
        private final Object[] priorValues;
        private final Object[] metricValues;

        private int t;
        private V timeValue;

        State(int steps, int repetition, SimulationListener listener) {
            this.steps = steps;
            this.repetition = repetition;
            this.listener = listener;
            int n = order.size();
            this.series = new Object[n][];
            for (int i = 0; i < n; i++)
                if (order.isRecorded(i))
                    series[i] = new Object[steps + 1];
            this.current = new Object[n];
            this.initValues = new Object[n];
            this.priorValues = new Object[n];
            this.metricValues = new Object[n];
        }

        void drawPriors(PriorSampler<V> priors) {
            for (int i = 0; i < order.size(); i++) {
                Reference r = order.ref(i);
                if (r.prior() != null)
                    priorValues[i] = algebra.broadcast(priors.draw(r), r.dim());
            }
        }

        void initialize() {
            setTime(0);
            for (int k = 0; k < order.initOrderLength(); k++)
                evaluateRef(order.initAt(k));
            for (int k = 0; k < order.stockCount(); k++) {
                int s = order.stockAt(k);
                initValues[s] = guarded(s, order.ref(s).init());
            }
        }

        void step(int time) {
            setTime(time);
            for (int k = 0; k < order.stockCount(); k++) {
                int s = order.stockAt(k);
                current[s] = time == 0 ? initValues[s] : carry(s, time - 1);
            }
            for (int k = 0; k < order.stepOrderLength(); k++)
                evaluateRef(order.stepAt(k));
            for (int i = 0; i < current.length; i++)
                if (series[i] != null)
                    series[i][time] = current[i];
        }

        void metrics() {
            for (int i : order.metricOrder())
                metricValues[i] = guarded(i, order.ref(i).equation());
        }

        @SuppressWarnings("unchecked")
        private V carry(int s, int prev) {
            V level = (V) series[s][prev];
            for (int f : order.inflowsOf(s))
                level = algebra.binary(BinaryOp.ADD, level, (V) series[f][prev]);
            for (int f : order.outflowsOf(s))
                level = algebra.binary(BinaryOp.SUB, level, (V) series[f][prev]);
            return algebra.broadcast(level, order.ref(s).dim());
        }

        private void setTime(int time) {
            t = time;
            timeValue = algebra.constant(new double[] { time });
        }

        private void evaluateRef(int i) {
            Reference r = order.ref(i);
            if (r.prior() != null) {
                current[i] = priorValues[i];
                return;
            }
            current[i] = guarded(i, r.equation());
        }

        /** Evaluates an equation of reference {@code i}, including its clamp. */
        private V guarded(int i, Expr expr) {
            Reference r = order.ref(i);
            algebra.locate(order.name(i), t);
            try {
                V v = Evaluator.evaluate(expr, algebra, this);
                if (r.kind() == RefKind.FLOW) {
                    if (r.min() != null)
                        v = algebra.binary(BinaryOp.MAX, v, Evaluator.evaluate(r.min(), algebra, this));
                    if (r.max() != null)
                        v = algebra.binary(BinaryOp.MIN, v, Evaluator.evaluate(r.max(), algebra, this));
                }
                return algebra.broadcast(v, r.dim());
            } catch (ArithmeticException e) {
                if (listener != null)
                    listener.onReferenceError(repetition, t, order.name(i), e);
                throw new SimulationException(order.name(i), t, repetition, e);
            }
        }

        // ── Environment ──────────────────────────────────────────

        @Override
        public V time() {
            return timeValue;
        }

        @Override
        @SuppressWarnings("unchecked")
        public V read(Reference ref) {
            int i = index(ref);
            Object v = switch (ref.kind()) {
                case TIME_REF -> timeValue;
                case METRIC -> metricValues[i];
                default -> current[i];
            };
            if (v == null)
                throw new IllegalStateException(order.name(i) + " read before it was evaluated");
            return (V) v;
        }

        @Override
        @SuppressWarnings("unchecked")
        public V lag(Reference ref, int k) {
            int i = index(ref);
            int at = t - k;
            if (at >= 0)
                return valueAt(i, at);
            if (ref.kind() == RefKind.STOCK)
                return (V) initValues[i];
            return algebra.constant(new double[ref.dim()]);
        }

        @Override
        public V seriesAt(Reference ref, int index) {
            int length = steps + 1;
            int at = index < 0 ? length + index : index;
            if (at < 0 || at >= length)
                throw new NumericException("index " + index + " out of range for a series of length " + length);
            return valueAt(index(ref), at);
        }

        @Override
        public List<V> series(Reference ref) {
            int i = index(ref);
            List<V> out = new ArrayList<>(steps + 1);
            for (int s = 0; s <= steps; s++)
                out.add(valueAt(i, s));
            return out;
        }

        @SuppressWarnings("unchecked")
        private V valueAt(int i, int at) {
            if (order.kind(i) == RefKind.TIME_REF)
                return algebra.constant(new double[] { at });
            if (series[i] == null)
                throw new IllegalStateException(order.name(i) + " has no recorded series");
            return (V) series[i][at];
        }

        private int index(Reference ref) {
            int i = order.indexOf(ref);
            if (i < 0)
                throw new IllegalStateException(ref.qualifiedName() + " is not part of this run");
            return i;
        }
    }
}
