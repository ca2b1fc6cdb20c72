package com.dynamics.sfg.fn;

import java.util.ArrayList;
import java.util.List;

/**
 * The shared recursive evaluator. Dispatches on {@link Expr#kind()} and
 * delegates primitives to a {@link ValueAlgebra} and state to an
 * {@link Environment}.
 */
public final class Evaluator {
    private Evaluator() {
        // Utility class
    }

    public static <V> V evaluate(Expr expr, ValueAlgebra<V> algebra, Environment<V> env) {
        return switch (expr.kind()) {
            case CONSTANT -> algebra.constant(((Expr.Constant) expr).values());
            case REF -> env.read(((Expr.Ref) expr).ref());
            case TIME -> env.time();
            case BINARY -> {
                var b = (Expr.Binary) expr;
                yield algebra.binary(b.op(), evaluate(b.left(), algebra, env), evaluate(b.right(), algebra, env));
            }
            case UNARY -> {
                var u = (Expr.Unary) expr;
                yield algebra.unary(u.fn(), evaluate(u.arg(), algebra, env));
            }
            case PIECEWISE -> piecewise((Expr.Piecewise) expr, algebra, env);
            case INTERPOLATE -> {
                var in = (Expr.Interpolate) expr;
                yield algebra.interpolate(evaluate(in.x(), algebra, env), in);
            }
            case PULSE -> pulse((Expr.Pulse) expr, algebra, env);
            case LAG -> {
                var lag = (Expr.Lag) expr;
                yield env.lag(lag.ref(), lag.steps());
            }
            case REDUCE -> {
                var r = (Expr.Reduce) expr;
                yield algebra.reduce(r.op(), evaluate(r.arg(), algebra, env));
            }
            case SERIES_INDEX -> {
                var s = (Expr.SeriesIndex) expr;
                yield env.seriesAt(s.ref(), s.index());
            }
            case SERIES_REDUCE -> {
                var s = (Expr.SeriesReduce) expr;
                yield algebra.reduceSeries(s.op(), env.series(s.ref()));
            }
        };
    }

    // A branch is evaluated only on the elements its condition selects, so a
    // branch guarded by its condition (e.g. x / y when y != 0) never trips on
    // the elements it does not cover.
    private static <V> V piecewise(Expr.Piecewise pw, ValueAlgebra<V> algebra, Environment<V> env) {
        List<V> conditions = new ArrayList<>(pw.conditions().size());
        List<V> branches = new ArrayList<>(pw.branches().size());
        for (Expr c : pw.conditions())
            conditions.add(evaluate(c, algebra, env));
        for (int i = 0; i < pw.branches().size(); i++) {
            V condition = conditions.get(i);
            branches.add(algebra.anyNonZero(condition)
                    ? evaluate(pw.branches().get(i), algebra.restrict(condition), env)
                    : null);
        }
        return algebra.piecewise(branches, conditions);
    }

    private static <V> V pulse(Expr.Pulse p, ValueAlgebra<V> algebra, Environment<V> env) {
        V start = evaluate(p.start(), algebra, env);
        V interval = evaluate(p.interval(), algebra, env);
        V magnitude = evaluate(p.magnitude(), algebra, env);
        V zero = algebra.constant(new double[] { 0.0 });
        V elapsed = algebra.binary(BinaryOp.SUB, env.time(), start);
        V started = algebra.binary(BinaryOp.GE, elapsed, zero);
        V onBeat = algebra.binary(BinaryOp.EQ, algebra.binary(BinaryOp.MOD, elapsed, interval), zero);
        return algebra.binary(BinaryOp.MUL, magnitude, algebra.binary(BinaryOp.MUL, started, onBeat));
    }
}
