package com.dynamics.sfg.dsl;

import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.ReduceOp;
import com.dynamics.sfg.fn.UnaryFn;
import com.dynamics.sfg.node.Reference;

import java.util.List;

/**
 * Expression builder -- the equation-facing half of the DSL.
 *
 * Every method returns a new immutable tree node; nothing is evaluated here.
 *
 * <pre>
 * var out = Eq.min(Eq.ref(level), Eq.c(2));
 * var faucet = Eq.piecewise(List.of(Eq.c(5), Eq.c(0)),
 *         List.of(Eq.lt(Eq.t(), Eq.ref(offTime)), Eq.ge(Eq.t(), Eq.ref(offTime))));
 * </pre>
 */
public final class Eq {
    private static final Expr.Time TIME = new Expr.Time();

    private Eq() {
        // Utility class
    }

    // ── Leaves ───────────────────────────────────────────────────

    public static Expr c(double value) {
        return new Expr.Constant(new double[] { value });
    }

    public static Expr vec(double... values) {
        return new Expr.Constant(values);
    }

    public static Expr ref(Reference ref) {
        return new Expr.Ref(ref);
    }

    /** The current time step. */
    public static Expr t() {
        return TIME;
    }

    // ── Arithmetic ───────────────────────────────────────────────

    public static Expr add(Expr a, Expr b, Expr... more) {
        Expr acc = new Expr.Binary(BinaryOp.ADD, a, b);
        for (Expr e : more)
            acc = new Expr.Binary(BinaryOp.ADD, acc, e);
        return acc;
    }

    public static Expr sub(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.SUB, a, b);
    }

    public static Expr mul(Expr a, Expr b, Expr... more) {
        Expr acc = new Expr.Binary(BinaryOp.MUL, a, b);
        for (Expr e : more)
            acc = new Expr.Binary(BinaryOp.MUL, acc, e);
        return acc;
    }

    public static Expr div(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.DIV, a, b);
    }

    public static Expr mod(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.MOD, a, b);
    }

    public static Expr pow(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.POW, a, b);
    }

    public static Expr neg(Expr a) {
        return new Expr.Unary(UnaryFn.NEG, a);
    }

    public static Expr min(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.MIN, a, b);
    }

    public static Expr max(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.MAX, a, b);
    }

    // ── Comparison / logic ───────────────────────────────────────

    public static Expr lt(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.LT, a, b);
    }

    public static Expr le(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.LE, a, b);
    }

    public static Expr gt(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.GT, a, b);
    }

    public static Expr ge(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.GE, a, b);
    }

    public static Expr eq(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.EQ, a, b);
    }

    public static Expr ne(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.NE, a, b);
    }

    public static Expr and(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.AND, a, b);
    }

    public static Expr or(Expr a, Expr b) {
        return new Expr.Binary(BinaryOp.OR, a, b);
    }

    public static Expr not(Expr a) {
        return new Expr.Unary(UnaryFn.NOT, a);
    }

    // ── Math ─────────────────────────────────────────────────────

    public static Expr sin(Expr a) {
        return new Expr.Unary(UnaryFn.SIN, a);
    }

    public static Expr cos(Expr a) {
        return new Expr.Unary(UnaryFn.COS, a);
    }

    public static Expr tan(Expr a) {
        return new Expr.Unary(UnaryFn.TAN, a);
    }

    public static Expr exp(Expr a) {
        return new Expr.Unary(UnaryFn.EXP, a);
    }

    public static Expr log(Expr a) {
        return new Expr.Unary(UnaryFn.LOG, a);
    }

    public static Expr sqrt(Expr a) {
        return new Expr.Unary(UnaryFn.SQRT, a);
    }

    public static Expr abs(Expr a) {
        return new Expr.Unary(UnaryFn.ABS, a);
    }

    public static Expr floor(Expr a) {
        return new Expr.Unary(UnaryFn.FLOOR, a);
    }

    public static Expr ceil(Expr a) {
        return new Expr.Unary(UnaryFn.CEIL, a);
    }

    // ── Structured functions ─────────────────────────────────────

    /** Per element, the branch whose condition holds; 0 where none does. */
    public static Expr piecewise(List<Expr> branches, List<Expr> conditions) {
        return new Expr.Piecewise(branches, conditions);
    }

    /** Piecewise-linear lookup; {@code xs} must be strictly increasing (checked when bound). */
    public static Expr interpolate(Expr x, double[] xs, double[] ys) {
        return new Expr.Interpolate(x, xs, ys);
    }

    /** 1 at {@code t = start, start + interval, ...}, else 0. */
    public static Expr pulse(Expr start, Expr interval) {
        return new Expr.Pulse(start, interval, c(1.0));
    }

    public static Expr pulse(Expr start, Expr interval, Expr magnitude) {
        return new Expr.Pulse(start, interval, magnitude);
    }

    /** Value of {@code ref} {@code steps} steps back. */
    public static Expr lag(Reference ref, int steps) {
        return new Expr.Lag(ref, steps);
    }

    // ── Reductions over the vector dimension ─────────────────────

    public static Expr sum(Expr a) {
        return new Expr.Reduce(ReduceOp.SUM, a);
    }

    public static Expr mean(Expr a) {
        return new Expr.Reduce(ReduceOp.MEAN, a);
    }

    public static Expr vmin(Expr a) {
        return new Expr.Reduce(ReduceOp.MIN, a);
    }

    public static Expr vmax(Expr a) {
        return new Expr.Reduce(ReduceOp.MAX, a);
    }

    // ── Series operations (metrics only) ─────────────────────────

    /** Value of the recorded series at {@code index}; {@code -1} is the last step. */
    public static Expr index(Reference ref, int index) {
        return new Expr.SeriesIndex(ref, index);
    }

    public static Expr seriesMin(Reference ref) {
        return new Expr.SeriesReduce(ReduceOp.MIN, ref);
    }

    public static Expr seriesMax(Reference ref) {
        return new Expr.SeriesReduce(ReduceOp.MAX, ref);
    }

    public static Expr seriesSum(Reference ref) {
        return new Expr.SeriesReduce(ReduceOp.SUM, ref);
    }

    public static Expr seriesMean(Reference ref) {
        return new Expr.SeriesReduce(ReduceOp.MEAN, ref);
    }
}
