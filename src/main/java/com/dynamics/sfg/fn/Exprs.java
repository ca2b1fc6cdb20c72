package com.dynamics.sfg.fn;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural queries over expression trees: dependency extraction, static
 * dimension inference and table validation.
 */
public final class Exprs {
    private Exprs() {
        // Utility class
    }

    /**
     * References read at the current time step. These are the edges the
     * dependency resolver orders; lagged and series reads look into the past
     * and are excluded.
     */
    public static Set<Reference> liveReads(Expr expr) {
        Set<Reference> out = new LinkedHashSet<>();
        walk(expr, e -> {
            if (e instanceof Expr.Ref r)
                out.add(r.ref());
        });
        return out;
    }

    /** Every reference the expression touches, including lagged and series reads. */
    public static Set<Reference> allReads(Expr expr) {
        Set<Reference> out = new LinkedHashSet<>();
        walk(expr, e -> {
            switch (e.kind()) {
                case REF -> out.add(((Expr.Ref) e).ref());
                case LAG -> out.add(((Expr.Lag) e).ref());
                case SERIES_INDEX -> out.add(((Expr.SeriesIndex) e).ref());
                case SERIES_REDUCE -> out.add(((Expr.SeriesReduce) e).ref());
                default -> {
                }
            }
        });
        return out;
    }

    /** True when the tree contains a node of the given kind. */
    public static boolean contains(Expr expr, Expr.Kind kind) {
        boolean[] found = { false };
        walk(expr, e -> {
            if (e.kind() == kind)
                found[0] = true;
        });
        return found[0];
    }

    /** Pre-order traversal without recursion. */
    public static void walk(Expr expr, java.util.function.Consumer<Expr> visitor) {
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expr e = stack.pop();
            visitor.accept(e);
            var children = e.children();
            for (int i = children.size() - 1; i >= 0; i--)
                stack.push(children.get(i));
        }
    }

    /**
     * Infers the dimension of the expression's result.
     *
     * @param owner qualified name used in error messages.
     * @throws ModelDefinitionException on non-broadcastable operands or invalid tables.
     */
    public static int dim(Expr expr, String owner) {
        return switch (expr.kind()) {
            case CONSTANT -> ((Expr.Constant) expr).dim();
            case REF -> ((Expr.Ref) expr).ref().dim();
            case LAG -> {
                var lag = (Expr.Lag) expr;
                if (lag.steps() < 1)
                    throw new ModelDefinitionException("Lag must look back at least one step, got "
                            + lag.steps() + " in", owner);
                yield lag.ref().dim();
            }
            case SERIES_INDEX -> ((Expr.SeriesIndex) expr).ref().dim();
            case SERIES_REDUCE -> ((Expr.SeriesReduce) expr).ref().dim();
            case TIME, REDUCE -> {
                for (Expr c : expr.children())
                    dim(c, owner);
                yield 1;
            }
            case BINARY -> {
                var b = (Expr.Binary) expr;
                if (b.op().dividesByRight() && b.right() instanceof Expr.Constant c && c.isZero())
                    throw new ModelDefinitionException("Division by a literal zero in", owner);
                yield broadcast(dim(b.left(), owner), dim(b.right(), owner), owner);
            }
            case UNARY -> dim(((Expr.Unary) expr).arg(), owner);
            case PIECEWISE, PULSE -> {
                int d = 1;
                for (Expr c : expr.children())
                    d = broadcast(d, dim(c, owner), owner);
                yield d;
            }
            case INTERPOLATE -> {
                var in = (Expr.Interpolate) expr;
                checkTable(in.xs(), in.ys(), owner);
                yield dim(in.x(), owner);
            }
        };
    }

    /** Broadcast rule: scalars stretch to any dimension, other dimensions must agree. */
    public static int broadcast(int a, int b, String owner) {
        if (a == b || b == 1)
            return a;
        if (a == 1)
            return b;
        throw new ModelDefinitionException("Dimension mismatch (" + a + " vs " + b + ") in", owner);
    }

    static void checkTable(double[] xs, double[] ys, String owner) {
        if (xs.length == 0 || xs.length != ys.length)
            throw new ModelDefinitionException("Interpolation table needs matching non-empty xs/ys ("
                    + xs.length + " vs " + ys.length + ") in", owner);
        for (int i = 1; i < xs.length; i++)
            if (!(xs[i] > xs[i - 1]))
                throw new ModelDefinitionException("Interpolation xs must be strictly increasing (index "
                        + i + ") in", owner);
    }
}
