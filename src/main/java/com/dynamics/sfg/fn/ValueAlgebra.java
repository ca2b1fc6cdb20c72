package com.dynamics.sfg.fn;

import java.util.List;

/**
 * The primitive operations of one evaluation semantics.
 *
 * {@link Evaluator} walks an expression tree and delegates every node to an
 * algebra. The simulation engine plugs in concrete double arrays, the
 * probabilistic compiler plugs in ensembles of random draws. Both see the same
 * tree, the same operators and the same broadcasting rules.
 *
 * @param <V> value representation.
 */
public interface ValueAlgebra<V> {

    V constant(double[] values);

    V binary(BinaryOp op, V left, V right);

    V unary(UnaryFn fn, V arg);

    /**
     * Per element, selects the branch whose condition is non-zero, or 0 when
     * none is. Branches whose condition is zero everywhere may be null.
     */
    V piecewise(List<V> branches, List<V> conditions);

    V interpolate(V x, Expr.Interpolate table);

    /** Reduction across the vector dimension. */
    V reduce(ReduceOp op, V arg);

    /** Reduction across a list of values (a recorded series), elementwise. */
    V reduceSeries(ReduceOp op, List<V> series);

    /** True when any element of the value is non-zero. */
    boolean anyNonZero(V value);

    /** Stretches a value to the given dimension (no-op when it already matches). */
    V broadcast(V value, int dim);

    /**
     * A view of this algebra that only computes the elements where
     * {@code mask} is non-zero. Numeric failures on the other elements are not
     * raised, and their values are unspecified. Views nest: the masks combine.
     */
    ValueAlgebra<V> restrict(V mask);

    /**
     * Called before each equation is evaluated, for algebras that record
     * failures rather than raising them.
     */
    default void locate(String reference, int step) {
    }
}
