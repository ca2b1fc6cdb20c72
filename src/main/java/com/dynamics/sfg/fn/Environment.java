package com.dynamics.sfg.fn;

import com.dynamics.sfg.node.Reference;

import java.util.List;

/**
 * Supplies the state-dependent leaves of an expression: the current time and
 * the recorded values of other references.
 *
 * @param <V> value representation, matching the {@link ValueAlgebra} in use.
 */
public interface Environment<V> {

    V time();

    /** Current value of a reference. */
    V read(Reference ref);

    /** Value of a reference {@code steps} time steps back. */
    V lag(Reference ref, int steps);

    /** Value of a recorded series at a Python-style index. */
    V seriesAt(Reference ref, int index);

    /** The full recorded series of a reference. */
    List<V> series(Reference ref);
}
