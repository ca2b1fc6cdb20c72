package com.dynamics.sfg.node;

/**
 * The kind tag of a {@link Reference}. The engine selects behavior by switching
 * on this tag.
 */
public enum RefKind {
    /** Accumulator carried across steps, changed only through its flows. */
    STOCK,
    /** Per-step rate applied to stocks, optionally clamped. */
    FLOW,
    /** Fixed, derived or free (prior-backed) quantity. */
    VARIABLE,
    /** Post-run reduction or index over recorded series. */
    METRIC,
    /** Named alias of the current time step. */
    TIME_REF,
    /** Named literal constant. */
    SCALAR;

    /** True for kinds evaluated in resolver order at every step. */
    public boolean isEvaluatedPerStep() {
        return this == FLOW || this == VARIABLE || this == SCALAR;
    }

    /** True for kinds whose values are recorded as a time series. */
    public boolean isRecorded() {
        return this == STOCK || isEvaluatedPerStep();
    }

    /** True for kinds that may be wired into a stock as inflow or outflow. */
    public boolean canFlow() {
        return this == FLOW || this == VARIABLE;
    }
}
