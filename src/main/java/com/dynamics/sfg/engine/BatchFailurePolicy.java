package com.dynamics.sfg.engine;

/**
 * What a multi-repetition run does when one repetition fails numerically.
 */
public enum BatchFailurePolicy {
    /** Stop starting repetitions and rethrow the failure of the lowest repetition index. */
    ABORT,
    /** Drop failed repetitions, keep the rest and report the failures in the trace. */
    SKIP
}
