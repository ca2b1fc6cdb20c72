package com.dynamics.sfg.api;

/**
 * Low-level numeric failure raised by an interpreter (division by zero,
 * out-of-domain math function input, non-exclusive piecewise conditions).
 *
 * The engine wraps it into a {@link SimulationException} that adds the
 * reference, step and repetition context.
 */
public class NumericException extends ArithmeticException {
    public NumericException(String message) {
        super(message);
    }
}
