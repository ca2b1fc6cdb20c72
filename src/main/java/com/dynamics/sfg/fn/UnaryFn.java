package com.dynamics.sfg.fn;

import com.dynamics.sfg.api.NumericException;

/**
 * Elementwise math functions of the expression tree (the fixed vocabulary).
 */
public enum UnaryFn {
    NEG("-"),
    NOT("not"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    EXP("exp"),
    LOG("log"),
    SQRT("sqrt"),
    ABS("abs"),
    FLOOR("floor"),
    CEIL("ceil");

    private final String symbol;

    UnaryFn(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Looks a function up by its text name, or null for prefix operators and unknown names. */
    public static UnaryFn byName(String name) {
        for (UnaryFn fn : values())
            if (fn != NEG && fn.symbol.equals(name))
                return fn;
        return null;
    }

    /**
     * @throws NumericException for inputs outside the function's domain.
     */
    public double apply(double x) {
        return switch (this) {
            case NEG -> -x;
            case NOT -> x == 0.0 ? 1.0 : 0.0;
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
            case EXP -> Math.exp(x);
            case LOG -> {
                if (!(x > 0.0))
                    throw new NumericException("log of non-positive value " + x);
                yield Math.log(x);
            }
            case SQRT -> {
                if (x < 0.0)
                    throw new NumericException("sqrt of negative value " + x);
                yield Math.sqrt(x);
            }
            case ABS -> Math.abs(x);
            case FLOOR -> Math.floor(x);
            case CEIL -> Math.ceil(x);
        };
    }
}
