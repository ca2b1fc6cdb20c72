package com.dynamics.sfg.fn;

/**
 * Elementwise binary operators of the expression tree.
 *
 * Comparison and logical operators produce 1.0 for true and 0.0 for false.
 * The precedence is used by the text formatter and parser only.
 */
public enum BinaryOp {
    ADD("+", 4),
    SUB("-", 4),
    MUL("*", 5),
    DIV("/", 5),
    MOD("%", 5),
    POW("^", 6),
    LT("<", 3),
    LE("<=", 3),
    GT(">", 3),
    GE(">=", 3),
    EQ("==", 3),
    NE("!=", 3),
    AND("and", 2),
    OR("or", 1),
    MIN("min", 0),
    MAX("max", 0);

    private final String symbol;
    private final int precedence;

    BinaryOp(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    /** Binding strength for infix printing; 0 means the operator is written as a function call. */
    public int precedence() {
        return precedence;
    }

    public boolean isInfix() {
        return precedence > 0;
    }

    /** Applies the operator to two doubles. Zero checks are the caller's job. */
    public double apply(double a, double b) {
        return switch (this) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case MOD -> a - b * Math.floor(a / b);
            case POW -> Math.pow(a, b);
            case LT -> a < b ? 1.0 : 0.0;
            case LE -> a <= b ? 1.0 : 0.0;
            case GT -> a > b ? 1.0 : 0.0;
            case GE -> a >= b ? 1.0 : 0.0;
            case EQ -> a == b ? 1.0 : 0.0;
            case NE -> a != b ? 1.0 : 0.0;
            case AND -> (a != 0.0 && b != 0.0) ? 1.0 : 0.0;
            case OR -> (a != 0.0 || b != 0.0) ? 1.0 : 0.0;
            case MIN -> Math.min(a, b);
            case MAX -> Math.max(a, b);
        };
    }

    /** True for operators whose right operand must not be zero. */
    public boolean dividesByRight() {
        return this == DIV || this == MOD;
    }
}
