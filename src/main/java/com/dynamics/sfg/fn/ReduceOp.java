package com.dynamics.sfg.fn;

/**
 * Reductions, used both across the vector dimension of a value and across the
 * time axis of a recorded series.
 */
public enum ReduceOp {
    SUM("sum", "series_sum"),
    MEAN("mean", "series_mean"),
    MIN("vmin", "series_min"),
    MAX("vmax", "series_max");

    private final String vectorName;
    private final String seriesName;

    ReduceOp(String vectorName, String seriesName) {
        this.vectorName = vectorName;
        this.seriesName = seriesName;
    }

    public String vectorName() {
        return vectorName;
    }

    public String seriesName() {
        return seriesName;
    }

    public static ReduceOp byVectorName(String name) {
        for (ReduceOp op : values())
            if (op.vectorName.equals(name))
                return op;
        return null;
    }

    public static ReduceOp bySeriesName(String name) {
        for (ReduceOp op : values())
            if (op.seriesName.equals(name))
                return op;
        return null;
    }

    public double identity() {
        return switch (this) {
            case SUM, MEAN -> 0.0;
            case MIN -> Double.POSITIVE_INFINITY;
            case MAX -> Double.NEGATIVE_INFINITY;
        };
    }

    public double accumulate(double acc, double x) {
        return switch (this) {
            case SUM, MEAN -> acc + x;
            case MIN -> Math.min(acc, x);
            case MAX -> Math.max(acc, x);
        };
    }

    public double finish(double acc, int count) {
        return this == MEAN ? acc / count : acc;
    }
}
