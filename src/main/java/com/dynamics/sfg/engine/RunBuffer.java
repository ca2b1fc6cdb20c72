package com.dynamics.sfg.engine;

/**
 * The time series of one completed repetition, indexed like its
 * {@link EvaluationOrder}: {@code series[ref][t][element]} for recorded
 * references and {@code metrics[ref][element]} for metrics, null elsewhere.
 *
 * Owned by exactly one repetition until it is handed to the trace collector.
 */
public final class RunBuffer {
    private final int repetition;
    private final double[][][] series;
    private final double[][] metrics;

    RunBuffer(int repetition, double[][][] series, double[][] metrics) {
        this.repetition = repetition;
        this.series = series;
        this.metrics = metrics;
    }

    static RunBuffer of(int repetition, Stepper.Run<double[]> run) {
        EvaluationOrder order = run.order();
        int n = order.size();
        double[][][] series = new double[n][][];
        double[][] metrics = new double[n][];
        for (int i = 0; i < n; i++) {
            if (order.isRecorded(i)) {
                series[i] = new double[run.steps() + 1][];
                for (int t = 0; t <= run.steps(); t++)
                    series[i][t] = run.value(i, t);
            } else if (order.isMetric(i)) {
                metrics[i] = run.metric(i);
            }
        }
        return new RunBuffer(repetition, series, metrics);
    }

    public int repetition() {
        return repetition;
    }

    double[][] series(int ref) {
        return series[ref];
    }

    double[] metric(int ref) {
        return metrics[ref];
    }
}
