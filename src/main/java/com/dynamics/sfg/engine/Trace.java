package com.dynamics.sfg.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The output of a run: per reference, per draw, per time step and per element
 * values.
 *
 * A draw is one repetition of a simulation batch or one sample of an
 * inference run; the keying is the same for both so consumers need not care
 * where a trace came from. Recorded references (stocks, flows, variables,
 * scalars) have a series {@code [draw][t][element]}, metrics have one value
 * {@code [draw][element]}. Names are qualified relative to the model that was
 * run.
 *
 * {@link #series(String)} and {@link #metric(String)} hand out copies, so a
 * trace shared between consumers cannot be altered through them.
 */
public final class Trace {

    /** Where the draws came from. */
    public enum Provenance {
        SIMULATION,
        PRIOR,
        POSTERIOR
    }

    private final Provenance provenance;
    private final int steps;
    private final int draws;
    private final Map<String, double[][][]> series;
    private final Map<String, double[][]> metrics;
    private final List<RepetitionFailure> failures;

    public Trace(Provenance provenance, int steps, int draws, Map<String, double[][][]> series,
            Map<String, double[][]> metrics, List<RepetitionFailure> failures) {
        this.provenance = provenance;
        this.steps = steps;
        this.draws = draws;
        this.series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.failures = List.copyOf(failures);
        for (var e : this.series.entrySet())
            if (e.getValue().length != draws || (draws > 0 && e.getValue()[0].length != steps + 1))
                throw new IllegalArgumentException("Series " + e.getKey() + " does not have shape ["
                        + draws + "][" + (steps + 1) + "][dim]");
        for (var e : this.metrics.entrySet())
            if (e.getValue().length != draws)
                throw new IllegalArgumentException("Metric " + e.getKey() + " does not have " + draws + " draws");
    }

    /**
     * Assembles a trace from completed repetitions, in the order given.
     */
    public static Trace of(EvaluationOrder order, Provenance provenance, int steps, List<RunBuffer> runs,
            List<RepetitionFailure> failures) {
        int draws = runs.size();
        Map<String, double[][][]> series = new LinkedHashMap<>();
        Map<String, double[][]> metrics = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            if (order.isRecorded(i)) {
                double[][][] s = new double[draws][][];
                for (int d = 0; d < draws; d++)
                    s[d] = runs.get(d).series(i);
                series.put(order.name(i), s);
            } else if (order.isMetric(i)) {
                double[][] m = new double[draws][];
                for (int d = 0; d < draws; d++)
                    m[d] = runs.get(d).metric(i);
                metrics.put(order.name(i), m);
            }
        }
        return new Trace(provenance, steps, draws, series, metrics, failures);
    }

    public Provenance provenance() {
        return provenance;
    }

    /** Last time step; series have {@code steps + 1} entries. */
    public int steps() {
        return steps;
    }

    public int draws() {
        return draws;
    }

    public List<RepetitionFailure> failures() {
        return failures;
    }

    public Set<String> seriesNames() {
        return series.keySet();
    }

    public Set<String> metricNames() {
        return metrics.keySet();
    }

    public boolean has(String name) {
        return series.containsKey(name) || metrics.containsKey(name);
    }

    /** A copy of the series {@code [draw][t][element]}. */
    public double[][][] series(String name) {
        double[][][] s = rawSeries(name);
        double[][][] out = new double[s.length][][];
        for (int d = 0; d < s.length; d++)
            out[d] = copy(s[d]);
        return out;
    }

    /** A copy of the metric values {@code [draw][element]}. */
    public double[][] metric(String name) {
        return copy(rawMetric(name));
    }

    public int dim(String name) {
        if (series.containsKey(name))
            return draws == 0 ? 0 : series.get(name)[0][0].length;
        return draws == 0 ? 0 : rawMetric(name)[0].length;
    }

    public double value(String name, int draw, int t) {
        return rawSeries(name)[draw][t][0];
    }

    public double value(String name, int draw, int t, int element) {
        return rawSeries(name)[draw][t][element];
    }

    /** First element of a series over time. */
    public double[] timeSeries(String name, int draw) {
        return timeSeries(name, draw, 0);
    }

    public double[] timeSeries(String name, int draw, int element) {
        double[][] s = rawSeries(name)[draw];
        double[] out = new double[s.length];
        for (int t = 0; t < s.length; t++)
            out[t] = s[t][element];
        return out;
    }

    public double metric(String name, int draw) {
        return rawMetric(name)[draw][0];
    }

    /** First element of a metric across all draws. */
    public double[] metricSamples(String name) {
        double[][] m = rawMetric(name);
        double[] out = new double[m.length];
        for (int d = 0; d < m.length; d++)
            out[d] = m[d][0];
        return out;
    }

    public double metricMean(String name) {
        double[] samples = metricSamples(name);
        double sum = 0;
        for (double v : samples)
            sum += v;
        return samples.length == 0 ? Double.NaN : sum / samples.length;
    }

    /** Mean of the first element of a series across draws at step {@code t}. */
    public double mean(String name, int t) {
        double[][][] s = rawSeries(name);
        double sum = 0;
        for (double[][] draw : s)
            sum += draw[t][0];
        return s.length == 0 ? Double.NaN : sum / s.length;
    }

    private double[][][] rawSeries(String name) {
        double[][][] s = series.get(name);
        if (s == null)
            throw new IllegalArgumentException("No series recorded for " + name);
        return s;
    }

    private double[][] rawMetric(String name) {
        double[][] m = metrics.get(name);
        if (m == null)
            throw new IllegalArgumentException("No metric named " + name);
        return m;
    }

    private static double[][] copy(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++)
            out[i] = rows[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "Trace(" + provenance + ", steps=" + steps + ", draws=" + draws + ", series=" + series.size()
                + ", metrics=" + metrics.size() + ", failures=" + failures.size() + ")";
    }
}
