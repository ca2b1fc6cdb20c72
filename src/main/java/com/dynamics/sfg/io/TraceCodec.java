package com.dynamics.sfg.io;

import com.dynamics.sfg.engine.Trace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts traces to and from {@link TraceDocument}s and JSON.
 */
public final class TraceCodec {
    static final String DRAW = "draw", TIME = "time", DIM = "dim";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TraceCodec() {
        // Utility class
    }

    public static TraceDocument toDocument(Trace trace) {
        TraceDocument doc = new TraceDocument();
        doc.setProvenance(trace.provenance().name());
        doc.setSteps(trace.steps());
        doc.setDraws(trace.draws());
        doc.setFailures(new ArrayList<>(trace.failures()));
        Map<String, TraceDocument.Variable> vars = new LinkedHashMap<>();
        int times = trace.steps() + 1;
        for (String name : trace.seriesNames()) {
            int dim = trace.dim(name);
            double[][][] s = trace.series(name);
            double[] data = new double[trace.draws() * times * dim];
            int k = 0;
            for (double[][] draw : s)
                for (double[] atT : draw)
                    for (double v : atT)
                        data[k++] = v;
            vars.put(name, variable(List.of(DRAW, TIME, DIM), new int[] { trace.draws(), times, dim }, data));
        }
        for (String name : trace.metricNames()) {
            int dim = trace.dim(name);
            double[] data = new double[trace.draws() * dim];
            int k = 0;
            for (double[] draw : trace.metric(name))
                for (double v : draw)
                    data[k++] = v;
            vars.put(name, variable(List.of(DRAW, DIM), new int[] { trace.draws(), dim }, data));
        }
        doc.setVariables(vars);
        return doc;
    }

    private static TraceDocument.Variable variable(List<String> dims, int[] shape, double[] data) {
        var v = new TraceDocument.Variable();
        v.setDims(dims);
        v.setShape(shape);
        v.setData(data);
        return v;
    }

    /**
     * @throws IllegalArgumentException when shapes and data disagree.
     */
    public static Trace fromDocument(TraceDocument doc) {
        int draws = doc.getDraws();
        int steps = doc.getSteps();
        Map<String, double[][][]> series = new LinkedHashMap<>();
        Map<String, double[][]> metrics = new LinkedHashMap<>();
        if (doc.getVariables() != null) {
            for (var e : doc.getVariables().entrySet()) {
                String name = e.getKey();
                TraceDocument.Variable v = e.getValue();
                int[] shape = v.getShape();
                double[] data = v.getData();
                if (shape == null || v.getDims() == null || shape.length != v.getDims().size())
                    throw new IllegalArgumentException("Variable " + name + " needs one size per axis");
                int expected = 1;
                for (int s : shape)
                    expected *= s;
                if (data == null || data.length != expected || shape[0] != draws)
                    throw new IllegalArgumentException("Variable " + name + " does not match its shape");
                if (List.of(DRAW, TIME, DIM).equals(v.getDims())) {
                    double[][][] s = new double[shape[0]][shape[1]][shape[2]];
                    int k = 0;
                    for (int d = 0; d < shape[0]; d++)
                        for (int t = 0; t < shape[1]; t++)
                            for (int i = 0; i < shape[2]; i++)
                                s[d][t][i] = data[k++];
                    series.put(name, s);
                } else if (List.of(DRAW, DIM).equals(v.getDims())) {
                    double[][] m = new double[shape[0]][shape[1]];
                    int k = 0;
                    for (int d = 0; d < shape[0]; d++)
                        for (int i = 0; i < shape[1]; i++)
                            m[d][i] = data[k++];
                    metrics.put(name, m);
                } else {
                    throw new IllegalArgumentException("Variable " + name + " has unknown dims " + v.getDims());
                }
            }
        }
        return new Trace(Trace.Provenance.valueOf(doc.getProvenance()), steps, draws, series, metrics,
                doc.getFailures() == null ? List.of() : doc.getFailures());
    }

    public static String toJson(Trace trace) {
        try {
            return MAPPER.writeValueAsString(toDocument(trace));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize trace", e);
        }
    }

    public static Trace fromJson(String json) {
        try {
            return fromDocument(MAPPER.readValue(json, TraceDocument.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed trace document: " + e.getMessage(), e);
        }
    }

    public static void write(Trace trace, Path path) throws IOException {
        Files.writeString(path, toJson(trace));
    }

    public static Trace read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }
}
