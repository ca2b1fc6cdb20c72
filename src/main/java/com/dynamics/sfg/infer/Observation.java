package com.dynamics.sfg.infer;

import java.util.List;
import java.util.Objects;

/**
 * Observed data for one metric.
 *
 * Each value {@code data[j]} adds the likelihood term
 * {@code Normal(data[j] | metric, sigma)}. A scalar metric may be observed any
 * number of times; a vector metric is observed element by element, so it
 * needs exactly one value per element.
 *
 * @param metric qualified name of a Metric reference.
 * @param sigma  standard deviation of the observation noise.
 */
public record Observation(String metric, double sigma, List<Double> data) {
    public Observation {
        Objects.requireNonNull(metric, "metric");
        data = List.copyOf(data);
    }

    public static Observation of(String metric, double sigma, double... data) {
        Double[] boxed = new Double[data.length];
        for (int i = 0; i < data.length; i++)
            boxed[i] = data[i];
        return new Observation(metric, sigma, List.of(boxed));
    }
}
