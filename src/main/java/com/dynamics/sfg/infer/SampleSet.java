package com.dynamics.sfg.infer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equally weighted draws of the free variables, as returned by an
 * {@link InferenceEngine}: {@code draws.get(name)[draw][element]}.
 */
public record SampleSet(int count, Map<String, double[][]> draws, Map<String, Object> diagnostics) {
    public SampleSet {
        for (var e : draws.entrySet())
            if (e.getValue().length != count)
                throw new IllegalArgumentException("Variable " + e.getKey() + " has " + e.getValue().length
                        + " draws, expected " + count);
        draws = Collections.unmodifiableMap(new LinkedHashMap<>(draws));
        diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }
}
