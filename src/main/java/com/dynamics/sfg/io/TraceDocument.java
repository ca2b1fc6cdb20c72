package com.dynamics.sfg.io;

import com.dynamics.sfg.engine.RepetitionFailure;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a trace as labeled multi-dimensional arrays.
 *
 * Each variable names its axes in {@code dims} ({@code draw}, {@code time},
 * {@code dim} for series; {@code draw}, {@code dim} for metrics), gives their
 * sizes in {@code shape} and stores the values row-major in {@code data}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TraceDocument {
    private String provenance;
    private int steps;
    private int draws;
    private Map<String, Variable> variables;
    private List<RepetitionFailure> failures;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Variable {
        private List<String> dims;
        private int[] shape;
        private double[] data;
    }
}
