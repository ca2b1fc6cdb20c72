package com.dynamics.sfg.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a model definition document.
 *
 * Nested models appear under {@code models}, keyed by the attribute name they
 * are attached under. Every name inside the document (equation text, wiring)
 * is relative to the outermost model of the document, so a nested model can
 * be completed by its parent exactly as in code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelDefinition {
    private String name, doc;
    private Integer steps, repetitions;
    private List<ReferenceDef> references;
    private Map<String, ModelDefinition> models;

    /** Definition of a single reference. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ReferenceDef {
        private String name, kind, doc;
        private Integer dim;
        private String equation, init, min, max, prior;
        private List<String> inflows, outflows;
    }
}
