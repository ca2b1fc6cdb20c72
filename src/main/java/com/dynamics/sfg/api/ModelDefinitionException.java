package com.dynamics.sfg.api;

import java.util.List;

/**
 * Raised when a model definition is structurally invalid.
 *
 * Definition errors are detected at construction time or, at the latest, the
 * first time a model is compiled into an evaluation order. They are never
 * raised in the middle of a run.
 *
 * Examples: incompatible re-definition of a name, dimension mismatch between an
 * equation and its reference, a genuine dependency cycle among non-stock
 * references, or an interpolation table whose x values are not strictly
 * increasing.
 */
public class ModelDefinitionException extends IllegalArgumentException {
    private final List<String> references;

    public ModelDefinitionException(String message, String... references) {
        this(message, List.of(references));
    }

    public ModelDefinitionException(String message, List<String> references) {
        super(references.isEmpty() ? message : message + " " + references);
        this.references = List.copyOf(references);
    }

    /** Qualified names of the offending references, in discovery order. */
    public List<String> references() {
        return references;
    }
}
