package com.dynamics.sfg;

import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.BatchRunner;
import com.dynamics.sfg.engine.RunSettings;
import com.dynamics.sfg.engine.SimulationEngine;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.infer.ForwardModel;
import com.dynamics.sfg.infer.InferenceRunner;
import com.dynamics.sfg.infer.InferenceSettings;
import com.dynamics.sfg.infer.Observation;
import com.dynamics.sfg.infer.ProbabilisticCompiler;
import com.dynamics.sfg.io.ModelCodec;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.util.GraphExplain;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for modellers.
 * <p>
 * This class handles:
 * <ul>
 * <li>Starting a model in code ({@link #builder(String)})</li>
 * <li>Loading JSON model definitions from a file or the classpath</li>
 * <li>Running simulation batches</li>
 * <li>Compiling a model with observations and sampling its prior or posterior</li>
 * </ul>
 */
public final class StockFlow {
    private static final Logger log = LogManager.getLogger(StockFlow.class);

    private StockFlow() {
        // Utility class
    }

    public static ModelBuilder builder(String name) {
        return ModelBuilder.create(name);
    }

    /**
     * Loads a model definition from a JSON file.
     *
     * @throws UncheckedIOException if the file cannot be read.
     */
    public static Model load(Path path) {
        try {
            Model model = ModelCodec.read(path);
            log.info("Loaded model {} from {}", model.name(), path);
            return model;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model definition from " + path, e);
        }
    }

    /** Loads a bundled definition such as {@code models/tub.json}. */
    public static Model loadResource(String resource) {
        try {
            return ModelCodec.readResource(resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model definition " + resource, e);
        }
    }

    public static Trace simulate(Model model) {
        return simulate(model, RunSettings.defaults());
    }

    public static Trace simulate(Model model, RunSettings settings) {
        return new BatchRunner().run(model, settings);
    }

    /**
     * Compiles {@code model} with {@code observations} and samples it.
     *
     * @param priorOnly sample the prior predictive and ignore the observations'
     *                  likelihood.
     * @throws com.dynamics.sfg.infer.InferenceException when sampling fails.
     */
    public static Trace infer(Model model, List<Observation> observations, boolean priorOnly,
            InferenceSettings settings) {
        int steps = settings.getSteps() != null ? settings.getSteps() : model.steps();
        ForwardModel forward = ProbabilisticCompiler.compile(model, observations, steps);
        try (InferenceRunner runner = new InferenceRunner()) {
            return runner.infer(forward, priorOnly, settings);
        }
    }

    /** Resolves {@code model} and describes its evaluation order. */
    public static GraphExplain explain(Model model) {
        return new GraphExplain(new SimulationEngine(model).order());
    }
}
