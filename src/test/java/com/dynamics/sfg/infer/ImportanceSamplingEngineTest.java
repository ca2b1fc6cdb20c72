package com.dynamics.sfg.infer;

import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import java.util.List;
import java.util.Random;

import org.junit.Test;
import static org.junit.Assert.*;

public class ImportanceSamplingEngineTest {

    private final ImportanceSamplingEngine engine = new ImportanceSamplingEngine();

    @Test
    public void testObservationsShiftThePosterior() {
        ForwardModel forward = ProbabilisticCompiler.compile(ProbabilisticCompilerTest.accumulator(),
                List.of(Observation.of("final", 0.2, 3.0)));
        InferenceSettings settings = InferenceSettings.defaults().setDraws(4000);

        SampleSet samples = engine.sample(forward, settings);
        Trace posterior = forward.trace(samples, Trace.Provenance.POSTERIOR);

        assertEquals(4000, posterior.draws());
        assertEquals(3.0, posterior.metricMean("final"), 0.1);
        assertEquals(0.75, posterior.metricMean("final") / 4, 0.03);
        assertTrue((double) samples.diagnostics().get("effectiveSampleSize") >= 10);
        assertTrue(samples.diagnostics().containsKey("logEvidence"));
    }

    @Test
    public void testSameSeedSameSample() {
        ForwardModel forward = ProbabilisticCompiler.compile(ProbabilisticCompilerTest.accumulator(),
                List.of(Observation.of("final", 0.5, 1.0)));
        InferenceSettings settings = InferenceSettings.defaults().setDraws(500).setSeed(9L);

        double[][] first = engine.sample(forward, settings).draws().get("rate");
        double[][] second = engine.sample(forward, settings).draws().get("rate");
        for (int d = 0; d < first.length; d++)
            assertArrayEquals(first[d], second[d], 0.0);
    }

    @Test
    public void testNonFiniteLikelihoodEverywhereDiverges() {
        ModelBuilder b = ModelBuilder.create("hopeless");
        Reference rate = b.variable("rate", Distribution.uniform(0, 1));
        b.metric("bad", Eq.log(Eq.sub(Eq.ref(rate), Eq.c(2))));
        Model model = b.build();
        ForwardModel forward = ProbabilisticCompiler.compile(model, List.of(Observation.of("bad", 1.0, 0.0)), 1);
        try {
            engine.sample(forward, InferenceSettings.defaults().setDraws(100));
            fail("Expected InferenceException");
        } catch (InferenceException e) {
            assertEquals(InferenceException.Reason.DIVERGED, e.reason());
            assertEquals(0, e.diagnostics().get("finiteWeights"));
            assertEquals(100, e.diagnostics().get("failedDraws"));
        }
    }

    @Test
    public void testFailingDrawsCarryNoWeight() {
        ModelBuilder b = ModelBuilder.create("half_valid");
        Reference p = b.variable("p", Distribution.uniform(-1, 1));
        b.metric("root", Eq.sqrt(Eq.ref(p)));
        ForwardModel forward = ProbabilisticCompiler.compile(b.build(), List.of(Observation.of("root", 0.2, 0.5)), 0);

        SampleSet samples = engine.sample(forward, InferenceSettings.defaults().setDraws(2000));
        Trace posterior = forward.trace(samples, Trace.Provenance.POSTERIOR);

        int failed = (int) samples.diagnostics().get("failedDraws");
        assertTrue("failed " + failed, failed > 800 && failed < 1200);
        assertTrue(posterior.failures().isEmpty());
        assertEquals(2000, posterior.draws());
        for (double root : posterior.metricSamples("root"))
            assertTrue(root >= 0.0);
        assertEquals(0.5, posterior.metricMean("root"), 0.1);
    }

    @Test
    public void testDegenerateWeightsDoNotConverge() {
        ForwardModel forward = ProbabilisticCompiler.compile(ProbabilisticCompilerTest.accumulator(),
                List.of(Observation.of("final", 1e-4, 3.0)));
        try {
            engine.sample(forward, InferenceSettings.defaults().setDraws(200));
            fail("Expected InferenceException");
        } catch (InferenceException e) {
            assertEquals(InferenceException.Reason.NOT_CONVERGED, e.reason());
            assertTrue((double) e.diagnostics().get("effectiveSampleSize") < 10);
        }
    }

    @Test
    public void testInterruptedSamplingIsCancelled() {
        ForwardModel forward = ProbabilisticCompiler.compile(ProbabilisticCompilerTest.accumulator(), List.of());
        Thread.currentThread().interrupt();
        try {
            engine.sample(forward, InferenceSettings.defaults().setDraws(100));
            fail("Expected InferenceException");
        } catch (InferenceException e) {
            assertEquals(InferenceException.Reason.CANCELLED, e.reason());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testSystematicResampleFollowsTheWeights() {
        Random random = new Random(1);
        assertArrayEquals(new int[] { 1, 1, 1, 1 },
                ImportanceSamplingEngine.systematicResample(new double[] { 0, 1, 0, 0 }, random));
        assertArrayEquals(new int[] { 0, 1, 2, 3 },
                ImportanceSamplingEngine.systematicResample(new double[] { 0.25, 0.25, 0.25, 0.25 }, random));
        int[] picks = ImportanceSamplingEngine.systematicResample(new double[] { 0.75, 0.25, 0, 0 }, random);
        assertArrayEquals(new int[] { 0, 0, 0, 1 }, picks);
    }
}
