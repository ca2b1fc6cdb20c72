package com.dynamics.sfg.infer;

import com.dynamics.sfg.engine.Trace;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import static org.junit.Assert.*;

public class InferenceRunnerTest {

    /** An engine that never finishes on its own. */
    private static final class StuckEngine implements InferenceEngine {
        final CountDownLatch started = new CountDownLatch(1);

        @Override
        public SampleSet sample(ForwardModel model, InferenceSettings settings) {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InferenceException(InferenceException.Reason.CANCELLED, "stopped", Map.of());
            }
            throw new IllegalStateException("not reached");
        }
    }

    private static ForwardModel forward() {
        return ProbabilisticCompiler.compile(ProbabilisticCompilerTest.accumulator(),
                List.of(Observation.of("final", 0.5, 2.0)));
    }

    @Test
    public void testPosteriorRunProducesAFullTrace() {
        try (InferenceRunner runner = new InferenceRunner()) {
            Trace trace = runner.infer(forward(), false, InferenceSettings.defaults().setDraws(1000));

            assertEquals(Trace.Provenance.POSTERIOR, trace.provenance());
            assertEquals(1000, trace.draws());
            assertTrue(trace.has("level"));
            assertTrue(trace.has("final"));
        }
    }

    @Test
    public void testCancellationNeverYieldsAPartialTrace() throws Exception {
        StuckEngine stuck = new StuckEngine();
        try (InferenceRunner runner = new InferenceRunner(stuck)) {
            InferenceHandle handle = runner.submit(forward(), false, InferenceSettings.defaults());
            assertTrue(stuck.started.await(5, TimeUnit.SECONDS));
            assertTrue(handle.cancel());
            try {
                handle.await();
                fail("Expected InferenceException");
            } catch (InferenceException e) {
                assertEquals(InferenceException.Reason.CANCELLED, e.reason());
            }
            assertTrue(handle.isDone());
        }
    }

    @Test
    public void testTimeoutIsReportedAsSuch() {
        try (InferenceRunner runner = new InferenceRunner(new StuckEngine())) {
            InferenceHandle handle = runner.submit(forward(), false,
                    InferenceSettings.defaults().setTimeoutMillis(100));
            try {
                handle.await();
                fail("Expected InferenceException");
            } catch (InferenceException e) {
                assertEquals(InferenceException.Reason.TIMEOUT, e.reason());
                assertEquals(100L, e.diagnostics().get("timeoutMillis"));
            }
        }
    }

    @Test
    public void testEngineFailuresPropagateUnchanged() {
        InferenceEngine failing = (model, settings) -> {
            throw new InferenceException(InferenceException.Reason.DIVERGED, "boom", Map.of("draws", 3));
        };
        try (InferenceRunner runner = new InferenceRunner(failing)) {
            runner.infer(forward(), false, InferenceSettings.defaults());
            fail("Expected InferenceException");
        } catch (InferenceException e) {
            assertEquals(InferenceException.Reason.DIVERGED, e.reason());
            assertEquals(3, e.diagnostics().get("draws"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNeedsAtLeastOneDraw() {
        try (InferenceRunner runner = new InferenceRunner()) {
            runner.submit(forward(), true, InferenceSettings.defaults().setDraws(0));
        }
    }
}
