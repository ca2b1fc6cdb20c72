package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.SimulationException;
import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;
import com.dynamics.sfg.util.RunTimingListener;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class BatchRunnerTest {

    private static final Distribution COIN = Distribution.bernoulli(0.5);

    /** {@code ratio = 1 / coin} fails in every repetition whose coin lands on 0. */
    private static Model fragile() {
        ModelBuilder b = ModelBuilder.create("fragile");
        Reference coin = b.variable("coin", COIN);
        b.bind(b.variable("ratio"), Eq.div(Eq.c(1), Eq.ref(coin)));
        return b.build();
    }

    private static List<Integer> failingRepetitions(long seed, int n) {
        List<Integer> out = new ArrayList<>();
        for (int rep = 0; rep < n; rep++)
            if (COIN.sample(SimulationEngine.random(seed, rep), 1)[0] == 0.0)
                out.add(rep);
        return out;
    }

    private static Model growth() {
        ModelBuilder b = ModelBuilder.create("growth").steps(8).repetitions(24);
        Reference rate = b.variable("rate", Distribution.uniform(0, 0.5));
        Reference level = b.stock("level", 10.0);
        Reference births = b.flow("births");
        b.inflow(level, births).bind(births, Eq.mul(Eq.ref(rate), Eq.ref(level)));
        b.metric("final", Eq.index(level, -1));
        return b.build();
    }

    @Test
    public void testModelDefaultsApplyWhenSettingsAreUnset() {
        Trace trace = new BatchRunner().run(growth(), RunSettings.defaults());

        assertEquals(8, trace.steps());
        assertEquals(24, trace.draws());
        assertEquals(Trace.Provenance.SIMULATION, trace.provenance());
        assertTrue(trace.failures().isEmpty());
    }

    @Test
    public void testResultsDoNotDependOnThreadCount() {
        Model model = growth();
        Trace single = new BatchRunner().run(model, RunSettings.defaults().setSeed(11L).setThreads(1));
        Trace pooled = new BatchRunner().run(model, RunSettings.defaults().setSeed(11L).setThreads(4));

        assertEquals(single.draws(), pooled.draws());
        for (int d = 0; d < single.draws(); d++) {
            assertArrayEquals("draw " + d, single.timeSeries("level", d), pooled.timeSeries("level", d), 0.0);
            assertEquals(single.metric("final", d), pooled.metric("final", d), 0.0);
        }
    }

    @Test
    public void testDifferentSeedsGiveDifferentDraws() {
        Model model = growth();
        Trace a = new BatchRunner().run(model, RunSettings.defaults().setSeed(1L));
        Trace b = new BatchRunner().run(model, RunSettings.defaults().setSeed(2L));

        assertNotEquals(a.metric("final", 0), b.metric("final", 0), 0.0);
    }

    @Test
    public void testAbortRethrowsTheLowestFailingRepetition() {
        List<Integer> failing = failingRepetitions(5L, 16);
        assertFalse("fixture needs at least one failing repetition", failing.isEmpty());
        try {
            new BatchRunner().run(fragile(), RunSettings.defaults().setSeed(5L).setRepetitions(16).setSteps(2));
            fail("Expected SimulationException");
        } catch (SimulationException e) {
            assertEquals(failing.get(0).intValue(), e.repetition());
            assertEquals("ratio", e.reference());
            assertEquals(0, e.step());
        }
    }

    @Test
    public void testSkipDropsFailedRepetitionsAndListsThem() {
        List<Integer> failing = failingRepetitions(5L, 16);
        RunTimingListener timing = new RunTimingListener();
        Trace trace = new BatchRunner().addListener(timing).run(fragile(), RunSettings.defaults()
                .setSeed(5L).setRepetitions(16).setSteps(2).setThreads(3)
                .setFailurePolicy(BatchFailurePolicy.SKIP));

        assertEquals(16 - failing.size(), trace.draws());
        assertEquals(failing.size(), trace.failures().size());
        for (int k = 0; k < failing.size(); k++) {
            RepetitionFailure f = trace.failures().get(k);
            assertEquals(failing.get(k).intValue(), f.repetition());
            assertEquals("ratio", f.reference());
        }
        for (int d = 0; d < trace.draws(); d++)
            assertEquals(1.0, trace.value("ratio", d, 2), 0.0);
        assertEquals(16 - failing.size(), timing.completedRuns());
        assertEquals(failing.size(), timing.failedRuns());
    }

    @Test
    public void testRepetitionsDrawIndependentPriors() {
        ModelBuilder b = ModelBuilder.create("spread");
        b.variable("u", Distribution.uniform(0, 1));
        Trace trace = new BatchRunner().run(b.build(), RunSettings.defaults().setRepetitions(1000).setSteps(0));

        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE, sum = 0;
        for (int d = 0; d < trace.draws(); d++) {
            double u = trace.value("u", d, 0);
            min = Math.min(min, u);
            max = Math.max(max, u);
            sum += u;
        }
        assertTrue("min " + min, min < 0.02);
        assertTrue("max " + max, max > 0.98);
        assertEquals(0.5, sum / trace.draws(), 0.03);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroRepetitionsIsRejected() {
        new BatchRunner().run(growth(), RunSettings.defaults().setRepetitions(0));
    }
}
