package com.dynamics.sfg.util;

import com.dynamics.sfg.api.SimulationListener;
import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.SimulationEngine;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;
import static org.junit.Assert.*;

public class SimulationListenerTest {

    private static final class Recording implements SimulationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onRunStart(int repetition, int steps) {
            events.add("start " + repetition + " " + steps);
        }

        @Override
        public void onReferenceError(int repetition, int step, String reference, Throwable error) {
            events.add("error " + repetition + " " + step + " " + reference);
        }

        @Override
        public void onRunEnd(int repetition, long durationNanos) {
            events.add("end " + repetition);
        }
    }

    @Test
    public void testCompositeFansOutInRegistrationOrder() {
        CompositeSimulationListener composite = new CompositeSimulationListener();
        assertTrue(composite.isEmpty());
        Recording first = new Recording();
        Recording second = new Recording();
        composite.add(first);
        composite.add(second);

        ModelBuilder b = ModelBuilder.create("m");
        b.variable("x", 1.0);
        new SimulationEngine(b.build()).runOnce(3, 2, SimulationEngine.random(1L, 2), composite);

        assertEquals(List.of("start 2 3", "end 2"), first.events);
        assertEquals(first.events, second.events);
    }

    @Test
    public void testErrorsAreReportedBeforeTheRunIsAbandoned() {
        Recording recording = new Recording();
        RunTimingListener timing = new RunTimingListener();
        CompositeSimulationListener composite = new CompositeSimulationListener();
        composite.add(recording);
        composite.add(timing);

        ModelBuilder b = ModelBuilder.create("m");
        Reference level = b.stock("level", 1.0);
        Reference out = b.flow("out");
        b.outflow(level, out).bind(out, Eq.c(1));
        b.bind(b.variable("ratio"), Eq.div(Eq.c(1), Eq.ref(level)));
        SimulationEngine engine = new SimulationEngine(b.build());
        try {
            engine.runOnce(3, 0, SimulationEngine.random(1L, 0), composite);
            fail("Expected SimulationException");
        } catch (RuntimeException expected) {
            // reported through the listener first
        }

        assertEquals(List.of("start 0 3", "error 0 1 ratio"), recording.events);
        assertEquals(0, timing.completedRuns());
        assertEquals(1, timing.failedRuns());
    }

    @Test
    public void testTimingListenerAggregates() {
        RunTimingListener timing = new RunTimingListener();
        timing.onRunEnd(0, 2_000);
        timing.onRunEnd(1, 4_000);

        assertEquals(2, timing.completedRuns());
        assertEquals(2_000, timing.minLatencyNanos());
        assertEquals(4_000, timing.maxLatencyNanos());
        assertEquals(3.0, timing.avgLatencyMicros(), 1e-9);
        assertTrue(timing.dump().contains("Repetitions"));

        timing.reset();
        assertEquals(0, timing.completedRuns());
    }

    @Test
    public void testRateLimiterSuppressesBursts() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(SimulationListenerTest.class), 60_000);
        assertTrue(limiter.warn("first"));
        assertFalse(limiter.warn("second"));
        assertFalse(limiter.warn("third"));
        assertEquals(2, limiter.suppressedCount());
    }
}
