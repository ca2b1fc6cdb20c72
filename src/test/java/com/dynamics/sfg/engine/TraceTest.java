package com.dynamics.sfg.engine;

import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.node.Reference;

import org.junit.Test;
import static org.junit.Assert.*;

public class TraceTest {

    private static Trace counter() {
        ModelBuilder b = ModelBuilder.create("counter");
        Reference level = b.stock("level");
        Reference in = b.flow("in");
        b.inflow(level, in).bind(in, Eq.c(1));
        b.metric("last", Eq.index(level, -1));
        return new SimulationEngine(b.build()).simulate(3);
    }

    @Test
    public void testSeriesAndMetricsAreHandedOutAsCopies() {
        Trace trace = counter();

        trace.series("level")[0][3][0] = -100;
        trace.metric("last")[0][0] = -100;

        assertEquals(3.0, trace.value("level", 0, 3), 0.0);
        assertEquals(3.0, trace.metric("last", 0), 0.0);
        assertArrayEquals(new double[] { 0, 1, 2, 3 }, trace.timeSeries("level", 0), 0.0);
    }

    @Test
    public void testCopiesHoldTheRecordedValues() {
        Trace trace = counter();

        double[][][] level = trace.series("level");
        assertEquals(1, level.length);
        assertEquals(4, level[0].length);
        assertEquals(2.0, level[0][2][0], 0.0);
        assertEquals(3.0, trace.metric("last")[0][0], 0.0);
    }
}
