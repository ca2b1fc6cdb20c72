package com.dynamics.sfg.io;

import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.BatchFailurePolicy;
import com.dynamics.sfg.engine.BatchRunner;
import com.dynamics.sfg.engine.RepetitionFailure;
import com.dynamics.sfg.engine.RunSettings;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.node.Reference;

import java.util.List;
import java.util.Map;

import org.junit.Test;
import static org.junit.Assert.*;

public class TraceCodecTest {

    private static Trace regions() {
        ModelBuilder b = ModelBuilder.create("regions").steps(3).repetitions(4);
        Reference rate = b.variable("rate", Distribution.uniform(0, 1));
        Reference pop = b.stock("pop", 2, 10, 20);
        Reference growth = b.flow("growth", 2);
        b.inflow(pop, growth).bind(growth, Eq.mul(Eq.ref(pop), Eq.ref(rate)));
        b.metric("total", Eq.sum(Eq.ref(pop)));
        return new BatchRunner().run(b.build(), RunSettings.defaults());
    }

    @Test
    public void testDocumentLabelsAxesAndShapes() {
        Trace trace = regions();
        TraceDocument doc = TraceCodec.toDocument(trace);

        assertEquals("SIMULATION", doc.getProvenance());
        assertEquals(3, doc.getSteps());
        assertEquals(4, doc.getDraws());

        TraceDocument.Variable pop = doc.getVariables().get("pop");
        assertEquals(List.of("draw", "time", "dim"), pop.getDims());
        assertArrayEquals(new int[] { 4, 4, 2 }, pop.getShape());
        assertEquals(32, pop.getData().length);
        // row-major: draw 1, t=2, element 1
        assertEquals(trace.value("pop", 1, 2, 1), pop.getData()[1 * 8 + 2 * 2 + 1], 0.0);

        TraceDocument.Variable total = doc.getVariables().get("total");
        assertEquals(List.of("draw", "dim"), total.getDims());
        assertArrayEquals(new int[] { 4, 1 }, total.getShape());
    }

    @Test
    public void testJsonRoundTrip() {
        Trace trace = regions();
        Trace copy = TraceCodec.fromJson(TraceCodec.toJson(trace));

        assertEquals(trace.provenance(), copy.provenance());
        assertEquals(trace.seriesNames(), copy.seriesNames());
        assertEquals(trace.metricNames(), copy.metricNames());
        for (int d = 0; d < trace.draws(); d++) {
            for (int t = 0; t <= trace.steps(); t++)
                assertArrayEquals(trace.series("pop")[d][t], copy.series("pop")[d][t], 0.0);
            assertEquals(trace.metric("total", d), copy.metric("total", d), 0.0);
        }
    }

    @Test
    public void testFailuresSurviveTheRoundTrip() {
        ModelBuilder b = ModelBuilder.create("fragile");
        Reference coin = b.variable("coin", Distribution.bernoulli(0.5));
        b.bind(b.variable("ratio"), Eq.div(Eq.c(1), Eq.ref(coin)));
        Trace trace = new BatchRunner().run(b.build(), RunSettings.defaults().setRepetitions(12).setSteps(1)
                .setFailurePolicy(BatchFailurePolicy.SKIP));

        Trace copy = TraceCodec.fromJson(TraceCodec.toJson(trace));
        assertEquals(trace.failures(), copy.failures());
        for (RepetitionFailure f : copy.failures())
            assertEquals("ratio", f.reference());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShapeMismatchIsRejected() {
        TraceDocument doc = new TraceDocument();
        doc.setProvenance("PRIOR");
        doc.setSteps(1);
        doc.setDraws(1);
        TraceDocument.Variable v = new TraceDocument.Variable();
        v.setDims(List.of("draw", "time", "dim"));
        v.setShape(new int[] { 1, 2, 1 });
        v.setData(new double[] { 1.0 });
        doc.setVariables(Map.of("x", v));
        TraceCodec.fromDocument(doc);
    }
}
