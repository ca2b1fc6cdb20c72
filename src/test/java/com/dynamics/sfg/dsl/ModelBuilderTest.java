package com.dynamics.sfg.dsl;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ModelBuilderTest {

    @Test
    public void testChainWiresInflowsAndOutflows() {
        ModelBuilder b = ModelBuilder.create("pipeline");
        Reference source = b.flow("source");
        Reference first = b.stock("first");
        Reference transfer = b.flow("transfer");
        Reference second = b.stock("second");
        Reference sink = b.flow("sink");
        b.chain(source, first, transfer, second, sink);

        assertEquals(List.of(source), first.inflows());
        assertEquals(List.of(transfer), first.outflows());
        assertEquals(List.of(transfer), second.inflows());
        assertEquals(List.of(sink), second.outflows());
    }

    @Test
    public void testChainMustAlternate() {
        ModelBuilder b = ModelBuilder.create("bad");
        Reference a = b.stock("a");
        Reference c = b.stock("c");
        try {
            b.chain(a, c);
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertEquals(List.of("a", "c"), e.references());
        }
    }

    @Test
    public void testVariablesMayActAsFlows() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference level = b.stock("level");
        Reference rate = b.variable("rate", 2.0);
        b.inflow(level, rate);
        assertEquals(List.of(rate), level.inflows());
    }

    @Test(expected = ModelDefinitionException.class)
    public void testMetricsCannotActAsFlows() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference level = b.stock("level");
        b.inflow(level, b.metric("peak", Eq.seriesMax(level)));
    }

    @Test(expected = ModelDefinitionException.class)
    public void testAFlowFeedsAtMostOneStock() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference in = b.flow("in");
        b.inflow(b.stock("a"), in);
        b.inflow(b.stock("b"), in);
    }

    @Test
    public void testTextBindingsResolveAgainstTheFinishedStructure() {
        ModelBuilder b = ModelBuilder.create("m");
        b.bind("early", "late * 2");
        b.variable("early");
        b.variable("late", 4.0);
        Model m = b.build();

        assertEquals(RefKind.VARIABLE, m.reference("early").kind());
        assertNotNull(m.reference("early").equation());
    }

    @Test
    public void testLaterBindingsWin() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference x = b.variable("x");
        b.bind(x, Eq.c(1)).bind(x, Eq.c(2));
        Model m = b.build();
        assertEquals("2.0", m.config().get("x"));
    }

    @Test
    public void testBuildFreezesTheBuilder() {
        ModelBuilder b = ModelBuilder.create("m");
        b.variable("x", 1.0);
        Model m = b.build();
        assertTrue(m.isFrozen());
        try {
            b.variable("y", 2.0);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
            // the model is complete
        }
    }

    @Test
    public void testKindSpecificAttributesAreChecked() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference level = b.stock("level");
        Reference in = b.flow("in");
        Reference scalar = b.scalar("k", 1.0);

        assertDefinitionError(() -> level.setEquation(Eq.c(1)));
        assertDefinitionError(() -> in.setPrior(Distribution.uniform(0, 1)));
        assertDefinitionError(() -> in.setInit(Eq.c(1)));
        assertDefinitionError(() -> level.setMin(Eq.c(0)));
        assertDefinitionError(() -> scalar.setEquation(Eq.ref(in)));
        assertDefinitionError(() -> level.setInit(Eq.t()));
    }

    @Test
    public void testEquationsAreValidatedWhenBound() {
        ModelBuilder b = ModelBuilder.create("m");
        Reference level = b.stock("level", 1.0);
        Reference v = b.variable("v", 3);
        Reference peak = b.metric("peak", Eq.seriesMax(level));
        Reference x = b.variable("x");

        // dimension mismatch
        assertDefinitionError(() -> v.setEquation(Eq.vec(1, 2)));
        assertDefinitionError(() -> x.setEquation(Eq.add(Eq.vec(1, 2), Eq.vec(1, 2, 3))));
        // literal zero denominator
        assertDefinitionError(() -> x.setEquation(Eq.div(Eq.ref(level), Eq.c(0))));
        // non-increasing interpolation table
        assertDefinitionError(() -> x.setEquation(Eq.interpolate(Eq.t(), new double[] { 0, 2, 1 },
                new double[] { 0, 1, 2 })));
        // metrics are post-run values
        assertDefinitionError(() -> x.setEquation(Eq.ref(peak)));
        // series operations belong to metrics
        assertDefinitionError(() -> x.setEquation(Eq.seriesMean(level)));
        // lag needs at least one step
        assertDefinitionError(() -> x.setEquation(Eq.lag(level, 0)));
        // a metric has no series to look back into
        assertDefinitionError(() -> peak.setEquation(Eq.index(peak, 0)));
    }

    private static void assertDefinitionError(Runnable action) {
        try {
            action.run();
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException expected) {
            assertFalse(expected.references().isEmpty());
        }
    }
}
