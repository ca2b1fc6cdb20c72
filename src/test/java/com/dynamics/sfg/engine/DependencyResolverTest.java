package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class DependencyResolverTest {

    private static List<String> stepNames(EvaluationOrder order) {
        List<String> names = new ArrayList<>();
        for (int i : order.stepOrder())
            names.add(order.name(i));
        return names;
    }

    @Test
    public void testDependenciesComeFirstRegardlessOfDeclarationOrder() {
        ModelBuilder b = ModelBuilder.create("chain");
        Reference c = b.variable("c");
        Reference bb = b.variable("b");
        Reference a = b.variable("a");
        b.bind(c, Eq.add(Eq.ref(bb), Eq.c(1)));
        b.bind(bb, Eq.mul(Eq.ref(a), Eq.c(2)));
        b.bind(a, Eq.c(1));
        EvaluationOrder order = DependencyResolver.resolve(b.build());

        assertEquals(List.of("a", "b", "c"), stepNames(order));
        assertEquals(1, order.dependentCount(order.index("a")));
        assertEquals("b", order.name(order.dependent(order.index("a"), 0)));
    }

    @Test
    public void testIndependentReferencesKeepDeclarationOrder() {
        ModelBuilder b = ModelBuilder.create("flat");
        b.variable("z", 1.0);
        b.variable("y", 2.0);
        b.variable("x", 3.0);
        EvaluationOrder order = DependencyResolver.resolve(b.build());

        assertEquals(List.of("z", "y", "x"), stepNames(order));
    }

    @Test
    public void testCycleNamesEveryReferenceOnIt() {
        ModelBuilder b = ModelBuilder.create("loop");
        Reference x = b.variable("x");
        Reference y = b.variable("y");
        b.variable("bystander", 1.0);
        b.bind(x, Eq.add(Eq.ref(y), Eq.c(1)));
        b.bind(y, Eq.add(Eq.ref(x), Eq.c(1)));
        Model model = b.build();
        try {
            DependencyResolver.resolve(model);
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertTrue(e.references().contains("x"));
            assertTrue(e.references().contains("y"));
            assertFalse(e.references().contains("bystander"));
        }
    }

    @Test
    public void testStocksBreakFeedbackLoops() {
        ModelBuilder b = ModelBuilder.create("feedback");
        Reference level = b.stock("level", 1.0);
        Reference growth = b.flow("growth");
        b.inflow(level, growth).bind(growth, Eq.mul(Eq.ref(level), Eq.c(0.5)));
        EvaluationOrder order = DependencyResolver.resolve(b.build());

        assertEquals(List.of("growth"), stepNames(order));
        assertEquals(1, order.stocks().length);
    }

    @Test
    public void testMissingEquationsAreReportedTogether() {
        ModelBuilder b = ModelBuilder.create("incomplete");
        b.flow("inflow");
        b.variable("rate");
        b.stock("level");
        try {
            DependencyResolver.resolve(b.build());
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertEquals(List.of("inflow", "rate"), e.references());
        }
    }

    @Test
    public void testStockInitMayReadStaticVariables() {
        ModelBuilder b = ModelBuilder.create("seeded");
        Reference capacity = b.variable("capacity", 40.0);
        Reference half = b.variable("half");
        Reference level = b.stock("level");
        b.bind(half, Eq.div(Eq.ref(capacity), Eq.c(2)));
        b.init(level, Eq.ref(half));
        EvaluationOrder order = DependencyResolver.resolve(b.build());

        assertEquals(2, order.initOrder().length);
        assertEquals(20.0, new SimulationEngine(order.root()).simulate(0).value("level", 0, 0), 0.0);
    }

    @Test(expected = ModelDefinitionException.class)
    public void testStockInitCannotReadAnotherStock() {
        ModelBuilder b = ModelBuilder.create("tangled");
        Reference first = b.stock("first", 1.0);
        Reference second = b.stock("second");
        b.init(second, Eq.ref(first));
        DependencyResolver.resolve(b.build());
    }

    @Test
    public void testStockInitCannotReachAFlowThroughAVariable() {
        ModelBuilder b = ModelBuilder.create("tangled");
        Reference level = b.stock("level");
        Reference in = b.flow("in");
        Reference copy = b.variable("copy");
        b.inflow(level, in).bind(in, Eq.c(1));
        b.bind(copy, Eq.ref(in));
        b.init(level, Eq.ref(copy));
        try {
            DependencyResolver.resolve(b.build());
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertEquals(List.of("level", "in"), e.references());
        }
    }

    @Test
    public void testSubModelReadingItsParentCannotRunAlone() {
        ModelBuilder tb = ModelBuilder.create("tub");
        Reference level = tb.stock("level");
        Reference faucet = tb.flow("faucet");
        tb.inflow(level, faucet);
        Model inner = tb.build();

        ModelBuilder hb = ModelBuilder.create("house");
        hb.submodel("tub", inner);
        hb.variable("pressure", 5.0);
        hb.bind("tub.faucet", "pressure");
        Model house = hb.build();

        assertNotNull(DependencyResolver.resolve(house));
        try {
            DependencyResolver.resolve(inner);
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertEquals("faucet", e.references().get(0));
            assertTrue(e.references().get(1).endsWith("pressure"));
        }
    }

    @Test
    public void testMetricsAreOrderedAmongThemselves() {
        ModelBuilder b = ModelBuilder.create("metrics");
        Reference level = b.stock("level", 4.0);
        Reference doubled = b.metric("doubled", Eq.c(0));
        b.metric("peak", Eq.seriesMax(level));
        b.bind("doubled", "peak * 2");
        EvaluationOrder order = DependencyResolver.resolve(b.build());

        int[] metrics = order.metricOrder();
        assertEquals(2, metrics.length);
        assertEquals("peak", order.name(metrics[0]));
        assertEquals(doubled, order.ref(metrics[1]));
    }
}
