package com.dynamics.sfg.io;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.BatchRunner;
import com.dynamics.sfg.engine.RunSettings;
import com.dynamics.sfg.engine.SimulationEngine;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ModelCodecTest {

    private static void assertSameTrace(Trace expected, Trace actual) {
        assertEquals(expected.seriesNames(), actual.seriesNames());
        assertEquals(expected.metricNames(), actual.metricNames());
        assertEquals(expected.draws(), actual.draws());
        for (String name : expected.seriesNames())
            for (int d = 0; d < expected.draws(); d++)
                for (int t = 0; t <= expected.steps(); t++)
                    assertArrayEquals(name + " draw " + d + " t=" + t, expected.series(name)[d][t],
                            actual.series(name)[d][t], 0.0);
        for (String name : expected.metricNames())
            for (int d = 0; d < expected.draws(); d++)
                assertArrayEquals(name, expected.metric(name)[d], actual.metric(name)[d], 0.0);
    }

    @Test
    public void testBundledTubLoadsAndRuns() throws Exception {
        Model tub = ModelCodec.readResource("models/tub.json");

        assertEquals(5, tub.steps());
        assertEquals(RefKind.STOCK, tub.reference("level").kind());
        Trace trace = new SimulationEngine(tub).simulate(tub.steps());
        assertArrayEquals(new double[] { 0, 5, 8, 11, 14, 17 }, trace.timeSeries("level", 0), 1e-12);
        assertEquals(17.0, trace.metric("final_level", 0), 0.0);
        assertEquals(2.0, trace.metric("peak_drain", 0), 0.0);
    }

    @Test
    public void testRoundTripReproducesTheSameTrace() throws Exception {
        for (String resource : List.of("models/predator_prey.json", "models/one_compartment.json",
                "models/urban_growth.json")) {
            Model original = ModelCodec.readResource(resource);
            Model copy = ModelCodec.fromJson(ModelCodec.toJson(original));

            RunSettings settings = RunSettings.defaults().setSeed(3L).setRepetitions(5);
            assertSameTrace(new BatchRunner().run(original, settings), new BatchRunner().run(copy, settings));
            assertEquals(original.config(), copy.config());
        }
    }

    @Test
    public void testNestedModelsKeepCrossModelBindings() throws Exception {
        ModelBuilder tb = ModelBuilder.create("tub");
        Reference faucet = tb.flow("faucet");
        Reference drain = tb.flow("drain");
        Reference level = tb.stock("level");
        tb.chain(faucet, level, drain);
        tb.bind(drain, Eq.min(Eq.ref(level), Eq.c(2)));
        Model inner = tb.build();

        ModelBuilder hb = ModelBuilder.create("house").steps(5);
        hb.submodel("tub", inner);
        hb.variable("pressure", 5.0);
        hb.bind("tub.faucet", "pressure");
        Model house = hb.build();

        Path file = Files.createTempFile("house", ".json");
        try {
            ModelCodec.write(house, file);
            Model loaded = ModelCodec.read(file);

            assertNotNull(loaded.submodel("tub"));
            assertEquals("pressure", ExprFormatter.format(loaded.reference("tub.faucet").equation(), loaded));
            assertSameTrace(new SimulationEngine(house).simulate(5), new SimulationEngine(loaded).simulate(5));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void testDefinitionKeepsPriorsClampsAndDocs() throws Exception {
        ModelDefinition def = ModelCodec.toDefinition(ModelCodec.readResource("models/predator_prey.json"));

        ModelDefinition.ReferenceDef growth = def.getReferences().stream()
                .filter(r -> r.getName().equals("prey_growth")).findFirst().orElseThrow();
        assertEquals("Uniform(0.08, 0.12)", growth.getPrior());
        assertNull(growth.getEquation());

        ModelDefinition.ReferenceDef predation = def.getReferences().stream()
                .filter(r -> r.getName().equals("predation")).findFirst().orElseThrow();
        assertEquals("0.0", predation.getMin());
        assertEquals("prey", predation.getMax());

        ModelDefinition.ReferenceDef prey = def.getReferences().stream()
                .filter(r -> r.getName().equals("prey")).findFirst().orElseThrow();
        assertEquals("40.0", prey.getInit());
        assertEquals(List.of("births"), prey.getInflows());
        assertEquals(List.of("predation"), prey.getOutflows());
    }

    @Test
    public void testUnknownKindIsADefinitionError() {
        String json = "{\"name\":\"bad\",\"references\":[{\"name\":\"x\",\"kind\":\"RESERVOIR\"}]}";
        try {
            ModelCodec.fromJson(json);
            fail("Expected ModelDefinitionException");
        } catch (ModelDefinitionException e) {
            assertEquals(List.of("x"), e.references());
        }
    }

    @Test(expected = ModelDefinitionException.class)
    public void testMalformedJsonIsADefinitionError() {
        ModelCodec.fromJson("{\"name\": ");
    }

    @Test(expected = ModelDefinitionException.class)
    public void testWiringToAnUnknownFlowIsRejected() {
        ModelCodec.fromJson("{\"name\":\"bad\",\"references\":[{\"name\":\"s\",\"kind\":\"STOCK\",\"inflows\":[\"ghost\"]}]}");
    }
}
