package com.dynamics.sfg;

import com.dynamics.sfg.engine.RunSettings;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.infer.InferenceSettings;
import com.dynamics.sfg.infer.Observation;
import com.dynamics.sfg.node.Model;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class StockFlowTest {

    @Test
    public void testPredatorPreyBatchStaysNonNegative() {
        Model model = StockFlow.loadResource("models/predator_prey.json");
        Trace trace = StockFlow.simulate(model, RunSettings.defaults().setThreads(2));

        assertEquals(20, trace.draws());
        assertEquals(50, trace.steps());
        for (int d = 0; d < trace.draws(); d++)
            for (int t = 0; t <= trace.steps(); t++) {
                assertTrue(trace.value("prey", d, t) >= 0);
                assertTrue(trace.value("predators", d, t) >= 0);
            }
        for (double peak : trace.metricSamples("peak_prey"))
            assertTrue(peak >= 40.0);
    }

    @Test
    public void testOneCompartmentDosesOnSchedule() {
        Model model = StockFlow.loadResource("models/one_compartment.json");
        Trace trace = StockFlow.simulate(model, RunSettings.defaults().setRepetitions(3));

        for (int d = 0; d < trace.draws(); d++) {
            assertEquals(100.0, trace.value("absorption", d, 0), 0.0);
            assertEquals(0.0, trace.value("absorption", d, 1), 0.0);
            assertEquals(100.0, trace.value("absorption", d, 12), 0.0);
            // the dose lands one step after absorption is recorded
            assertEquals(0.0, trace.value("amount", d, 0), 0.0);
            assertEquals(100.0, trace.value("amount", d, 1), 0.0);
            assertTrue(trace.metric("peak_concentration", d) >= 5.0);
        }
    }

    @Test
    public void testUrbanGrowthCouplesBothSectors() {
        Model model = StockFlow.loadResource("models/urban_growth.json");
        Trace trace = StockFlow.simulate(model, RunSettings.defaults().setRepetitions(1));

        assertEquals(50, trace.steps());
        // t=0: labor availability 17500 / 20000 = 0.875 feeds both lookup tables
        assertEquals(0.875, trace.value("business.labor_availability", 0, 0), 1e-12);
        assertEquals(0.6525, trace.value("business.labor_availability_multiplier", 0, 0), 1e-9);
        assertEquals(2.2525, trace.value("population.job_attractiveness_multiplier", 0, 0), 1e-9);
        assertEquals(1018.889, trace.value("business.structures", 0, 1), 1e-6);
        double people = 50000 + 50000 * 0.08 * 2.2525 + 50000 * 0.015 - 50000 * 0.08 - 50000 / 66.7;
        assertEquals(people, trace.value("population.population", 0, 1), 1e-6);
        for (int t = 0; t <= trace.steps(); t++) {
            double jobs = trace.value("business.jobs", 0, t);
            double labor = trace.value("population.labor_force", 0, t);
            assertEquals(labor / jobs, trace.value("business.labor_availability", 0, t), 1e-12);
            assertTrue(trace.value("business.structures", 0, t) > 0);
            assertTrue(trace.value("population.population", 0, t) > 0);
        }
    }

    @Test
    public void testCalibrateEliminationRate() {
        Model model = StockFlow.loadResource("models/one_compartment.json");
        Trace posterior = StockFlow.infer(model, List.of(Observation.of("trough_concentration", 0.1, 1.0)), false,
                InferenceSettings.defaults().setDraws(3000));

        assertEquals(Trace.Provenance.POSTERIOR, posterior.provenance());
        assertEquals(1.0, posterior.metricMean("trough_concentration"), 0.15);
    }

    @Test(expected = UncheckedIOException.class)
    public void testMissingFileIsAnIoFailure() {
        StockFlow.load(Path.of("does", "not", "exist.json"));
    }

    @Test
    public void testExplain() {
        String dump = StockFlow.explain(StockFlow.loadResource("models/tub.json")).dumpOrder();
        assertTrue(dump, dump.startsWith("Model tub"));
    }
}
