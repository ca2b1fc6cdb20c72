package com.dynamics.sfg.util;

import com.dynamics.sfg.dsl.Eq;
import com.dynamics.sfg.dsl.ModelBuilder;
import com.dynamics.sfg.engine.SimulationEngine;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import org.junit.Test;
import static org.junit.Assert.*;

public class GraphExplainTest {

    private static Model tub() {
        ModelBuilder b = ModelBuilder.create("tub");
        Reference faucet = b.flow("faucet");
        Reference drain = b.flow("drain");
        Reference level = b.stock("level");
        b.chain(faucet, level, drain);
        b.bind(faucet, Eq.c(5)).bind(drain, Eq.min(Eq.ref(level), Eq.c(2)));
        b.metric("final_level", Eq.index(level, -1));
        return b.build();
    }

    @Test
    public void testExplainReference() {
        SimulationEngine engine = new SimulationEngine(tub());
        String text = new GraphExplain(engine.order()).explainReference("drain");

        assertTrue(text, text.contains("Reference: drain"));
        assertTrue(text, text.contains("Kind: FLOW[1]"));
        assertTrue(text, text.contains("Equation: min(level, 2.0)"));
        assertTrue(text, text.contains("Read by (0)"));

        String stock = new GraphExplain(engine.order()).explainReference("level");
        assertTrue(stock, stock.contains("Inflows: [faucet]"));
        assertTrue(stock, stock.contains("Outflows: [drain]"));
        assertTrue(stock, stock.contains("Read by (1): drain"));
    }

    @Test
    public void testDumpOrder() {
        String dump = new GraphExplain(new SimulationEngine(tub()).order()).dumpOrder();

        assertTrue(dump, dump.startsWith("Model tub (4 references)"));
        assertTrue(dump, dump.contains("level.init"));
        assertTrue(dump, dump.contains("[0] faucet (FLOW)"));
        assertTrue(dump, dump.contains("level += [faucet] -= [drain]"));
        assertTrue(dump, dump.contains("Metrics:\n  final_level"));
    }

    @Test
    public void testMermaidShowsKindsReadsAndWiring() {
        SimulationEngine engine = new SimulationEngine(tub());
        Trace trace = engine.simulate(5);
        String mermaid = new GraphExplain(engine.order(), trace).toMermaid();

        assertTrue(mermaid, mermaid.startsWith("graph LR;"));
        assertTrue(mermaid, mermaid.contains("level[\"level<br/><b>"));
        assertTrue(mermaid, mermaid.contains("faucet([\"faucet"));
        assertTrue(mermaid, mermaid.contains("final_level{{\"final_level"));
        assertTrue(mermaid, mermaid.contains("level -.-> drain;"));
        assertTrue(mermaid, mermaid.contains("faucet -- \"+\" --> level;"));
        assertTrue(mermaid, mermaid.contains("level -- \"-\" --> drain;"));
    }
}
