package com.dynamics.sfg.util;

import com.dynamics.sfg.engine.EvaluationOrder;
import com.dynamics.sfg.engine.Trace;
import com.dynamics.sfg.io.ExprFormatter;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.List;

/**
 * Diagnostic utility for inspecting a resolved model.
 *
 * <p>
 * Generates human-readable text of the evaluation order and a Mermaid diagram
 * of the reference graph, optionally annotated with the final values of a
 * trace. The diagram is the input handed to the rendering collaborator.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and error reports. Allocates
 * freely; do <b>not</b> call it from inside a run.
 */
public final class GraphExplain {
    private final EvaluationOrder order;
    private final Trace trace;

    public GraphExplain(EvaluationOrder order) {
        this(order, null);
    }

    /** @param trace may be null; when set, nodes show their value at the last step of draw 0. */
    public GraphExplain(EvaluationOrder order, Trace trace) {
        this.order = order;
        this.trace = trace;
    }

    /**
     * Dumps the definition and the readers of a single reference.
     */
    public String explainReference(String name) {
        int idx = order.index(name);
        Reference r = order.ref(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Reference: ").append(name).append('\n')
                .append("  Kind: ").append(r.kind()).append('[').append(r.dim()).append("]\n");
        if (r.equation() != null)
            sb.append("  Equation: ").append(ExprFormatter.format(r.equation(), order.root())).append('\n');
        if (r.prior() != null)
            sb.append("  Prior: ").append(r.prior()).append('\n');
        if (r.kind() == RefKind.STOCK) {
            sb.append("  Init: ").append(ExprFormatter.format(r.init(), order.root())).append('\n');
            sb.append("  Inflows: ").append(names(r.inflows())).append('\n');
            sb.append("  Outflows: ").append(names(r.outflows())).append('\n');
        }
        if (r.min() != null)
            sb.append("  Min: ").append(ExprFormatter.format(r.min(), order.root())).append('\n');
        if (r.max() != null)
            sb.append("  Max: ").append(ExprFormatter.format(r.max(), order.root())).append('\n');
        if (r.doc() != null)
            sb.append("  Doc: ").append(r.doc()).append('\n');
        int cc = order.dependentCount(idx);
        sb.append("  Read by (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(order.name(order.dependent(idx, i)));
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the per-step evaluation order, the stock carry and the metrics.
     */
    public String dumpOrder() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Model ").append(order.root().name()).append(" (").append(order.size()).append(" references)\n");
        sb.append("Init:\n");
        for (int i : order.initOrder())
            sb.append("  ").append(order.name(i)).append('\n');
        for (int s : order.stocks())
            sb.append("  ").append(order.name(s)).append(".init\n");
        sb.append("Per step:\n");
        int k = 0;
        for (int i : order.stepOrder()) {
            sb.append("  [").append(k++).append("] ").append(order.name(i)).append(" (").append(order.kind(i))
                    .append(')');
            int cc = order.dependentCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(order.name(order.dependent(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        sb.append("Carry:\n");
        for (int s : order.stocks()) {
            Reference r = order.ref(s);
            sb.append("  ").append(order.name(s)).append(" += ").append(names(r.inflows()))
                    .append(" -= ").append(names(r.outflows())).append('\n');
        }
        sb.append("Metrics:\n");
        for (int i : order.metricOrder())
            sb.append("  ").append(order.name(i)).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram: one node per reference, shaped by
     * kind, an arrow from every reference to its readers, and labeled arrows
     * from flows into and out of stocks.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Declare nodes in declaration order
        for (int i = 0; i < order.size(); i++) {
            String label = order.name(i);
            if (trace != null && trace.draws() > 0 && trace.has(label))
                label += String.format("<br/><b>%.4f</b>", order.isMetric(i)
                        ? trace.metric(label, 0)
                        : trace.value(label, 0, trace.steps()));
            String id = sanitize(order.name(i));
            String[] shape = switch (order.kind(i)) {
                case STOCK -> new String[] { "[", "]" };
                case FLOW -> new String[] { "([", "])" };
                case METRIC -> new String[] { "{{", "}}" };
                case VARIABLE, SCALAR, TIME_REF -> new String[] { "(", ")" };
            };
            sb.append("  ").append(id).append(shape[0]).append('"').append(label).append('"').append(shape[1])
                    .append(";\n");
        }

        // 2. Read edges, then the stock wiring
        for (int i = 0; i < order.size(); i++) {
            int cc = order.dependentCount(i);
            for (int j = 0; j < cc; j++)
                sb.append("  ").append(sanitize(order.name(i))).append(" -.-> ")
                        .append(sanitize(order.name(order.dependent(i, j)))).append(";\n");
        }
        for (int s : order.stocks()) {
            Reference stock = order.ref(s);
            for (Reference f : stock.inflows())
                sb.append("  ").append(sanitize(order.root().nameOf(f))).append(" -- \"+\" --> ")
                        .append(sanitize(order.name(s))).append(";\n");
            for (Reference f : stock.outflows())
                sb.append("  ").append(sanitize(order.name(s))).append(" -- \"-\" --> ")
                        .append(sanitize(order.root().nameOf(f))).append(";\n");
        }
        return sb.toString();
    }

    private String names(List<Reference> refs) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < refs.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(order.root().nameOf(refs.get(i)));
        }
        return sb.append(']').toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
