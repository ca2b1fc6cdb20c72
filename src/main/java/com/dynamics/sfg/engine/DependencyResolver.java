package com.dynamics.sfg.engine;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.Exprs;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a model (with all nested models flattened) into an
 * {@link EvaluationOrder}.
 *
 * An edge {@code A -> B} means "A's equation (or clamp) reads B at the current
 * step". Only flows, variables and scalars take part in the per-step ordering:
 * stocks and time references are state supplied by the engine, lagged and
 * series reads look into the past, and metrics run after the whole run.
 * Sorting uses Kahn's algorithm with declaration order as the tie-break, so the
 * order is stable for a fixed graph.
 *
 * Every definition error found here names the offending references.
 */
@Log4j2
public final class DependencyResolver {
    private DependencyResolver() {
        // Utility class
    }

    public static EvaluationOrder resolve(Model root) {
        List<Reference> all = root.allReferences();
        int n = all.size();
        Reference[] refs = all.toArray(new Reference[0]);
        String[] names = new String[n];
        var indexOf = new IdentityHashMap<Reference, Integer>(n * 2);
        for (int i = 0; i < n; i++) {
            names[i] = root.nameOf(refs[i]);
            indexOf.put(refs[i], i);
        }

        checkComplete(refs, names);

        // 1. Collect live-read dependencies of every reference
        List<List<Integer>> deps = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Set<Reference> reads = new LinkedHashSet<>();
            Reference r = refs[i];
            for (Expr e : new Expr[] { r.equation(), r.init(), r.min(), r.max() })
                if (e != null) {
                    reads.addAll(Exprs.liveReads(e));
                    for (Reference past : Exprs.allReads(e))
                        requireInside(past, indexOf, names[i]);
                }
            List<Integer> d = new ArrayList<>(reads.size());
            for (Reference dep : reads)
                d.add(requireInside(dep, indexOf, names[i]));
            deps.add(d);
        }

        // 2. Per-step order over flows, variables and scalars
        BitSet perStep = new BitSet(n);
        for (int i = 0; i < n; i++)
            if (refs[i].kind().isEvaluatedPerStep())
                perStep.set(i);
        int[] stepOrder = sort(perStep, stepDeps(refs, deps, perStep), names, "Dependency cycle");

        // 3. Stock bookkeeping
        List<Integer> stockList = new ArrayList<>();
        int[][] inflows = new int[n][];
        int[][] outflows = new int[n][];
        for (int i = 0; i < n; i++) {
            if (refs[i].kind() != RefKind.STOCK)
                continue;
            stockList.add(i);
            inflows[i] = flowIndices(refs[i].inflows(), indexOf, names[i]);
            outflows[i] = flowIndices(refs[i].outflows(), indexOf, names[i]);
        }
        int[] stocks = stockList.stream().mapToInt(Integer::intValue).toArray();

        // 4. Stock inits: the static references they need, in step order
        int[] initOrder = initOrder(refs, names, deps, stocks, stepOrder);

        // 5. Metrics may read other metrics
        BitSet metrics = new BitSet(n);
        for (int i = 0; i < n; i++)
            if (refs[i].kind() == RefKind.METRIC)
                metrics.set(i);
        int[] metricOrder = sort(metrics, stepDeps(refs, deps, metrics), names, "Metric cycle");

        // 6. Dependents in CSR form (for diagnostics)
        int[] offsets = new int[n + 1];
        for (int i = 0; i < n; i++)
            for (int d : deps.get(i))
                offsets[d + 1]++;
        for (int i = 0; i < n; i++)
            offsets[i + 1] += offsets[i];
        int[] fill = offsets.clone();
        int[] dependents = new int[offsets[n]];
        for (int i = 0; i < n; i++)
            for (int d : deps.get(i))
                dependents[fill[d]++] = i;

        var order = new EvaluationOrder(root, refs, names, stepOrder, initOrder, metricOrder, stocks,
                inflows, outflows, offsets, dependents);
        if (log.isDebugEnabled()) {
            StringBuilder sb = new StringBuilder();
            for (int k : stepOrder)
                sb.append(names[k]).append(' ');
            log.debug("Resolved {} references for model {}, step order: {}", n, root.name(), sb);
        }
        return order;
    }

    private static void checkComplete(Reference[] refs, String[] names) {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < refs.length; i++) {
            Reference r = refs[i];
            boolean needsEquation = switch (r.kind()) {
                case FLOW, SCALAR, METRIC -> true;
                case VARIABLE -> r.prior() == null;
                case STOCK, TIME_REF -> false;
            };
            if (needsEquation && r.equation() == null)
                missing.add(names[i]);
        }
        if (!missing.isEmpty())
            throw new ModelDefinitionException("No equation bound for", missing);
    }

    private static int requireInside(Reference dep, Map<Reference, Integer> indexOf, String reader) {
        Integer idx = indexOf.get(dep);
        if (idx == null)
            throw new ModelDefinitionException("Equation reads a reference outside the model being run:",
                    reader, dep.qualifiedName());
        return idx;
    }

    private static int[] flowIndices(List<Reference> flows, Map<Reference, Integer> indexOf,
            String stock) {
        int[] out = new int[flows.size()];
        for (int k = 0; k < out.length; k++)
            out[k] = requireInside(flows.get(k), indexOf, stock);
        return out;
    }

    /** Restricts dependencies to edges between members of {@code nodes}. */
    private static List<List<Integer>> stepDeps(Reference[] refs, List<List<Integer>> deps, BitSet nodes) {
        List<List<Integer>> out = new ArrayList<>(refs.length);
        for (int i = 0; i < refs.length; i++) {
            List<Integer> d = new ArrayList<>();
            if (nodes.get(i))
                for (int dep : deps.get(i))
                    if (nodes.get(dep))
                        d.add(dep);
            out.add(d);
        }
        return out;
    }

    /**
     * Kahn's algorithm restricted to {@code nodes}, ready nodes taken in
     * declaration order.
     */
    private static int[] sort(BitSet nodes, List<List<Integer>> deps, String[] names, String what) {
        int n = deps.size();
        int[] inDegree = new int[n];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            dependents.add(new ArrayList<>());
        for (int i = nodes.nextSetBit(0); i >= 0; i = nodes.nextSetBit(i + 1)) {
            for (int d : deps.get(i)) {
                inDegree[i]++;
                dependents.get(d).add(i);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = nodes.nextSetBit(0); i >= 0; i = nodes.nextSetBit(i + 1))
            if (inDegree[i] == 0)
                ready.add(i);

        int[] order = new int[nodes.cardinality()];
        int k = 0;
        while (!ready.isEmpty()) {
            int cur = ready.poll();
            order[k++] = cur;
            for (int child : dependents.get(cur))
                if (--inDegree[child] == 0)
                    ready.add(child);
        }
        if (k != order.length)
            throw new ModelDefinitionException(what + " among", findCycle(nodes, deps, inDegree, names));
        return order;
    }

    /**
     * Every node left after Kahn's algorithm still has an unprocessed
     * dependency, so walking dependencies from any of them must revisit a node.
     */
    private static List<String> findCycle(BitSet nodes, List<List<Integer>> deps, int[] inDegree,
            String[] names) {
        int start = -1;
        for (int i = nodes.nextSetBit(0); i >= 0; i = nodes.nextSetBit(i + 1))
            if (inDegree[i] > 0) {
                start = i;
                break;
            }
        List<Integer> path = new ArrayList<>();
        int cur = start;
        while (!path.contains(cur)) {
            path.add(cur);
            int next = -1;
            for (int d : deps.get(cur))
                if (inDegree[d] > 0) {
                    next = d;
                    break;
                }
            cur = next;
        }
        List<String> cycle = new ArrayList<>();
        for (int i = path.indexOf(cur); i < path.size(); i++)
            cycle.add(names[path.get(i)]);
        return cycle;
    }

    private static int[] initOrder(Reference[] refs, String[] names, List<List<Integer>> deps, int[] stocks,
            int[] stepOrder) {
        BitSet needed = new BitSet(refs.length);
        ArrayDeque<Integer> work = new ArrayDeque<>();
        for (int s : stocks) {
            for (int d : deps.get(s)) {
                RefKind kind = refs[d].kind();
                if (kind == RefKind.STOCK || kind == RefKind.FLOW)
                    throw new ModelDefinitionException("A stock init cannot read a " + kind + ":",
                            names[s], names[d]);
                if (kind.isEvaluatedPerStep() && !needed.get(d)) {
                    needed.set(d);
                    work.add(d);
                }
            }
            while (!work.isEmpty()) {
                int cur = work.poll();
                for (int d : deps.get(cur)) {
                    RefKind kind = refs[d].kind();
                    if (kind == RefKind.STOCK || kind == RefKind.FLOW)
                        throw new ModelDefinitionException("A stock init depends (through "
                                + names[cur] + ") on a " + kind + ":", names[s], names[d]);
                    if (kind.isEvaluatedPerStep() && !needed.get(d)) {
                        needed.set(d);
                        work.add(d);
                    }
                }
            }
        }
        int[] out = new int[needed.cardinality()];
        int k = 0;
        for (int i : stepOrder)
            if (needed.get(i))
                out[k++] = i;
        return out;
    }
}
