package com.dynamics.sfg.engine;

import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * The resolved, immutable evaluation plan of one model for one run.
 *
 * Every reference of the run (nested models flattened) gets an integer index
 * in declaration order. The per-step order lists the indices of flows,
 * variables and scalars so that every reference is evaluated after the
 * references it reads; stocks are not part of it because their value at step
 * {@code t} is carried over from {@code t-1}.
 *
 * Data layout follows a compressed sparse row scheme: {@code dependents} of
 * reference {@code i} are {@code dependentList[dependentOffset[i]] ..
 * dependentList[dependentOffset[i+1]-1]}.
 */
public final class EvaluationOrder {
    private final Model root;
    private final Reference[] refs;
    private final String[] names;
    private final Map<Reference, Integer> indexOf;
    private final Map<String, Integer> nameToIndex;

    private final int[] stepOrder;
    private final int[] initOrder;
    private final int[] metricOrder;
    private final int[] stocks;
    private final int[][] inflows;
    private final int[][] outflows;

    private final int[] dependentOffset;
    private final int[] dependentList;

    EvaluationOrder(Model root, Reference[] refs, String[] names, int[] stepOrder, int[] initOrder,
            int[] metricOrder, int[] stocks, int[][] inflows, int[][] outflows,
            int[] dependentOffset, int[] dependentList) {
        this.root = root;
        this.refs = refs;
        this.names = names;
        this.stepOrder = stepOrder;
        this.initOrder = initOrder;
        this.metricOrder = metricOrder;
        this.stocks = stocks;
        this.inflows = inflows;
        this.outflows = outflows;
        this.dependentOffset = dependentOffset;
        this.dependentList = dependentList;
        this.indexOf = new IdentityHashMap<>(refs.length * 2);
        this.nameToIndex = new HashMap<>(refs.length * 2);
        for (int i = 0; i < refs.length; i++) {
            indexOf.put(refs[i], i);
            nameToIndex.put(names[i], i);
        }
    }

    public Model root() {
        return root;
    }

    public int size() {
        return refs.length;
    }

    public Reference ref(int i) {
        return refs[i];
    }

    public RefKind kind(int i) {
        return refs[i].kind();
    }

    /** Qualified name relative to the run root. */
    public String name(int i) {
        return names[i];
    }

    /** Index of a reference, or -1 if it is not part of this run. */
    public int indexOf(Reference ref) {
        Integer i = indexOf.get(ref);
        return i == null ? -1 : i;
    }

    /** Resolves a qualified name to its index. */
    public int index(String name) {
        Integer i = nameToIndex.get(name);
        if (i == null)
            throw new IllegalArgumentException("Unknown reference: " + name);
        return i;
    }

    // Internal arrays are exposed as copies to keep the plan immutable.

    public int[] stepOrder() {
        return stepOrder.clone();
    }

    int stepOrderLength() {
        return stepOrder.length;
    }

    int stepAt(int k) {
        return stepOrder[k];
    }

    public int[] initOrder() {
        return initOrder.clone();
    }

    int initOrderLength() {
        return initOrder.length;
    }

    int initAt(int k) {
        return initOrder[k];
    }

    public int[] metricOrder() {
        return metricOrder.clone();
    }

    public int[] stocks() {
        return stocks.clone();
    }

    int stockCount() {
        return stocks.length;
    }

    int stockAt(int k) {
        return stocks[k];
    }

    int[] inflowsOf(int stock) {
        return inflows[stock];
    }

    int[] outflowsOf(int stock) {
        return outflows[stock];
    }

    public int dependentCount(int i) {
        return dependentOffset[i + 1] - dependentOffset[i];
    }

    public int dependent(int i, int k) {
        return dependentList[dependentOffset[i] + k];
    }

    public boolean isRecorded(int i) {
        return refs[i].kind().isRecorded();
    }

    public boolean isMetric(int i) {
        return refs[i].kind() == RefKind.METRIC;
    }
}
