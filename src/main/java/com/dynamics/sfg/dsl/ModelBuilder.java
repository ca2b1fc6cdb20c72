package com.dynamics.sfg.dsl;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.io.EquationParser;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Model Builder -- primary modeller-facing API.
 *
 * Building happens in two explicit phases:
 * <ol>
 * <li>Structure: declare references, nest sub-models and wire flows into
 * stocks. Each call registers immediately, so references exist (with their
 * owner and name) as soon as they are declared.</li>
 * <li>Binding: equations, clamps and inits are queued by the {@code bind*}
 * methods and applied in call order by {@link #build()}, after the whole
 * structure is known. Targets may be addressed by dotted name, including
 * references inside sub-models that were built elsewhere.</li>
 * </ol>
 *
 * <pre>
 * ModelBuilder b = ModelBuilder.create("tub").steps(5);
 * Reference in = b.flow("in");
 * Reference out = b.flow("out");
 * Reference level = b.stock("level");
 * b.chain(in, level, out);
 * b.bind(in, Eq.c(5)).bind(out, Eq.min(Eq.ref(level), Eq.c(2)));
 * Model tub = b.build();
 * </pre>
 *
 * Binding after {@link #build()} goes through {@link Model#bind(String, Expr)}.
 */
public final class ModelBuilder {
    private final Model model;
    private final List<Binding> bindings = new ArrayList<>();

    // Flag to prevent modification after building
    private boolean built;

    private ModelBuilder(String name) {
        this.model = new Model(name);
    }

    public static ModelBuilder create(String name) {
        return new ModelBuilder(name);
    }

    public ModelBuilder doc(String doc) {
        model.setDoc(doc);
        return this;
    }

    public ModelBuilder steps(int steps) {
        model.setSteps(steps);
        return this;
    }

    public ModelBuilder repetitions(int repetitions) {
        model.setRepetitions(repetitions);
        return this;
    }

    // ── Phase 1: structure ───────────────────────────────────────

    public Reference stock(String name) {
        return declare(name, RefKind.STOCK, 1);
    }

    public Reference stock(String name, double init) {
        return stock(name).setInit(Eq.c(init));
    }

    public Reference stock(String name, int dim, double... init) {
        Reference ref = declare(name, RefKind.STOCK, dim);
        if (init.length > 0)
            ref.setInit(Eq.vec(init));
        return ref;
    }

    public Reference flow(String name) {
        return declare(name, RefKind.FLOW, 1);
    }

    public Reference flow(String name, int dim) {
        return declare(name, RefKind.FLOW, dim);
    }

    /** A variable whose equation is bound later. */
    public Reference variable(String name) {
        return declare(name, RefKind.VARIABLE, 1);
    }

    public Reference variable(String name, int dim) {
        return declare(name, RefKind.VARIABLE, dim);
    }

    /** A fixed, user-tunable variable. */
    public Reference variable(String name, double value) {
        return variable(name).setEquation(Eq.c(value));
    }

    /** A fixed, user-tunable vector variable. */
    public Reference vector(String name, double... values) {
        return declare(name, RefKind.VARIABLE, values.length).setEquation(Eq.vec(values));
    }

    /** A free variable drawn from a prior. */
    public Reference variable(String name, Distribution prior) {
        return variable(name).setPrior(prior);
    }

    public Reference variable(String name, int dim, Distribution prior) {
        return variable(name, dim).setPrior(prior);
    }

    public Reference scalar(String name, double value) {
        return declare(name, RefKind.SCALAR, 1).setEquation(Eq.c(value));
    }

    public Reference timeRef(String name) {
        return declare(name, RefKind.TIME_REF, 1);
    }

    /** A post-run metric; its equation is applied with the other bindings. */
    public Reference metric(String name, Expr equation) {
        Reference ref = declare(name, RefKind.METRIC, 1);
        bind(ref, equation);
        return ref;
    }

    public Reference metric(String name, int dim, Expr equation) {
        Reference ref = declare(name, RefKind.METRIC, dim);
        bind(ref, equation);
        return ref;
    }

    /** Nests an existing model under {@code name}. */
    public ModelBuilder submodel(String name, Model sub) {
        checkNotBuilt();
        model.attach(name, sub);
        return this;
    }

    /**
     * Wires a chain such as {@code faucet >> level >> drain}: a flow followed
     * by a stock is an inflow of it, a stock followed by a flow drains into it.
     */
    public ModelBuilder chain(Reference first, Reference second, Reference... rest) {
        checkNotBuilt();
        List<Reference> all = new ArrayList<>(List.of(first, second));
        all.addAll(List.of(rest));
        for (int i = 0; i + 1 < all.size(); i++) {
            Reference a = all.get(i), b = all.get(i + 1);
            if (b.kind() == RefKind.STOCK && a.kind() != RefKind.STOCK)
                b.addInflow(a);
            else if (a.kind() == RefKind.STOCK && b.kind() != RefKind.STOCK)
                a.addOutflow(b);
            else
                throw new ModelDefinitionException(
                        "A chain must alternate flows and stocks:", a.qualifiedName(), b.qualifiedName());
        }
        return this;
    }

    /** {@code stock += flow}. */
    public ModelBuilder inflow(Reference stock, Reference flow) {
        checkNotBuilt();
        stock.addInflow(flow);
        return this;
    }

    /** {@code stock -= flow}. */
    public ModelBuilder outflow(Reference stock, Reference flow) {
        checkNotBuilt();
        stock.addOutflow(flow);
        return this;
    }

    /** Looks up a reference declared so far, including inside sub-models. */
    public Reference ref(String qualified) {
        return model.reference(qualified);
    }

    // ── Phase 2: binding (applied by build) ──────────────────────

    public ModelBuilder bind(Reference ref, Expr equation) {
        return queue(new Binding(ref, null, Slot.EQUATION, equation, null));
    }

    public ModelBuilder bind(String qualified, Expr equation) {
        return queue(new Binding(null, qualified, Slot.EQUATION, equation, null));
    }

    /** Binds equation text; names resolve against the finished structure. */
    public ModelBuilder bind(String qualified, String equationText) {
        return queue(new Binding(null, qualified, Slot.EQUATION, null, equationText));
    }

    public ModelBuilder init(Reference stock, Expr init) {
        return queue(new Binding(stock, null, Slot.INIT, init, null));
    }

    public ModelBuilder clamp(Reference flow, Expr min, Expr max) {
        if (min != null)
            queue(new Binding(flow, null, Slot.MIN, min, null));
        if (max != null)
            queue(new Binding(flow, null, Slot.MAX, max, null));
        return this;
    }

    public ModelBuilder min(Reference flow, Expr min) {
        return clamp(flow, min, null);
    }

    public ModelBuilder max(Reference flow, Expr max) {
        return clamp(flow, null, max);
    }

    private ModelBuilder queue(Binding binding) {
        checkNotBuilt();
        bindings.add(binding);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Applies every queued binding in order, validating each, then freezes the
     * structure. Missing equations and dependency cycles are reported when the
     * model is first resolved for a run, since a sub-model may legitimately be
     * completed by its parent.
     */
    public Model build() {
        checkNotBuilt();
        built = true;
        for (Binding b : bindings) {
            Reference target = b.ref != null ? b.ref : model.reference(b.qualified);
            Expr expr = b.expr != null ? b.expr : EquationParser.parse(b.text, model);
            switch (b.slot) {
                case EQUATION -> target.setEquation(expr);
                case INIT -> target.setInit(expr);
                case MIN -> target.setMin(expr);
                case MAX -> target.setMax(expr);
            }
        }
        bindings.clear();
        model.freeze();
        return model;
    }

    private Reference declare(String name, RefKind kind, int dim) {
        checkNotBuilt();
        return model.declare(name, kind, dim);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Model already built");
    }

    private enum Slot {
        EQUATION, INIT, MIN, MAX
    }

    private record Binding(Reference ref, String qualified, Slot slot, Expr expr, String text) {
    }
}
