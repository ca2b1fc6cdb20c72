package com.dynamics.sfg.node;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.io.EquationParser;
import com.dynamics.sfg.io.ExprFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * A hierarchical namespace of {@link Reference}s and nested sub-models.
 *
 * Members are kept in declaration order, which is also the tie-break order of
 * the dependency resolver. Names are unique within one model across both
 * references and sub-models; nesting is addressed with dotted qualified names
 * such as {@code business.labor_availability}.
 *
 * Structure (members and wiring) can only change until {@link #freeze()}.
 * Equations, priors, inits and clamps may be rebound later, but never while a
 * run on this model is in flight: the engines read the definition without
 * locking.
 */
public final class Model {
    /** Name of the time leaf in equation text; unavailable as a reference name. */
    public static final String TIME_NAME = "t";
    public static final String INIT_SUFFIX = ".init";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private String doc;
    private int steps = 10;
    private int repetitions = 1;

    private Model parent;
    private String attributeName;
    private final Map<String, Object> members = new LinkedHashMap<>();
    private boolean frozen;
    private volatile long revision;

    public Model(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public String doc() {
        return doc;
    }

    public Model setDoc(String doc) {
        this.doc = doc;
        return this;
    }

    /** Default last time step for runs of this model (runs cover 0..steps). */
    public int steps() {
        return steps;
    }

    public Model setSteps(int steps) {
        if (steps < 0)
            throw new IllegalArgumentException("steps must be >= 0, got " + steps);
        this.steps = steps;
        return this;
    }

    /** Default number of repetitions for runs of this model. */
    public int repetitions() {
        return repetitions;
    }

    public Model setRepetitions(int repetitions) {
        if (repetitions < 1)
            throw new IllegalArgumentException("repetitions must be >= 1, got " + repetitions);
        this.repetitions = repetitions;
        return this;
    }

    public Model parent() {
        return parent;
    }

    /** Name under which this model is attached to its parent, or null for a root. */
    public String attributeName() {
        return attributeName;
    }

    /** Qualification prefix from the outermost model, e.g. {@code "tub."}; empty for a root. */
    public String path() {
        return parent == null ? "" : parent.path() + attributeName + ".";
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Freezes the structure of this model and every nested model. */
    public void freeze() {
        frozen = true;
        for (Object m : members.values())
            if (m instanceof Model sub)
                sub.freeze();
    }

    /** Incremented on every equation, prior or wiring change in this model or below. */
    public long revision() {
        return revision;
    }

    void touch() {
        revision++;
        if (parent != null)
            parent.touch();
    }

    // ── Structural registration ──────────────────────────────────

    /**
     * Declares a reference. Re-declaring a name with the same kind and
     * dimension returns the existing reference (so its equation can be
     * reassigned); any other clash is a definition error.
     */
    public Reference declare(String refName, RefKind kind, int dim) {
        checkNotFrozen();
        checkName(refName);
        Object existing = members.get(refName);
        if (existing instanceof Reference r) {
            if (r.kind() != kind || r.dim() != dim)
                throw new ModelDefinitionException("Name already bound to a " + r.kind() + "[" + r.dim()
                        + "], cannot redeclare as " + kind + "[" + dim + "]:", r.qualifiedName());
            return r;
        }
        if (existing != null)
            throw new ModelDefinitionException("Name already bound to a sub-model:", path() + refName);
        var ref = new Reference(this, refName, kind, dim);
        members.put(refName, ref);
        touch();
        return ref;
    }

    /** Nests {@code sub} under this model as {@code attrName}. */
    public Model attach(String attrName, Model sub) {
        checkNotFrozen();
        checkName(attrName);
        if (members.containsKey(attrName))
            throw new ModelDefinitionException("Name already bound in model " + name + ":", path() + attrName);
        if (sub.parent != null)
            throw new ModelDefinitionException("Model is already nested under " + sub.parent.name + ":",
                    sub.path());
        for (Model m = this; m != null; m = m.parent)
            if (m == sub)
                throw new ModelDefinitionException("Nesting would create a cycle:", attrName);
        sub.parent = this;
        sub.attributeName = attrName;
        members.put(attrName, sub);
        touch();
        return this;
    }

    private void checkName(String n) {
        if (n == null || !IDENTIFIER.matcher(n).matches())
            throw new ModelDefinitionException("Invalid name '" + n + "' in model " + name);
        if (TIME_NAME.equals(n))
            throw new ModelDefinitionException("'" + TIME_NAME + "' is reserved for time:", path() + n);
    }

    private void checkNotFrozen() {
        if (frozen)
            throw new IllegalStateException("Model " + name + " already built");
    }

    // ── Lookup ───────────────────────────────────────────────────

    /** Resolves a dotted name relative to this model, or null. */
    public Reference find(String qualified) {
        Object member = member(qualified);
        return member instanceof Reference r ? r : null;
    }

    /**
     * Resolves a dotted name relative to this model.
     *
     * @throws IllegalArgumentException if no reference has that name.
     */
    public Reference reference(String qualified) {
        Reference r = find(qualified);
        if (r == null)
            throw new IllegalArgumentException("Unknown reference: " + qualified);
        return r;
    }

    /** Resolves a dotted sub-model name relative to this model, or null. */
    public Model submodel(String qualified) {
        Object member = member(qualified);
        return member instanceof Model m ? m : null;
    }

    private Object member(String qualified) {
        Model scope = this;
        String[] parts = qualified.split("\\.");
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = scope.members.get(parts[i]);
            if (!(next instanceof Model m))
                return null;
            scope = m;
        }
        return scope.members.get(parts[parts.length - 1]);
    }

    /** Dotted name of {@code ref} relative to this model, or null if it lives outside. */
    public String nameOf(Reference ref) {
        StringBuilder prefix = new StringBuilder();
        for (Model m = ref.owner(); m != null; m = m.parent) {
            if (m == this)
                return prefix + ref.name();
            prefix.insert(0, m.attributeName + ".");
        }
        return null;
    }

    /** Own references in declaration order. */
    public List<Reference> references() {
        List<Reference> out = new ArrayList<>();
        for (Object m : members.values())
            if (m instanceof Reference r)
                out.add(r);
        return out;
    }

    /** Directly nested models by attribute name, in declaration order. */
    public Map<String, Model> submodels() {
        Map<String, Model> out = new LinkedHashMap<>();
        for (var e : members.entrySet())
            if (e.getValue() instanceof Model m)
                out.put(e.getKey(), m);
        return Collections.unmodifiableMap(out);
    }

    /** Every reference of this model and all nested models, depth-first in declaration order. */
    public List<Reference> allReferences() {
        List<Reference> out = new ArrayList<>();
        collect(out);
        return out;
    }

    private void collect(List<Reference> out) {
        for (Object m : members.values()) {
            if (m instanceof Reference r)
                out.add(r);
            else
                ((Model) m).collect(out);
        }
    }

    public List<Reference> allMetrics() {
        List<Reference> out = new ArrayList<>();
        for (Reference r : allReferences())
            if (r.kind() == RefKind.METRIC)
                out.add(r);
        return out;
    }

    // ── Equation binding (second phase) ──────────────────────────

    /** Binds an equation to a reference addressed by dotted name. Last write wins. */
    public Reference bind(String qualified, Expr equation) {
        return reference(qualified).setEquation(equation);
    }

    /** Binds equation text, resolving names relative to this model. */
    public Reference bind(String qualified, String equationText) {
        return bind(qualified, EquationParser.parse(equationText, this));
    }

    public Reference bindPrior(String qualified, Distribution prior) {
        return reference(qualified).setPrior(prior);
    }

    // ── Calibration surface ──────────────────────────────────────

    /**
     * Qualified names of the tunable parameters: variables with a prior or a
     * literal value, and literal stock inits (suffixed {@code .init}).
     */
    public List<String> freeRefs(boolean recursive) {
        List<String> out = new ArrayList<>();
        for (Reference r : recursive ? allReferences() : references()) {
            if (r.isFree())
                out.add(nameOf(r));
            else if (r.hasFreeInit())
                out.add(nameOf(r) + INIT_SUFFIX);
        }
        return out;
    }

    /**
     * Snapshot of every free reference (recursively) as canonical text: a
     * number, a vector literal or a prior such as {@code Uniform(0.0, 1.0)}.
     */
    public SortedMap<String, String> config() {
        SortedMap<String, String> out = new TreeMap<>();
        for (Reference r : allReferences()) {
            if (r.isFree())
                out.put(nameOf(r), r.prior() != null
                        ? r.prior().toString()
                        : ExprFormatter.format(r.equation(), this));
            else if (r.hasFreeInit())
                out.put(nameOf(r) + INIT_SUFFIX, ExprFormatter.format(r.init(), this));
        }
        return out;
    }

    /** Applies a snapshot produced by {@link #config()} (possibly edited). */
    public void applyConfig(Map<String, String> config) {
        for (var e : config.entrySet()) {
            String key = e.getKey();
            String text = e.getValue();
            if (key.endsWith(INIT_SUFFIX) && find(key) == null) {
                Reference stock = reference(key.substring(0, key.length() - INIT_SUFFIX.length()));
                stock.setInit(EquationParser.parse(text, this));
                continue;
            }
            Reference ref = reference(key);
            Distribution prior = EquationParser.parsePrior(text);
            if (prior != null)
                ref.setPrior(prior);
            else
                ref.setEquation(EquationParser.parse(text, this));
        }
    }

    @Override
    public String toString() {
        return "Model(" + name + ", " + members.size() + " members)";
    }
}
