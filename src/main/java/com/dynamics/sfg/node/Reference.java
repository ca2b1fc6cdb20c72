package com.dynamics.sfg.node;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.Exprs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The atomic graph node: a named, typed slot owned by exactly one
 * {@link Model}.
 *
 * A reference is a tagged union over {@link RefKind}. Which attributes are
 * meaningful depends on the kind:
 * <ul>
 * <li>STOCK: {@code init} and the registered inflows/outflows.</li>
 * <li>FLOW: {@code equation} plus optional {@code min}/{@code max} clamps.</li>
 * <li>VARIABLE: {@code equation} or a {@code prior} (never both).</li>
 * <li>METRIC: {@code equation} over recorded series.</li>
 * <li>SCALAR: a literal {@code equation}.</li>
 * <li>TIME_REF: nothing; it reads as the current step.</li>
 * </ul>
 * Setters validate against the kind and raise {@link ModelDefinitionException}
 * with the qualified name of the reference. Structure is fixed once the owning
 * model is built; equations, priors, inits and clamps may be reassigned before
 * a run (last write wins).
 */
public final class Reference {
    private final RefKind kind;
    private final int dim;
    private final String name;
    private final Model owner;

    private Expr equation;
    private Expr init;
    private Expr min, max;
    private Distribution prior;
    private String doc;

    // Stock wiring
    private final List<Reference> inflows = new ArrayList<>();
    private final List<Reference> outflows = new ArrayList<>();

    // Flow side of the wiring: at most one stock per direction
    private Reference inflowOf;
    private Reference outflowOf;

    Reference(Model owner, String name, RefKind kind, int dim) {
        if (dim < 1)
            throw new ModelDefinitionException("Dimension must be >= 1, got " + dim + " for", name);
        this.owner = owner;
        this.name = name;
        this.kind = kind;
        this.dim = dim;
        if (kind == RefKind.STOCK)
            this.init = new Expr.Constant(new double[] { 0.0 });
    }

    public String name() {
        return name;
    }

    public Model owner() {
        return owner;
    }

    public RefKind kind() {
        return kind;
    }

    public int dim() {
        return dim;
    }

    /** Dotted name from the outermost enclosing model. */
    public String qualifiedName() {
        return owner.path() + name;
    }

    public Expr equation() {
        return equation;
    }

    public Expr init() {
        return init;
    }

    public Expr min() {
        return min;
    }

    public Expr max() {
        return max;
    }

    public Distribution prior() {
        return prior;
    }

    public String doc() {
        return doc;
    }

    public Reference setDoc(String doc) {
        this.doc = doc;
        return this;
    }

    public List<Reference> inflows() {
        return Collections.unmodifiableList(inflows);
    }

    public List<Reference> outflows() {
        return Collections.unmodifiableList(outflows);
    }

    /** A Variable with a prior or a literal value, exposed to calibration. */
    public boolean isFree() {
        return kind == RefKind.VARIABLE && (prior != null || equation instanceof Expr.Constant);
    }

    /** A Stock whose init is a literal, exposed to calibration as {@code <name>.init}. */
    public boolean hasFreeInit() {
        return kind == RefKind.STOCK && init instanceof Expr.Constant;
    }

    // ── Equation binding ─────────────────────────────────────────

    public Reference setEquation(Expr expr) {
        String qn = qualifiedName();
        switch (kind) {
            case STOCK -> throw new ModelDefinitionException(
                    "Stocks change only through flows; set an init instead on", qn);
            case TIME_REF -> throw new ModelDefinitionException("A time reference has no equation:", qn);
            case SCALAR -> {
                if (!(expr instanceof Expr.Constant))
                    throw new ModelDefinitionException("A scalar must be a literal constant:", qn);
            }
            default -> {
            }
        }
        validate(expr, qn);
        this.equation = expr;
        this.prior = null;
        owner.touch();
        return this;
    }

    public Reference setPrior(Distribution prior) {
        if (kind != RefKind.VARIABLE)
            throw new ModelDefinitionException("Only variables take priors, not " + kind + ":", qualifiedName());
        this.prior = prior;
        this.equation = null;
        owner.touch();
        return this;
    }

    public Reference setInit(Expr init) {
        String qn = qualifiedName();
        if (kind != RefKind.STOCK)
            throw new ModelDefinitionException("Only stocks have an init, not " + kind + ":", qn);
        validate(init, qn);
        if (Exprs.contains(init, Expr.Kind.TIME) || Exprs.contains(init, Expr.Kind.LAG))
            throw new ModelDefinitionException("A stock init cannot depend on time:", qn);
        this.init = init;
        owner.touch();
        return this;
    }

    public Reference setMin(Expr min) {
        checkClamp();
        if (min != null)
            validate(min, qualifiedName());
        this.min = min;
        owner.touch();
        return this;
    }

    public Reference setMax(Expr max) {
        checkClamp();
        if (max != null)
            validate(max, qualifiedName());
        this.max = max;
        owner.touch();
        return this;
    }

    private void checkClamp() {
        if (kind != RefKind.FLOW)
            throw new ModelDefinitionException("Only flows can be clamped, not " + kind + ":", qualifiedName());
    }

    private void validate(Expr expr, String qn) {
        int d = Exprs.dim(expr, qn);
        if (d != 1 && d != dim)
            throw new ModelDefinitionException("Equation has dimension " + d + " but the reference declares "
                    + dim + ":", qn);
        Exprs.walk(expr, e -> {
            Reference past = switch (e.kind()) {
                case LAG -> ((Expr.Lag) e).ref();
                case SERIES_INDEX -> ((Expr.SeriesIndex) e).ref();
                case SERIES_REDUCE -> ((Expr.SeriesReduce) e).ref();
                default -> null;
            };
            if (past != null && past.kind == RefKind.METRIC)
                throw new ModelDefinitionException("A metric has no time series to look back into:", qn,
                        past.qualifiedName());
        });
        if (kind != RefKind.METRIC) {
            if (Exprs.contains(expr, Expr.Kind.SERIES_INDEX) || Exprs.contains(expr, Expr.Kind.SERIES_REDUCE))
                throw new ModelDefinitionException("Series operations are only allowed in metrics:", qn);
            for (Reference r : Exprs.allReads(expr))
                if (r.kind == RefKind.METRIC)
                    throw new ModelDefinitionException("Metrics are post-run values and cannot feed a "
                            + kind + ":", qn, r.qualifiedName());
        }
    }

    // ── Wiring ───────────────────────────────────────────────────

    /** Registers {@code flow} as an inflow of this stock. */
    public Reference addInflow(Reference flow) {
        checkWiring(flow);
        if (flow.inflowOf != null)
            throw new ModelDefinitionException("Flow is already an inflow of " + flow.inflowOf.qualifiedName()
                    + ":", flow.qualifiedName());
        flow.inflowOf = this;
        inflows.add(flow);
        owner.touch();
        return this;
    }

    /** Registers {@code flow} as an outflow of this stock. */
    public Reference addOutflow(Reference flow) {
        checkWiring(flow);
        if (flow.outflowOf != null)
            throw new ModelDefinitionException("Flow is already an outflow of " + flow.outflowOf.qualifiedName()
                    + ":", flow.qualifiedName());
        flow.outflowOf = this;
        outflows.add(flow);
        owner.touch();
        return this;
    }

    private void checkWiring(Reference flow) {
        if (kind != RefKind.STOCK)
            throw new ModelDefinitionException("Flows can only be wired into stocks, not " + kind + ":",
                    qualifiedName());
        if (!flow.kind.canFlow())
            throw new ModelDefinitionException("A " + flow.kind + " cannot act as a flow:", flow.qualifiedName());
        if (flow.dim != 1 && flow.dim != dim)
            throw new ModelDefinitionException("Flow dimension " + flow.dim + " does not match stock dimension "
                    + dim + ":", flow.qualifiedName(), qualifiedName());
    }

    @Override
    public String toString() {
        return kind + "(" + qualifiedName() + ")";
    }
}
