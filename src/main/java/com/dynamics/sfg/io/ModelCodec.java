package com.dynamics.sfg.io;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.RefKind;
import com.dynamics.sfg.node.Reference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;

/**
 * Converts models to and from {@link ModelDefinition} documents, and those
 * documents to and from JSON.
 *
 * Loading is two-phase like {@link com.dynamics.sfg.dsl.ModelBuilder}: the
 * whole structure (references, nesting, wiring) is registered first, then
 * every equation, init, clamp and prior is parsed against the finished
 * structure, so forward and cross-model references resolve.
 */
@Log4j2
public final class ModelCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ModelCodec() {
        // Utility class
    }

    // ── Model -> definition ──────────────────────────────────────

    public static ModelDefinition toDefinition(Model model) {
        return toDefinition(model, model);
    }

    private static ModelDefinition toDefinition(Model model, Model root) {
        ModelDefinition def = new ModelDefinition();
        def.setName(model.name());
        def.setDoc(model.doc());
        def.setSteps(model.steps());
        def.setRepetitions(model.repetitions());

        List<ModelDefinition.ReferenceDef> refs = new ArrayList<>();
        for (Reference r : model.references())
            refs.add(toDefinition(r, root));
        def.setReferences(refs);

        Map<String, ModelDefinition> subs = new LinkedHashMap<>();
        for (var e : model.submodels().entrySet())
            subs.put(e.getKey(), toDefinition(e.getValue(), root));
        def.setModels(subs);
        return def;
    }

    private static ModelDefinition.ReferenceDef toDefinition(Reference r, Model root) {
        var rd = new ModelDefinition.ReferenceDef();
        rd.setName(r.name());
        rd.setKind(r.kind().name());
        rd.setDoc(r.doc());
        if (r.dim() != 1)
            rd.setDim(r.dim());
        rd.setEquation(text(r.equation(), root));
        rd.setMin(text(r.min(), root));
        rd.setMax(text(r.max(), root));
        if (r.prior() != null)
            rd.setPrior(r.prior().toString());
        if (r.kind() == RefKind.STOCK) {
            if (!(r.init() instanceof Expr.Constant c && c.dim() == 1 && c.value(0) == 0.0))
                rd.setInit(text(r.init(), root));
            rd.setInflows(names(r.inflows(), root));
            rd.setOutflows(names(r.outflows(), root));
        }
        return rd;
    }

    private static String text(Expr e, Model root) {
        return e == null ? null : ExprFormatter.format(e, root);
    }

    private static List<String> names(List<Reference> refs, Model root) {
        List<String> out = new ArrayList<>(refs.size());
        for (Reference r : refs) {
            String n = root.nameOf(r);
            if (n == null)
                throw new ModelDefinitionException("Wiring leaves the model being serialized:", r.qualifiedName());
            out.add(n);
        }
        return out;
    }

    // ── Definition -> model ──────────────────────────────────────

    /**
     * Builds and freezes a model from a definition.
     *
     * @throws ModelDefinitionException if the document is not a valid model.
     */
    public static Model fromDefinition(ModelDefinition def) {
        if (def.getName() == null)
            throw new ModelDefinitionException("Model definition needs a name");
        // 1. Structure
        Model root = new Model(def.getName());
        List<Pending> pending = new ArrayList<>();
        declare(root, def, pending);

        // 2. Wiring
        for (Pending p : pending) {
            var rd = p.def();
            if (rd.getInflows() != null)
                for (String flow : rd.getInflows())
                    p.ref().addInflow(lookup(root, flow, p.ref()));
            if (rd.getOutflows() != null)
                for (String flow : rd.getOutflows())
                    p.ref().addOutflow(lookup(root, flow, p.ref()));
        }

        // 3. Bindings
        for (Pending p : pending) {
            var rd = p.def();
            Reference ref = p.ref();
            if (rd.getEquation() != null)
                ref.setEquation(EquationParser.parse(rd.getEquation(), root));
            if (rd.getPrior() != null) {
                Distribution prior = EquationParser.parsePrior(rd.getPrior());
                if (prior == null)
                    throw new ModelDefinitionException("Not a prior: '" + rd.getPrior() + "' on",
                            ref.qualifiedName());
                ref.setPrior(prior);
            }
            if (rd.getInit() != null)
                ref.setInit(EquationParser.parse(rd.getInit(), root));
            if (rd.getMin() != null)
                ref.setMin(EquationParser.parse(rd.getMin(), root));
            if (rd.getMax() != null)
                ref.setMax(EquationParser.parse(rd.getMax(), root));
        }
        root.freeze();
        log.debug("Loaded model {} with {} references", root.name(), pending.size());
        return root;
    }

    private record Pending(Reference ref, ModelDefinition.ReferenceDef def) {
    }

    private static void declare(Model model, ModelDefinition def, List<Pending> pending) {
        if (def.getDoc() != null)
            model.setDoc(def.getDoc());
        if (def.getSteps() != null)
            model.setSteps(def.getSteps());
        if (def.getRepetitions() != null)
            model.setRepetitions(def.getRepetitions());
        if (def.getReferences() != null) {
            for (var rd : def.getReferences()) {
                RefKind kind = kind(rd, model);
                Reference ref = model.declare(rd.getName(), kind, rd.getDim() == null ? 1 : rd.getDim());
                if (rd.getDoc() != null)
                    ref.setDoc(rd.getDoc());
                pending.add(new Pending(ref, rd));
            }
        }
        if (def.getModels() != null) {
            for (var e : def.getModels().entrySet()) {
                ModelDefinition subDef = e.getValue();
                Model sub = new Model(subDef.getName() != null ? subDef.getName() : e.getKey());
                model.attach(e.getKey(), sub);
                declare(sub, subDef, pending);
            }
        }
    }

    private static RefKind kind(ModelDefinition.ReferenceDef rd, Model model) {
        if (rd.getKind() == null)
            throw new ModelDefinitionException("Missing kind for", model.path() + rd.getName());
        try {
            return RefKind.valueOf(rd.getKind().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ModelDefinitionException("Unknown kind '" + rd.getKind() + "' for",
                    model.path() + rd.getName());
        }
    }

    private static Reference lookup(Model root, String name, Reference stock) {
        Reference r = root.find(name);
        if (r == null)
            throw new ModelDefinitionException("Unknown flow '" + name + "' wired to", stock.qualifiedName());
        return r;
    }

    // ── JSON ─────────────────────────────────────────────────────

    public static String toJson(Model model) {
        try {
            return MAPPER.writeValueAsString(toDefinition(model));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize model " + model.name(), e);
        }
    }

    public static Model fromJson(String json) {
        try {
            return fromDefinition(MAPPER.readValue(json, ModelDefinition.class));
        } catch (IOException e) {
            throw new ModelDefinitionException("Malformed model definition: " + e.getMessage());
        }
    }

    public static Model read(Path path) throws IOException {
        return fromDefinition(MAPPER.readValue(Files.readString(path), ModelDefinition.class));
    }

    public static void write(Model model, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), toDefinition(model));
    }

    /** Loads a definition bundled on the classpath, e.g. {@code models/tub.json}. */
    public static Model readResource(String resource) throws IOException {
        try (InputStream in = ModelCodec.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return fromDefinition(MAPPER.readValue(in, ModelDefinition.class));
        }
    }
}
