package com.jointcalc.pipeline;

import static com.jointcalc.model.Fields.*;

import com.jointcalc.api.Node;
import com.jointcalc.api.ScalarValue;
import com.jointcalc.api.StabilizationListener;
import com.jointcalc.dsl.GraphBuilder;
import com.jointcalc.engine.GraphContext;
import com.jointcalc.engine.StabilizationEngine;
import com.jointcalc.engine.StabilizationException;
import com.jointcalc.io.CalculationConfig;
import com.jointcalc.model.DerivedState;
import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.JointError;
import com.jointcalc.model.JointResult;
import com.jointcalc.model.JointSpec;
import com.jointcalc.model.Stage;
import com.jointcalc.model.StrengthBasis;
import com.jointcalc.model.SurfaceCriterionResult;
import com.jointcalc.node.BooleanNode;
import com.jointcalc.node.ScalarCalcNode;
import com.jointcalc.node.ScalarSourceNode;
import com.jointcalc.util.CompositeStabilizationListener;
import com.jointcalc.util.GraphExplain;
import com.jointcalc.util.StageTraceListener;
import com.jointcalc.vdi.LoadDistribution;
import com.jointcalc.vdi.Preload;
import com.jointcalc.vdi.Resilience;
import com.jointcalc.vdi.StressEvaluator;
import com.jointcalc.vdi.SurfaceCriterion;
import com.jointcalc.vdi.ThreadGeometry;
import com.jointcalc.vdi.WorkingLoad;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * The VDI 2230 joint pipeline wired as a dependency graph.
 *
 * <p>
 * Every scalar input of a {@link JointSpec} is a source node named after its
 * field (see {@link com.jointcalc.model.Fields}); every derived quantity is a
 * calculation node calling one stage function. After
 * {@link #update(String, double)} only the stages downstream of the changed
 * input are re-run by {@link #recompute()}: a new operating load re-derives
 * forces, stress and torque but leaves both resiliences untouched.
 *
 * <p>
 * A failed evaluation leaves the graph usable. The failing node is marked for
 * re-evaluation, so correcting the offending input and recomputing yields a
 * fresh result.
 *
 * <p>
 * Not thread-safe. Use one instance per thread.
 */
@Log4j2
public final class JointGraph {
    public static final String AS = "As";
    public static final String PHI_N = "PhiN";
    public static final String DELTA_BOLT = "deltaBolt";
    public static final String DELTA_P = "deltaP";
    public static final String PHI = "Phi";
    public static final String OPERATING_FA = "FA";
    public static final String OPERATING_FZ = "FZ";
    public static final String EMBED_LOSS = "F_embed_loss";
    public static final String FV_MIN = "FV_min";
    public static final String FV_ASSEMBLY = "FV_assembly";
    public static final String FV = "FV";
    public static final String MA = "MA";
    public static final String FSB = "FSB";
    public static final String FKB = "FKB";
    public static final String SIGMA = "sigma_bolt";
    public static final String UTILIZATION = "utilization";
    public static final String USE_UTS = "useUts";
    public static final String STRENGTH_BASIS = "strengthBasis";
    public static final String FZ_FROM_LOAD = "fzFromLoad";
    public static final String SURFACE_AXIAL = "surfaceAxial";
    public static final String SURFACE_TENSILE = "surfaceTensile";
    public static final String SURFACE_SHEAR = "surfaceShear";
    public static final String SURFACE_COMBINED = "surfaceCombined";
    public static final String PRELOAD_MARGIN = "preloadMargin";
    public static final String CLAMP_LOSS = "clampLoss";
    public static final String UTILIZATION_OVERLOAD = "utilizationOverload";
    public static final String SURFACE_FAILURE = "surfaceFailure";
    public static final String OVERLOAD = "overload";
    public static final String PRELOAD_SHORTFALL = "preloadShortfall";

    private final String name;
    private final CalculationConfig config;
    private final GraphContext context;
    private final StabilizationEngine engine;
    private final Map<String, ScalarSourceNode> inputs = new LinkedHashMap<>();
    private final Map<String, Stage> stages = new HashMap<>();
    private final Map<String, String> logicalTypes = new HashMap<>();
    private final CompositeStabilizationListener listeners = new CompositeStabilizationListener();
    private final StageTraceListener trace = new StageTraceListener();

    public JointGraph(String name, JointSpec spec, CalculationConfig config) {
        this.name = name;
        this.config = config;

        GraphBuilder g = GraphBuilder.create(name);
        for (Map.Entry<String, Double> e : fieldValues(spec, config).entrySet()) {
            inputs.put(e.getKey(), g.scalarSource(e.getKey(), e.getValue()));
            logicalTypes.put(e.getKey(), "Input");
        }
        wire(g);
        this.context = g.buildWithContext();
        this.engine = context.engine();

        listeners.addForComposite(trace);
        engine.setListener(listeners);
        log.debug("Joint graph '{}' built with {} nodes", name, engine.nodeCount());
    }

    /**
     * Scalar value of every input field of {@code spec}, keyed by field name.
     * A bolt without a flank angle gets the configured default. Without a
     * surface load, {@code surface.Fz} is FA and the graph keeps it tied to
     * {@code load.FA}.
     */
    public static Map<String, Double> fieldValues(JointSpec spec, CalculationConfig config) {
        var bolt = spec.bolt();
        var stack = spec.stack();
        var mat = spec.material();
        var fr = spec.friction();
        var lc = spec.loadCase();
        var sf = spec.surfaceLoad();

        Map<String, Double> v = new LinkedHashMap<>();
        v.put(BOLT_D, bolt.d());
        v.put(BOLT_D2, bolt.d2());
        v.put(BOLT_D3, bolt.d3());
        v.put(BOLT_P, bolt.pitch());
        v.put(BOLT_ALPHA, flankAngle(bolt.flankAngleDeg(), config));
        v.put(STACK_LK, stack.lK());
        v.put(STACK_DW, stack.dW());
        v.put(STACK_DH, stack.dh());
        v.put(STACK_EP, stack.clampedModulus());
        v.put(MAT_EB, mat.boltModulus());
        v.put(MAT_ALPHA_A, mat.alphaBolt());
        v.put(MAT_ALPHA_P, mat.alphaClamped());
        v.put(MAT_RP02, mat.rp02());
        v.put(MAT_RM, mat.rm());
        v.put(FRICTION_MUG, fr.muG());
        v.put(FRICTION_MUK, fr.muK());
        v.put(FRICTION_DKM, fr.dKm());
        v.put(LOAD_FA, lc.axialLoad());
        v.put(LOAD_FZ, lc.additionalLoad());
        v.put(LOAD_N, lc.loadExponent());
        v.put(LOAD_DA, lc.dA());
        v.put(LOAD_DELTA_T, lc.deltaT());
        v.put(LOAD_INTERFACES, (double) lc.interfaces());
        v.put(LOAD_EMBEDDING, lc.embedding());
        v.put(LOAD_FM_TAB, lc.tablePreload());
        v.put(SURFACE_FX, sf.fx());
        v.put(SURFACE_FY, sf.fy());
        v.put(SURFACE_FZ, sf.fz());
        v.put(SURFACE_USE_UTS, sf.basis() == StrengthBasis.UTS ? 1.0 : 0.0);
        v.put(SURFACE_FZ_FROM_LOAD, spec.surfaceFollowsAxialLoad() ? 1.0 : 0.0);
        return v;
    }

    private static double flankAngle(double deg, CalculationConfig config) {
        return deg > 0.0 ? deg : config.getDefaultFlankAngleDeg();
    }

    private void wire(GraphBuilder g) {
        // Geometry
        var as = stage(Stage.GEOMETRY, g.computeN(AS,
                new ScalarValue[] { in(BOLT_D), in(BOLT_D2), in(BOLT_D3), in(BOLT_P) },
                x -> ThreadGeometry.stressArea(x[0], x[1], x[2], x[3])));
        stage(Stage.GEOMETRY, g.compute(PHI_N, ThreadGeometry::eccentricLoadingFactor,
                in(LOAD_N), in(LOAD_DA), in(STACK_DW)));

        // Resilience
        var deltaBolt = stage(Stage.RESILIENCE, g.compute(DELTA_BOLT, Resilience::boltResilience,
                in(STACK_LK), as, in(MAT_EB)));
        final double cone = config.getConeAngleDeg();
        final double minRatio = config.getMinBearingToHoleRatio();
        var deltaP = stage(Stage.RESILIENCE, g.computeN(DELTA_P,
                new ScalarValue[] { in(STACK_LK), in(STACK_DW), in(STACK_DH), in(STACK_EP) },
                x -> Resilience.clampedPartsResilience(x[0], x[1], x[2], x[3], cone, minRatio)));

        // Load factor
        var phi = stage(Stage.LOAD_FACTOR, g.compute(PHI, LoadDistribution::loadFactor, deltaBolt, deltaP));

        // Operating loads
        var fa = stage(Stage.WORKING_LOAD, g.compute(OPERATING_FA,
                v -> WorkingLoad.requireTensile(v, LOAD_FA), in(LOAD_FA)));
        var fz = stage(Stage.WORKING_LOAD, g.compute(OPERATING_FZ,
                v -> WorkingLoad.requireTensile(v, LOAD_FZ), in(LOAD_FZ)));

        // Preload and embedding
        var embed = stage(Stage.EMBEDDING, g.compute(EMBED_LOSS, Preload::embeddingLoss,
                in(LOAD_EMBEDDING), deltaBolt, deltaP));
        var fvMin = stage(Stage.PRELOAD, g.computeN(FV_MIN,
                new ScalarValue[] { fa, fz, phi, in(LOAD_INTERFACES) },
                x -> Preload.minimumPreload(x[0], x[1], x[2], x[3])));
        var fvAssembly = stage(Stage.PRELOAD, g.computeN(FV_ASSEMBLY,
                new ScalarValue[] { in(LOAD_FM_TAB), in(MAT_ALPHA_A), in(MAT_ALPHA_P), in(LOAD_DELTA_T),
                        in(STACK_LK), deltaBolt, deltaP },
                x -> Preload.assemblyPreload(x[0], x[1], x[2], x[3], x[4], x[5], x[6])));
        var fv = stage(Stage.EMBEDDING, g.compute(FV, Preload::residualPreload, fvAssembly, embed));
        stage(Stage.TIGHTENING, g.computeN(MA,
                new ScalarValue[] { fvAssembly, in(BOLT_P), in(BOLT_D2), in(BOLT_ALPHA),
                        in(FRICTION_MUG), in(FRICTION_MUK), in(FRICTION_DKM) },
                x -> Preload.tighteningTorque(x[0], x[1], x[2], x[3], x[4], x[5], x[6])));

        // Working loads
        var fsb = stage(Stage.WORKING_LOAD, g.compute(FSB, WorkingLoad::boltForceWorking, fv, fa, phi));
        var fkb = stage(Stage.WORKING_LOAD, g.compute(FKB, WorkingLoad::clampingForceWorking, fv, fa, phi));
        var margin = stage(Stage.PRELOAD, g.compute(PRELOAD_MARGIN, (a, b) -> a - b, fv, fvMin));

        // Stress and utilization
        var sigma = stage(Stage.STRESS, g.compute(SIGMA, StressEvaluator::boltStress, fsb, as));
        var utilization = stage(Stage.STRESS, g.compute(UTILIZATION, StressEvaluator::utilizationFactor,
                sigma, in(MAT_RP02)));

        // Surface criterion
        final double shearFactor = config.getShearStrengthFactor();
        BooleanNode useUts = g.condition(USE_UTS, in(SURFACE_USE_UTS), v -> v >= 0.5);
        var basis = stage(Stage.SURFACE_CRITERION, g.select(STRENGTH_BASIS, useUts, in(MAT_RM), in(MAT_RP02)));
        BooleanNode fzFromLoad = g.condition(FZ_FROM_LOAD, in(SURFACE_FZ_FROM_LOAD), v -> v >= 0.5);
        var axial = stage(Stage.SURFACE_CRITERION, g.select(SURFACE_AXIAL, fzFromLoad, fa, in(SURFACE_FZ)));
        var tensile = stage(Stage.SURFACE_CRITERION, g.computeN(SURFACE_TENSILE,
                new ScalarValue[] { fv, axial, in(BOLT_D), basis },
                x -> SurfaceCriterion.tensileRatio(x[0], x[1], x[2], x[3])));
        var shear = stage(Stage.SURFACE_CRITERION, g.computeN(SURFACE_SHEAR,
                new ScalarValue[] { in(SURFACE_FX), in(SURFACE_FY), in(BOLT_D), basis },
                x -> SurfaceCriterion.shearRatio(x[0], x[1], x[2], x[3], shearFactor)));
        var combined = stage(Stage.SURFACE_CRITERION, g.compute(SURFACE_COMBINED, Double::sum, tensile, shear));

        // Non-aborting diagnostics
        final double overloadThreshold = config.getOverloadThreshold();
        g.condition(CLAMP_LOSS, fkb, v -> v <= 0.0);
        var utilOverload = g.condition(UTILIZATION_OVERLOAD, utilization, v -> v >= overloadThreshold);
        var surfaceFailure = g.condition(SURFACE_FAILURE, combined, v -> v > 1.0);
        g.anyOf(OVERLOAD, utilOverload, surfaceFailure);
        g.condition(PRELOAD_SHORTFALL, margin, v -> v < 0.0);

        for (String diagnostic : List.of(USE_UTS, FZ_FROM_LOAD, CLAMP_LOSS, UTILIZATION_OVERLOAD, SURFACE_FAILURE,
                OVERLOAD, PRELOAD_SHORTFALL))
            logicalTypes.put(diagnostic, "Condition");
    }

    private ScalarSourceNode in(String field) {
        return inputs.get(field);
    }

    private ScalarCalcNode stage(Stage stage, ScalarCalcNode node) {
        stages.put(node.name(), stage);
        logicalTypes.put(node.name(), stage.label());
        return node;
    }

    // ── Evaluation ───────────────────────────────────────────────

    /**
     * Sets one input field. Takes effect on the next {@link #recompute()}.
     * A flank angle of zero or less selects the configured default. While
     * {@code surface.FzFromLoad} is 1, {@code surface.Fz} is not read.
     *
     * @throws IllegalArgumentException if {@code field} is not an input field.
     */
    public JointGraph update(String field, double value) {
        ScalarSourceNode node = inputs.get(field);
        if (node == null)
            throw new IllegalArgumentException("Unknown input field: " + field);
        node.updateDouble(BOLT_ALPHA.equals(field) ? flankAngle(value, config) : value);
        engine.markDirty(field);
        return this;
    }

    /** Sets every input field from {@code spec}. */
    public JointGraph update(JointSpec spec) {
        fieldValues(spec, config).forEach(this::update);
        return this;
    }

    /**
     * Re-runs the stages affected by the updates since the last call.
     *
     * @return the complete derived state with any warnings, or the fatal error.
     */
    public JointResult recompute() {
        try {
            engine.stabilize();
        } catch (StabilizationException e) {
            JointError error = toError(e);
            engine.markDirty(e.nodeName());
            engine.resetHealth();
            log.warn("Joint '{}' evaluation failed: {}", name, error);
            return JointResult.failure(error);
        }

        DerivedState state = readState();
        List<JointError> warnings = collectWarnings(state);
        for (JointError w : warnings)
            log.info("Joint '{}': {}", name, w);
        return JointResult.success(state, warnings);
    }

    private JointError toError(StabilizationException e) {
        if (e.getCause() instanceof JointCalculationException jce)
            return jce.error();
        String detail = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        if (inputs.containsKey(e.nodeName()))
            return new JointError(Fields.invalidKindOf(e.nodeName()), Fields.stageOf(e.nodeName()),
                    e.nodeName(), detail);
        Stage stage = stages.getOrDefault(e.nodeName(), Stage.GEOMETRY);
        ErrorKind kind = switch (stage) {
            case GEOMETRY, RESILIENCE -> ErrorKind.INVALID_GEOMETRY;
            case LOAD_FACTOR -> ErrorKind.INVALID_LOAD_FACTOR;
            case STRESS, SURFACE_CRITERION -> ErrorKind.INVALID_MATERIAL;
            default -> ErrorKind.INVALID_LOAD_CASE;
        };
        return new JointError(kind, stage, e.nodeName(), detail);
    }

    private DerivedState readState() {
        double util = value(UTILIZATION);
        return DerivedState.builder()
                .stressArea(value(AS))
                .eccentricFactor(value(PHI_N))
                .deltaBolt(value(DELTA_BOLT))
                .deltaP(value(DELTA_P))
                .phi(value(PHI))
                .embeddingLoss(value(EMBED_LOSS))
                .minimumPreload(value(FV_MIN))
                .assemblyPreload(value(FV_ASSEMBLY))
                .residualPreload(value(FV))
                .tighteningTorque(value(MA))
                .boltForce(value(FSB))
                .clampingForce(value(FKB))
                .boltStress(value(SIGMA))
                .utilization(util)
                .utilizationClass(StressEvaluator.classify(util,
                        config.getMarginalThreshold(), config.getOverloadThreshold()))
                .surface(new SurfaceCriterionResult(value(SURFACE_TENSILE), value(SURFACE_SHEAR),
                        value(SURFACE_COMBINED)))
                .build();
    }

    private List<JointError> collectWarnings(DerivedState s) {
        List<JointError> warnings = new ArrayList<>();
        if (flag(CLAMP_LOSS))
            warnings.add(new JointError(ErrorKind.CLAMP_LOSS_WARNING, Stage.WORKING_LOAD, FKB,
                    "joint opens under load, FKB=" + fmt(s.clampingForce()) + " N"));
        if (flag(OVERLOAD)) {
            if (flag(UTILIZATION_OVERLOAD))
                warnings.add(new JointError(ErrorKind.OVERLOAD, Stage.STRESS, UTILIZATION,
                        "bolt stress " + fmt(s.boltStress()) + " N/mm² gives utilization " + fmt(s.utilization())));
            if (flag(SURFACE_FAILURE))
                warnings.add(new JointError(ErrorKind.OVERLOAD, Stage.SURFACE_CRITERION, SURFACE_COMBINED,
                        "combined tensile and shear ratio " + fmt(s.surface().combined()) + " exceeds 1"));
        }
        if (flag(PRELOAD_SHORTFALL))
            warnings.add(new JointError(ErrorKind.PRELOAD_SHORTFALL, Stage.PRELOAD, FV,
                    "residual preload " + fmt(s.residualPreload()) + " N below required "
                            + fmt(s.minimumPreload()) + " N"));
        return warnings;
    }

    // ── Inspection ───────────────────────────────────────────────

    /** Current value of a scalar node (input or derived). */
    public double value(String nodeName) {
        Node<?> node = context.node(nodeName);
        if (node instanceof ScalarValue sv)
            return sv.doubleValue();
        throw new IllegalArgumentException("Node " + nodeName + " is not a scalar node");
    }

    /** Current value of a diagnostic condition node. */
    public boolean flag(String nodeName) {
        Node<?> node = context.node(nodeName);
        if (node instanceof BooleanNode b)
            return b.booleanValue();
        throw new IllegalArgumentException("Node " + nodeName + " is not a condition node");
    }

    /** Nodes recomputed by the last {@link #recompute()}, in evaluation order. */
    public List<String> lastRecomputed() {
        return trace.lastRecomputed();
    }

    public int lastRecomputeCount() {
        return engine.lastStabilizedCount();
    }

    public String explain(String nodeName) {
        return new GraphExplain(engine, logicalTypes).explainNode(nodeName);
    }

    public String toMermaid() {
        return new GraphExplain(engine, logicalTypes).toMermaid();
    }

    /** Adds a listener next to the built-in stage trace. */
    public void addListener(StabilizationListener listener) {
        listeners.addForComposite(listener);
    }

    public String name() {
        return name;
    }

    public CalculationConfig config() {
        return config;
    }

    public StabilizationEngine engine() {
        return engine;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4g", v);
    }
}
