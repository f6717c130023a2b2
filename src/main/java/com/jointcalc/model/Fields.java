package com.jointcalc.model;

import java.util.List;
import java.util.Map;

/**
 * Names of the input fields of a joint.
 *
 * <p>
 * The same names identify the input nodes of a {@code JointGraph} and the
 * offending field of a {@link JointError}, so a failure report can be traced
 * straight back to the value that has to be corrected.
 */
public final class Fields {
    private Fields() {
    }

    public static final String BOLT_D = "bolt.d";
    public static final String BOLT_D2 = "bolt.d2";
    public static final String BOLT_D3 = "bolt.d3";
    public static final String BOLT_P = "bolt.P";
    public static final String BOLT_ALPHA = "bolt.alpha";

    public static final String STACK_LK = "stack.lK";
    public static final String STACK_DW = "stack.dW";
    public static final String STACK_DH = "stack.dh";
    public static final String STACK_EP = "stack.E_P";

    public static final String MAT_EB = "material.E_B";
    public static final String MAT_ALPHA_A = "material.alphaA";
    public static final String MAT_ALPHA_P = "material.alphaP";
    public static final String MAT_RP02 = "material.Rp02";
    public static final String MAT_RM = "material.Rm";

    public static final String FRICTION_MUG = "friction.muG";
    public static final String FRICTION_MUK = "friction.muK";
    public static final String FRICTION_DKM = "friction.dKm";

    public static final String LOAD_FA = "load.FA";
    public static final String LOAD_FZ = "load.FZ";
    public static final String LOAD_N = "load.n";
    public static final String LOAD_DA = "load.dA";
    public static final String LOAD_DELTA_T = "load.deltaT";
    public static final String LOAD_INTERFACES = "load.nInterfaces";
    public static final String LOAD_EMBEDDING = "load.fZ";
    public static final String LOAD_FM_TAB = "load.FMTab";

    public static final String SURFACE_FX = "surface.Fx";
    public static final String SURFACE_FY = "surface.Fy";
    public static final String SURFACE_FZ = "surface.Fz";
    public static final String SURFACE_USE_UTS = "surface.useUts";
    /** 1 when {@code surface.Fz} is ignored and the working load {@code load.FA} is used instead. */
    public static final String SURFACE_FZ_FROM_LOAD = "surface.FzFromLoad";

    /** All input fields in declaration order. */
    public static final List<String> ALL = List.of(
            BOLT_D, BOLT_D2, BOLT_D3, BOLT_P, BOLT_ALPHA,
            STACK_LK, STACK_DW, STACK_DH, STACK_EP,
            MAT_EB, MAT_ALPHA_A, MAT_ALPHA_P, MAT_RP02, MAT_RM,
            FRICTION_MUG, FRICTION_MUK, FRICTION_DKM,
            LOAD_FA, LOAD_FZ, LOAD_N, LOAD_DA, LOAD_DELTA_T, LOAD_INTERFACES, LOAD_EMBEDDING, LOAD_FM_TAB,
            SURFACE_FX, SURFACE_FY, SURFACE_FZ, SURFACE_USE_UTS, SURFACE_FZ_FROM_LOAD);

    // stage that first reads each field
    private static final Map<String, Stage> FIRST_READ = Map.ofEntries(
            Map.entry(BOLT_D, Stage.GEOMETRY), Map.entry(BOLT_D2, Stage.GEOMETRY),
            Map.entry(BOLT_D3, Stage.GEOMETRY), Map.entry(BOLT_P, Stage.GEOMETRY),
            Map.entry(BOLT_ALPHA, Stage.TIGHTENING),
            Map.entry(STACK_LK, Stage.RESILIENCE), Map.entry(STACK_DW, Stage.GEOMETRY),
            Map.entry(STACK_DH, Stage.RESILIENCE), Map.entry(STACK_EP, Stage.RESILIENCE),
            Map.entry(MAT_EB, Stage.RESILIENCE), Map.entry(MAT_ALPHA_A, Stage.PRELOAD),
            Map.entry(MAT_ALPHA_P, Stage.PRELOAD), Map.entry(MAT_RP02, Stage.STRESS),
            Map.entry(MAT_RM, Stage.SURFACE_CRITERION),
            Map.entry(FRICTION_MUG, Stage.TIGHTENING), Map.entry(FRICTION_MUK, Stage.TIGHTENING),
            Map.entry(FRICTION_DKM, Stage.TIGHTENING),
            Map.entry(LOAD_FA, Stage.WORKING_LOAD), Map.entry(LOAD_FZ, Stage.WORKING_LOAD),
            Map.entry(LOAD_N, Stage.GEOMETRY), Map.entry(LOAD_DA, Stage.GEOMETRY),
            Map.entry(LOAD_DELTA_T, Stage.PRELOAD), Map.entry(LOAD_INTERFACES, Stage.PRELOAD),
            Map.entry(LOAD_EMBEDDING, Stage.EMBEDDING), Map.entry(LOAD_FM_TAB, Stage.PRELOAD),
            Map.entry(SURFACE_FX, Stage.SURFACE_CRITERION), Map.entry(SURFACE_FY, Stage.SURFACE_CRITERION),
            Map.entry(SURFACE_FZ, Stage.SURFACE_CRITERION), Map.entry(SURFACE_USE_UTS, Stage.SURFACE_CRITERION),
            Map.entry(SURFACE_FZ_FROM_LOAD, Stage.SURFACE_CRITERION));

    /**
     * Stage that reads {@code field} first.
     *
     * @throws IllegalArgumentException if {@code field} is not an input field.
     */
    public static Stage stageOf(String field) {
        Stage stage = FIRST_READ.get(field);
        if (stage == null)
            throw new IllegalArgumentException("Unknown input field: " + field);
        return stage;
    }

    /** Error kind reported when the value of {@code field} itself is unusable. */
    public static ErrorKind invalidKindOf(String field) {
        stageOf(field);
        if (field.startsWith("bolt.") || field.startsWith("stack."))
            return ErrorKind.INVALID_GEOMETRY;
        if (field.startsWith("material."))
            return ErrorKind.INVALID_MATERIAL;
        return ErrorKind.INVALID_LOAD_CASE;
    }
}
