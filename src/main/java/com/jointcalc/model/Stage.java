package com.jointcalc.model;

/**
 * Calculation stages of the joint pipeline, in evaluation order.
 */
public enum Stage {
    GEOMETRY("Geometry/stress primitives"),
    RESILIENCE("Resilience model"),
    LOAD_FACTOR("Load-distribution model"),
    PRELOAD("Preload model"),
    EMBEDDING("Embedding loss"),
    TIGHTENING("Tightening torque"),
    WORKING_LOAD("Working-load model"),
    STRESS("Stress and utilization"),
    SURFACE_CRITERION("Combined surface criterion");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
