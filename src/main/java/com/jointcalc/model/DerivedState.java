package com.jointcalc.model;

import lombok.Builder;

/**
 * All derived quantities of one evaluated joint. Forces in N, lengths in mm,
 * resiliences in mm/N, stresses in N/mm², torque in N·m.
 *
 * @param stressArea       As.
 * @param eccentricFactor  PhiN.
 * @param deltaBolt        Bolt resilience.
 * @param deltaP           Clamped-parts resilience.
 * @param phi              Load factor.
 * @param embeddingLoss    Preload lost to settling.
 * @param minimumPreload   FV_min.
 * @param assemblyPreload  FV_assembly including the thermal term.
 * @param residualPreload  FV, assembly preload after embedding.
 * @param tighteningTorque MA.
 * @param boltForce        FSB.
 * @param clampingForce    FKB.
 * @param boltStress       Bolt stress.
 * @param utilization      Bolt stress over yield.
 * @param utilizationClass Classified utilization.
 * @param surface          Combined surface criterion.
 */
@Builder
public record DerivedState(
        double stressArea,
        double eccentricFactor,
        double deltaBolt,
        double deltaP,
        double phi,
        double embeddingLoss,
        double minimumPreload,
        double assemblyPreload,
        double residualPreload,
        double tighteningTorque,
        double boltForce,
        double clampingForce,
        double boltStress,
        double utilization,
        UtilizationClass utilizationClass,
        SurfaceCriterionResult surface) {

    public boolean clampLoss() {
        return clampingForce <= 0.0;
    }

    public double preloadMargin() {
        return residualPreload - minimumPreload;
    }
}
