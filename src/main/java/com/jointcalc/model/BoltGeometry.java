package com.jointcalc.model;

/**
 * Thread geometry of the bolt. Lengths in mm, flank half-angle in degrees.
 *
 * @param d             Nominal diameter.
 * @param d2            Pitch diameter.
 * @param d3            Minor diameter.
 * @param pitch         Thread pitch P.
 * @param flankAngleDeg Thread flank half-angle, 30 for metric ISO threads.
 */
public record BoltGeometry(double d, double d2, double d3, double pitch, double flankAngleDeg) {

    /**
     * Metric ISO coarse/fine thread from nominal diameter and pitch, using the
     * basic profile relations d2 = d - 0.649519 P and d3 = d - 1.226869 P.
     */
    public static BoltGeometry isoMetric(double d, double pitch) {
        return new BoltGeometry(d, d - 0.649519 * pitch, d - 1.226869 * pitch, pitch, 30.0);
    }
}
