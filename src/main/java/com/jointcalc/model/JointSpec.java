package com.jointcalc.model;

import lombok.Builder;

/**
 * Everything needed to evaluate one bolted joint.
 *
 * <p>
 * {@code surface} may be omitted. The surface criterion then sees the axial
 * load case ({@code Fx = Fy = 0}, {@code Fz = FA}, yield basis), and keeps
 * following {@code FA} when the load case changes.
 */
@Builder(toBuilder = true)
public record JointSpec(BoltGeometry bolt, ClampedStack stack, MaterialPair material,
        FrictionModel friction, LoadCase loadCase, SurfaceLoad surface) {

    public JointSpec {
        if (bolt == null || stack == null || material == null || friction == null || loadCase == null)
            throw new IllegalArgumentException("bolt, stack, material, friction and loadCase are required");
    }

    /** True when no surface load was given and {@code Fz} tracks the working load. */
    public boolean surfaceFollowsAxialLoad() {
        return surface == null;
    }

    /** The surface load actually evaluated. */
    public SurfaceLoad surfaceLoad() {
        return surface != null ? surface : SurfaceLoad.axial(loadCase);
    }
}
