package com.jointcalc.pipeline;

import com.jointcalc.io.CalculationConfig;
import com.jointcalc.io.CalculationConfigLoader;
import com.jointcalc.model.JointResult;
import com.jointcalc.model.JointSpec;

/**
 * One-shot evaluation: build the joint graph, stabilize once, read the result
 * and discard the graph. Identical specs always give identical results.
 */
public final class JointPipeline {
    private JointPipeline() {
    }

    // loaded on first use
    private static final class Defaults {
        static final CalculationConfig CONFIG = CalculationConfigLoader.defaults().validate();
    }

    /** Evaluates {@code spec} with the classpath defaults. */
    public static JointResult evaluateJoint(JointSpec spec) {
        return evaluateJoint(spec, Defaults.CONFIG);
    }

    public static JointResult evaluateJoint(JointSpec spec, CalculationConfig config) {
        return new JointGraph("joint", spec, config).recompute();
    }

    static CalculationConfig defaultConfig() {
        return Defaults.CONFIG;
    }
}
