package com.jointcalc.pipeline;

import com.jointcalc.io.CalculationConfig;
import com.jointcalc.model.BoltGeometry;
import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointResult;
import com.jointcalc.model.JointSpec;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class JointBatchEvaluatorTest {

    private static CalculationConfig threads(int n) {
        CalculationConfig c = new CalculationConfig();
        c.setBatchThreads(n);
        return c;
    }

    @Test
    public void testResultsKeepInputOrder() throws InterruptedException {
        List<JointSpec> specs = new ArrayList<>();
        for (int i = 0; i < 40; i++)
            specs.add(ReferenceJoints.m10WithLoad(250.0 * i, 25000.0));

        List<JointResult> results;
        try (JointBatchEvaluator batch = new JointBatchEvaluator(threads(4))) {
            results = batch.evaluateAll(specs);
        }

        assertEquals(specs.size(), results.size());
        for (int i = 0; i < specs.size(); i++)
            assertEquals(JointPipeline.evaluateJoint(specs.get(i), threads(4)).state(), results.get(i).state());
    }

    @Test
    public void testSweepOverBoltSizes() throws InterruptedException {
        List<BoltGeometry> bolts = List.of(
                BoltGeometry.isoMetric(8.0, 1.25),
                BoltGeometry.isoMetric(10.0, 1.5),
                new BoltGeometry(10.0, 9.026, 9.5, 1.5, 30.0),
                BoltGeometry.isoMetric(12.0, 1.75));

        List<JointResult> results;
        try (JointBatchEvaluator batch = new JointBatchEvaluator(threads(2))) {
            results = batch.sweep(ReferenceJoints.m10(), bolts);
        }

        assertEquals(4, results.size());
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isSuccess());
        assertEquals(ErrorKind.INVALID_GEOMETRY, results.get(2).error().kind());
        assertTrue(results.get(3).isSuccess());

        double m8 = results.get(0).state().utilization();
        double m10 = results.get(1).state().utilization();
        double m12 = results.get(3).state().utilization();
        assertTrue(m8 > m10);
        assertTrue(m10 > m12);
    }
}
