package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class WorkingLoadTest {

    @Test
    public void testBoltAndClampingForce() {
        assertEquals(16500.0, WorkingLoad.boltForceWorking(15000.0, 5000.0, 0.3), 1e-9);
        assertEquals(11500.0, WorkingLoad.clampingForceWorking(15000.0, 5000.0, 0.3), 1e-9);
    }

    @Test
    public void testBoltForceMinusLoadShareIsPreload() {
        Random rnd = new Random(2230);
        for (int i = 0; i < 200; i++) {
            double fv = 1000.0 + rnd.nextDouble() * 50000.0;
            double fa = rnd.nextDouble() * 20000.0;
            double phi = rnd.nextDouble();
            assertEquals(fv, WorkingLoad.boltForceWorking(fv, fa, phi) - phi * fa, 1e-9 * fv);
        }
    }

    @Test
    public void testRigidStackBoltForceIndependentOfLoad() {
        assertEquals(15000.0, WorkingLoad.boltForceWorking(15000.0, 5000.0, 0.0), 0.0);
        assertEquals(15000.0, WorkingLoad.boltForceWorking(15000.0, 90000.0, 0.0), 0.0);
    }

    @Test
    public void testClampLossBelowZero() {
        assertTrue(WorkingLoad.clampingForceWorking(1000.0, 5000.0, 0.3) <= 0.0);
    }

    @Test
    public void testCompressiveLoadRejected() {
        try {
            WorkingLoad.requireTensile(-1.0, Fields.LOAD_FA);
            fail();
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_LOAD_CASE, e.kind());
            assertEquals(Fields.LOAD_FA, e.field());
        }
        assertEquals(0.0, WorkingLoad.requireTensile(0.0, Fields.LOAD_FZ), 0.0);
    }
}
