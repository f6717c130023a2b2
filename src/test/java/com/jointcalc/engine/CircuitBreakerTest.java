package com.jointcalc.engine;

import com.jointcalc.api.Node;
import com.jointcalc.api.ScalarValue;
import com.jointcalc.api.StabilizationListener;
import com.jointcalc.dsl.GraphBuilder;
import com.jointcalc.node.ScalarCalcNode;
import com.jointcalc.node.ScalarSourceNode;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class CircuitBreakerTest {

    @Test
    public void testCircuitBreakerTrips() {
        GraphBuilder g = GraphBuilder.create("breaker_test");
        var dh = g.scalarSource("stack.dh", 11.0);
        g.compute("holeCheck", (a) -> {
            if (a > 15.0)
                throw new IllegalStateException("hole larger than bearing face");
            return a;
        }, dh);

        var context = g.buildWithContext();
        var engine = context.engine();

        assertTrue(engine.isHealthy());
        engine.stabilize();
        assertTrue(engine.isHealthy());

        ((ScalarSourceNode) context.node("stack.dh")).updateDouble(20.0);
        engine.markDirty("stack.dh");
        try {
            engine.stabilize();
            fail("Should have thrown due to fail fast");
        } catch (StabilizationException e) {
            assertTrue(e.getMessage().contains("Stabilization failed"));
            assertEquals("hole larger than bearing face", e.getCause().getMessage());
        }

        assertFalse("Engine should be unhealthy", engine.isHealthy());
        try {
            engine.stabilize();
            fail("Should have thrown IllegalStateException immediately");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("unhealthy state"));
        }

        engine.resetHealth();
        assertTrue(engine.isHealthy());

        ((ScalarSourceNode) context.node("stack.dh")).updateDouble(10.0);
        engine.markDirty("stack.dh");
        engine.stabilize();
        assertTrue(engine.isHealthy());
        ScalarCalcNode check = context.node("holeCheck");
        assertEquals(10.0, check.doubleValue(), 0.001);
    }

    @Test
    public void testNaNResultIsAnError() {
        Node<Double> nan = new NaNNode("deltaP");
        StabilizationEngine engine = new StabilizationEngine(TopologicalOrder.builder().addNode(nan).build());

        AtomicReference<Throwable> errorRef = new AtomicReference<>();
        engine.setListener(new StabilizationListener() {
            @Override
            public void onStabilizationStart(long epoch) {
            }

            @Override
            public void onNodeStabilized(long epoch, int topoIndex, String nodeName, boolean changed,
                    long durationNanos) {
            }

            @Override
            public void onNodeError(long epoch, int topoIndex, String nodeName, Throwable error) {
                errorRef.set(error);
            }

            @Override
            public void onStabilizationEnd(long epoch, int nodesStabilized) {
            }
        });

        engine.markDirty("deltaP");
        try {
            engine.stabilize();
            fail("NaN must abort the pass");
        } catch (StabilizationException e) {
            assertEquals("deltaP", e.nodeName());
        }
        assertNotNull(errorRef.get());
        assertEquals("Node evaluated to NaN", errorRef.get().getMessage());
    }

    @Test
    public void testInfiniteInputIsAnError() {
        ScalarSourceNode fx = new ScalarSourceNode("surface.Fx", Double.POSITIVE_INFINITY);
        StabilizationEngine engine = new StabilizationEngine(TopologicalOrder.builder()
                .addNode(fx).markSource("surface.Fx").build());

        engine.markDirty("surface.Fx");
        try {
            engine.stabilize();
            fail("infinite input must abort the pass");
        } catch (StabilizationException e) {
            assertEquals("surface.Fx", e.nodeName());
            assertEquals("Node evaluated to Infinity", e.getCause().getMessage());
        }
        assertFalse(engine.isHealthy());
    }

    private static final class NaNNode implements Node<Double>, ScalarValue {
        private final String name;

        NaNNode(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean stabilize() {
            return true;
        }

        @Override
        public Double value() {
            return Double.NaN;
        }

        @Override
        public double doubleValue() {
            return Double.NaN;
        }
    }
}
