package com.jointcalc.io;

import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class CalculationConfigLoaderTest {

    @Test
    public void testShippedDefaults() {
        CalculationConfig c = CalculationConfigLoader.defaults();
        assertEquals(33.0, c.getConeAngleDeg(), 0.0);
        assertEquals(0.577, c.getShearStrengthFactor(), 0.0);
        assertEquals(0.9, c.getMarginalThreshold(), 0.0);
        assertEquals(1.0, c.getOverloadThreshold(), 0.0);
        assertEquals(30.0, c.getDefaultFlankAngleDeg(), 0.0);
        assertEquals(1.1, c.getMinBearingToHoleRatio(), 0.0);
        assertEquals(0, c.getBatchThreads());
        assertEquals(Runtime.getRuntime().availableProcessors(), c.effectiveBatchThreads());
    }

    @Test
    public void testDefaultsAreFreshInstances() {
        CalculationConfig a = CalculationConfigLoader.defaults();
        a.setConeAngleDeg(45.0);
        assertEquals(33.0, CalculationConfigLoader.defaults().getConeAngleDeg(), 0.0);
    }

    @Test
    public void testPartialDocumentKeepsDefaults() throws IOException {
        CalculationConfig c = CalculationConfigLoader.parse("{\"marginalThreshold\": 0.8, \"comment\": \"x\"}");
        assertEquals(0.8, c.getMarginalThreshold(), 0.0);
        assertEquals(33.0, c.getConeAngleDeg(), 0.0);
    }

    @Test
    public void testLoadFromFile() throws IOException {
        Path file = Files.createTempFile("jointcalc", ".json");
        try {
            Files.writeString(file, "{\"coneAngleDeg\": 30.0, \"batchThreads\": 3}");
            CalculationConfig c = CalculationConfigLoader.load(file);
            assertEquals(30.0, c.getConeAngleDeg(), 0.0);
            assertEquals(3, c.effectiveBatchThreads());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void testRoundTripThroughJson() throws IOException {
        CalculationConfig c = new CalculationConfig();
        c.setMinBearingToHoleRatio(1.25);
        assertEquals(c, CalculationConfigLoader.parse(CalculationConfigLoader.toJson(c)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsInvertedThresholds() throws IOException {
        CalculationConfigLoader.parse("{\"marginalThreshold\": 1.2, \"overloadThreshold\": 1.0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsConeAngleOutOfRange() {
        CalculationConfig c = new CalculationConfig();
        c.setConeAngleDeg(90.0);
        c.validate();
    }
}
