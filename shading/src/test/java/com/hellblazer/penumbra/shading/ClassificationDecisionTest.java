/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.shading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ClassificationDecisionTest {

    private static final double EPSILON = 1e-12;

    private final ClassificationDecision decision = new ClassificationDecision(ClassifierConfiguration.defaults());

    @Test
    @DisplayName("Neither obstruction above 20 degrees is minimal obstruction")
    void testNeitherSignificant() {
        var result = decision.decide(20.0, new ShadingResult(70.0, 0.8), true);

        assertEquals(Classification.MINIMAL_OBSTRUCTION, result.classification());
        assertEquals(DominantFactor.NEITHER, result.dominant());
        assertEquals(0.0, result.hoRatio());
        assertEquals(20.0, result.contextBlocked(), EPSILON);
        assertEquals(20.0, result.shadingBlocked(), EPSILON);
    }

    @Test
    @DisplayName("Significant shading with insignificant context is an overhang")
    void testShadingOnly() {
        var result = decision.decide(5.0, new ShadingResult(65.0, 0.443), true);

        assertEquals(Classification.OVERHANG, result.classification());
        assertEquals(DominantFactor.SHADING, result.dominant());
        assertEquals(0.443, result.hoRatio(), EPSILON);
        assertEquals(25.0, result.shadingBlocked(), EPSILON);
    }

    @Test
    @DisplayName("Equal blocked sky favours the shading device")
    void testTieFavoursShading() {
        var result = decision.decide(30.0, new ShadingResult(60.0, 0.6), true);
        assertEquals(Classification.OVERHANG, result.classification());
        assertEquals(0.6, result.hoRatio(), EPSILON);
    }

    @Test
    @DisplayName("Strictly dominant context is a context obstruction with ho from tan(angle)")
    void testContextDominant() {
        var result = decision.decide(40.0, new ShadingResult(60.0, 0.6), true);

        assertEquals(Classification.CONTEXT_OBSTRUCTION, result.classification());
        assertEquals(DominantFactor.CONTEXT, result.dominant());
        assertEquals(Math.tan(Math.toRadians(40.0)), result.hoRatio(), EPSILON);
    }

    @Test
    @DisplayName("Context ho is clamped to 2")
    void testContextHoClamped() {
        var result = decision.decide(80.0, ShadingResult.OPEN, false);
        assertEquals(Classification.CONTEXT_OBSTRUCTION, result.classification());
        assertEquals(2.0, result.hoRatio());
    }

    @Test
    @DisplayName("Shading only counts when a device was supplied")
    void testShadingRequiresDevice() {
        var result = decision.decide(0.0, new ShadingResult(10.0, 1.5), false);
        assertEquals(Classification.MINIMAL_OBSTRUCTION, result.classification());
    }

    @Test
    @DisplayName("Threshold is configurable")
    void testConfiguredThreshold() {
        var strict = new ClassificationDecision(ClassifierConfiguration.defaults().withSignificanceThreshold(50));
        assertEquals(Classification.MINIMAL_OBSTRUCTION,
                     strict.decide(45.0, ShadingResult.OPEN, false).classification());
        assertEquals(Classification.CONTEXT_OBSTRUCTION,
                     strict.decide(55.0, ShadingResult.OPEN, false).classification());
    }

    @Test
    void testConfigurationValidation() {
        var configuration = ClassifierConfiguration.defaults();
        assertThrows(IllegalArgumentException.class, () -> configuration.withSignificanceThreshold(-1));
        assertThrows(IllegalArgumentException.class, () -> configuration.withMaxContextDistance(0));
        assertThrows(IllegalArgumentException.class, () -> configuration.withContextAverageWeight(1.5));
        assertThrows(IllegalArgumentException.class, () -> configuration.withWorkerThreads(0));
        assertThrows(NullPointerException.class, () -> configuration.withCalculationMode(null));
        assertThrows(IllegalArgumentException.class, () -> configuration.withMinRayDistance(-0.1));
        assertThrows(IllegalArgumentException.class, () -> configuration.withMaxShadingDistance(0));
        assertThrows(IllegalArgumentException.class, () -> configuration.withNormalQuantizationDigits(13));
        assertEquals(20.0, configuration.getSignificanceThreshold());
    }

    @Test
    void testFluentRayWindow() {
        var configuration = ClassifierConfiguration.defaults()
                                                   .withMinRayDistance(0.1)
                                                   .withMaxShadingDistance(25)
                                                   .withNormalQuantizationDigits(3);
        assertEquals(0.1, configuration.getMinRayDistance());
        assertEquals(25.0, configuration.getMaxShadingDistance());
        assertEquals(3, configuration.getNormalQuantizationDigits());
        assertEquals(500.0, configuration.getMaxContextDistance());
    }
}
