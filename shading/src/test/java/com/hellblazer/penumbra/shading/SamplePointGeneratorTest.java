/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.shading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SamplePointGeneratorTest {

    private static final double EPSILON = 1e-9;

    private final SamplePointGenerator generator = new SamplePointGenerator(ClassifierConfiguration.defaults());

    private static void assertPoint(double x, double y, double z, Point3d actual) {
        assertEquals(x, actual.x, EPSILON);
        assertEquals(y, actual.y, EPSILON);
        assertEquals(z, actual.z, EPSILON);
    }

    @Test
    @DisplayName("Five samples on a south window: three bottom, mid and top")
    void testSouthWindowSamples() {
        var window = WindowRecord.of(TestMeshes.southWindow()).orElseThrow();
        var samples = generator.generate(window.bounds(), window.normal());

        assertEquals(5, samples.size());
        // right = normal x up = (-1, 0, 0), offset = 0.35 * 1.5
        assertPoint(0.525, 0, 0.1, samples.get(0).position());
        assertPoint(0, 0, 0.1, samples.get(1).position());
        assertPoint(-0.525, 0, 0.1, samples.get(2).position());
        assertPoint(0, 0, 1.0, samples.get(3).position());
        assertPoint(0, 0, 1.9, samples.get(4).position());

        assertEquals(1.5, samples.get(0).weight());
        assertEquals(2.0, samples.get(1).weight());
        assertEquals(1.5, samples.get(2).weight());
        assertEquals(1.0, samples.get(3).weight());
        assertEquals(0.5, samples.get(4).weight());
        assertEquals(6.5, samples.stream().mapToDouble(SamplePoint::weight).sum(), EPSILON);
    }

    @Test
    @DisplayName("Horizontal windows fall back to +X for the in-plane direction")
    void testDegenerateNormalFallback() {
        var window = WindowRecord.of(TestMeshes.horizontalWindow()).orElseThrow();
        var samples = generator.generate(window.bounds(), window.normal());

        assertPoint(0.15, 0.5, 0.1, samples.get(0).position());
        assertPoint(0.85, 0.5, 0.1, samples.get(2).position());
        // Zero height window: top sample sits below the bottom row
        assertPoint(0.5, 0.5, -0.1, samples.get(4).position());
    }

    @Test
    @DisplayName("Reference point is the bottom center sample")
    void testReferencePoint() {
        var window = WindowRecord.of(TestMeshes.southWindow()).orElseThrow();
        var reference = generator.referencePoint(window.bounds());
        assertEquals(generator.generate(window.bounds(), window.normal()).get(1).position(), reference);
    }

    @Test
    @DisplayName("Configured offsets are honoured")
    void testConfiguredOffsets() {
        var custom = new SamplePointGenerator(
        ClassifierConfiguration.defaults().withSampleEdgeOffset(0.2).withSampleWidthFraction(0.25));
        var window = WindowRecord.of(TestMeshes.southWindow()).orElseThrow();
        var samples = custom.generate(window.bounds(), window.normal());

        assertPoint(0.375, 0, 0.2, samples.get(0).position());
        assertPoint(0, 0, 1.8, samples.get(4).position());
    }

    @Test
    void testWeightMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SamplePoint(new Point3d(), 0.0));
        assertThrows(IllegalArgumentException.class, () -> new SamplePoint(new Point3d(), Double.NaN));
    }

    @Test
    void testRightVector() {
        var right = SamplePointGenerator.rightVector(new Vector3d(0, -1, 0), new Vector3d(1, 0, 0));
        assertEquals(-1.0, right.x, EPSILON);
        assertEquals(0.0, right.y, EPSILON);

        var fallback = SamplePointGenerator.rightVector(new Vector3d(0, 0, 1), new Vector3d(0, 2, 0));
        assertEquals(1.0, fallback.y, EPSILON);
    }
}
