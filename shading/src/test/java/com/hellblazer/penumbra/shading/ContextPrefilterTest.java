/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.shading;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ContextPrefilterTest {

    private ContextPrefilter prefilter;
    private WindowRecord     window;

    private static ContextItem item(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        return ContextItem.of(TestMeshes.box(minX, minY, minZ, maxX, maxY, maxZ), 0);
    }

    @BeforeEach
    void setUp() {
        prefilter = new ContextPrefilter(ClassifierConfiguration.defaults());
        window = WindowRecord.of(TestMeshes.southWindow()).orElseThrow();
    }

    @Test
    @DisplayName("Items in front of the window are kept")
    void testInFront() {
        assertTrue(prefilter.accepts(item(-5, -30, 0, 5, -20, 10), window));
    }

    @Test
    @DisplayName("Items entirely behind the window are dropped")
    void testBehind() {
        assertFalse(prefilter.accepts(item(-5, 20, 0, 5, 30, 10), window));
    }

    @Test
    @DisplayName("Items straddling the window plane are kept")
    void testStraddling() {
        // Center 2 units behind, diagonal well over 4
        assertTrue(prefilter.accepts(item(-5, -3, 0, 5, 7, 10), window));
    }

    @Test
    @DisplayName("Horizontal distance limit is 500")
    void testDistanceLimit() {
        assertTrue(prefilter.accepts(item(-50, -504, 0, 50, -494, 100), window));
        assertFalse(prefilter.accepts(item(-50, -506, 0, 50, -496, 100), window));
    }

    @Test
    @DisplayName("Distance uses the horizontal projection only")
    void testHeightDoesNotCount() {
        assertTrue(prefilter.accepts(item(-5, -450, 600, 5, -440, 610), window));
    }

    @Test
    @DisplayName("Items whose top is below the window bottom are dropped")
    void testBelowWindow() {
        var raised = WindowRecord.of(
        TestMeshes.quad(-0.75, 0, 10, 0.75, 0, 10, 0.75, 0, 12, -0.75, 0, 12)).orElseThrow();
        assertFalse(prefilter.accepts(item(-5, -30, 0, 5, -20, 9.9), raised));
        assertTrue(prefilter.accepts(item(-5, -30, 0, 5, -20, 10.0), raised));
    }

    @Test
    void testFilterKeepsOrder() {
        var front = item(-5, -30, 0, 5, -20, 10);
        var behind = item(-5, 20, 0, 5, 30, 10);
        var far = item(-5, -800, 0, 5, -790, 10);
        var near = item(10, -15, 0, 20, -5, 10);
        assertEquals(List.of(front, near), prefilter.filter(List.of(front, behind, far, near), window));
    }
}
