/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BoundingBoxTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testOfPoints() {
        var box = BoundingBox.of(List.of(new Point3d(1, -2, 3), new Point3d(-1, 4, 0), new Point3d(0, 0, 5)));
        assertEquals(new Point3d(-1, -2, 0), box.getMin());
        assertEquals(new Point3d(1, 4, 5), box.getMax());
        assertEquals(new Point3d(0, 1, 2.5), box.getCenter());
        assertEquals(Math.sqrt(4 + 36 + 25), box.getDiagonalLength(), EPSILON);
    }

    @Test
    void testInvertedCornersRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new BoundingBox(new Point3d(1, 0, 0), new Point3d(0, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.of(List.of()));
    }

    @Test
    void testCornersAreCopied() {
        var min = new Point3d(0, 0, 0);
        var box = new BoundingBox(min, new Point3d(1, 1, 1));
        min.x = -10;
        box.getMin().x = -20;
        assertEquals(0.0, box.getMinX(), EPSILON);
    }
}
