/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Penumbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.penumbra.shading;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the hemispherical fan of sky sampling directions in front of a window: 16 elevations from 5 to 80 degrees
 * times 9 azimuth offsets evenly spread over [-60, 60] degrees around the normal.
 *
 * @author hal.hildebrand
 */
public final class RayDirectionGenerator {

    public static final int    ELEVATION_STEP    = 5;
    public static final int    MIN_ELEVATION     = 5;
    public static final int    MAX_ELEVATION     = 80;
    public static final double HORIZONTAL_SPREAD = 60.0;
    public static final int    HORIZONTAL_STEPS  = 9;

    private static final Vector3d FALLBACK_RIGHT = new Vector3d(0, 1, 0);

    private RayDirectionGenerator() {
    }

    /**
     * Azimuth offsets in degrees, ascending from -spread to +spread
     */
    static double[] azimuthOffsets() {
        var offsets = new double[HORIZONTAL_STEPS];
        for (int i = 0; i < HORIZONTAL_STEPS; i++) {
            offsets[i] = -HORIZONTAL_SPREAD + (2 * HORIZONTAL_SPREAD * i / (HORIZONTAL_STEPS - 1));
        }
        return offsets;
    }

    /**
     * Generate the fan for a window normal, ordered by elevation then azimuth
     */
    public static List<RayDirection> generate(Vector3d normal) {
        var forward = new Vector3d(normal);
        forward.normalize();
        var right = SamplePointGenerator.rightVector(forward, FALLBACK_RIGHT);
        var up = SamplePointGenerator.UP;
        var offsets = azimuthOffsets();

        var directions = new ArrayList<RayDirection>(
        ((MAX_ELEVATION - MIN_ELEVATION) / ELEVATION_STEP + 1) * HORIZONTAL_STEPS);
        for (int elevation = MIN_ELEVATION; elevation <= MAX_ELEVATION; elevation += ELEVATION_STEP) {
            double v = Math.toRadians(elevation);
            for (double azimuth : offsets) {
                double h = Math.toRadians(azimuth);

                // Swing forward toward right in the window's horizontal frame, then tilt up
                var horizontal = new Vector3d();
                horizontal.scaleAdd(Math.cos(h), forward, scaled(right, Math.sin(h)));
                horizontal.normalize();

                var direction = new Vector3d();
                direction.scaleAdd(Math.cos(v), horizontal, scaled(up, Math.sin(v)));
                directions.add(new RayDirection(direction, elevation, azimuth));
            }
        }
        return List.copyOf(directions);
    }

    private static Vector3d scaled(Vector3d v, double s) {
        var result = new Vector3d(v);
        result.scale(s);
        return result;
    }
}
