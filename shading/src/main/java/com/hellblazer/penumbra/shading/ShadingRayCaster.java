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

import com.hellblazer.penumbra.geometry.MeshBVH;
import com.hellblazer.penumbra.geometry.Ray3D;
import com.hellblazer.penumbra.geometry.TriangleMesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;

/**
 * Finds the lowest elevation at which an attached shading device blocks the window's reference point. One ray per
 * elevation from 5 to 85 degrees is cast straight out along the window normal; no azimuth fan.
 *
 * @author hal.hildebrand
 */
public class ShadingRayCaster {

    public static final int MIN_ELEVATION  = 5;
    public static final int MAX_ELEVATION  = 85;
    public static final int ELEVATION_STEP = 5;

    private static final Logger log = LoggerFactory.getLogger(ShadingRayCaster.class);

    private final SamplePointGenerator sampler;
    private final double               minDistance;
    private final double               maxDistance;

    public ShadingRayCaster(ClassifierConfiguration configuration) {
        this.sampler = new SamplePointGenerator(configuration);
        this.minDistance = configuration.getMinRayDistance();
        this.maxDistance = configuration.getMaxShadingDistance();
    }

    /**
     * @param shading the device mesh, or null when the window has none
     */
    public ShadingResult cast(WindowRecord window, TriangleMesh shading) {
        if (shading == null || shading.getTriangleCount() == 0) {
            return ShadingResult.OPEN;
        }

        var hierarchy = new MeshBVH(shading);
        var origin = sampler.referencePoint(window.bounds());
        var forward = window.normal();
        forward.normalize();

        for (int elevation = MIN_ELEVATION; elevation <= MAX_ELEVATION; elevation += ELEVATION_STEP) {
            double v = Math.toRadians(elevation);
            var direction = new Vector3d(forward);
            direction.scale(Math.cos(v));
            direction.z += Math.sin(v);

            var hit = hierarchy.intersectRay(new Ray3D(origin, direction, maxDistance)).orElse(null);
            if (hit != null && hit.isWithin(minDistance, maxDistance)) {
                // Ascending elevations, so the first valid hit is the lowest
                double depth = hit.distance() * Math.cos(v);
                double ho = window.height() > 0 ? depth / window.height() : 0.0;
                log.trace("Shading blocked at {} degrees, depth {}, ho {}", elevation, depth, ho);
                return new ShadingResult(elevation, HoRatio.clamp(ho));
            }
        }
        return ShadingResult.OPEN;
    }
}
