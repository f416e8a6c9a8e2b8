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

import com.hellblazer.penumbra.geometry.Ray3D;
import com.hellblazer.penumbra.geometry.RayHit;

import java.util.List;

/**
 * Casts the direction fan from every sample point against the surrounding context and reduces the blocked elevations to
 * a single context angle.
 * <p>
 * Per sample point the highest elevation with a valid hit is kept; a hit is valid when the nearest intersection across
 * all context items lies in [minRayDistance, maxContextDistance). The per sample maxima are then combined as
 * {@code w * weightedAverage + (1 - w) * max}, with w the configured context average weight.
 *
 * @author hal.hildebrand
 */
public class ContextRayCaster {

    private final double minDistance;
    private final double maxDistance;
    private final double averageWeight;

    public ContextRayCaster(ClassifierConfiguration configuration) {
        this.minDistance = configuration.getMinRayDistance();
        this.maxDistance = configuration.getMaxContextDistance();
        this.averageWeight = configuration.getContextAverageWeight();
    }

    /**
     * @return the aggregated context elevation angle in degrees, 0 when nothing is hit
     */
    public double cast(List<SamplePoint> samples, List<RayDirection> directions, List<ContextItem> context) {
        if (context.isEmpty() || samples.isEmpty()) {
            return 0.0;
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        double absoluteMax = 0.0;
        for (var sample : samples) {
            double sampleMax = maxBlockedElevation(sample, directions, context);
            weightedSum += sampleMax * sample.weight();
            totalWeight += sample.weight();
            absoluteMax = Math.max(absoluteMax, sampleMax);
        }

        if (absoluteMax == 0.0) {
            return 0.0;
        }
        double weightedAverage = weightedSum / totalWeight;
        return averageWeight * weightedAverage + (1.0 - averageWeight) * absoluteMax;
    }

    /**
     * Highest elevation among the directions whose nearest context hit from this sample is valid
     */
    double maxBlockedElevation(SamplePoint sample, List<RayDirection> directions, List<ContextItem> context) {
        double max = 0.0;
        for (var direction : directions) {
            if (direction.elevation() <= max) {
                continue;
            }
            var ray = new Ray3D(sample.position(), direction.direction(), maxDistance);
            var hit = nearestHit(ray, context);
            if (hit != null && hit.isWithin(minDistance, maxDistance)) {
                max = direction.elevation();
            }
        }
        return max;
    }

    private static RayHit nearestHit(Ray3D ray, List<ContextItem> context) {
        RayHit nearest = null;
        for (var item : context) {
            var hit = item.intersect(ray).orElse(null);
            if (hit != null && (nearest == null || hit.distance() < nearest.distance())) {
                nearest = hit;
            }
        }
        return nearest;
    }
}
