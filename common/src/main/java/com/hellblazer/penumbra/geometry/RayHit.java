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
package com.hellblazer.penumbra.geometry;

import javax.vecmath.Point3d;

/**
 * Ray-triangle intersection result
 *
 * @param triangleIndex index of the intersected triangle within its mesh
 * @param distance      distance from the ray origin to the hit point
 * @param point         the hit point
 * @author hal.hildebrand
 */
public record RayHit(int triangleIndex, double distance, Point3d point) {

    public RayHit {
        point = new Point3d(point);
    }

    /**
     * @return true if the distance lies in the half open interval [minDistance, maxDistance)
     */
    public boolean isWithin(double minDistance, double maxDistance) {
        return distance >= minDistance && distance < maxDistance;
    }
}
