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
import javax.vecmath.Vector3d;

/**
 * 3D Ray representation for ray casting queries. Ray is defined by an origin point, a normalized direction vector, and
 * an optional maximum distance. Unlike spatial index rays, the origin may lie anywhere in model space.
 *
 * @author hal.hildebrand
 */
public record Ray3D(Point3d origin, Vector3d direction, double maxDistance) {

    /**
     * Default maximum distance for unbounded rays
     */
    public static final double UNBOUNDED = Double.POSITIVE_INFINITY;

    /**
     * Create a ray with validation
     *
     * @param origin      the starting point of the ray
     * @param direction   the direction vector (will be normalized)
     * @param maxDistance the maximum distance along the ray (must be positive, can be UNBOUNDED)
     */
    public Ray3D {
        if (maxDistance <= 0 || Double.isNaN(maxDistance)) {
            throw new IllegalArgumentException("Ray max distance must be positive or unbounded: " + maxDistance);
        }
        origin = new Point3d(origin);

        direction = new Vector3d(direction);
        if (direction.lengthSquared() == 0) {
            throw new IllegalArgumentException("Ray direction cannot be zero vector");
        }
        direction.normalize();
    }

    /**
     * Create an unbounded ray
     */
    public Ray3D(Point3d origin, Vector3d direction) {
        this(origin, direction, UNBOUNDED);
    }

    /**
     * Get a point along the ray at parameter t
     *
     * @param t the parameter (t >= 0 for points along the ray from origin)
     * @return the point at origin + t * direction
     */
    public Point3d getPointAt(double t) {
        return new Point3d(origin.x + t * direction.x, origin.y + t * direction.y, origin.z + t * direction.z);
    }
}
