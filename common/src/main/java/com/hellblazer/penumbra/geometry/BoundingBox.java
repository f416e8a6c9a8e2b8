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
import java.util.Collection;
import java.util.Objects;

/**
 * Immutable axis-aligned bounding box. Computed once per mesh and never modified afterwards.
 *
 * @author hal.hildebrand
 */
public final class BoundingBox {
    private final Point3d min;
    private final Point3d max;

    /**
     * Create bounds from min and max corners
     */
    public BoundingBox(Point3d min, Point3d max) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.x > max.x || min.y > max.y || min.z > max.z) {
            throw new IllegalArgumentException("Min corner " + min + " exceeds max corner " + max);
        }
        this.min = new Point3d(min);
        this.max = new Point3d(max);
    }

    /**
     * Create the smallest bounds enclosing all the points
     *
     * @throws IllegalArgumentException if there are no points
     */
    public static BoundingBox of(Collection<Point3d> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot bound an empty point set");
        }
        var min = new Point3d(Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE);
        var max = new Point3d(-Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE);

        for (var p : points) {
            min.x = Math.min(min.x, p.x);
            min.y = Math.min(min.y, p.y);
            min.z = Math.min(min.z, p.z);
            max.x = Math.max(max.x, p.x);
            max.y = Math.max(max.y, p.y);
            max.z = Math.max(max.z, p.z);
        }
        return new BoundingBox(min, max);
    }

    public Point3d getMin() {
        return new Point3d(min);
    }

    public Point3d getMax() {
        return new Point3d(max);
    }

    public double getMinX() {
        return min.x;
    }

    public double getMinY() {
        return min.y;
    }

    public double getMinZ() {
        return min.z;
    }

    public double getMaxX() {
        return max.x;
    }

    public double getMaxY() {
        return max.y;
    }

    public double getMaxZ() {
        return max.z;
    }

    /**
     * Get the center point of the bounds
     */
    public Point3d getCenter() {
        return new Point3d((min.x + max.x) / 2, (min.y + max.y) / 2, (min.z + max.z) / 2);
    }

    public double getExtentX() {
        return max.x - min.x;
    }

    public double getExtentY() {
        return max.y - min.y;
    }

    public double getExtentZ() {
        return max.z - min.z;
    }

    /**
     * Length of the min to max diagonal
     */
    public double getDiagonalLength() {
        var dx = getExtentX();
        var dy = getExtentY();
        var dz = getExtentZ();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BoundingBox other)) {
            return false;
        }
        return min.equals(other.min) && max.equals(other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "BoundingBox[min=" + min + ", max=" + max + "]";
    }
}
