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

import com.hellblazer.penumbra.geometry.BoundingBox;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Places the five weighted sample points on a window: three along the bottom, one at mid height and one near the top.
 * The bottom center point is the NEN 5060 reference point and carries the largest weight.
 *
 * @author hal.hildebrand
 */
public class SamplePointGenerator {

    public static final double BOTTOM_SIDE_WEIGHT   = 1.5;
    public static final double BOTTOM_CENTER_WEIGHT = 2.0;
    public static final double MID_WEIGHT           = 1.0;
    public static final double TOP_WEIGHT           = 0.5;

    static final Vector3d UP = new Vector3d(0, 0, 1);

    private static final double   DEGENERATE_LENGTH = 1e-3;
    private static final Vector3d FALLBACK_RIGHT    = new Vector3d(1, 0, 0);

    private final double edgeOffset;
    private final double widthFraction;

    public SamplePointGenerator(ClassifierConfiguration configuration) {
        this.edgeOffset = configuration.getSampleEdgeOffset();
        this.widthFraction = configuration.getSampleWidthFraction();
    }

    /**
     * In-plane horizontal direction of a window: normal x up, or the fallback for near vertical normals
     */
    static Vector3d rightVector(Vector3d normal, Vector3d fallback) {
        var right = new Vector3d();
        right.cross(normal, UP);
        if (right.length() < DEGENERATE_LENGTH) {
            right.set(fallback);
        }
        right.normalize();
        return right;
    }

    /**
     * @return bottom left, bottom center, bottom right, mid and top samples, in that order
     */
    public List<SamplePoint> generate(BoundingBox bounds, Vector3d normal) {
        var center = bounds.getCenter();
        var right = rightVector(normal, FALLBACK_RIGHT);

        double width = Math.max(bounds.getExtentX(), bounds.getExtentY());
        double offset = width * widthFraction;

        double zBottom = bounds.getMinZ() + edgeOffset;
        double zMid = center.z;
        double zTop = bounds.getMaxZ() - edgeOffset;

        return List.of(
        new SamplePoint(new Point3d(center.x - right.x * offset, center.y - right.y * offset, zBottom),
                        BOTTOM_SIDE_WEIGHT),
        new SamplePoint(new Point3d(center.x, center.y, zBottom), BOTTOM_CENTER_WEIGHT),
        new SamplePoint(new Point3d(center.x + right.x * offset, center.y + right.y * offset, zBottom),
                        BOTTOM_SIDE_WEIGHT), new SamplePoint(new Point3d(center.x, center.y, zMid), MID_WEIGHT),
        new SamplePoint(new Point3d(center.x, center.y, zTop), TOP_WEIGHT));
    }

    /**
     * The bottom center reference point used for shading device analysis
     */
    public Point3d referencePoint(BoundingBox bounds) {
        var center = bounds.getCenter();
        return new Point3d(center.x, center.y, bounds.getMinZ() + edgeOffset);
    }
}
