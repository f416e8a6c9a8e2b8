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
import com.hellblazer.penumbra.geometry.TriangleMesh;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Optional;

/**
 * A window mesh with its derived geometry. Lives for a single classification call.
 *
 * @author hal.hildebrand
 */
public record WindowRecord(TriangleMesh mesh, Point3d center, Vector3d normal, BoundingBox bounds,
                           Orientation orientation, double height) {

    public WindowRecord {
        center = new Point3d(center);
        normal = new Vector3d(normal);
    }

    @Override
    public Point3d center() {
        return new Point3d(center);
    }

    @Override
    public Vector3d normal() {
        return new Vector3d(normal);
    }

    /**
     * @return the window record, or empty if the mesh has no usable surface
     */
    public static Optional<WindowRecord> of(TriangleMesh mesh) {
        return MeshProperties.of(mesh)
                             .map(p -> new WindowRecord(mesh, p.center(), p.normal(), p.bounds(),
                                                        OrientationClassifier.classify(p.normal()), p.height()));
    }
}
