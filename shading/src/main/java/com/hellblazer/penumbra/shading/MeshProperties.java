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
 * Center, unit normal and bounds of a triangulated surface.
 * <p>
 * The normal is the area weighted average of the face normals, so irregular or slightly non-planar meshes still
 * yield a representative outward direction. The center is the bounding box center.
 *
 * @author hal.hildebrand
 */
public record MeshProperties(Point3d center, Vector3d normal, BoundingBox bounds) {

    private static final double MIN_NORMAL_LENGTH = 1e-12;

    public MeshProperties {
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
     * @return the properties, or empty if the mesh has no triangles, no net surface area or non-finite vertices
     */
    public static Optional<MeshProperties> of(TriangleMesh mesh) {
        if (mesh == null || mesh.isEmpty()) {
            return Optional.empty();
        }

        // Each scaled face normal has length 2 * area, so the plain sum is already area weighted
        var accumulated = new Vector3d();
        for (int i = 0; i < mesh.getTriangleCount(); i++) {
            accumulated.add(mesh.getScaledNormal(i));
        }
        // NaN or infinite coordinates fail this test as well
        if (!(accumulated.length() >= MIN_NORMAL_LENGTH) || !Double.isFinite(accumulated.length())) {
            return Optional.empty();
        }
        accumulated.normalize();

        var bounds = mesh.getBounds();
        return Optional.of(new MeshProperties(bounds.getCenter(), accumulated, bounds));
    }

    /**
     * Vertical extent of the bounds
     */
    public double height() {
        return bounds.getExtentZ();
    }
}
