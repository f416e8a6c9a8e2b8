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
import com.hellblazer.penumbra.geometry.MeshBVH;
import com.hellblazer.penumbra.geometry.Ray3D;
import com.hellblazer.penumbra.geometry.RayHit;
import com.hellblazer.penumbra.geometry.TriangleMesh;

import java.util.Optional;

/**
 * One surrounding obstruction, triangulated and indexed once per batch and then shared read only by every window.
 *
 * @param sourceIndex position of the item in the caller's raw context list
 * @author hal.hildebrand
 */
public record ContextItem(TriangleMesh mesh, BoundingBox bounds, int sourceIndex, MeshBVH hierarchy) {

    public static ContextItem of(TriangleMesh mesh, int sourceIndex) {
        return new ContextItem(mesh, mesh.getBounds(), sourceIndex, new MeshBVH(mesh));
    }

    public Optional<RayHit> intersect(Ray3D ray) {
        return hierarchy.intersectRay(ray);
    }
}
