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

/**
 * Anything that can produce an indexed triangle mesh. Surfaces, extrusions and other host geometry are adapted to
 * this capability upstream; the classification engine only ever consumes the resulting {@link TriangleMesh}.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface MeshSource {

    /**
     * @return the triangulated form of this geometry
     * @throws MeshConversionException if the geometry cannot be triangulated
     */
    TriangleMesh toTriangleMesh() throws MeshConversionException;
}
