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

import javax.vecmath.Vector3d;

/**
 * A unit sky sampling direction tagged with the elevation above horizontal and the azimuth offset from the window
 * normal that produced it, both in degrees. Instances are shared between threads through the ray direction cache, so
 * the accessor hands out a copy.
 *
 * @author hal.hildebrand
 */
public record RayDirection(Vector3d direction, double elevation, double azimuth) {

    public RayDirection {
        direction = new Vector3d(direction);
        direction.normalize();
    }

    @Override
    public Vector3d direction() {
        return new Vector3d(direction);
    }
}
