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

import javax.vecmath.Point3d;

/**
 * A ray origin on the window face and its weight in the aggregated context angle.
 *
 * @author hal.hildebrand
 */
public record SamplePoint(Point3d position, double weight) {

    public SamplePoint {
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Sample weight must be positive: " + weight);
        }
        position = new Point3d(position);
    }

    @Override
    public Point3d position() {
        return new Point3d(position);
    }
}
