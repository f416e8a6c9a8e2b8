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

/**
 * Helpers for the perpendicular obstruction ratio (projection depth over window height).
 *
 * @author hal.hildebrand
 */
public final class HoRatio {

    public static final double MIN = 0.0;
    public static final double MAX = 2.0;

    private static final double STEEP_ANGLE = 89.0;

    private HoRatio() {
    }

    public static double clamp(double ho) {
        if (Double.isNaN(ho)) {
            return MIN;
        }
        return Math.max(MIN, Math.min(MAX, ho));
    }

    /**
     * Approximate ho for a context obstruction from its elevation angle, tan(angle) within [0, 2]
     */
    public static double fromElevation(double degrees) {
        if (degrees <= 0) {
            return MIN;
        }
        if (degrees >= STEEP_ANGLE) {
            return MAX;
        }
        return clamp(Math.tan(Math.toRadians(degrees)));
    }
}
