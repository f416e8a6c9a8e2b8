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
 * Outcome of the shading device cast: the lowest blocked elevation in degrees and the resulting ho ratio.
 *
 * @author hal.hildebrand
 */
public record ShadingResult(double elevation, double hoRatio) {

    /**
     * Sky open up to the zenith
     */
    public static final ShadingResult OPEN = new ShadingResult(90.0, 0.0);

    public boolean isBlocked() {
        return elevation < 90.0;
    }
}
