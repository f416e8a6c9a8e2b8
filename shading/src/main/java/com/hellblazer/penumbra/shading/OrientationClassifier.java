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
 * Maps a window normal to one of the eight compass sectors. +Y is North, +X is East and azimuth grows clockwise. Each
 * sector spans 45 degrees centered on its compass direction, lower bound inclusive.
 *
 * @author hal.hildebrand
 */
public final class OrientationClassifier {

    private static final double SECTOR_WIDTH = 45.0;
    private static final double HALF_SECTOR  = SECTOR_WIDTH / 2;

    private OrientationClassifier() {
    }

    /**
     * Classify a normal by its XY projection only
     */
    public static Orientation classify(Vector3d normal) {
        return fromAzimuth(azimuth(normal));
    }

    /**
     * Compass azimuth of the normal in degrees, [0, 360), 0 at +Y
     */
    public static double azimuth(Vector3d normal) {
        double degrees = Math.toDegrees(Math.atan2(normal.x, normal.y));
        if (degrees < 0) {
            degrees += 360.0;
        }
        return degrees >= 360.0 ? degrees - 360.0 : degrees;
    }

    /**
     * Sector containing the azimuth; [337.5, 360) and [0, 22.5) are North
     */
    static Orientation fromAzimuth(double degrees) {
        return Orientation.ofSector((int) Math.floor((degrees + HALF_SECTOR) / SECTOR_WIDTH));
    }
}
