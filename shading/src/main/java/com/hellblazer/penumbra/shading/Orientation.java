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
 * Compass sector a window faces. The eight sectors are declared clockwise from North; {@link #UNKNOWN} is only
 * reported for windows that could not be analysed.
 *
 * @author hal.hildebrand
 */
public enum Orientation {
    NORTH("North"),
    NORTHEAST("Northeast"),
    EAST("East"),
    SOUTHEAST("Southeast"),
    SOUTH("South"),
    SOUTHWEST("Southwest"),
    WEST("West"),
    NORTHWEST("Northwest"),
    UNKNOWN("Unknown");

    private static final Orientation[] COMPASS = { NORTH, NORTHEAST, EAST, SOUTHEAST, SOUTH, SOUTHWEST, WEST,
                                                   NORTHWEST };

    private final String label;

    Orientation(String label) {
        this.label = label;
    }

    /**
     * Sector for a clockwise sector index, 0 being North
     */
    static Orientation ofSector(int sector) {
        return COMPASS[Math.floorMod(sector, COMPASS.length)];
    }

    public String label() {
        return label;
    }

    /**
     * @return the sector facing the opposite way; {@link #UNKNOWN} is its own opposite
     */
    public Orientation opposite() {
        return this == UNKNOWN ? UNKNOWN : ofSector(ordinal() + 4);
    }

    @Override
    public String toString() {
        return label;
    }
}
