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
package com.hellblazer.penumbra.shading.fsh;

/**
 * The three ho ratio bands of table 17.7. Lower bounds are inclusive.
 *
 * @author hal.hildebrand
 */
public enum HoCategory {
    SHALLOW("<0.5"),
    MEDIUM("0.5-1.0"),
    DEEP(">=1.0");

    private final String label;

    HoCategory(String label) {
        this.label = label;
    }

    public static HoCategory of(double hoRatio) {
        if (hoRatio < 0.5) {
            return SHALLOW;
        }
        if (hoRatio < 1.0) {
            return MEDIUM;
        }
        return DEEP;
    }

    /**
     * @throws IllegalArgumentException if no category carries the label
     */
    public static HoCategory fromLabel(String label) {
        for (var category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown ho category: " + label);
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
