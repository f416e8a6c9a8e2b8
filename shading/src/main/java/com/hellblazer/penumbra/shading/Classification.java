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
 * The NEN 5060 obstruction class of a window.
 *
 * @author hal.hildebrand
 */
public enum Classification {
    MINIMAL_OBSTRUCTION("MinimalObstruction", "MIN"),
    OVERHANG("Overhang", "OVH"),
    CONTEXT_OBSTRUCTION("ContextObstruction", "CTX"),
    ERROR("Error", "ERR");

    private final String label;
    private final String abbreviation;

    Classification(String label, String abbreviation) {
        this.label = label;
        this.abbreviation = abbreviation;
    }

    public String label() {
        return label;
    }

    /**
     * Three letter code used in report rows
     */
    public String abbreviation() {
        return abbreviation;
    }

    @Override
    public String toString() {
        return label;
    }
}
