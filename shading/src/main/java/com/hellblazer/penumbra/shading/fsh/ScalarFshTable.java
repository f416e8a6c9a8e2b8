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

import com.hellblazer.penumbra.shading.Orientation;

import java.time.Month;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * A reduction factor table indexed by month and orientation.
 *
 * @author hal.hildebrand
 */
public final class ScalarFshTable {

    private final String                             id;
    private final String                             description;
    private final Map<Month, Map<Orientation, Double>> values;

    ScalarFshTable(String id, String description, Map<Month, Map<Orientation, Double>> values) {
        this.id = id;
        this.description = description;
        var copy = new EnumMap<Month, Map<Orientation, Double>>(Month.class);
        values.forEach((month, row) -> {
            var rowCopy = new EnumMap<Orientation, Double>(Orientation.class);
            rowCopy.putAll(row);
            copy.put(month, Collections.unmodifiableMap(rowCopy));
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public OptionalDouble get(Month month, Orientation orientation) {
        var row = values.get(month);
        if (row == null) {
            return OptionalDouble.empty();
        }
        var value = row.get(orientation);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return "ScalarFshTable[" + id + ", months=" + values.size() + "]";
    }
}
