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

import com.hellblazer.penumbra.shading.Classification;
import com.hellblazer.penumbra.shading.Orientation;

import java.time.Month;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Resolves the reduction factor Fsh for a classified window.
 * <p>
 * Minimal obstruction reads the scalar table of the calculation mode; overhang and context obstruction read the
 * categorized table with the ho category of the window. Anything the tables do not cover resolves to 1.0. A Southwest
 * window without its own entry gets the mean of the South and West values.
 *
 * @author hal.hildebrand
 */
public class FshTableLookup {

    public static final double DEFAULT_FSH = 1.0;

    private final FshTables       tables;
    private final CalculationMode mode;

    public FshTableLookup(FshTables tables, CalculationMode mode) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public double lookup(Classification classification, Orientation orientation, Month month, double hoRatio) {
        if (orientation == Orientation.UNKNOWN) {
            return DEFAULT_FSH;
        }
        var tableId = mode.tableFor(classification);
        if (tableId.isEmpty()) {
            return DEFAULT_FSH;
        }

        var value = find(classification, tableId.get(), orientation, month, hoRatio);
        if (value.isPresent()) {
            return value.getAsDouble();
        }
        if (orientation == Orientation.SOUTHWEST) {
            double south = find(classification, tableId.get(), Orientation.SOUTH, month, hoRatio).orElse(DEFAULT_FSH);
            double west = find(classification, tableId.get(), Orientation.WEST, month, hoRatio).orElse(DEFAULT_FSH);
            return (south + west) / 2.0;
        }
        return DEFAULT_FSH;
    }

    private OptionalDouble find(Classification classification, String tableId, Orientation orientation, Month month,
                                double hoRatio) {
        if (classification == Classification.MINIMAL_OBSTRUCTION) {
            return tables.scalar(tableId).map(t -> t.get(month, orientation)).orElse(OptionalDouble.empty());
        }
        var category = HoCategory.of(hoRatio);
        return tables.categorized(tableId)
                     .map(t -> t.get(month, orientation, category))
                     .orElse(OptionalDouble.empty());
    }
}
