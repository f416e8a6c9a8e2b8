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

import java.util.Optional;

/**
 * Energy calculation a reduction factor is looked up for. Each mode names the table used per obstruction class.
 *
 * @author hal.hildebrand
 */
public enum CalculationMode {
    HEATING("17.4", "17.7", "17.7"),
    COOLING("17.5", "17.9", "17.5"),
    SOLAR("17.6", "17.6", "17.6");

    private final String minimalTable;
    private final String overhangTable;
    private final String contextTable;

    CalculationMode(String minimalTable, String overhangTable, String contextTable) {
        this.minimalTable = minimalTable;
        this.overhangTable = overhangTable;
        this.contextTable = contextTable;
    }

    /**
     * @return the table id for the classification, empty for {@link Classification#ERROR}
     */
    public Optional<String> tableFor(Classification classification) {
        return switch (classification) {
            case MINIMAL_OBSTRUCTION -> Optional.of(minimalTable);
            case OVERHANG -> Optional.of(overhangTable);
            case CONTEXT_OBSTRUCTION -> Optional.of(contextTable);
            case ERROR -> Optional.empty();
        };
    }
}
