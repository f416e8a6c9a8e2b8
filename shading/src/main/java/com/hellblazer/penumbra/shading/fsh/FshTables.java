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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of reduction factor tables available for lookup, keyed by table id ("17.4", "17.7", ...). Immutable.
 *
 * @author hal.hildebrand
 */
public final class FshTables {

    public static final String STANDARD_RESOURCE = "/nen5060-fsh-tables.json";

    private static final class StandardHolder {
        private static final FshTables INSTANCE = loadStandard();

        private static FshTables loadStandard() {
            try {
                return FshTableLoader.loadResource(STANDARD_RESOURCE);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to load " + STANDARD_RESOURCE, e);
            }
        }
    }

    private final Map<String, ScalarFshTable>      scalarTables;
    private final Map<String, CategorizedFshTable> categorizedTables;

    FshTables(Map<String, ScalarFshTable> scalarTables, Map<String, CategorizedFshTable> categorizedTables) {
        this.scalarTables = Map.copyOf(scalarTables);
        this.categorizedTables = Map.copyOf(categorizedTables);
    }

    /**
     * The NEN 5060 tables shipped with the library, loaded on first use
     */
    public static FshTables standard() {
        return StandardHolder.INSTANCE;
    }

    public Optional<ScalarFshTable> scalar(String id) {
        return Optional.ofNullable(scalarTables.get(id));
    }

    public Optional<CategorizedFshTable> categorized(String id) {
        return Optional.ofNullable(categorizedTables.get(id));
    }

    public Set<String> getTableIds() {
        var ids = new TreeSet<>(scalarTables.keySet());
        ids.addAll(categorizedTables.keySet());
        return ids;
    }

    @Override
    public String toString() {
        return "FshTables" + getTableIds();
    }
}
