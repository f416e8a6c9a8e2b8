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

import com.hellblazer.penumbra.geometry.MeshConversionException;
import com.hellblazer.penumbra.geometry.MeshSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The context geometry of a batch. Built once from the caller's raw context list; sources that are null, empty or fail
 * to convert are skipped and counted rather than failing the batch.
 *
 * @author hal.hildebrand
 */
public final class ContextSet {

    private static final Logger     log   = LoggerFactory.getLogger(ContextSet.class);
    private static final ContextSet EMPTY = new ContextSet(List.of(), 0);

    private final List<ContextItem> items;
    private final int               skippedCount;

    private ContextSet(List<ContextItem> items, int skippedCount) {
        this.items = List.copyOf(items);
        this.skippedCount = skippedCount;
    }

    public static ContextSet empty() {
        return EMPTY;
    }

    public static ContextSet build(List<? extends MeshSource> sources) {
        Objects.requireNonNull(sources, "sources");
        var items = new ArrayList<ContextItem>(sources.size());
        int skipped = 0;
        for (int i = 0; i < sources.size(); i++) {
            var source = sources.get(i);
            if (source == null) {
                log.warn("Context item {} is null, skipping", i);
                skipped++;
                continue;
            }
            try {
                var mesh = source.toTriangleMesh();
                if (mesh == null || mesh.isEmpty()) {
                    log.warn("Context item {} has no triangles, skipping", i);
                    skipped++;
                    continue;
                }
                items.add(ContextItem.of(mesh, i));
            } catch (MeshConversionException | RuntimeException e) {
                log.warn("Context item {} could not be converted, skipping: {}", i, e.getMessage());
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} of {} context items", skipped, sources.size());
        }
        log.debug("Built context set with {} items", items.size());
        return new ContextSet(items, skipped);
    }

    public List<ContextItem> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Number of raw context entries that could not be used
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    @Override
    public String toString() {
        return "ContextSet[items=" + items.size() + ", skipped=" + skippedCount + "]";
    }
}
