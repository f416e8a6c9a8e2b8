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
package com.hellblazer.penumbra.shading.batch;

import com.hellblazer.penumbra.shading.Classification;
import com.hellblazer.penumbra.shading.ClassificationResult;
import com.hellblazer.penumbra.shading.fsh.CalculationMode;

import java.time.Month;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of a batch, one per requested window in request order.
 *
 * @param contextItemCount    context items used
 * @param contextSkippedCount raw context entries that were skipped as unusable
 * @param shadingCount        windows that had a shading device supplied
 * @author hal.hildebrand
 */
public record BatchResult(List<ClassificationResult> results, int contextItemCount, int contextSkippedCount,
                          int shadingCount, Month month, CalculationMode mode) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public ClassificationResult get(int windowIndex) {
        return results.get(windowIndex);
    }

    /**
     * Number of windows per classification, including zero counts
     */
    public Map<Classification, Integer> countsByClassification() {
        var counts = new EnumMap<Classification, Integer>(Classification.class);
        for (var classification : Classification.values()) {
            counts.put(classification, 0);
        }
        for (var result : results) {
            counts.merge(result.classification(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public int errorCount() {
        return countsByClassification().get(Classification.ERROR);
    }
}
