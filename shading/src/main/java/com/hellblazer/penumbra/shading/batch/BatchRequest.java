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

import com.hellblazer.penumbra.geometry.MeshSource;
import com.hellblazer.penumbra.shading.fsh.CalculationMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of windows to classify together against one context.
 *
 * @param windows  window surfaces; null entries yield error results
 * @param shadings shading devices paired with the windows by index; a null entry or a short list means no device
 * @param context  surrounding obstructions shared by all windows
 * @param month    month number, 1 to 12
 * @param mode     calculation to look the reduction factor up for, or null for the classifier's configured mode
 * @author hal.hildebrand
 */
public record BatchRequest(List<? extends MeshSource> windows, List<? extends MeshSource> shadings,
                           List<? extends MeshSource> context, int month, CalculationMode mode) {

    public BatchRequest {
        Objects.requireNonNull(windows, "windows");
        windows = copyOf(windows);
        shadings = shadings == null ? List.of() : copyOf(shadings);
        context = context == null ? List.of() : copyOf(context);
    }

    public BatchRequest(List<? extends MeshSource> windows, List<? extends MeshSource> shadings,
                        List<? extends MeshSource> context, int month) {
        this(windows, shadings, context, month, null);
    }

    /**
     * @return the shading device paired with the window, or null
     */
    public MeshSource shadingFor(int windowIndex) {
        return windowIndex < shadings.size() ? shadings.get(windowIndex) : null;
    }

    // List.copyOf rejects null elements, which are legitimate here
    private static List<MeshSource> copyOf(List<? extends MeshSource> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
