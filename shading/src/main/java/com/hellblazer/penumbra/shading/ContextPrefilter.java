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

import java.util.ArrayList;
import java.util.List;

/**
 * Coarse visibility filter that drops context items which cannot affect a window before any rays are cast. Works on
 * the horizontal projection only.
 *
 * @author hal.hildebrand
 */
public class ContextPrefilter {

    private final double maxDistanceSquared;

    public ContextPrefilter(ClassifierConfiguration configuration) {
        double maxDistance = configuration.getMaxContextDistance();
        this.maxDistanceSquared = maxDistance * maxDistance;
    }

    public List<ContextItem> filter(List<ContextItem> items, WindowRecord window) {
        var result = new ArrayList<ContextItem>();
        for (var item : items) {
            if (accepts(item, window)) {
                result.add(item);
            }
        }
        return result;
    }

    boolean accepts(ContextItem item, WindowRecord window) {
        var center = window.center();
        var normal = window.normal();
        var itemCenter = item.bounds().getCenter();

        double dx = itemCenter.x - center.x;
        double dy = itemCenter.y - center.y;

        // Behind the window, allowing for items that straddle its plane
        double dot = dx * normal.x + dy * normal.y;
        if (dot < -item.bounds().getDiagonalLength() / 2) {
            return false;
        }
        if (dx * dx + dy * dy > maxDistanceSquared) {
            return false;
        }
        return item.bounds().getMaxZ() >= window.bounds().getMinZ();
    }
}
