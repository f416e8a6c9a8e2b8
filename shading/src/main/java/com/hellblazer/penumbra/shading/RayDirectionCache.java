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

import javax.vecmath.Vector3d;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe memo of ray direction fans keyed by a quantized window normal.
 * <p>
 * Fans are generated from the quantized key rather than from the normal that first missed, so every window that maps
 * to the same key sees identical directions no matter which worker populated the entry.
 *
 * @author hal.hildebrand
 */
public class RayDirectionCache {

    /**
     * Normal components scaled by 10^digits and rounded
     */
    public record NormalKey(long x, long y, long z, int digits) {

        public static NormalKey of(Vector3d normal, int digits) {
            double scale = Math.pow(10, digits);
            return new NormalKey(Math.round(normal.x * scale), Math.round(normal.y * scale),
                                 Math.round(normal.z * scale), digits);
        }

        public Vector3d toNormal() {
            double scale = Math.pow(10, digits);
            return new Vector3d(x / scale, y / scale, z / scale);
        }
    }

    private final Map<NormalKey, List<RayDirection>> cache = new ConcurrentHashMap<>();
    private final int                                digits;
    private final AtomicLong                         hits   = new AtomicLong();
    private final AtomicLong                         misses = new AtomicLong();

    public RayDirectionCache(int digits) {
        if (digits < 0) {
            throw new IllegalArgumentException("Quantization digits must not be negative: " + digits);
        }
        this.digits = digits;
    }

    /**
     * @return the fan for the normal, generated on first use of its key
     */
    public List<RayDirection> get(Vector3d normal) {
        var key = NormalKey.of(normal, digits);
        var cached = cache.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        return cache.computeIfAbsent(key, k -> {
            misses.incrementAndGet();
            return RayDirectionGenerator.generate(k.toNormal());
        });
    }

    /**
     * Populate the entries for all normals ahead of parallel dispatch
     */
    public void prewarm(Collection<Vector3d> normals) {
        for (var normal : normals) {
            cache.computeIfAbsent(NormalKey.of(normal, digits), k -> RayDirectionGenerator.generate(k.toNormal()));
        }
    }

    public int size() {
        return cache.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    @Override
    public String toString() {
        return String.format("RayDirectionCache[entries=%d, hits=%d, misses=%d, hitRate=%.2f%%]", size(), hits.get(),
                             misses.get(), getHitRate() * 100);
    }
}
