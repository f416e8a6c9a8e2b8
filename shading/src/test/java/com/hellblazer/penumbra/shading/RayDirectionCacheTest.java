/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.shading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RayDirectionCacheTest {

    @Test
    @DisplayName("Normals equal after quantization share one entry")
    void testQuantizedKeySharing() {
        var cache = new RayDirectionCache(4);
        var first = cache.get(new Vector3d(0, -1, 0));
        var second = cache.get(new Vector3d(0.00001, -0.99999, 0.00002));

        assertSame(first, second);
        assertEquals(1, cache.size());
        assertEquals(1, cache.getMisses());
        assertEquals(1, cache.getHits());
        assertEquals(0.5, cache.getHitRate(), 1e-12);
    }

    @Test
    @DisplayName("Directions come from the quantized normal, not the first caller's")
    void testOrderIndependence() {
        var a = new Vector3d(0.70711, 0.70710, 0);
        var b = new Vector3d(0.707108, 0.707104, 0);

        var forward = new RayDirectionCache(4);
        var abDirections = List.of(forward.get(a), forward.get(b));
        var reverse = new RayDirectionCache(4);
        var baDirections = List.of(reverse.get(b), reverse.get(a));

        assertEquals(abDirections.get(0), baDirections.get(0));
        assertEquals(abDirections.get(1), baDirections.get(1));
    }

    @Test
    @DisplayName("Distinct normals get distinct fans")
    void testDistinctNormals() {
        var cache = new RayDirectionCache(4);
        cache.get(new Vector3d(0, -1, 0));
        cache.get(new Vector3d(1, 0, 0));
        assertEquals(2, cache.size());
        assertEquals(2, cache.getMisses());
    }

    @Test
    @DisplayName("Pre-warming populates entries without counting misses")
    void testPrewarm() {
        var cache = new RayDirectionCache(4);
        cache.prewarm(List.of(new Vector3d(0, -1, 0), new Vector3d(0, 1, 0), new Vector3d(0, -1, 0)));
        assertEquals(2, cache.size());

        cache.get(new Vector3d(0, 1, 0));
        assertEquals(1, cache.getHits());
        assertEquals(0, cache.getMisses());
    }

    @Test
    @DisplayName("Concurrent first access generates a single fan")
    void testConcurrentAccess() throws Exception {
        var cache = new RayDirectionCache(4);
        var executor = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<CompletableFuture<List<RayDirection>>>();
            for (int i = 0; i < 64; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> cache.get(new Vector3d(0, -1, 0)), executor));
            }
            var expected = futures.get(0).get();
            for (var future : futures) {
                assertSame(expected, future.get());
            }
            assertEquals(1, cache.size());
            assertEquals(1, cache.getMisses());
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Cached fans cannot be altered through returned directions")
    void testCachedDirectionsAreCopies() {
        var cache = new RayDirectionCache(4);
        var normal = new Vector3d(0, -1, 0);
        var first = cache.get(normal);
        var original = first.get(0).direction();

        first.get(0).direction().negate();
        first.get(0).direction().set(1, 2, 3);

        assertEquals(original, cache.get(normal).get(0).direction());
        assertThrows(UnsupportedOperationException.class, () -> first.remove(0));
    }

    @Test
    void testNormalKey() {
        var key = RayDirectionCache.NormalKey.of(new Vector3d(0.123456, -0.5, 1.0), 4);
        assertEquals(1235, key.x());
        assertEquals(-5000, key.y());
        assertEquals(10000, key.z());
        assertEquals(0.1235, key.toNormal().x, 1e-12);
        assertThrows(IllegalArgumentException.class, () -> new RayDirectionCache(-1));
    }
}
