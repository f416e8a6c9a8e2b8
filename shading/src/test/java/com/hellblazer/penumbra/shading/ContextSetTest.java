/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.shading;

import com.hellblazer.penumbra.geometry.MeshConversionException;
import com.hellblazer.penumbra.geometry.MeshSource;
import com.hellblazer.penumbra.geometry.TriangleMesh;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class ContextSetTest {

    @Test
    @DisplayName("Unusable context sources are skipped and counted")
    void testSkipsInvalidSources() throws Exception {
        var failing = mock(MeshSource.class);
        when(failing.toTriangleMesh()).thenThrow(new MeshConversionException("not a solid"));
        var exploding = mock(MeshSource.class);
        when(exploding.toTriangleMesh()).thenThrow(new IllegalStateException("boom"));
        var returnsNull = mock(MeshSource.class);

        var sources = new ArrayList<MeshSource>();
        sources.add(TestMeshes.box(0, 10, 0, 5, 15, 10));
        sources.add(null);
        sources.add(failing);
        sources.add(TriangleMesh.empty());
        sources.add(exploding);
        sources.add(returnsNull);
        sources.add(TestMeshes.box(20, 10, 0, 25, 15, 10));

        var context = ContextSet.build(sources);

        assertEquals(2, context.size());
        assertEquals(5, context.getSkippedCount());
        assertEquals(0, context.getItems().get(0).sourceIndex());
        assertEquals(6, context.getItems().get(1).sourceIndex());
        verify(failing).toTriangleMesh();
    }

    @Test
    void testItemsCarryBounds() {
        var context = ContextSet.build(List.of(TestMeshes.box(0, 10, 0, 5, 15, 10)));
        var item = context.getItems().get(0);
        assertEquals(10.0, item.bounds().getMaxZ());
        assertEquals(12.5, item.bounds().getCenter().y);
        assertFalse(context.isEmpty());
    }

    @Test
    void testEmpty() {
        assertTrue(ContextSet.empty().isEmpty());
        assertEquals(0, ContextSet.build(List.of()).getSkippedCount());
        assertThrows(NullPointerException.class, () -> ContextSet.build(null));
    }
}
