/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.penumbra.geometry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BVH accelerated ray casting against triangle meshes.
 *
 * @author hal.hildebrand
 */
public class MeshBVHTest {

    private static final double EPSILON = 1e-9;

    private MeshBVH cube;

    static TriangleMesh createBox(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        var builder = TriangleMesh.builder();
        builder.addVertex(minX, minY, minZ);
        builder.addVertex(maxX, minY, minZ);
        builder.addVertex(maxX, maxY, minZ);
        builder.addVertex(minX, maxY, minZ);
        builder.addVertex(minX, minY, maxZ);
        builder.addVertex(maxX, minY, maxZ);
        builder.addVertex(maxX, maxY, maxZ);
        builder.addVertex(minX, maxY, maxZ);

        builder.addQuad(0, 1, 2, 3); // bottom
        builder.addQuad(4, 5, 6, 7); // top
        builder.addQuad(0, 1, 5, 4); // front
        builder.addQuad(3, 2, 6, 7); // back
        builder.addQuad(0, 3, 7, 4); // left
        builder.addQuad(1, 2, 6, 5); // right
        return builder.build();
    }

    @BeforeEach
    void setUp() {
        cube = new MeshBVH(createBox(-5, -5, -5, 5, 5, 5));
    }

    @Test
    void testNearestHitIsReturned() {
        var ray = new Ray3D(new Point3d(0, -20, 0), new Vector3d(0, 1, 0));
        var hit = cube.intersectRay(ray);

        assertTrue(hit.isPresent());
        assertEquals(15.0, hit.get().distance(), EPSILON);
        assertEquals(-5.0, hit.get().point().y, EPSILON);
    }

    @Test
    void testMiss() {
        var ray = new Ray3D(new Point3d(0, -20, 10), new Vector3d(0, 1, 0));
        assertTrue(cube.intersectRay(ray).isEmpty());

        var away = new Ray3D(new Point3d(0, -20, 0), new Vector3d(0, -1, 0));
        assertTrue(cube.intersectRay(away).isEmpty());
    }

    @Test
    void testMaxDistanceLimitsHits() {
        var shortRay = new Ray3D(new Point3d(0, -20, 0), new Vector3d(0, 1, 0), 10.0);
        assertTrue(cube.intersectRay(shortRay).isEmpty());

        var longRay = new Ray3D(new Point3d(0, -20, 0), new Vector3d(0, 1, 0), 16.0);
        assertTrue(cube.intersectRay(longRay).isPresent());
    }

    @Test
    void testBackFacesAreHit() {
        // From inside, the far face is hit regardless of winding
        var ray = new Ray3D(new Point3d(0, 0, 0), new Vector3d(0, 0, 1));
        var hit = cube.intersectRay(ray);
        assertTrue(hit.isPresent());
        assertEquals(5.0, hit.get().distance(), EPSILON);
    }

    @Test
    void testFlatMeshWithAxisAlignedRay() {
        var builder = TriangleMesh.builder();
        builder.addVertex(-1, 0, 2);
        builder.addVertex(1, 0, 2);
        builder.addVertex(1, -1, 2);
        builder.addVertex(-1, -1, 2);
        var plate = new MeshBVH(builder.addQuad(0, 1, 2, 3).build());

        var up = new Ray3D(new Point3d(0, -0.5, 0), new Vector3d(0, 0, 1));
        var hit = plate.intersectRay(up);
        assertTrue(hit.isPresent());
        assertEquals(2.0, hit.get().distance(), EPSILON);

        var outside = new Ray3D(new Point3d(0, 0.5, 0), new Vector3d(0, 0, 1));
        assertTrue(plate.intersectRay(outside).isEmpty());
    }

    @Test
    void testMatchesBruteForceOnLargerMesh() {
        var random = new Random(0x5eed);
        var builder = TriangleMesh.builder();
        for (int i = 0; i < 200; i++) {
            double x = random.nextDouble() * 50;
            double y = random.nextDouble() * 50;
            double z = random.nextDouble() * 50;
            int a = builder.addVertex(x, y, z);
            int b = builder.addVertex(x + 2, y, z);
            int c = builder.addVertex(x, y + 2, z + 1);
            builder.addTriangle(a, b, c);
        }
        var mesh = builder.build();
        var bvh = new MeshBVH(mesh);
        var single = new MeshBVH[mesh.getTriangleCount()];
        for (int t = 0; t < mesh.getTriangleCount(); t++) {
            var one = TriangleMesh.builder();
            var v0 = new Point3d();
            var v1 = new Point3d();
            var v2 = new Point3d();
            mesh.getTriangleVertices(t, v0, v1, v2);
            one.addVertex(v0);
            one.addVertex(v1);
            one.addVertex(v2);
            single[t] = new MeshBVH(one.addTriangle(0, 1, 2).build());
        }

        for (int r = 0; r < 100; r++) {
            var origin = new Point3d(random.nextDouble() * 50, random.nextDouble() * 50, -10);
            var direction = new Vector3d(random.nextDouble() - 0.5, random.nextDouble() - 0.5, 1);
            var ray = new Ray3D(origin, direction);

            double expected = Double.POSITIVE_INFINITY;
            for (var s : single) {
                var h = s.intersectRay(ray);
                if (h.isPresent()) {
                    expected = Math.min(expected, h.get().distance());
                }
            }
            var actual = bvh.intersectRay(ray);
            if (Double.isInfinite(expected)) {
                assertTrue(actual.isEmpty());
            } else {
                assertEquals(expected, actual.orElseThrow().distance(), EPSILON);
            }
        }
    }

    @Test
    void testEmptyMesh() {
        var bvh = new MeshBVH(TriangleMesh.empty());
        assertTrue(bvh.intersectRay(new Ray3D(new Point3d(), new Vector3d(1, 0, 0))).isEmpty());
    }
}
