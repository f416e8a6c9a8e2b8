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
package com.hellblazer.penumbra.geometry;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounding Volume Hierarchy (BVH) for accelerating ray casts against a triangle mesh. Uses axis-aligned bounding boxes
 * as bounding volumes. Immutable once built, so a single hierarchy may be queried from many threads.
 *
 * @author hal.hildebrand
 */
public class MeshBVH {

    private static final int    MAX_TRIANGLES_PER_LEAF = 4;
    private static final double PARALLEL_EPSILON       = 1e-12;
    private static final double MIN_HIT_DISTANCE       = 1e-9;

    private final TriangleMesh mesh;
    private final BVHNode      root;

    public MeshBVH(TriangleMesh mesh) {
        this.mesh = mesh;

        var triangleIndices = new ArrayList<Integer>();
        for (int i = 0; i < mesh.getTriangleCount(); i++) {
            triangleIndices.add(i);
        }

        this.root = buildBVH(triangleIndices);
    }

    /**
     * Find the closest triangle intersected by the ray, within the ray's maximum distance
     */
    public Optional<RayHit> intersectRay(Ray3D ray) {
        if (root == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(intersectRayNode(root, ray, ray.maxDistance()));
    }

    private BVHNode buildBVH(List<Integer> triangleIndices) {
        if (triangleIndices.isEmpty()) {
            return null;
        }

        var node = new BVHNode();
        node.bounds = computeBounds(triangleIndices);

        if (triangleIndices.size() <= MAX_TRIANGLES_PER_LEAF) {
            node.triangleIndices = new ArrayList<>(triangleIndices);
            return node;
        }

        int splitAxis = chooseSplitAxis(node.bounds);
        double splitPos = computeSplitPosition(triangleIndices, splitAxis);

        var leftTriangles = new ArrayList<Integer>();
        var rightTriangles = new ArrayList<Integer>();

        for (var triIndex : triangleIndices) {
            if (axisValue(computeTriangleCentroid(triIndex), splitAxis) < splitPos) {
                leftTriangles.add(triIndex);
            } else {
                rightTriangles.add(triIndex);
            }
        }

        // All centroids on one side; no useful split
        if (leftTriangles.isEmpty() || rightTriangles.isEmpty()) {
            node.triangleIndices = new ArrayList<>(triangleIndices);
            return node;
        }

        node.left = buildBVH(leftTriangles);
        node.right = buildBVH(rightTriangles);

        return node;
    }

    private BoundingBox computeBounds(List<Integer> triangleIndices) {
        var points = new ArrayList<Point3d>(triangleIndices.size() * 3);
        for (var triIndex : triangleIndices) {
            var v0 = new Point3d();
            var v1 = new Point3d();
            var v2 = new Point3d();
            mesh.getTriangleVertices(triIndex, v0, v1, v2);
            points.add(v0);
            points.add(v1);
            points.add(v2);
        }
        return BoundingBox.of(points);
    }

    private int chooseSplitAxis(BoundingBox bounds) {
        double dx = bounds.getExtentX();
        double dy = bounds.getExtentY();
        double dz = bounds.getExtentZ();

        if (dx >= dy && dx >= dz) {
            return 0;
        }
        if (dy >= dz) {
            return 1;
        }
        return 2;
    }

    private double computeSplitPosition(List<Integer> triangleIndices, int axis) {
        double sum = 0;
        for (var triIndex : triangleIndices) {
            sum += axisValue(computeTriangleCentroid(triIndex), axis);
        }
        return sum / triangleIndices.size();
    }

    private static double axisValue(Point3d point, int axis) {
        return switch (axis) {
            case 0 -> point.x;
            case 1 -> point.y;
            case 2 -> point.z;
            default -> throw new IllegalStateException("Invalid axis: " + axis);
        };
    }

    private Point3d computeTriangleCentroid(int triangleIndex) {
        var v0 = new Point3d();
        var v1 = new Point3d();
        var v2 = new Point3d();
        mesh.getTriangleVertices(triangleIndex, v0, v1, v2);

        var centroid = new Point3d(v0);
        centroid.add(v1);
        centroid.add(v2);
        centroid.scale(1.0 / 3.0);
        return centroid;
    }

    private RayHit intersectRayNode(BVHNode node, Ray3D ray, double tMax) {
        if (!rayIntersectsAABB(ray, node.bounds, tMax)) {
            return null;
        }

        if (node.isLeaf()) {
            RayHit closest = null;
            double closestT = tMax;

            for (var triIndex : node.triangleIndices) {
                var hit = rayIntersectsTriangle(ray, triIndex);
                if (hit != null && hit.distance() <= closestT) {
                    closest = hit;
                    closestT = hit.distance();
                }
            }
            return closest;
        }

        var leftHit = node.left != null ? intersectRayNode(node.left, ray, tMax) : null;
        var rightTMax = leftHit != null ? leftHit.distance() : tMax;
        var rightHit = node.right != null ? intersectRayNode(node.right, ray, rightTMax) : null;

        if (leftHit == null) {
            return rightHit;
        }
        if (rightHit == null) {
            return leftHit;
        }
        return leftHit.distance() <= rightHit.distance() ? leftHit : rightHit;
    }

    private static boolean rayIntersectsAABB(Ray3D ray, BoundingBox bounds, double tMax) {
        var origin = ray.origin();
        var direction = ray.direction();
        double tMin = 0.0;

        double[] o = { origin.x, origin.y, origin.z };
        double[] d = { direction.x, direction.y, direction.z };
        double[] lo = { bounds.getMinX(), bounds.getMinY(), bounds.getMinZ() };
        double[] hi = { bounds.getMaxX(), bounds.getMaxY(), bounds.getMaxZ() };

        for (int axis = 0; axis < 3; axis++) {
            if (Math.abs(d[axis]) < PARALLEL_EPSILON) {
                // Parallel to this slab: must start inside it
                if (o[axis] < lo[axis] || o[axis] > hi[axis]) {
                    return false;
                }
                continue;
            }
            double inv = 1.0 / d[axis];
            double t1 = (lo[axis] - o[axis]) * inv;
            double t2 = (hi[axis] - o[axis]) * inv;
            tMin = Math.max(tMin, Math.min(t1, t2));
            tMax = Math.min(tMax, Math.max(t1, t2));
            if (tMax < tMin) {
                return false;
            }
        }
        return true;
    }

    private RayHit rayIntersectsTriangle(Ray3D ray, int triangleIndex) {
        var v0 = new Point3d();
        var v1 = new Point3d();
        var v2 = new Point3d();
        mesh.getTriangleVertices(triangleIndex, v0, v1, v2);

        // Möller–Trumbore intersection algorithm, two sided
        var edge1 = new Vector3d();
        edge1.sub(v1, v0);
        var edge2 = new Vector3d();
        edge2.sub(v2, v0);

        var h = new Vector3d();
        h.cross(ray.direction(), edge2);
        var a = edge1.dot(h);

        if (a > -PARALLEL_EPSILON && a < PARALLEL_EPSILON) {
            return null;
        }

        var f = 1.0 / a;
        var s = new Vector3d();
        s.sub(ray.origin(), v0);
        var u = f * s.dot(h);

        if (u < 0.0 || u > 1.0) {
            return null;
        }

        var q = new Vector3d();
        q.cross(s, edge1);
        var v = f * ray.direction().dot(q);

        if (v < 0.0 || u + v > 1.0) {
            return null;
        }

        var t = f * edge2.dot(q);
        if (t > MIN_HIT_DISTANCE && t <= ray.maxDistance()) {
            return new RayHit(triangleIndex, t, ray.getPointAt(t));
        }

        return null;
    }

    private static class BVHNode {
        BoundingBox   bounds;
        BVHNode       left;
        BVHNode       right;
        List<Integer> triangleIndices;

        boolean isLeaf() {
            return triangleIndices != null;
        }
    }
}
