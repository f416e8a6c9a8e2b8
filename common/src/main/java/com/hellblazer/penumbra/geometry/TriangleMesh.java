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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable indexed triangle mesh: a vertex list and a flat array of triangle index triples. Instances are only read
 * by the classification engine, never modified.
 *
 * @author hal.hildebrand
 */
public final class TriangleMesh implements MeshSource {

    private static final TriangleMesh EMPTY = new TriangleMesh(List.of(), new int[0]);

    private final List<Point3d> vertices;
    private final int[]         indices;
    private final BoundingBox   bounds;

    private TriangleMesh(List<Point3d> vertices, int[] indices) {
        this.vertices = Collections.unmodifiableList(vertices);
        this.indices = indices;
        this.bounds = vertices.isEmpty() ? null : BoundingBox.of(vertices);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TriangleMesh empty() {
        return EMPTY;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public int getTriangleCount() {
        return indices.length / 3;
    }

    /**
     * A mesh with no vertices or no triangles has no surface to classify or intersect
     */
    public boolean isEmpty() {
        return vertices.isEmpty() || indices.length == 0;
    }

    /**
     * Get a vertex by index
     */
    public Point3d getVertex(int index) {
        return new Point3d(vertices.get(index));
    }

    /**
     * Get the vertex indices of a triangle
     */
    public int[] getTriangle(int triangleIndex) {
        int base = triangleIndex * 3;
        return new int[] { indices[base], indices[base + 1], indices[base + 2] };
    }

    /**
     * Get the three vertices of a triangle
     */
    public void getTriangleVertices(int triangleIndex, Point3d v0, Point3d v1, Point3d v2) {
        int base = triangleIndex * 3;
        v0.set(vertices.get(indices[base]));
        v1.set(vertices.get(indices[base + 1]));
        v2.set(vertices.get(indices[base + 2]));
    }

    /**
     * Un-normalized face normal of a triangle; its length is twice the triangle area
     */
    public Vector3d getScaledNormal(int triangleIndex) {
        var v0 = new Point3d();
        var v1 = new Point3d();
        var v2 = new Point3d();
        getTriangleVertices(triangleIndex, v0, v1, v2);

        var edge1 = new Vector3d();
        edge1.sub(v1, v0);
        var edge2 = new Vector3d();
        edge2.sub(v2, v0);

        var normal = new Vector3d();
        normal.cross(edge1, edge2);
        return normal;
    }

    /**
     * Get the axis-aligned bounding box of the mesh
     *
     * @throws IllegalStateException if the mesh has no vertices
     */
    public BoundingBox getBounds() {
        if (bounds == null) {
            throw new IllegalStateException("Mesh has no vertices");
        }
        return bounds;
    }

    @Override
    public TriangleMesh toTriangleMesh() {
        return this;
    }

    @Override
    public String toString() {
        return "TriangleMesh[vertices=" + vertices.size() + ", triangles=" + getTriangleCount() + "]";
    }

    /**
     * Accumulates vertices and faces. Quads are split along their A-C diagonal.
     */
    public static class Builder {
        private final List<Point3d> vertices = new ArrayList<>();
        private int[]               indices  = new int[48];
        private int                 size;

        /**
         * Add a vertex to the mesh
         *
         * @return the index of the added vertex
         */
        public int addVertex(Point3d vertex) {
            vertices.add(new Point3d(vertex));
            return vertices.size() - 1;
        }

        public int addVertex(double x, double y, double z) {
            return addVertex(new Point3d(x, y, z));
        }

        /**
         * Add a triangle to the mesh using vertex indices
         */
        public Builder addTriangle(int v0, int v1, int v2) {
            checkIndex(v0);
            checkIndex(v1);
            checkIndex(v2);
            if (size + 3 > indices.length) {
                indices = Arrays.copyOf(indices, indices.length * 2);
            }
            indices[size++] = v0;
            indices[size++] = v1;
            indices[size++] = v2;
            return this;
        }

        /**
         * Add a quad as the two triangles A-B-C and A-C-D
         */
        public Builder addQuad(int a, int b, int c, int d) {
            addTriangle(a, b, c);
            return addTriangle(a, c, d);
        }

        public TriangleMesh build() {
            return new TriangleMesh(new ArrayList<>(vertices), Arrays.copyOf(indices, size));
        }

        private void checkIndex(int index) {
            if (index < 0 || index >= vertices.size()) {
                throw new IllegalArgumentException(
                "Invalid vertex index " + index + " (vertex count " + vertices.size() + ")");
            }
        }
    }
}
