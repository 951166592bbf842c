/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.loftsmith.loft.mesh;

import com.hellblazer.loftsmith.geometry.EulerRotation;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Arrays;

/**
 * One indexed triangle mesh piece: packed xyz positions, optional packed rgb colors, optional packed uv
 * coordinates, and triangle indices into its own vertices. Immutable; accessors return copies.
 *
 * @author hal.hildebrand
 */
public final class MeshPart {

    private final float[] positions;
    private final float[] colors;
    private final float[] uvs;
    private final int[]   indices;

    public MeshPart(float[] positions, float[] colors, float[] uvs, int[] indices) {
        if (positions.length % 3 != 0) {
            throw new IllegalArgumentException("Position array length must be a multiple of 3: " + positions.length);
        }
        if (indices.length % 3 != 0) {
            throw new IllegalArgumentException("Index array length must be a multiple of 3: " + indices.length);
        }
        var vertexCount = positions.length / 3;
        if (colors != null && colors.length != vertexCount * 3) {
            throw new IllegalArgumentException("Expected " + vertexCount * 3 + " color components: " + colors.length);
        }
        if (uvs != null && uvs.length != vertexCount * 2) {
            throw new IllegalArgumentException("Expected " + vertexCount * 2 + " uv components: " + uvs.length);
        }
        for (var index : indices) {
            if (index < 0 || index >= vertexCount) {
                throw new IllegalArgumentException("Invalid vertex index " + index + " for " + vertexCount + " vertices");
            }
        }
        this.positions = positions.clone();
        this.colors = colors == null ? null : colors.clone();
        this.uvs = uvs == null ? null : uvs.clone();
        this.indices = indices.clone();
    }

    public MeshBounds computeBounds() {
        return MeshBounds.of(positions);
    }

    /**
     * @return a copy of the colors, or null when the part is uncolored
     */
    public float[] getColors() {
        return colors == null ? null : colors.clone();
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public Point3f getPosition(int vertex) {
        return new Point3f(positions[vertex * 3], positions[vertex * 3 + 1], positions[vertex * 3 + 2]);
    }

    public float[] getPositions() {
        return positions.clone();
    }

    public int getTriangleCount() {
        return indices.length / 3;
    }

    /**
     * @return a copy of the uv coordinates, or null when the part has none
     */
    public float[] getUvs() {
        return uvs == null ? null : uvs.clone();
    }

    public int getVertexCount() {
        return positions.length / 3;
    }

    public boolean hasColors() {
        return colors != null;
    }

    public boolean hasUvs() {
        return uvs != null;
    }

    /**
     * Rotate every vertex about the part's own origin, then translate.
     */
    public MeshPart transformed(EulerRotation rotation, Vector3f translation) {
        var moved = new float[positions.length];
        var m = rotation.matrix();
        var p = new Point3f();
        for (int i = 0; i < positions.length; i += 3) {
            p.set(positions[i], positions[i + 1], positions[i + 2]);
            m.transform(p);
            moved[i] = p.x + translation.x;
            moved[i + 1] = p.y + translation.y;
            moved[i + 2] = p.z + translation.z;
        }
        return new MeshPart(moved, colors, uvs, indices);
    }

    public MeshPart withColors(float[] newColors) {
        return new MeshPart(positions, newColors, uvs, indices);
    }

    /**
     * Every vertex painted the same linear rgb color.
     */
    public MeshPart withSolidColor(float r, float g, float b) {
        var filled = new float[positions.length];
        for (int i = 0; i < filled.length; i += 3) {
            filled[i] = r;
            filled[i + 1] = g;
            filled[i + 2] = b;
        }
        return withColors(filled);
    }

    @Override
    public String toString() {
        return "MeshPart[vertices=" + getVertexCount() + ", triangles=" + getTriangleCount() + ", colored="
        + hasColors() + "]";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof MeshPart other && Arrays.equals(positions, other.positions) && Arrays.equals(
        colors, other.colors) && Arrays.equals(uvs, other.uvs) && Arrays.equals(indices, other.indices));
    }

    @Override
    public int hashCode() {
        var result = Arrays.hashCode(positions);
        result = 31 * result + Arrays.hashCode(colors);
        result = 31 * result + Arrays.hashCode(uvs);
        return 31 * result + Arrays.hashCode(indices);
    }
}
