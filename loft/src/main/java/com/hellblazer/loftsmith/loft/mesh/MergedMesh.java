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

import javax.vecmath.Point3f;

/**
 * The concatenation of every component and addon part, with recomputed normals. Colors and uvs are always
 * present; parts that lacked them contribute zeros.
 *
 * @author hal.hildebrand
 */
public final class MergedMesh {

    private final float[]    positions;
    private final float[]    normals;
    private final float[]    colors;
    private final float[]    uvs;
    private final int[]      indices;
    private final MeshBounds bounds;

    MergedMesh(float[] positions, float[] normals, float[] colors, float[] uvs, int[] indices) {
        this.positions = positions;
        this.normals = normals;
        this.colors = colors;
        this.uvs = uvs;
        this.indices = indices;
        this.bounds = MeshBounds.of(positions);
    }

    public MeshBounds getBounds() {
        return bounds;
    }

    public float[] getColors() {
        return colors.clone();
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public float[] getNormals() {
        return normals.clone();
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

    public float[] getUvs() {
        return uvs.clone();
    }

    public int getVertexCount() {
        return positions.length / 3;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    @Override
    public String toString() {
        return "MergedMesh[vertices=" + getVertexCount() + ", triangles=" + getTriangleCount() + "]";
    }
}
