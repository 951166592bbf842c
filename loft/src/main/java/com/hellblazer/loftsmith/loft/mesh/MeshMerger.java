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

import com.hellblazer.loftsmith.common.FloatArrayList;
import com.hellblazer.loftsmith.common.IntArrayList;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.List;

/**
 * Appends mesh parts in the given order and recomputes smooth normals over the result.
 *
 * @author hal.hildebrand
 */
public final class MeshMerger {

    private MeshMerger() {
    }

    public static MergedMesh merge(List<MeshPart> parts) {
        var vertexTotal = 0;
        var indexTotal = 0;
        for (var part : parts) {
            vertexTotal += part.getVertexCount();
            indexTotal += part.getTriangleCount() * 3;
        }
        var positions = new FloatArrayList(vertexTotal * 3);
        var colors = new FloatArrayList(vertexTotal * 3);
        var uvs = new FloatArrayList(vertexTotal * 2);
        var indices = new IntArrayList(indexTotal);

        var offset = 0;
        for (var part : parts) {
            var count = part.getVertexCount();
            positions.addAll(part.getPositions());
            if (part.hasColors()) {
                colors.addAll(part.getColors());
            } else {
                colors.addZeros(count * 3);
            }
            if (part.hasUvs()) {
                uvs.addAll(part.getUvs());
            } else {
                uvs.addZeros(count * 2);
            }
            indices.addAll(part.getIndices(), offset);
            offset += count;
        }

        var packed = positions.toArray();
        var triangles = indices.toArray();
        return new MergedMesh(packed, computeNormals(packed, triangles), colors.toArray(), uvs.toArray(), triangles);
    }

    /**
     * Area-weighted vertex normals: every face's unnormalized cross product is accumulated into its three vertices
     * and each sum normalized. Vertices touched by no non-degenerate face get +Y.
     */
    public static float[] computeNormals(float[] positions, int[] indices) {
        var normals = new float[positions.length];
        var v0 = new Point3f();
        var v1 = new Point3f();
        var v2 = new Point3f();
        var edge1 = new Vector3f();
        var edge2 = new Vector3f();
        var face = new Vector3f();
        for (int i = 0; i + 2 < indices.length; i += 3) {
            var a = indices[i] * 3;
            var b = indices[i + 1] * 3;
            var c = indices[i + 2] * 3;
            v0.set(positions[a], positions[a + 1], positions[a + 2]);
            v1.set(positions[b], positions[b + 1], positions[b + 2]);
            v2.set(positions[c], positions[c + 1], positions[c + 2]);
            edge1.sub(v1, v0);
            edge2.sub(v2, v0);
            face.cross(edge1, edge2);
            for (var base : new int[] { a, b, c }) {
                normals[base] += face.x;
                normals[base + 1] += face.y;
                normals[base + 2] += face.z;
            }
        }
        var n = new Vector3f();
        for (int i = 0; i < normals.length; i += 3) {
            n.set(normals[i], normals[i + 1], normals[i + 2]);
            var length = n.length();
            if (length > 0) {
                n.scale(1.0f / length);
            } else {
                n.set(0, 1, 0);
            }
            normals[i] = n.x;
            normals[i + 1] = n.y;
            normals[i + 2] = n.z;
        }
        return normals;
    }
}
