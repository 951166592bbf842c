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

package com.hellblazer.loftsmith.loft.primitive;

import com.hellblazer.loftsmith.common.FloatArrayList;
import com.hellblazer.loftsmith.common.IntArrayList;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;

/**
 * Parametric solids centered on their own origin. Every part carries uvs and no colors.
 *
 * @author hal.hildebrand
 */
public final class Primitives {

    public static final int DEFAULT_CYLINDER_SEGMENTS = 8;
    public static final int DEFAULT_SPHERE_HEIGHT     = 4;
    public static final int DEFAULT_SPHERE_WIDTH      = 6;

    // normal, right, up per face; right x up == normal
    private static final float[][][] BOX_FACES = { { { 1, 0, 0 }, { 0, 0, -1 }, { 0, 1, 0 } },
                                                   { { -1, 0, 0 }, { 0, 0, 1 }, { 0, 1, 0 } },
                                                   { { 0, 1, 0 }, { 1, 0, 0 }, { 0, 0, -1 } },
                                                   { { 0, -1, 0 }, { 1, 0, 0 }, { 0, 0, 1 } },
                                                   { { 0, 0, 1 }, { 1, 0, 0 }, { 0, 1, 0 } },
                                                   { { 0, 0, -1 }, { -1, 0, 0 }, { 0, 1, 0 } } };
    private static final float[][]   CORNERS   = { { -1, -1 }, { 1, -1 }, { 1, 1 }, { -1, 1 } };

    private Primitives() {
    }

    /**
     * An axis-aligned box with four unshared vertices per face: 24 vertices, 12 triangles.
     */
    public static MeshPart box(float width, float height, float depth) {
        var half = new float[] { width / 2, height / 2, depth / 2 };
        var positions = new FloatArrayList(24 * 3);
        var uvs = new FloatArrayList(24 * 2);
        var indices = new IntArrayList(36);
        for (var face : BOX_FACES) {
            var base = positions.size() / 3;
            var n = face[0];
            var r = face[1];
            var u = face[2];
            for (var corner : CORNERS) {
                positions.add((n[0] + corner[0] * r[0] + corner[1] * u[0]) * half[0],
                              (n[1] + corner[0] * r[1] + corner[1] * u[1]) * half[1],
                              (n[2] + corner[0] * r[2] + corner[1] * u[2]) * half[2]);
                uvs.add((corner[0] + 1) / 2, (corner[1] + 1) / 2);
            }
            indices.addTriangle(base, base + 1, base + 2);
            indices.addTriangle(base, base + 2, base + 3);
        }
        return new MeshPart(positions.toArray(), null, uvs.toArray(), indices.toArray());
    }

    /**
     * A capped cylinder or cone frustum along Y, centered on the origin. The side has {@code radialSegments + 1}
     * columns so the seam carries its own uvs; each cap is a fan around one center vertex.
     */
    public static MeshPart cylinder(float radiusTop, float radiusBottom, float height, int radialSegments) {
        if (radialSegments < 3) {
            throw new IllegalArgumentException("radialSegments must be at least 3: " + radialSegments);
        }
        var positions = new FloatArrayList();
        var uvs = new FloatArrayList();
        var indices = new IntArrayList();
        var halfHeight = height / 2;

        // side: row 0 at the top, row 1 at the bottom
        for (int row = 0; row <= 1; row++) {
            var radius = row == 0 ? radiusTop : radiusBottom;
            var y = row == 0 ? halfHeight : -halfHeight;
            for (int x = 0; x <= radialSegments; x++) {
                var u = (float) x / radialSegments;
                var theta = u * 2 * Math.PI;
                positions.add((float) (radius * Math.sin(theta)), y, (float) (radius * Math.cos(theta)));
                uvs.add(u, 1 - row);
            }
        }
        var columns = radialSegments + 1;
        for (int x = 0; x < radialSegments; x++) {
            var a = x;
            var b = columns + x;
            var c = columns + x + 1;
            var d = x + 1;
            indices.addTriangle(a, b, d);
            indices.addTriangle(b, c, d);
        }

        if (radiusTop > 0) {
            cap(true, radiusTop, halfHeight, radialSegments, positions, uvs, indices);
        }
        if (radiusBottom > 0) {
            cap(false, radiusBottom, halfHeight, radialSegments, positions, uvs, indices);
        }
        return new MeshPart(positions.toArray(), null, uvs.toArray(), indices.toArray());
    }

    /**
     * A uv sphere with {@code (widthSegments + 1) * (heightSegments + 1)} vertices; the zero-area triangles at the
     * poles are omitted.
     */
    public static MeshPart sphere(float radius, int widthSegments, int heightSegments) {
        if (widthSegments < 3 || heightSegments < 2) {
            throw new IllegalArgumentException(
            "Sphere needs at least 3 x 2 segments: " + widthSegments + " x " + heightSegments);
        }
        var positions = new FloatArrayList();
        var uvs = new FloatArrayList();
        var indices = new IntArrayList();
        var columns = widthSegments + 1;
        for (int iy = 0; iy <= heightSegments; iy++) {
            var v = (float) iy / heightSegments;
            for (int ix = 0; ix <= widthSegments; ix++) {
                var u = (float) ix / widthSegments;
                var phi = u * 2 * Math.PI;
                var theta = v * Math.PI;
                positions.add((float) (-radius * Math.cos(phi) * Math.sin(theta)), (float) (radius * Math.cos(theta)),
                              (float) (radius * Math.sin(phi) * Math.sin(theta)));
                uvs.add(u, 1 - v);
            }
        }
        for (int iy = 0; iy < heightSegments; iy++) {
            for (int ix = 0; ix < widthSegments; ix++) {
                var a = iy * columns + ix + 1;
                var b = iy * columns + ix;
                var c = (iy + 1) * columns + ix;
                var d = (iy + 1) * columns + ix + 1;
                if (iy != 0) {
                    indices.addTriangle(a, b, d);
                }
                if (iy != heightSegments - 1) {
                    indices.addTriangle(b, c, d);
                }
            }
        }
        return new MeshPart(positions.toArray(), null, uvs.toArray(), indices.toArray());
    }

    private static void cap(boolean top, float radius, float halfHeight, int radialSegments, FloatArrayList positions,
                            FloatArrayList uvs, IntArrayList indices) {
        var sign = top ? 1 : -1;
        var y = halfHeight * sign;
        var center = positions.size() / 3;
        positions.add(0, y, 0);
        uvs.add(0.5f, 0.5f);
        var start = center + 1;
        for (int x = 0; x <= radialSegments; x++) {
            var theta = (double) x / radialSegments * 2 * Math.PI;
            var cos = (float) Math.cos(theta);
            var sin = (float) Math.sin(theta);
            positions.add(radius * sin, y, radius * cos);
            uvs.add(cos * 0.5f + 0.5f, sin * 0.5f * sign + 0.5f);
        }
        for (int x = 0; x < radialSegments; x++) {
            if (top) {
                indices.addTriangle(center, start + x, start + x + 1);
            } else {
                indices.addTriangle(center, start + x + 1, start + x);
            }
        }
    }
}
