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

import com.hellblazer.loftsmith.loft.mesh.MeshMerger;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PrimitivesTest {

    private static final float EPSILON = 1e-5f;

    @Test
    public void testBox() {
        var box = Primitives.box(2, 4, 6);
        assertEquals(24, box.getVertexCount());
        assertEquals(12, box.getTriangleCount());
        assertTrue(box.hasUvs());
        var bounds = box.computeBounds();
        assertArrayEquals(new float[] { -1, -2, -3 }, bounds.min(), EPSILON);
        assertArrayEquals(new float[] { 1, 2, 3 }, bounds.max(), EPSILON);
        assertFacesPointOutward(box);
    }

    @Test
    public void testCylinder() {
        var cylinder = Primitives.cylinder(1, 1, 2, 8);
        // side (8 + 1) * 2, each cap 1 + 8 + 1
        assertEquals(18 + 10 + 10, cylinder.getVertexCount());
        assertEquals(16 + 8 + 8, cylinder.getTriangleCount());
        var bounds = cylinder.computeBounds();
        assertEquals(-1, bounds.minY(), EPSILON);
        assertEquals(1, bounds.maxY(), EPSILON);
        assertEquals(1, bounds.maxZ(), EPSILON);
        assertFacesPointOutward(cylinder);
    }

    @Test
    public void testConeOmitsPointCap() {
        var cone = Primitives.cylinder(0, 1, 2, 8);
        assertEquals(18 + 10, cone.getVertexCount());
        assertEquals(16 + 8, cone.getTriangleCount());
    }

    @Test
    public void testSphere() {
        var sphere = Primitives.sphere(2, 6, 4);
        assertEquals(7 * 5, sphere.getVertexCount());
        // Pole rows contribute one triangle per column, the others two
        assertEquals(6 + 12 + 12 + 6, sphere.getTriangleCount());
        for (int v = 0; v < sphere.getVertexCount(); v++) {
            var p = sphere.getPosition(v);
            assertEquals(2, Math.sqrt(p.x * p.x + p.y * p.y + p.z * p.z), 1e-4);
        }
        assertFacesPointOutward(sphere);
    }

    @Test
    public void testSegmentMinimums() {
        assertThrows(IllegalArgumentException.class, () -> Primitives.cylinder(1, 1, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> Primitives.sphere(1, 2, 4));
        assertThrows(IllegalArgumentException.class, () -> Primitives.sphere(1, 6, 1));
    }

    /** Every referenced vertex of a shape centered on the origin has a normal facing away from the center. */
    private static void assertFacesPointOutward(MeshPart part) {
        var positions = part.getPositions();
        var indices = part.getIndices();
        var normals = MeshMerger.computeNormals(positions, indices);
        var referenced = new boolean[part.getVertexCount()];
        for (var index : indices) {
            referenced[index] = true;
        }
        for (int i = 0; i < positions.length; i += 3) {
            if (!referenced[i / 3]) {
                continue;
            }
            var dot = positions[i] * normals[i] + positions[i + 1] * normals[i + 1] + positions[i + 2] * normals[i + 2];
            assertTrue(dot > 0, "vertex " + i / 3 + " faces inward");
        }
    }
}
