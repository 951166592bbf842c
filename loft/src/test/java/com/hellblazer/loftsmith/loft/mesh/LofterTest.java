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

import com.hellblazer.loftsmith.loft.path.PathParser;
import com.hellblazer.loftsmith.loft.silhouette.OutlineNormalizer;
import com.hellblazer.loftsmith.loft.silhouette.SilhouetteSampler;
import com.hellblazer.loftsmith.loft.silhouette.SilhouetteSamples;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.Arrays;
import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LofterTest {

    private static final float EPSILON = 1e-5f;

    private final PathParser parser = new PathParser();

    /** 2 wide, centered on x = 1, from y = 0 to 4. */
    private SilhouetteSamples front() {
        return SilhouetteSampler.sample(parser.parse("M 0 0 L 2 0 L 2 4 L 0 4 Z"), 0, 4, 5);
    }

    /** 1 deep, centered on z = 1.5. */
    private SilhouetteSamples side() {
        return SilhouetteSampler.sample(parser.parse("M 1 0 L 2 0 L 2 4 L 1 4 Z"), 0, 4, 5);
    }

    @Test
    public void testOpenTube() {
        var mesh = Lofter.loft(front(), side(), LoftOptions.defaults().withVertsPerRing(4));
        assertNotNull(mesh);
        assertEquals(5, mesh.rings().size());
        var part = mesh.part();
        assertEquals(20, part.getVertexCount());
        assertEquals(4 * 4 * 2, part.getTriangleCount());
        assertFalse(part.hasColors());
        for (var uv : part.getUvs()) {
            assertEquals(0, uv);
        }

        // Slot 0 faces +Z, slot 1 faces +X
        assertPoint(1, 0, 2, part.getPosition(0));
        assertPoint(2, 0, 1.5f, part.getPosition(1));
        assertPoint(1, 4, 1, part.getPosition(18));

        var indices = part.getIndices();
        assertArrayEquals(new int[] { 0, 4, 1, 1, 4, 5 }, Arrays.copyOf(indices, 6));
        // Last slot wraps to slot 0
        assertArrayEquals(new int[] { 3, 7, 0, 0, 7, 4 }, Arrays.copyOfRange(indices, 18, 24));
    }

    @Test
    public void testCaps() {
        var options = LoftOptions.defaults().withVertsPerRing(4).withCaps(true, true);
        var part = Lofter.loft(front(), side(), options).part();
        assertEquals(22, part.getVertexCount());
        assertEquals(32 + 8, part.getTriangleCount());
        // Bottom cap center first, then top
        assertPoint(1, 0, 1.5f, part.getPosition(20));
        assertPoint(1, 4, 1.5f, part.getPosition(21));

        var indices = part.getIndices();
        var bottom = 32 * 3;
        assertArrayEquals(new int[] { 0, 20, 1 }, Arrays.copyOfRange(indices, bottom, bottom + 3));
        var top = 36 * 3;
        assertArrayEquals(new int[] { 16, 21, 17 }, Arrays.copyOfRange(indices, top, top + 3));
        assertEquals(22, part.getUvs().length / 2);
    }

    @Test
    public void testTopCapOnly() {
        var options = LoftOptions.defaults().withVertsPerRing(4).withCaps(false, true);
        var part = Lofter.loft(front(), side(), options).part();
        assertEquals(21, part.getVertexCount());
        assertPoint(1, 4, 1.5f, part.getPosition(20));
    }

    @Test
    public void testHeightRangeAndOffset() {
        var options = LoftOptions.defaults()
                                 .withVertsPerRing(6)
                                 .withHeightRange(1, 3)
                                 .withOffset(10, 0.5f, -1);
        var mesh = Lofter.loft(front(), side(), options);
        assertEquals(3, mesh.rings().size());
        assertEquals(1.5f, mesh.rings().get(0).height(), EPSILON);
        assertEquals(3.5f, mesh.rings().get(2).height(), EPSILON);
        var centroid = mesh.rings().get(1).centroid();
        assertEquals(11, centroid.x, EPSILON);
        assertEquals(0.5f, centroid.z, EPSILON);
    }

    @Test
    public void testLevelsMissingFromOneViewAreDropped() {
        var shortSide = SilhouetteSampler.sample(parser.parse("M 1 0 L 2 0 L 2 2 L 1 2 Z"), 0, 4, 5);
        var mesh = Lofter.loft(front(), shortSide, LoftOptions.defaults().withVertsPerRing(4));
        assertEquals(3, mesh.rings().size());
    }

    @Test
    public void testTooFewRings() {
        assertNull(Lofter.loft(front(), side(), LoftOptions.defaults().withHeightRange(10, 20)));
        assertNull(Lofter.loft(front(), side(), LoftOptions.defaults().withHeightRange(3, 1)));
        assertNull(Lofter.loft(front(), side(), LoftOptions.defaults().withHeightRange(2, 2)));
        // Zero-width levels do not count
        var tent = SilhouetteSampler.sample(parser.parse("M 0 0 L 1 4 L 2 0"), 0, 4, 2);
        assertNull(Lofter.loft(tent, tent, LoftOptions.defaults()));
    }

    @Test
    public void testCrossSectionShape() {
        var diamond = parser.parse("M 100 150 L 150 100 L 100 50 L 50 100 Z");
        var shape = OutlineNormalizer.normalize(diamond, 100, 100, 8);
        var part = Lofter.loft(front(), side(), LoftOptions.defaults().withVertsPerRing(8).withTopShape(shape))
                         .part();
        // Slot 1 is pulled in to the diamond's edge: 0.5 of the half width and half depth
        assertPoint(1.5f, 0, 1.75f, part.getPosition(1));
    }

    @Test
    public void testMismatchedCrossSectionIsIgnored() {
        var diamond = parser.parse("M 100 150 L 150 100 L 100 50 L 50 100 Z");
        var shape = OutlineNormalizer.normalize(diamond, 100, 100, 8);
        var shaped = Lofter.loft(front(), side(), LoftOptions.defaults().withVertsPerRing(4).withTopShape(shape));
        var plain = Lofter.loft(front(), side(), LoftOptions.defaults().withVertsPerRing(4));
        assertEquals(plain.part(), shaped.part());
    }

    @Test
    public void testCappedCylinderIsClosedAndRound() {
        var square = SilhouetteSampler.sample(parser.parse("M 0 0 L 2 0 L 2 4 L 0 4 Z"), 0, 4, 5);
        var options = LoftOptions.defaults().withVertsPerRing(12).withCaps(true, true);
        var mesh = Lofter.loft(square, square, options);
        var part = mesh.part();
        var ringVertices = mesh.rings().size() * 12;
        assertEquals(ringVertices + 2, part.getVertexCount());

        // Every ring vertex sits one unit from the axis through (1, 1)
        for (int v = 0; v < ringVertices; v++) {
            var p = part.getPosition(v);
            var dx = p.x - 1;
            var dz = p.z - 1;
            assertEquals(1, Math.sqrt(dx * dx + dz * dz), EPSILON, "vertex " + v);
        }

        // Closed 2-manifold: each undirected edge borders exactly two triangles
        var edges = new HashMap<Long, Integer>();
        var indices = part.getIndices();
        for (int t = 0; t < indices.length; t += 3) {
            for (int e = 0; e < 3; e++) {
                int a = indices[t + e], b = indices[t + (e + 1) % 3];
                var key = (long) Math.min(a, b) << 32 | Math.max(a, b);
                edges.merge(key, 1, Integer::sum);
            }
        }
        edges.forEach((edge, count) -> assertEquals(2, count, "edge " + Long.toHexString(edge)));
        assertEquals(indices.length / 2, edges.size());
        // Sphere topology
        assertEquals(2, part.getVertexCount() - edges.size() + part.getTriangleCount());
    }

    @Test
    public void testVertsPerRingMinimum() {
        assertThrows(IllegalArgumentException.class, () -> LoftOptions.defaults().withVertsPerRing(2));
    }

    private static void assertPoint(float x, float y, float z, Point3f actual) {
        assertEquals(x, actual.x, EPSILON, "x");
        assertEquals(y, actual.y, EPSILON, "y");
        assertEquals(z, actual.z, EPSILON, "z");
    }
}
