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

package com.hellblazer.loftsmith.loft.silhouette;

import com.hellblazer.loftsmith.geometry.Point2;
import com.hellblazer.loftsmith.geometry.Polyline;
import com.hellblazer.loftsmith.loft.path.PathParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OutlineNormalizerTest {

    private static final double EPSILON = 1e-6;

    private final PathParser parser = new PathParser();

    @Test
    public void testDiamond() {
        var diamond = parser.parse("M 100 150 L 150 100 L 100 50 L 50 100 Z");
        var shape = OutlineNormalizer.normalize(diamond, 100, 100, 8);
        assertNotNull(shape);
        assertEquals(8, shape.slots());
        // Slot 0 points along +Z
        assertEquals(0, shape.x(0), EPSILON);
        assertEquals(1, shape.z(0), EPSILON);
        // Diagonal slots hit the middle of the diamond's edges
        assertEquals(0.5, shape.x(1), EPSILON);
        assertEquals(0.5, shape.z(1), EPSILON);
        assertEquals(1, shape.x(2), EPSILON);
        assertEquals(0, shape.z(2), EPSILON);
        assertEquals(-0.5, shape.x(5), EPSILON);
        assertEquals(-0.5, shape.z(5), EPSILON);
    }

    @Test
    public void testAxesScaleIndependently() {
        var ellipseBox = parser.parse("M 60 90 L 140 90 L 140 110 L 60 110 Z");
        var shape = OutlineNormalizer.normalize(ellipseBox, 100, 100, 4);
        assertNotNull(shape);
        assertEquals(1, shape.z(0), EPSILON);
        assertEquals(1, shape.x(1), EPSILON);
        assertEquals(-1, shape.z(2), EPSILON);
        assertEquals(-1, shape.x(3), EPSILON);
    }

    @Test
    public void testMissesFallBackToTheUnitCircle() {
        // Square corners lie beyond the unit circle on the diagonals
        var square = parser.parse("M 0 0 L 2 0 L 2 2 L 0 2 Z");
        var shape = OutlineNormalizer.normalize(square, 1, 1, 8);
        assertNotNull(shape);
        var diagonal = Math.sqrt(0.5);
        assertEquals(diagonal, shape.x(1), EPSILON);
        assertEquals(diagonal, shape.z(1), EPSILON);
    }

    @Test
    public void testDegenerateOutlines() {
        assertNull(OutlineNormalizer.normalize(null, 0, 0, 8));
        assertNull(OutlineNormalizer.normalize(Polyline.of(new Point2(0, 0), new Point2(1, 1)), 0, 0, 8));
        var line = Polyline.of(new Point2(5, 0), new Point2(5, 5), new Point2(5, 10));
        assertNull(OutlineNormalizer.normalize(line, 5, 5, 8));
    }
}
