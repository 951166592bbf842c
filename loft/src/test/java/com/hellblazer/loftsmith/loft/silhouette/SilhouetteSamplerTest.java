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
public class SilhouetteSamplerTest {

    private static final double EPSILON = 1e-9;

    @Test
    public void testLevels() {
        assertArrayEquals(new double[] { 0, 0.25, 0.5, 0.75, 1.0 }, SilhouetteSampler.levels(0, 1, 5), EPSILON);
        var levels = SilhouetteSampler.levels(0.2, 1.8, 7);
        assertEquals(1.8, levels[6]);
        assertThrows(IllegalArgumentException.class, () -> SilhouetteSampler.levels(0, 1, 1));
    }

    @Test
    public void testRectangleIsMeasuredAtEveryLevel() {
        var rectangle = new PathParser().parse("M 0 0 L 10 0 L 10 10 L 0 10 Z");
        var samples = SilhouetteSampler.sample(rectangle, 0, 10, 11);
        assertEquals(11, samples.size());
        for (var bounds : samples.levels().values()) {
            assertEquals(0, bounds.left(), EPSILON);
            assertEquals(10, bounds.right(), EPSILON);
        }
        assertEquals(5, samples.get(3.0).halfExtent(), EPSILON);
        assertEquals(5, samples.get(3.0).center(), EPSILON);
    }

    @Test
    public void testSlopedEdgesAreInterpolated() {
        // Open polyline, not closed back to the start
        var tent = Polyline.of(new Point2(0, 0), new Point2(10, 10), new Point2(20, 0));
        var samples = SilhouetteSampler.sample(tent, 0, 10, 3);
        assertEquals(3, samples.size());
        assertEquals(new SampleBounds(0, 20), samples.get(0.0));
        assertEquals(new SampleBounds(5, 15), samples.get(5.0));
        // The apex is still measured, with zero width
        assertEquals(0, samples.get(10.0).halfExtent(), EPSILON);
    }

    @Test
    public void testUntouchedLevelsAreAbsent() {
        var rectangle = new PathParser().parse("M 0 0 L 10 0 L 10 10 L 0 10 Z");
        var samples = SilhouetteSampler.sample(rectangle, 0, 20, 3);
        assertEquals(2, samples.size());
        assertNull(samples.get(20.0));
        assertNotNull(samples.get(10.0));
    }

    @Test
    public void testHorizontalEdgesOnlyProduceNothing() {
        var flat = Polyline.of(new Point2(0, 5), new Point2(10, 5));
        assertTrue(SilhouetteSampler.sample(flat, 0, 10, 5).isEmpty());
        assertTrue(SilhouetteSampler.sample(Polyline.empty(), 0, 10, 5).isEmpty());
    }

    @Test
    public void testLevelsAreAscending() {
        var outline = new PathParser().parse("M 3 0 L 7 10 L 0 8 Z");
        var samples = SilhouetteSampler.sample(outline, 0, 10, 21);
        var previous = Double.NEGATIVE_INFINITY;
        for (var level : samples.levels().keySet()) {
            assertTrue(level > previous);
            previous = level;
        }
        for (var bounds : samples.levels().values()) {
            assertTrue(bounds.left() <= bounds.right());
        }
    }
}
