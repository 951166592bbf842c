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

import com.hellblazer.loftsmith.loft.color.Rgb;
import com.hellblazer.loftsmith.loft.config.AddonSpec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class AddonsTest {

    private static final float EPSILON = 1e-5f;

    private static AddonSpec spec(String type) {
        var spec = new AddonSpec();
        spec.id = type + "_addon";
        spec.type = type;
        return spec;
    }

    @Test
    public void testBoxPlacedAndColored() {
        var spec = spec("box");
        spec.size = new float[] { 0.2f, 0.4f, 0.2f };
        spec.position = new float[] { 1, 2, 3 };
        spec.color = Rgb.of(0xff0000);

        var part = Addons.build(spec).orElseThrow();
        assertEquals(24, part.getVertexCount());
        var bounds = part.computeBounds();
        assertEquals(1.8f, bounds.minY(), EPSILON);
        assertEquals(2.2f, bounds.maxY(), EPSILON);
        assertEquals(0.9f, bounds.minX(), EPSILON);

        var colors = part.getColors();
        for (int i = 0; i < colors.length; i += 3) {
            assertEquals(1, colors[i], EPSILON);
            assertEquals(0, colors[i + 1], EPSILON);
            assertEquals(0, colors[i + 2], EPSILON);
        }
    }

    @Test
    public void testPositionAppliesBeforeRotation() {
        var spec = spec("box");
        spec.size = new float[] { 0.2f, 1, 0.2f };
        spec.rotation = new float[] { 0, 0, (float) (Math.PI / 2) };
        spec.position = new float[] { 5, 0, 0 };

        var bounds = Addons.build(spec).orElseThrow().computeBounds();
        // Moved out to x = 5, then swung a quarter turn about Z through the origin
        assertEquals(-0.5f, bounds.minX(), EPSILON);
        assertEquals(0.5f, bounds.maxX(), EPSILON);
        assertEquals(4.9f, bounds.minY(), EPSILON);
        assertEquals(5.1f, bounds.maxY(), EPSILON);
    }

    @Test
    public void testUnitBoxQuarterTurnAboutZ() {
        var spec = spec("box");
        spec.size = new float[] { 1, 1, 1 };
        spec.rotation = new float[] { 0, 0, (float) (Math.PI / 2) };
        spec.position = new float[] { 1, 0, 0 };

        var bounds = Addons.build(spec).orElseThrow().computeBounds();
        assertEquals(0.5f, bounds.minY(), EPSILON);
        assertEquals(1.5f, bounds.maxY(), EPSILON);
        assertEquals(-0.5f, bounds.minX(), EPSILON);
    }

    @Test
    public void testDefaultColorIsGray() {
        var spec = spec("sphere");
        spec.radius = 0.5f;
        var part = Addons.build(spec).orElseThrow();
        assertEquals(7 * 5, part.getVertexCount());
        var gray = Rgb.GRAY.linear();
        assertEquals(gray[0], part.getColors()[0], EPSILON);
    }

    @Test
    public void testCylinderRadii() {
        var spec = spec("cylinder");
        spec.radius = 0.5f;
        spec.radiusTop = 0.25f;
        spec.height = 1f;
        spec.segments = 12;
        var part = Addons.build(spec).orElseThrow();
        assertEquals(26 + 14 + 14, part.getVertexCount());
        assertEquals(0.5f, part.computeBounds().maxZ(), EPSILON);
    }

    @Test
    public void testRejectedAddons() {
        assertTrue(Addons.build(spec("torus")).isEmpty());
        assertTrue(Addons.build(spec(null)).isEmpty());
        assertTrue(Addons.build(spec("box")).isEmpty());
        assertTrue(Addons.build(spec("sphere")).isEmpty());

        var cylinder = spec("cylinder");
        cylinder.radius = 1f;
        assertTrue(Addons.build(cylinder).isEmpty());
        cylinder.height = 1f;
        cylinder.segments = 2;
        assertTrue(Addons.build(cylinder).isEmpty());
    }
}
