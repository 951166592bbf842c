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

package com.hellblazer.loftsmith.loft.color;

import com.hellblazer.loftsmith.loft.mesh.MeshPart;

import java.util.List;

/**
 * Coloring policy for lofted components.
 *
 * @author hal.hildebrand
 */
public final class ColorRules {

    private ColorRules() {
    }

    /**
     * Paint every vertex of {@code part} by its height.
     */
    public static MeshPart apply(MeshPart part, ColorRule rule) {
        var positions = part.getPositions();
        var colors = new float[positions.length];
        for (int i = 0; i < positions.length; i += 3) {
            var c = rule.colorAt(positions[i + 1]).linear();
            colors[i] = c[0];
            colors[i + 1] = c[1];
            colors[i + 2] = c[2];
        }
        return part.withColors(colors);
    }

    /**
     * Component zones, then the component's solid color, then the global zones, then gray. A zone list that is
     * present but empty still takes precedence.
     */
    public static ColorRule select(List<ColorZone> componentZones, Rgb componentColor, List<ColorZone> globalZones) {
        if (componentZones != null) {
            return ColorRule.zones(componentZones);
        }
        if (componentColor != null) {
            return ColorRule.solid(componentColor);
        }
        if (globalZones != null) {
            return ColorRule.zones(globalZones);
        }
        return ColorRule.DEFAULT;
    }
}
