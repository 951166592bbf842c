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

import java.util.List;

/**
 * Chooses a vertex color from the vertex's height.
 *
 * @author hal.hildebrand
 */
public interface ColorRule {

    ColorRule DEFAULT = solid(Rgb.GRAY);

    static ColorRule solid(Rgb color) {
        return y -> color;
    }

    /**
     * The first zone containing the height wins; heights outside every zone are gray.
     */
    static ColorRule zones(List<ColorZone> zones) {
        var copy = List.copyOf(zones);
        return y -> {
            for (var zone : copy) {
                if (zone.contains(y)) {
                    return zone.color();
                }
            }
            return Rgb.GRAY;
        };
    }

    Rgb colorAt(double y);
}
