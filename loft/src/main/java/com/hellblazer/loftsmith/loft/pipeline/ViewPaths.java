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

package com.hellblazer.loftsmith.loft.pipeline;

import com.hellblazer.loftsmith.geometry.Polyline;

import java.util.Map;

/**
 * The named outlines of each orthographic view, in drawing coordinates.
 *
 * @author hal.hildebrand
 */
public record ViewPaths(Map<String, Polyline> front, Map<String, Polyline> side, Map<String, Polyline> top) {

    public ViewPaths {
        front = Map.copyOf(front);
        side = Map.copyOf(side);
        top = top == null ? Map.of() : Map.copyOf(top);
    }

    public ViewPaths(Map<String, Polyline> front, Map<String, Polyline> side) {
        this(front, side, Map.of());
    }
}
