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

import com.hellblazer.loftsmith.geometry.Point2;
import com.hellblazer.loftsmith.geometry.Polyline;

/**
 * Maps drawing coordinates, Y growing downward, to world units with Y growing upward.
 *
 * @author hal.hildebrand
 */
public record ViewTransform(double centerX, double sourceHeight, double scale) {

    public Point2 apply(Point2 p) {
        return new Point2((p.x() - centerX) * scale, (sourceHeight - p.y()) * scale);
    }

    public Polyline apply(Polyline outline) {
        return outline.map(this::apply);
    }
}
