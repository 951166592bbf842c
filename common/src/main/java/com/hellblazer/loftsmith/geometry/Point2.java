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

package com.hellblazer.loftsmith.geometry;

/**
 * Immutable 2D point in drawing or world units.
 *
 * @author hal.hildebrand
 */
public record Point2(double x, double y) {

    public static final Point2 ORIGIN = new Point2(0, 0);

    public Point2 add(Point2 other) {
        return new Point2(x + other.x, y + other.y);
    }

    public double distance(Point2 other) {
        var dx = x - other.x;
        var dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Point reflection of {@code other} through this point, {@code 2 * this - other}.
     */
    public Point2 reflect(Point2 other) {
        return new Point2(2 * x - other.x, 2 * y - other.y);
    }

    public Point2 subtract(Point2 other) {
        return new Point2(x - other.x, y - other.y);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f)", x, y);
    }
}
