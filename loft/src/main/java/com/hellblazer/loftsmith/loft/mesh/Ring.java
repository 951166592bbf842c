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

import javax.vecmath.Point3f;

/**
 * One height-level cross-section of a lofted component, ordered by angle slot.
 *
 * @author hal.hildebrand
 */
public final class Ring {

    private final Point3f[] points;

    Ring(Point3f[] points) {
        this.points = points;
    }

    public Point3f get(int slot) {
        return new Point3f(points[slot]);
    }

    /**
     * Mean of the ring's X and Z at the ring's height.
     */
    public Point3f centroid() {
        var c = new Point3f(0, points[0].y, 0);
        for (var p : points) {
            c.x += p.x;
            c.z += p.z;
        }
        c.x /= points.length;
        c.z /= points.length;
        return c;
    }

    public float height() {
        return points[0].y;
    }

    public int size() {
        return points.length;
    }
}
