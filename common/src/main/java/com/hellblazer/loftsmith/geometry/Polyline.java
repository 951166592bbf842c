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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered, immutable sequence of 2D points. A polyline is never implicitly closed: a closed outline repeats its
 * first point at the end.
 *
 * @author hal.hildebrand
 */
public final class Polyline implements Iterable<Point2> {

    private static final Polyline EMPTY = new Polyline(List.of());

    private final List<Point2> points;

    private Polyline(List<Point2> points) {
        this.points = points;
    }

    public static Polyline empty() {
        return EMPTY;
    }

    public static Polyline of(List<Point2> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        return new Polyline(Collections.unmodifiableList(new ArrayList<>(points)));
    }

    public static Polyline of(Point2... points) {
        return of(List.of(points));
    }

    public Point2 get(int index) {
        return points.get(index);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public Iterator<Point2> iterator() {
        return points.iterator();
    }

    /**
     * @return a new polyline with {@code mapping} applied to every point, in order
     */
    public Polyline map(UnaryOperator<Point2> mapping) {
        var mapped = new ArrayList<Point2>(points.size());
        for (var p : points) {
            mapped.add(mapping.apply(p));
        }
        return of(mapped);
    }

    public double maxY() {
        var max = Double.NEGATIVE_INFINITY;
        for (var p : points) {
            max = Math.max(max, p.y());
        }
        return max;
    }

    public double minY() {
        var min = Double.POSITIVE_INFINITY;
        for (var p : points) {
            min = Math.min(min, p.y());
        }
        return min;
    }

    public List<Point2> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Polyline other && points.equals(other.points));
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Polyline" + points;
    }
}
