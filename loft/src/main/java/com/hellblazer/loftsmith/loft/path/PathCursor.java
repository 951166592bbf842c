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

package com.hellblazer.loftsmith.loft.path;

import com.hellblazer.loftsmith.geometry.Point2;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable parse state threaded through one path string: current position, subpath start, the last Bézier
 * control point and the points emitted so far.
 *
 * @author hal.hildebrand
 */
final class PathCursor {

    private final List<Point2> points = new ArrayList<>();
    private       double       cx, cy;
    private       double       sx, sy;
    private       Point2       prevCp;

    /**
     * Absolute coordinate for a command argument: relative arguments are offset by the current position.
     */
    Point2 resolve(boolean relative, double x, double y) {
        return relative ? new Point2(cx + x, cy + y) : new Point2(x, y);
    }

    void clearControlPoint() {
        prevCp = null;
    }

    void close() {
        cx = sx;
        cy = sy;
        points.add(new Point2(cx, cy));
        prevCp = null;
    }

    Point2 current() {
        return new Point2(cx, cy);
    }

    double currentX() {
        return cx;
    }

    double currentY() {
        return cy;
    }

    void emit(Point2 p) {
        points.add(p);
    }

    void lineTo(Point2 p) {
        cx = p.x();
        cy = p.y();
        points.add(p);
    }

    void markSubpathStart() {
        sx = cx;
        sy = cy;
    }

    List<Point2> points() {
        return points;
    }

    /**
     * Move the current position without emitting a point; used after a curve has emitted its own samples.
     */
    void advanceTo(Point2 p) {
        cx = p.x();
        cy = p.y();
    }

    /**
     * The implied first control point of a smooth continuation: the previous control point reflected through the
     * current position, or the current position itself when there is no previous control point.
     */
    Point2 reflectedControlPoint() {
        var current = current();
        return prevCp == null ? current : current.reflect(prevCp);
    }

    void setControlPoint(Point2 cp) {
        prevCp = cp;
    }
}
