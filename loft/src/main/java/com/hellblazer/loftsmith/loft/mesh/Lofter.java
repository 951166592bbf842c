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

import com.hellblazer.loftsmith.common.FloatArrayList;
import com.hellblazer.loftsmith.common.IntArrayList;
import com.hellblazer.loftsmith.loft.silhouette.CrossSectionShape;
import com.hellblazer.loftsmith.loft.silhouette.SampleBounds;
import com.hellblazer.loftsmith.loft.silhouette.SilhouetteSamples;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a tube of rings from a front and a side silhouette sampled on the same levels, stitching neighbouring
 * rings into triangles and optionally closing either end with a fan.
 * <p>
 * Each ring's half-width and X center come from the front view, its half-depth and Z center from the side view.
 * Levels missing from either view, or with a non-positive extent, are dropped. The ring-to-ring winding is
 * {@code (a, c, b), (b, c, d)}; both caps use {@code (ring + v, center, ring + v + 1)}.
 *
 * @author hal.hildebrand
 */
public final class Lofter {

    private static final Logger log = LoggerFactory.getLogger(Lofter.class);

    private Lofter() {
    }

    /**
     * @return the lofted component, or null when fewer than two rings survive
     */
    public static ComponentMesh loft(SilhouetteSamples front, SilhouetteSamples side, LoftOptions options) {
        if (options.getYMin() > options.getYMax()) {
            log.warn("Empty height range {} to {}", options.getYMin(), options.getYMax());
            return null;
        }
        var levels = front.levels().subMap(options.getYMin(), true, options.getYMax(), true).keySet();
        if (levels.size() < 2) {
            log.warn("Fewer than 2 height levels between {} and {}", options.getYMin(), options.getYMax());
            return null;
        }

        var vpr = options.getVertsPerRing();
        var shape = options.getTopShape();
        if (shape != null && shape.slots() != vpr) {
            log.debug("Ignoring cross-section with {} slots for rings of {}", shape.slots(), vpr);
            shape = null;
        }

        var rings = new ArrayList<Ring>();
        for (var level : levels) {
            var f = front.get(level);
            var s = side.get(level);
            if (f == null || s == null) {
                continue;
            }
            var halfWidth = f.halfExtent();
            var halfDepth = s.halfExtent();
            if (halfWidth <= 0 || halfDepth <= 0) {
                continue;
            }
            rings.add(ring(level, f, s, halfWidth, halfDepth, vpr, shape, options));
        }
        if (rings.size() < 2) {
            log.warn("Fewer than 2 valid rings between {} and {}", options.getYMin(), options.getYMax());
            return null;
        }
        return new ComponentMesh(rings, stitch(rings, vpr, options));
    }

    private static Ring ring(double level, SampleBounds front, SampleBounds side, double halfWidth, double halfDepth,
                             int vpr, CrossSectionShape shape, LoftOptions options) {
        var cx = front.center() + options.getOffsetX();
        var cz = side.center() + options.getOffsetZ();
        var y = (float) (level + options.getOffsetY());
        var points = new Point3f[vpr];
        for (int i = 0; i < vpr; i++) {
            double x, z;
            if (shape != null) {
                x = shape.x(i) * halfWidth;
                z = shape.z(i) * halfDepth;
            } else {
                var angle = 2.0 * Math.PI * i / vpr;
                x = halfWidth * Math.sin(angle);
                z = halfDepth * Math.cos(angle);
            }
            points[i] = new Point3f((float) (x + cx), y, (float) (z + cz));
        }
        return new Ring(points);
    }

    private static MeshPart stitch(List<Ring> rings, int vpr, LoftOptions options) {
        var nr = rings.size();
        var positions = new FloatArrayList(nr * vpr * 3 + 6);
        for (var ring : rings) {
            for (int i = 0; i < vpr; i++) {
                var p = ring.get(i);
                positions.add(p.x, p.y, p.z);
            }
        }

        var indices = new IntArrayList((nr - 1) * vpr * 6 + vpr * 6);
        for (int r = 0; r < nr - 1; r++) {
            for (int v = 0; v < vpr; v++) {
                var a = r * vpr + v;
                var b = r * vpr + (v + 1) % vpr;
                var c = (r + 1) * vpr + v;
                var d = (r + 1) * vpr + (v + 1) % vpr;
                indices.addTriangle(a, c, b);
                indices.addTriangle(b, c, d);
            }
        }

        var vertexCount = nr * vpr;
        if (options.isCapBottom()) {
            vertexCount = cap(rings.get(0), 0, vertexCount, vpr, positions, indices);
        }
        if (options.isCapTop()) {
            vertexCount = cap(rings.get(nr - 1), (nr - 1) * vpr, vertexCount, vpr, positions, indices);
        }

        var uvs = new FloatArrayList(vertexCount * 2);
        uvs.addZeros(vertexCount * 2);
        return new MeshPart(positions.toArray(), null, uvs.toArray(), indices.toArray());
    }

    private static int cap(Ring ring, int ringBase, int capIndex, int vpr, FloatArrayList positions,
                           IntArrayList indices) {
        var center = ring.centroid();
        positions.add(center.x, center.y, center.z);
        for (int v = 0; v < vpr; v++) {
            indices.addTriangle(ringBase + v, capIndex, ringBase + (v + 1) % vpr);
        }
        return capIndex + 1;
    }
}
