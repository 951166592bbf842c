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

package com.hellblazer.loftsmith.loft.silhouette;

import com.hellblazer.loftsmith.geometry.Polyline;

/**
 * Turns a closed top-view outline into a {@link CrossSectionShape} by casting one ray per angle slot from the
 * outline's center and keeping the nearest crossing.
 *
 * @author hal.hildebrand
 */
public final class OutlineNormalizer {

    /** Outlines whose extent on either axis is below this are treated as collapsed. */
    public static final double MIN_EXTENT  = 0.001;
    /** Crossings closer to the center than this ray parameter are ignored. */
    public static final double MIN_RAY_T   = 0.01;
    private static final double PARALLEL   = 1e-8;

    private OutlineNormalizer() {
    }

    /**
     * @return the unit shape, or null when the outline has fewer than 3 points or collapses on an axis
     */
    public static CrossSectionShape normalize(Polyline outline, double centerX, double centerY, int vertsPerRing) {
        if (outline == null || outline.size() < 3) {
            return null;
        }
        var n = outline.size();
        var px = new double[n];
        var pz = new double[n];
        double maxX = 0, maxZ = 0;
        for (int i = 0; i < n; i++) {
            var p = outline.get(i);
            px[i] = p.x() - centerX;
            pz[i] = p.y() - centerY;
            maxX = Math.max(maxX, Math.abs(px[i]));
            maxZ = Math.max(maxZ, Math.abs(pz[i]));
        }
        if (maxX < MIN_EXTENT || maxZ < MIN_EXTENT) {
            return null;
        }
        for (int i = 0; i < n; i++) {
            px[i] /= maxX;
            pz[i] /= maxZ;
        }

        var xs = new double[vertsPerRing];
        var zs = new double[vertsPerRing];
        for (int slot = 0; slot < vertsPerRing; slot++) {
            var angle = 2.0 * Math.PI * slot / vertsPerRing;
            var dirX = Math.sin(angle);
            var dirZ = Math.cos(angle);
            var best = 1.0;
            for (int i = 0; i < n; i++) {
                var j = (i + 1) % n;
                var ex = px[j] - px[i];
                var ez = pz[j] - pz[i];
                var denom = dirX * ez - dirZ * ex;
                if (Math.abs(denom) < PARALLEL) {
                    continue;
                }
                var t = (px[i] * ez - pz[i] * ex) / denom;
                var s = (px[i] * dirZ - pz[i] * dirX) / denom;
                if (t > MIN_RAY_T && s >= 0 && s <= 1 && t < best) {
                    best = t;
                }
            }
            xs[slot] = dirX * best;
            zs[slot] = dirZ * best;
        }
        return new CrossSectionShape(xs, zs);
    }
}
