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

import java.util.Arrays;
import java.util.TreeMap;

/**
 * Measures the left/right X extent of a polyline at evenly spaced height levels.
 * <p>
 * Consecutive point pairs are treated as edges; the polyline is not implicitly closed, so an outline without a
 * closing segment leaves its seam open. Horizontal edges are skipped. An edge contributes to every level in its
 * closed Y interval, so levels falling exactly on a vertex are still measured.
 *
 * @author hal.hildebrand
 */
public final class SilhouetteSampler {

    private SilhouetteSampler() {
    }

    /**
     * Evenly spaced levels from {@code yMin} to {@code yMax} inclusive; the last level is exactly {@code yMax}.
     */
    public static double[] levels(double yMin, double yMax, int numSamples) {
        if (numSamples < 2) {
            throw new IllegalArgumentException("numSamples must be at least 2: " + numSamples);
        }
        var levels = new double[numSamples];
        var dy = (yMax - yMin) / (numSamples - 1);
        for (int i = 0; i < numSamples; i++) {
            levels[i] = yMin + i * dy;
        }
        levels[numSamples - 1] = yMax;
        return levels;
    }

    public static SilhouetteSamples sample(Polyline outline, double yMin, double yMax, int numSamples) {
        var levels = levels(yMin, yMax, numSamples);
        var left = new double[numSamples];
        var right = new double[numSamples];
        Arrays.fill(left, Double.POSITIVE_INFINITY);
        Arrays.fill(right, Double.NEGATIVE_INFINITY);

        for (int i = 0; i + 1 < outline.size(); i++) {
            var p0 = outline.get(i);
            var p1 = outline.get(i + 1);
            if (p0.y() == p1.y()) {
                continue;
            }
            var lo = Math.min(p0.y(), p1.y());
            var hi = Math.max(p0.y(), p1.y());
            for (int l = 0; l < numSamples; l++) {
                var level = levels[l];
                if (level < lo || level > hi) {
                    continue;
                }
                var t = (level - p0.y()) / (p1.y() - p0.y());
                var x = p0.x() + t * (p1.x() - p0.x());
                left[l] = Math.min(left[l], x);
                right[l] = Math.max(right[l], x);
            }
        }

        var result = new TreeMap<Double, SampleBounds>();
        for (int l = 0; l < numSamples; l++) {
            if (left[l] != Double.POSITIVE_INFINITY) {
                result.put(levels[l], new SampleBounds(left[l], right[l]));
            }
        }
        return new SilhouetteSamples(result);
    }
}
