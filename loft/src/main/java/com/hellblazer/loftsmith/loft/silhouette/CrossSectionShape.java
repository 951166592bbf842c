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

import java.util.Arrays;

/**
 * A unit cross-section: one {@code (x, z)} offset in {@code [-1, 1]^2} per angle slot, scaled per ring by the
 * ring's half-width and half-depth.
 *
 * @author hal.hildebrand
 */
public final class CrossSectionShape {

    private final double[] xs;
    private final double[] zs;

    CrossSectionShape(double[] xs, double[] zs) {
        if (xs.length != zs.length) {
            throw new IllegalArgumentException("Mismatched slot counts: " + xs.length + " != " + zs.length);
        }
        this.xs = xs;
        this.zs = zs;
    }

    public int slots() {
        return xs.length;
    }

    public double x(int slot) {
        return xs[slot];
    }

    public double z(int slot) {
        return zs[slot];
    }

    @Override
    public String toString() {
        var buf = new StringBuilder("CrossSectionShape[");
        for (int i = 0; i < xs.length; i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(String.format("(%.3f, %.3f)", xs[i], zs[i]));
        }
        return buf.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CrossSectionShape other && Arrays.equals(xs, other.xs) && Arrays.equals(
        zs, other.zs));
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xs) + Arrays.hashCode(zs);
    }
}
