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

package com.hellblazer.loftsmith.loft.anim;

import java.util.Arrays;

/**
 * Keyframes for one property of one bone. Rotation values are unit quaternions {@code x, y, z, w}; translation
 * values are {@code x, y, z}.
 *
 * @author hal.hildebrand
 */
public record AnimationTrack(String bone, Kind kind, float[] times, float[] values) {

    public AnimationTrack {
        if (values.length != times.length * kind.components()) {
            throw new IllegalArgumentException(
            "Track " + bone + " has " + values.length + " values for " + times.length + " " + kind + " keys");
        }
        times = times.clone();
        values = values.clone();
    }

    public int keyCount() {
        return times.length;
    }

    @Override
    public float[] times() {
        return times.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof AnimationTrack other && bone.equals(other.bone) && kind == other.kind
                             && Arrays.equals(times, other.times) && Arrays.equals(values, other.values));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * bone.hashCode() + kind.hashCode()) + Arrays.hashCode(times);
    }

    @Override
    public String toString() {
        return "AnimationTrack[" + bone + " " + kind + " x" + times.length + "]";
    }

    public enum Kind {
        ROTATION(4), TRANSLATION(3);

        private final int components;

        Kind(int components) {
            this.components = components;
        }

        public int components() {
            return components;
        }
    }
}
