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

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The result of sampling one silhouette: height level to {@link SampleBounds}, ascending by level. Levels that no
 * edge crosses are absent.
 *
 * @author hal.hildebrand
 */
public final class SilhouetteSamples {

    private final NavigableMap<Double, SampleBounds> levels;

    SilhouetteSamples(TreeMap<Double, SampleBounds> levels) {
        this.levels = Collections.unmodifiableNavigableMap(levels);
    }

    public SampleBounds get(double level) {
        return levels.get(level);
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    public NavigableMap<Double, SampleBounds> levels() {
        return levels;
    }

    public int size() {
        return levels.size();
    }

    @Override
    public String toString() {
        return "SilhouetteSamples[" + levels.size() + " levels]";
    }
}
