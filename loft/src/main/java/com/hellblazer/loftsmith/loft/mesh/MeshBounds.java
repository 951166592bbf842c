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

/**
 * Axis-aligned bounds of a packed xyz position array.
 *
 * @author hal.hildebrand
 */
public record MeshBounds(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {

    public static final MeshBounds EMPTY = new MeshBounds(0, 0, 0, 0, 0, 0);

    public static MeshBounds of(float[] positions) {
        if (positions.length < 3) {
            return EMPTY;
        }
        float minX = Float.MAX_VALUE, minY = Float.MAX_VALUE, minZ = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE, maxY = -Float.MAX_VALUE, maxZ = -Float.MAX_VALUE;
        for (int i = 0; i + 2 < positions.length; i += 3) {
            minX = Math.min(minX, positions[i]);
            minY = Math.min(minY, positions[i + 1]);
            minZ = Math.min(minZ, positions[i + 2]);
            maxX = Math.max(maxX, positions[i]);
            maxY = Math.max(maxY, positions[i + 1]);
            maxZ = Math.max(maxZ, positions[i + 2]);
        }
        return new MeshBounds(minX, minY, minZ, maxX, maxY, maxZ);
    }

    public float extentY() {
        return maxY - minY;
    }

    public float[] max() {
        return new float[] { maxX, maxY, maxZ };
    }

    public float[] min() {
        return new float[] { minX, minY, minZ };
    }
}
