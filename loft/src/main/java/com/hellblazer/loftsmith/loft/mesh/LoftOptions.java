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

import com.hellblazer.loftsmith.loft.silhouette.CrossSectionShape;

/**
 * Per-component lofting parameters.
 *
 * @author hal.hildebrand
 */
public class LoftOptions {
    private int               vertsPerRing = 10;
    private double            yMin         = Double.NEGATIVE_INFINITY;
    private double            yMax         = Double.POSITIVE_INFINITY;
    private float             offsetX;
    private float             offsetY;
    private float             offsetZ;
    private boolean           capTop;
    private boolean           capBottom;
    private CrossSectionShape topShape;

    public static LoftOptions defaults() {
        return new LoftOptions();
    }

    public float getOffsetX() {
        return offsetX;
    }

    public float getOffsetY() {
        return offsetY;
    }

    public float getOffsetZ() {
        return offsetZ;
    }

    /**
     * @return the unit cross-section, or null for an ellipse
     */
    public CrossSectionShape getTopShape() {
        return topShape;
    }

    public int getVertsPerRing() {
        return vertsPerRing;
    }

    public double getYMax() {
        return yMax;
    }

    public double getYMin() {
        return yMin;
    }

    public boolean isCapBottom() {
        return capBottom;
    }

    public boolean isCapTop() {
        return capTop;
    }

    public LoftOptions withCaps(boolean bottom, boolean top) {
        this.capBottom = bottom;
        this.capTop = top;
        return this;
    }

    public LoftOptions withHeightRange(double min, double max) {
        this.yMin = min;
        this.yMax = max;
        return this;
    }

    public LoftOptions withOffset(float x, float y, float z) {
        this.offsetX = x;
        this.offsetY = y;
        this.offsetZ = z;
        return this;
    }

    /**
     * A shape whose slot count differs from the ring size is ignored when lofting.
     */
    public LoftOptions withTopShape(CrossSectionShape shape) {
        this.topShape = shape;
        return this;
    }

    public LoftOptions withVertsPerRing(int count) {
        if (count < 3) {
            throw new IllegalArgumentException("vertsPerRing must be at least 3: " + count);
        }
        this.vertsPerRing = count;
        return this;
    }
}
