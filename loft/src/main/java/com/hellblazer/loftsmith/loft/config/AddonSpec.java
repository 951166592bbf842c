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

package com.hellblazer.loftsmith.loft.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hellblazer.loftsmith.loft.color.Rgb;

/**
 * A parametric solid added next to the lofted components. The solid is moved by {@link #position} first; then
 * {@link #rotation}, XYZ Euler radians, turns it about the model origin.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AddonSpec {
    public String  id;
    public String  type;
    public float[] size;
    public Float   radius;
    public Float   radiusTop;
    public Float   radiusBottom;
    public Float   height;
    public Integer segments;
    public float[] position;
    public float[] rotation;
    public Rgb     color;
    public int     boneIdx;

    public String label() {
        return id != null ? id : type;
    }

    @Override
    public String toString() {
        return "AddonSpec[" + label() + "]";
    }
}
