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
 * A named rigid attachment of a static model, such as a wheel.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChildSpec {
    public String  name;
    public String  type;
    public Float   radius;
    public Float   width;
    public Float   height;
    public float[] size;
    public Integer segments;
    public Rgb     color;
    public Float   roughness;
    public Float   metalness;
    public float[] position;
    public float[] rotation;
    public Float   rotateX;
    public Float   rotateZ;

    @Override
    public String toString() {
        return "ChildSpec[" + name + ":" + type + "]";
    }
}
