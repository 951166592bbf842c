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

package com.hellblazer.loftsmith.loft.color;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A height band painted one color. The band is closed below and open above.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColorZone(@JsonProperty("yMin") double yMin, @JsonProperty("yMax") double yMax,
                        @JsonProperty("color") Rgb color) {

    public ColorZone {
        if (color == null) {
            color = Rgb.GRAY;
        }
    }

    public boolean contains(double y) {
        return y >= yMin && y < yMax;
    }
}
