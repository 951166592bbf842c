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
import com.hellblazer.loftsmith.loft.color.ColorZone;
import com.hellblazer.loftsmith.loft.color.Rgb;

import java.util.List;

/**
 * One lofted part of a model. Path ids default to the component id; a null {@link #yRanges} means the component
 * defines no zones of its own.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComponentSpec {
    public String          id;
    public String          frontPath;
    public String          sidePath;
    public String          topPath;
    public Double          yMin;
    public Double          yMax;
    public float           offsetX;
    public float           offsetY;
    public float           offsetZ;
    public boolean         capTop;
    public boolean         capBottom;
    public Integer         vertsPerRing;
    public Rgb             color;
    public List<ColorZone> yRanges;
    public int             boneIdx;

    public ComponentSpec() {
    }

    public ComponentSpec(String id) {
        this.id = id;
    }

    public String frontPathId() {
        return frontPath == null ? id : frontPath;
    }

    public String sidePathId() {
        return sidePath == null ? id : sidePath;
    }

    public String topPathId() {
        return topPath == null ? id : topPath;
    }

    public int vertsPerRing(int global) {
        return vertsPerRing == null ? global : vertsPerRing;
    }

    @Override
    public String toString() {
        return "ComponentSpec[" + id + "]";
    }
}
