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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hellblazer.loftsmith.loft.color.ColorZone;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of one model: the vector files per view, how their coordinates map to world units, the
 * components to loft, and what else goes into the asset.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelConfig {
    public String              name           = "lofted_model";
    public String              svgFront;
    public String              svgSide;
    public String              svgTop;
    public String              output         = "output.glb";
    public double              svgHeight      = 200;
    public double              svgCenterX     = 100;
    public Double              sideCenterX;
    public Double              topCenterX;
    public double              topCenterY     = 100;
    public double              scale          = 1.0;
    public int                 vertsPerRing   = 10;
    public double              samplesPerUnit = 40;
    public int                 parallelism    = 1;
    public List<ComponentSpec> components     = new ArrayList<>();
    public List<ColorZone>     yRanges;
    public List<AddonSpec>     addons         = new ArrayList<>();
    public boolean             skeleton;
    public List<ChildSpec>     children       = new ArrayList<>();
    public float               roughness      = 0.7f;
    public float               metalness      = 0.02f;

    /** Directory that relative file names resolve against; not part of the JSON. */
    @JsonIgnore
    public Path baseDirectory;

    public List<AddonSpec> addons() {
        return addons == null ? List.of() : addons;
    }

    public List<ChildSpec> children() {
        return children == null ? List.of() : children;
    }

    public List<ComponentSpec> components() {
        return components == null ? List.of() : components;
    }

    public Path resolve(String file) {
        var path = Path.of(file);
        if (path.isAbsolute() || baseDirectory == null) {
            return path;
        }
        return baseDirectory.resolve(path);
    }

    public Path outputPath() {
        return resolve(output == null ? "output.glb" : output);
    }

    public double sideCenter() {
        return sideCenterX == null ? svgCenterX : sideCenterX;
    }

    public double topCenter() {
        return topCenterX == null ? svgCenterX : topCenterX;
    }

    /**
     * @throws ModelConfigException if a numeric option is out of range, a component has no id, or a zone list holds
     *                              a null entry
     */
    public void validate() {
        if (!(scale > 0)) {
            throw new ModelConfigException("scale must be positive: " + scale);
        }
        if (vertsPerRing < 3) {
            throw new ModelConfigException("vertsPerRing must be at least 3: " + vertsPerRing);
        }
        if (!(samplesPerUnit > 0)) {
            throw new ModelConfigException("samplesPerUnit must be positive: " + samplesPerUnit);
        }
        if (parallelism < 1) {
            throw new ModelConfigException("parallelism must be at least 1: " + parallelism);
        }
        checkZones("yRanges", yRanges);
        for (var component : components()) {
            if (component.id == null || component.id.isBlank()) {
                throw new ModelConfigException("Every component needs an id");
            }
            checkZones("Component " + component.id + " yRanges", component.yRanges);
            if (component.vertsPerRing != null && component.vertsPerRing < 3) {
                throw new ModelConfigException(
                "Component " + component.id + " vertsPerRing must be at least 3: " + component.vertsPerRing);
            }
        }
    }

    private static void checkZones(String owner, List<ColorZone> zones) {
        if (zones != null && zones.stream().anyMatch(Objects::isNull)) {
            throw new ModelConfigException(owner + " contains an empty zone");
        }
    }
}
