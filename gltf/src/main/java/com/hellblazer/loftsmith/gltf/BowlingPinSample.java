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

package com.hellblazer.loftsmith.gltf;

import com.hellblazer.loftsmith.loft.color.ColorZone;
import com.hellblazer.loftsmith.loft.color.Rgb;
import com.hellblazer.loftsmith.loft.config.ComponentSpec;
import com.hellblazer.loftsmith.loft.config.ModelConfig;
import com.hellblazer.loftsmith.loft.path.PathParser;
import com.hellblazer.loftsmith.loft.pipeline.ViewPaths;

import java.util.List;
import java.util.Map;

/**
 * A bowling pin: one closed outline of cubic segments, used for both the front and side views. Wide belly, narrow
 * neck, rounded head, banded white, red, white from the base up. Small enough to run through the whole pipeline as a
 * smoke test.
 *
 * @author hal.hildebrand
 */
public final class BowlingPinSample {
    public static final String NAME           = "bowling_pin";
    public static final String DEFAULT_OUTPUT = "bowling_pin.glb";
    public static final String PATH_ID        = "body";

    /** 200x200 view box, centered on x = 100, y grows downward. */
    public static final String PROFILE = "M 80 10 C 78 10 70 20 70 40 C 70 55 88 70 88 80 C 88 90 75 100 72 120 "
    + "C 68 140 60 155 60 165 C 60 175 62 185 65 190 L 135 190 C 138 185 140 175 140 165 "
    + "C 140 155 132 140 128 120 C 125 100 112 90 112 80 C 112 70 130 55 130 40 C 130 20 122 10 120 10 Z";

    private BowlingPinSample() {
    }

    public static ModelConfig config() {
        var config = new ModelConfig();
        config.name = NAME;
        config.output = DEFAULT_OUTPUT;
        config.svgHeight = 200;
        config.svgCenterX = 100;
        config.scale = 0.01;
        config.vertsPerRing = 10;
        config.samplesPerUnit = 60;

        var body = new ComponentSpec(PATH_ID);
        body.capTop = true;
        body.capBottom = true;
        config.components.add(body);

        var white = Rgb.of(0xeeeeee);
        config.yRanges = List.of(new ColorZone(0, 0.5, white), new ColorZone(0.5, 1.2, Rgb.of(0xcc0000)),
                                 new ColorZone(1.2, 2.0, white));
        return config;
    }

    public static ViewPaths views() {
        var outline = new PathParser().parse(PROFILE);
        return new ViewPaths(Map.of(PATH_ID, outline), Map.of(PATH_ID, outline));
    }
}
