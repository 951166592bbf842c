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

import com.hellblazer.loftsmith.loft.color.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ModelConfigLoaderTest {

    private static final String CHARACTER = """
    {
      "name": "character",
      "svgFront": "front.svg",
      "svgSide": "side.svg",
      "scale": 0.01,
      "vertsPerRing": 12,
      "components": [
        { "id": "torso", "capTop": true, "yMin": 0.8, "yMax": 1.5, "color": "0x3366cc" },
        { "id": "head", "frontPath": "head_f", "sidePath": "head_s", "vertsPerRing": 16, "offsetX": 0.25,
          "yRanges": [ { "yMin": 1.5, "yMax": 1.6, "color": "#d4a574" } ] }
      ],
      "yRanges": [ { "yMin": 0, "yMax": 0.08, "color": "0x1a1a1a" } ],
      "addons": [ { "id": "hat", "type": "cylinder", "radius": 0.1, "height": 0.05, "position": [0, 1.7, 0] } ],
      "children": [ { "name": "wheel_fl", "type": "wheel", "radius": 0.3, "width": 0.2 } ],
      "comment": "ignored"
    }
    """;

    private final ModelConfigLoader loader = new ModelConfigLoader();

    @Test
    public void testParse() {
        var config = loader.parse(CHARACTER);
        assertEquals("character", config.name);
        assertEquals(0.01, config.scale);
        assertEquals(12, config.vertsPerRing);
        assertEquals(2, config.components().size());

        var torso = config.components().get(0);
        assertEquals("torso", torso.frontPathId());
        assertEquals("torso", torso.sidePathId());
        assertTrue(torso.capTop);
        assertFalse(torso.capBottom);
        assertEquals(0.8, torso.yMin);
        assertEquals(Rgb.of(0x3366cc), torso.color);
        assertEquals(12, torso.vertsPerRing(config.vertsPerRing));
        assertNull(torso.yRanges);

        var head = config.components().get(1);
        assertEquals("head_f", head.frontPathId());
        assertEquals("head_s", head.sidePathId());
        assertEquals(16, head.vertsPerRing(config.vertsPerRing));
        assertEquals(0.25f, head.offsetX);
        assertEquals(Rgb.of(0xd4a574), head.yRanges.get(0).color());
        assertNull(head.yMin);

        assertEquals(1, config.yRanges.size());
        assertEquals("hat", config.addons().get(0).label());
        assertEquals(1.7f, config.addons().get(0).position[1]);
        assertEquals("wheel", config.children().get(0).type);
    }

    @Test
    public void testDefaults() {
        var config = loader.parse("{}");
        assertEquals("lofted_model", config.name);
        assertEquals(200, config.svgHeight);
        assertEquals(100, config.svgCenterX);
        assertEquals(100, config.sideCenter());
        assertEquals(100, config.topCenter());
        assertEquals(100, config.topCenterY);
        assertEquals(1.0, config.scale);
        assertEquals(10, config.vertsPerRing);
        assertEquals(40, config.samplesPerUnit);
        assertEquals(1, config.parallelism);
        assertFalse(config.skeleton);
        assertNull(config.yRanges);
        assertTrue(config.components().isEmpty());
        assertEquals(Path.of("output.glb"), config.outputPath());
    }

    @Test
    public void testSeparateViewCenters() {
        var config = loader.parse("{\"svgCenterX\": 50, \"sideCenterX\": 80}");
        assertEquals(80, config.sideCenter());
        assertEquals(50, config.topCenter());
    }

    @Test
    public void testInvalidConfigurations() {
        assertThrows(ModelConfigException.class, () -> loader.parse("{ not json"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"scale\": 0}"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"vertsPerRing\": 2}"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"samplesPerUnit\": -1}"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"parallelism\": 0}"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"components\": [ { \"capTop\": true } ]}"));
        assertThrows(ModelConfigException.class,
                     () -> loader.parse("{\"components\": [ { \"id\": \"a\", \"vertsPerRing\": 1 } ]}"));
        assertThrows(ModelConfigException.class, () -> loader.parse("{\"yRanges\": [ null ]}"));
        assertThrows(ModelConfigException.class,
                     () -> loader.parse("{\"components\": [ { \"id\": \"a\", \"yRanges\": [ null ] } ]}"));
    }

    @Test
    public void testLoadResolvesAgainstConfigDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("front.svg"), "<svg/>");
        Files.writeString(dir.resolve("side.svg"), "<svg/>");
        var file = dir.resolve("character.json");
        Files.writeString(file, CHARACTER);

        var config = loader.load(file);
        assertEquals(dir.toAbsolutePath(), config.baseDirectory);
        assertEquals(dir.toAbsolutePath().resolve("front.svg"), config.resolve(config.svgFront));
        assertEquals(dir.toAbsolutePath().resolve("output.glb"), config.outputPath());
    }

    @Test
    public void testLoadRequiresViewFiles(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("front.svg"), "<svg/>");
        var file = dir.resolve("character.json");
        Files.writeString(file, CHARACTER);
        var e = assertThrows(ModelConfigException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("svgSide"), e.getMessage());

        var noFront = dir.resolve("bare.json");
        Files.writeString(noFront, "{\"svgSide\": \"front.svg\"}");
        assertThrows(ModelConfigException.class, () -> loader.load(noFront));
    }
}
