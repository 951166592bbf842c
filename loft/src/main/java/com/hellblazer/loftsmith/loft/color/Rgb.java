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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An 8-bit sRGB color as authored in configuration. Vertex colors are handed on in linear space.
 *
 * @author hal.hildebrand
 */
public record Rgb(int red, int green, int blue) {

    public static final Rgb GRAY = of(0xcccccc);

    private static final Logger log = LoggerFactory.getLogger(Rgb.class);

    public Rgb {
        if ((red | green | blue) < 0 || red > 255 || green > 255 || blue > 255) {
            throw new IllegalArgumentException("Color channels must be in [0, 255]: " + red + ", " + green + ", " + blue);
        }
    }

    /**
     * Binds a configuration value: a JSON integer or a hex string. Missing or unreadable values fall back to
     * {@link #GRAY}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Rgb fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return GRAY;
        }
        if (node.isIntegralNumber()) {
            return of(node.asInt());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        log.warn("Unsupported color value {}, using gray", node);
        return GRAY;
    }

    public static Rgb of(int hex) {
        return new Rgb((hex >> 16) & 0xff, (hex >> 8) & 0xff, hex & 0xff);
    }

    /**
     * Accepts {@code 0xRRGGBB}, {@code #RRGGBB} or bare {@code RRGGBB}.
     */
    public static Rgb parse(String text) {
        if (text == null) {
            return GRAY;
        }
        var digits = text.trim();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        } else if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        try {
            return of(Integer.parseInt(digits, 16));
        } catch (NumberFormatException e) {
            log.warn("Unreadable color '{}', using gray", text);
            return GRAY;
        }
    }

    private static float toLinear(int channel) {
        var c = channel / 255.0;
        return (float) (c < 0.04045 ? c * 0.0773993808 : Math.pow(c * 0.9478672986 + 0.0521327014, 2.4));
    }

    public int hex() {
        return (red << 16) | (green << 8) | blue;
    }

    /**
     * @return {r, g, b} in linear space, each in [0, 1]
     */
    public float[] linear() {
        return new float[] { toLinear(red), toLinear(green), toLinear(blue) };
    }

    @Override
    public String toString() {
        return String.format("#%06x", hex());
    }
}
