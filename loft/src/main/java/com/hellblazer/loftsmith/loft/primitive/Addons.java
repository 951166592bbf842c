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

package com.hellblazer.loftsmith.loft.primitive;

import com.hellblazer.loftsmith.geometry.EulerRotation;
import com.hellblazer.loftsmith.loft.color.Rgb;
import com.hellblazer.loftsmith.loft.config.AddonSpec;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3f;
import java.util.Optional;

/**
 * Turns {@link AddonSpec}s into placed, solid-colored primitives.
 *
 * @author hal.hildebrand
 */
public final class Addons {
    private static final Logger log = LoggerFactory.getLogger(Addons.class);

    private Addons() {
    }

    /**
     * @return the placed addon, or empty when its type is unknown or its dimensions are missing
     */
    public static Optional<MeshPart> build(AddonSpec spec) {
        Optional<MeshPart> shape;
        try {
            shape = shape(spec);
        } catch (IllegalArgumentException e) {
            log.warn("Addon {} rejected: {}", spec.label(), e.getMessage());
            return Optional.empty();
        }
        if (shape.isEmpty()) {
            return shape;
        }
        var translation = spec.position == null || spec.position.length < 3 ? new Vector3f() : new Vector3f(
        spec.position);
        // translated first, so the rotation swings the addon about the model origin
        var placed = shape.get()
                          .transformed(EulerRotation.IDENTITY, translation)
                          .transformed(EulerRotation.of(spec.rotation), new Vector3f());
        var c = (spec.color == null ? Rgb.GRAY : spec.color).linear();
        return Optional.of(placed.withSolidColor(c[0], c[1], c[2]));
    }

    private static Optional<MeshPart> shape(AddonSpec spec) {
        var type = spec.type == null ? "" : spec.type;
        switch (type) {
            case "box" -> {
                if (spec.size == null || spec.size.length < 3) {
                    log.warn("Addon {} needs a 3 element size", spec.label());
                    return Optional.empty();
                }
                return Optional.of(Primitives.box(spec.size[0], spec.size[1], spec.size[2]));
            }
            case "cylinder" -> {
                var top = spec.radiusTop != null ? spec.radiusTop : spec.radius;
                var bottom = spec.radiusBottom != null ? spec.radiusBottom : spec.radius;
                if (top == null || bottom == null || spec.height == null) {
                    log.warn("Addon {} needs radii and a height", spec.label());
                    return Optional.empty();
                }
                var segments = spec.segments == null ? Primitives.DEFAULT_CYLINDER_SEGMENTS : spec.segments;
                return Optional.of(Primitives.cylinder(top, bottom, spec.height, segments));
            }
            case "sphere" -> {
                if (spec.radius == null) {
                    log.warn("Addon {} needs a radius", spec.label());
                    return Optional.empty();
                }
                var width = spec.segments == null ? Primitives.DEFAULT_SPHERE_WIDTH : spec.segments;
                var height = spec.segments == null ? Primitives.DEFAULT_SPHERE_HEIGHT : spec.segments;
                return Optional.of(Primitives.sphere(spec.radius, width, height));
            }
            default -> {
                log.warn("Unknown addon type '{}' for {}", spec.type, spec.label());
                return Optional.empty();
            }
        }
    }
}
