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

package com.hellblazer.loftsmith.loft.child;

import com.hellblazer.loftsmith.geometry.EulerRotation;
import com.hellblazer.loftsmith.loft.color.Rgb;
import com.hellblazer.loftsmith.loft.config.ChildSpec;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import com.hellblazer.loftsmith.loft.primitive.Primitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds {@link ChildObject}s from their configuration.
 *
 * @author hal.hildebrand
 */
public final class ChildObjects {

    public static final Rgb TIRE = Rgb.of(0x222222);
    public static final Rgb HUB  = Rgb.of(0x888888);

    private static final Logger        log          = LoggerFactory.getLogger(ChildObjects.class);
    private static final int           SPOKES       = 5;
    private static final Vector3f      NO_OFFSET    = new Vector3f();
    private static final EulerRotation ONTO_X_AXIS  = new EulerRotation(0, 0, (float) (Math.PI / 2));

    private ChildObjects() {
    }

    /**
     * @return the child, or empty for an unknown type
     */
    public static Optional<ChildObject> build(ChildSpec spec) {
        List<ChildPart> parts = switch (spec.type == null ? "" : spec.type) {
            case "wheel" -> wheel(spec);
            case "box" -> List.of(box(spec));
            case "cylinder" -> List.of(cylinder(spec));
            default -> null;
        };
        if (parts == null) {
            log.warn("Unknown child type '{}' for {}", spec.type, spec.name);
            return Optional.empty();
        }
        var name = spec.name == null ? spec.type : spec.name;
        var translation = spec.position == null || spec.position.length < 3 ? new Vector3f() : new Vector3f(
        spec.position);
        return Optional.of(new ChildObject(name, translation, EulerRotation.of(spec.rotation), parts));
    }

    private static ChildPart box(ChildSpec spec) {
        var size = spec.size == null || spec.size.length < 3 ? new float[] { 0.1f, 0.1f, 0.1f } : spec.size;
        var mesh = Primitives.box(size[0], size[1], size[2]);
        return finish(mesh, spec.color, spec, 0.5f, 0.3f);
    }

    private static ChildPart cylinder(ChildSpec spec) {
        var radius = positive(spec.radius, 0.1f);
        var height = positive(spec.height, 0.1f);
        var segments = spec.segments == null || spec.segments < 3 ? 12 : spec.segments;
        var mesh = Primitives.cylinder(radius, radius, height, segments);
        if (spec.rotateX != null && spec.rotateX != 0) {
            mesh = mesh.transformed(new EulerRotation(spec.rotateX, 0, 0), NO_OFFSET);
        }
        if (spec.rotateZ != null && spec.rotateZ != 0) {
            mesh = mesh.transformed(new EulerRotation(0, 0, spec.rotateZ), NO_OFFSET);
        }
        return finish(mesh, spec.color, spec, 0.5f, 0.3f);
    }

    private static ChildPart finish(MeshPart mesh, Rgb color, ChildSpec spec, float roughness, float metalness) {
        var c = (color == null ? Rgb.GRAY : color).linear();
        return new ChildPart(mesh.withSolidColor(c[0], c[1], c[2]),
                             spec.roughness == null ? roughness : spec.roughness,
                             spec.metalness == null ? metalness : spec.metalness);
    }

    private static float positive(Float value, float fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static ChildPart painted(MeshPart mesh, Rgb color, float roughness, float metalness) {
        var c = color.linear();
        return new ChildPart(mesh.withSolidColor(c[0], c[1], c[2]), roughness, metalness);
    }

    private static List<ChildPart> wheel(ChildSpec spec) {
        var r = positive(spec.radius, 0.25f);
        var w = positive(spec.width, 0.14f);
        var parts = new ArrayList<ChildPart>();
        parts.add(painted(Primitives.cylinder(r, r, w, 14).transformed(ONTO_X_AXIS, NO_OFFSET), TIRE, 0.95f, 0.0f));
        parts.add(painted(Primitives.cylinder(r * 0.6f, r * 0.6f, w + 0.02f, 10).transformed(ONTO_X_AXIS, NO_OFFSET),
                          HUB, 0.2f, 0.8f));

        var outside = spec.position != null && spec.position.length > 0 && spec.position[0] > 0;
        var x = outside ? w / 2 + 0.01f : -w / 2 - 0.01f;
        var spokeLength = r * 0.35f;
        for (int i = 0; i < SPOKES; i++) {
            var angle = (float) (2 * Math.PI * i / SPOKES);
            var spoke = Primitives.box(0.02f, spokeLength, 0.025f)
                                  .transformed(new EulerRotation(angle, 0, 0),
                                               new Vector3f(x, (float) Math.sin(angle) * spokeLength,
                                                            (float) Math.cos(angle) * spokeLength));
            parts.add(painted(spoke, HUB, 0.2f, 0.8f));
        }
        return parts;
    }
}
