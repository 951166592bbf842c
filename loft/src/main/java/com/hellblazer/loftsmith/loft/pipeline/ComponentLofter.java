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

package com.hellblazer.loftsmith.loft.pipeline;

import com.hellblazer.loftsmith.loft.color.ColorRules;
import com.hellblazer.loftsmith.loft.config.ComponentSpec;
import com.hellblazer.loftsmith.loft.config.ModelConfig;
import com.hellblazer.loftsmith.loft.mesh.LoftOptions;
import com.hellblazer.loftsmith.loft.mesh.Lofter;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import com.hellblazer.loftsmith.loft.silhouette.CrossSectionShape;
import com.hellblazer.loftsmith.loft.silhouette.OutlineNormalizer;
import com.hellblazer.loftsmith.loft.silhouette.SilhouetteSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Lofts and colors one component from the named outlines. Holds no mutable state, so one instance serves
 * concurrent components.
 *
 * @author hal.hildebrand
 */
final class ComponentLofter {
    static final int MIN_SAMPLES = 4;
    static final int MAX_SAMPLES = 100_000;

    private static final Logger log = LoggerFactory.getLogger(ComponentLofter.class);

    private final ModelConfig   config;
    private final ViewPaths     views;
    private final ViewTransform frontView;
    private final ViewTransform sideView;

    ComponentLofter(ModelConfig config, ViewPaths views) {
        this.config = config;
        this.views = views;
        this.frontView = new ViewTransform(config.svgCenterX, config.svgHeight, config.scale);
        this.sideView = new ViewTransform(config.sideCenter(), config.svgHeight, config.scale);
    }

    static int sampleCount(double yMin, double yMax, double samplesPerUnit) {
        return Math.max(MIN_SAMPLES, (int) Math.ceil((yMax - yMin) * samplesPerUnit));
    }

    /**
     * @return the colored component, or empty when it is skipped
     */
    Optional<MeshPart> loft(ComponentSpec spec) {
        log.debug("Lofting component {}", spec.id);
        var frontRaw = views.front().get(spec.frontPathId());
        if (frontRaw == null) {
            log.warn("No front path found for '{}', skipping {}", spec.frontPathId(), spec.id);
            return Optional.empty();
        }
        var sideRaw = views.side().get(spec.sidePathId());
        if (sideRaw == null) {
            log.warn("No side path found for '{}', skipping {}", spec.sidePathId(), spec.id);
            return Optional.empty();
        }
        var vertsPerRing = spec.vertsPerRing(config.vertsPerRing);
        var front = frontView.apply(frontRaw);
        var side = sideView.apply(sideRaw);

        var yMin = spec.yMin != null ? spec.yMin : Math.min(front.minY(), side.minY());
        var yMax = spec.yMax != null ? spec.yMax : Math.max(front.maxY(), side.maxY());
        if (!(yMax > yMin)) {
            log.warn("Empty height range {} to {}, skipping {}", yMin, yMax, spec.id);
            return Optional.empty();
        }
        var span = (yMax - yMin) * config.samplesPerUnit;
        if (!(span <= MAX_SAMPLES)) {
            log.warn("Height range {} to {} needs {} levels, more than {}, skipping {}", yMin, yMax,
                     String.format("%.0f", span), MAX_SAMPLES, spec.id);
            return Optional.empty();
        }
        var numSamples = sampleCount(yMin, yMax, config.samplesPerUnit);
        var frontSamples = SilhouetteSampler.sample(front, yMin, yMax, numSamples);
        var sideSamples = SilhouetteSampler.sample(side, yMin, yMax, numSamples);
        log.debug("{}: height {} to {}, {}/{} of {} levels sampled", spec.id, String.format("%.3f", yMin),
                  String.format("%.3f", yMax), frontSamples.size(), sideSamples.size(), numSamples);

        var options = LoftOptions.defaults()
                                 .withVertsPerRing(vertsPerRing)
                                 .withHeightRange(yMin, yMax)
                                 .withOffset(spec.offsetX, spec.offsetY, spec.offsetZ)
                                 .withCaps(spec.capBottom, spec.capTop)
                                 .withTopShape(topShape(spec, vertsPerRing));
        var lofted = Lofter.loft(frontSamples, sideSamples, options);
        if (lofted == null) {
            log.warn("Failed to generate geometry for {}", spec.id);
            return Optional.empty();
        }
        var rule = ColorRules.select(spec.yRanges, spec.color, config.yRanges);
        var part = ColorRules.apply(lofted.part(), rule);
        log.info("{}: {} vertices, {} triangles", spec.id, part.getVertexCount(), part.getTriangleCount());
        return Optional.of(part);
    }

    private CrossSectionShape topShape(ComponentSpec spec, int vertsPerRing) {
        var top = views.top().get(spec.topPathId());
        if (top == null || top.size() < 3) {
            return null;
        }
        var shape = OutlineNormalizer.normalize(top, config.topCenter(), config.topCenterY, vertsPerRing);
        if (shape == null) {
            log.debug("Top outline '{}' collapsed, using ellipse cross-sections for {}", spec.topPathId(), spec.id);
        }
        return shape;
    }
}
