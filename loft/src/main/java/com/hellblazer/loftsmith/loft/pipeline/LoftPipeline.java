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

import com.hellblazer.loftsmith.geometry.Polyline;
import com.hellblazer.loftsmith.loft.anim.ClipTable;
import com.hellblazer.loftsmith.loft.child.ChildObject;
import com.hellblazer.loftsmith.loft.child.ChildObjects;
import com.hellblazer.loftsmith.loft.config.ModelConfig;
import com.hellblazer.loftsmith.loft.mesh.MeshMerger;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import com.hellblazer.loftsmith.loft.primitive.Addons;
import com.hellblazer.loftsmith.loft.skin.HumanoidRig;
import com.hellblazer.loftsmith.loft.skin.SkinWeightAssigner;
import com.hellblazer.loftsmith.loft.svg.SvgPathLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives a {@link ModelConfig} from vector outlines to an exported asset.
 * <p>
 * Components are lofted independently, on a fixed pool when {@code parallelism > 1}, and always merged in declared
 * order followed by the addons, so the output does not depend on scheduling. Components that cannot be lofted are
 * logged and skipped; a run with nothing left to merge fails with {@link PipelineException}.
 *
 * @author hal.hildebrand
 */
public class LoftPipeline {
    public static final String NO_GEOMETRY = "No geometries generated";

    private static final Logger log = LoggerFactory.getLogger(LoftPipeline.class);

    private final MeshExporter   exporter;
    private final SvgPathLibrary library;

    public LoftPipeline(MeshExporter exporter) {
        this(exporter, new SvgPathLibrary());
    }

    public LoftPipeline(MeshExporter exporter, SvgPathLibrary library) {
        this.exporter = exporter;
        this.library = library;
    }

    /**
     * Read the configured vector files and build the asset.
     */
    public ModelAsset build(ModelConfig config) throws IOException, PipelineException {
        return build(config, loadViews(config));
    }

    public ModelAsset build(ModelConfig config, ViewPaths views) throws PipelineException {
        config.validate();
        var parts = loftComponents(config, new ComponentLofter(config, views));
        for (var addon : config.addons()) {
            var part = Addons.build(addon);
            if (part.isPresent()) {
                parts.add(part.get());
                log.info("Addon {}: {} vertices, {} triangles", addon.label(), part.get().getVertexCount(),
                         part.get().getTriangleCount());
            }
        }
        if (parts.isEmpty()) {
            log.error(NO_GEOMETRY);
            throw new PipelineException(NO_GEOMETRY);
        }

        var merged = MeshMerger.merge(parts);
        log.info("Merged {} parts into {} vertices, {} triangles", parts.size(), merged.getVertexCount(),
                 merged.getTriangleCount());

        if (config.skeleton) {
            if (!config.children().isEmpty()) {
                log.warn("Ignoring {} children on a skinned model", config.children().size());
            }
            var skeleton = HumanoidRig.skeleton();
            var bindings = new SkinWeightAssigner(skeleton).assign(merged);
            var clips = ClipTable.humanoid();
            log.info("Skinned to {} bones with {} clips", skeleton.size(), clips.size());
            return ModelAsset.skinned(config.name, merged, skeleton, bindings, clips, config.roughness,
                                      config.metalness);
        }

        var children = new ArrayList<ChildObject>();
        for (var spec : config.children()) {
            ChildObjects.build(spec).ifPresent(children::add);
        }
        return ModelAsset.rigid(config.name, merged, children, config.roughness, config.metalness);
    }

    public ViewPaths loadViews(ModelConfig config) throws IOException {
        var front = library.load(config.resolve(config.svgFront));
        var side = library.load(config.resolve(config.svgSide));
        Map<String, Polyline> top = config.svgTop == null ? Map.of() : library.load(config.resolve(config.svgTop));
        return new ViewPaths(front, side, top);
    }

    /**
     * Build the asset and export it to the configured output.
     */
    public Path run(ModelConfig config) throws IOException, PipelineException {
        return run(config, config.outputPath());
    }

    public Path run(ModelConfig config, Path output) throws IOException, PipelineException {
        return export(build(config), output);
    }

    /**
     * Build from paths already in hand, bypassing the vector files, and export.
     */
    public Path run(ModelConfig config, ViewPaths views, Path output) throws IOException, PipelineException {
        return export(build(config, views), output);
    }

    private Path export(ModelAsset asset, Path output) throws IOException {
        var parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        exporter.export(asset, output);
        log.info("Exported {} ({} KB)", output, String.format("%.1f", Files.size(output) / 1024.0));
        return output;
    }

    private List<MeshPart> loftComponents(ModelConfig config, ComponentLofter lofter) throws PipelineException {
        var components = config.components();
        var parts = new ArrayList<MeshPart>();
        if (config.parallelism <= 1 || components.size() < 2) {
            for (var spec : components) {
                lofter.loft(spec).ifPresent(parts::add);
            }
            return parts;
        }

        var executor = Executors.newFixedThreadPool(Math.min(config.parallelism, components.size()));
        try {
            var futures = new ArrayList<Future<Optional<MeshPart>>>(components.size());
            for (var spec : components) {
                futures.add(executor.submit(() -> lofter.loft(spec)));
            }
            for (var future : futures) {
                future.get().ifPresent(parts::add);
            }
            return parts;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while lofting components", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PipelineException("Lofting failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
