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

package com.hellblazer.loftsmith.loft.anim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.loftsmith.geometry.EulerRotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authored animation clips for a rig, in declaration order. Rotation keys are authored as XYZ Euler angles and
 * held as quaternions.
 *
 * @author hal.hildebrand
 */
public final class ClipTable {
    public static final String HUMANOID_RESOURCE = "/animations/humanoid-clips.json";

    private static final Logger log = LoggerFactory.getLogger(ClipTable.class);

    private static volatile ClipTable humanoid;

    private final Map<String, AnimationClip> clips;

    public ClipTable(List<AnimationClip> clips) {
        var byName = new LinkedHashMap<String, AnimationClip>();
        for (var clip : clips) {
            if (byName.put(clip.name(), clip) != null) {
                throw new IllegalArgumentException("Duplicate clip: " + clip.name());
            }
        }
        this.clips = Collections.unmodifiableMap(byName);
    }

    /**
     * The clips shipped for the humanoid rig, loaded once.
     */
    public static ClipTable humanoid() {
        var table = humanoid;
        if (table == null) {
            synchronized (ClipTable.class) {
                table = humanoid;
                if (table == null) {
                    try (var in = ClipTable.class.getResourceAsStream(HUMANOID_RESOURCE)) {
                        if (in == null) {
                            throw new IllegalStateException("Missing resource " + HUMANOID_RESOURCE);
                        }
                        table = load(in);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Unable to read " + HUMANOID_RESOURCE, e);
                    }
                    log.debug("Loaded {} humanoid clips", table.size());
                    humanoid = table;
                }
            }
        }
        return table;
    }

    public static ClipTable load(InputStream in) throws IOException {
        var root = new ObjectMapper().readTree(in);
        var order = root.path("rotationOrder").asText("XYZ");
        if (!"XYZ".equals(order)) {
            throw new IOException("Unsupported rotation order: " + order);
        }
        var clips = new ArrayList<AnimationClip>();
        for (var clipNode : root.path("clips")) {
            var tracks = new ArrayList<AnimationTrack>();
            for (var trackNode : clipNode.path("tracks")) {
                tracks.add(track(trackNode));
            }
            clips.add(new AnimationClip(clipNode.path("name").asText(), (float) clipNode.path("duration").asDouble(),
                                        tracks));
        }
        return new ClipTable(clips);
    }

    private static AnimationTrack track(JsonNode node) throws IOException {
        var bone = node.path("bone").asText();
        var kind = switch (node.path("type").asText()) {
            case "rotation" -> AnimationTrack.Kind.ROTATION;
            case "translation" -> AnimationTrack.Kind.TRANSLATION;
            default -> throw new IOException("Unknown track type '" + node.path("type").asText() + "' for " + bone);
        };
        var timesNode = node.path("times");
        var valuesNode = node.path("values");
        if (timesNode.size() != valuesNode.size()) {
            throw new IOException("Track " + bone + " has " + timesNode.size() + " times and " + valuesNode.size()
                                  + " values");
        }
        var times = new float[timesNode.size()];
        var values = new float[times.length * kind.components()];
        for (int k = 0; k < times.length; k++) {
            times[k] = (float) timesNode.get(k).asDouble();
            var v = valuesNode.get(k);
            var x = (float) v.path(0).asDouble();
            var y = (float) v.path(1).asDouble();
            var z = (float) v.path(2).asDouble();
            if (kind == AnimationTrack.Kind.ROTATION) {
                System.arraycopy(new EulerRotation(x, y, z).components(), 0, values, k * 4, 4);
            } else {
                values[k * 3] = x;
                values[k * 3 + 1] = y;
                values[k * 3 + 2] = z;
            }
        }
        return new AnimationTrack(bone, kind, times, values);
    }

    public List<AnimationClip> clips() {
        return List.copyOf(clips.values());
    }

    public Optional<AnimationClip> get(String name) {
        return Optional.ofNullable(clips.get(name));
    }

    public int size() {
        return clips.size();
    }
}
