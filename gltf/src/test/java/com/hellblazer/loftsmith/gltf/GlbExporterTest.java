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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.loftsmith.geometry.EulerRotation;
import com.hellblazer.loftsmith.loft.anim.ClipTable;
import com.hellblazer.loftsmith.loft.child.ChildObjects;
import com.hellblazer.loftsmith.loft.config.ChildSpec;
import com.hellblazer.loftsmith.loft.mesh.MergedMesh;
import com.hellblazer.loftsmith.loft.mesh.MeshMerger;
import com.hellblazer.loftsmith.loft.pipeline.ModelAsset;
import com.hellblazer.loftsmith.loft.primitive.Primitives;
import com.hellblazer.loftsmith.loft.skin.HumanoidRig;
import com.hellblazer.loftsmith.loft.skin.SkinWeightAssigner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Vector3f;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GlbExporterTest {

    private static final int GLB_MAGIC  = 0x46546C67;
    private static final int JSON_CHUNK = 0x4E4F534A;
    private static final int BIN_CHUNK  = 0x004E4942;

    @TempDir
    Path dir;

    private static MergedMesh box() {
        var part = Primitives.box(0.5f, 1.8f, 0.3f).transformed(EulerRotation.IDENTITY, new Vector3f(0, 0.9f, 0));
        return MeshMerger.merge(List.of(part.withSolidColor(1, 0, 0)));
    }

    /** Validates the GLB container and returns its JSON chunk. */
    private static JsonNode readGlb(Path file) throws Exception {
        var bytes = Files.readAllBytes(file);
        var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(GLB_MAGIC, buffer.getInt(0));
        assertEquals(2, buffer.getInt(4));
        assertEquals(bytes.length, buffer.getInt(8));

        var jsonLength = buffer.getInt(12);
        assertEquals(JSON_CHUNK, buffer.getInt(16));
        var json = new String(bytes, 20, jsonLength, StandardCharsets.UTF_8);
        var binOffset = 20 + jsonLength;
        assertEquals(BIN_CHUNK, buffer.getInt(binOffset + 4));

        var root = new ObjectMapper().readTree(json);
        assertTrue(buffer.getInt(binOffset) >= root.path("buffers").get(0).path("byteLength").asInt());
        return root;
    }

    @Test
    public void testRigidMesh() throws Exception {
        var mesh = box();
        var output = dir.resolve("box.glb");
        new GlbExporter().export(ModelAsset.rigid("crate", mesh, List.of(), 0.7f, 0.02f), output);

        var root = readGlb(output);
        assertEquals("2.0", root.path("asset").path("version").asText());
        assertEquals(GlbExporter.GENERATOR, root.path("asset").path("generator").asText());
        assertEquals(1, root.path("nodes").size());
        assertEquals("crate", root.path("nodes").get(0).path("name").asText());
        assertEquals(0, root.path("scene").asInt());

        var primitive = root.path("meshes").get(0).path("primitives").get(0);
        assertEquals(4, primitive.path("mode").asInt());
        var attributes = primitive.path("attributes");
        for (var name : List.of("POSITION", "NORMAL", "COLOR_0", "TEXCOORD_0")) {
            assertTrue(attributes.has(name), name);
        }
        assertFalse(attributes.has("JOINTS_0"));

        var accessors = root.path("accessors");
        var position = accessors.get(attributes.path("POSITION").asInt());
        assertEquals(mesh.getVertexCount(), position.path("count").asInt());
        assertEquals("VEC3", position.path("type").asText());
        assertEquals(0.0, position.path("min").get(1).asDouble(), 1e-6);
        assertEquals(1.8, position.path("max").get(1).asDouble(), 1e-6);

        var indices = accessors.get(primitive.path("indices").asInt());
        assertEquals(GlbBufferBuilder.UNSIGNED_INT, indices.path("componentType").asInt());
        assertEquals(mesh.getTriangleCount() * 3, indices.path("count").asInt());

        var pbr = root.path("materials").get(0).path("pbrMetallicRoughness");
        assertEquals(0.7, pbr.path("roughnessFactor").asDouble(), 1e-6);
        assertEquals(0.02, pbr.path("metallicFactor").asDouble(), 1e-6);

        for (var view : root.path("bufferViews")) {
            assertEquals(0, view.path("byteOffset").asInt() % 4);
        }
    }

    @Test
    public void testChildrenGroupedUnderModelNode() throws Exception {
        var wheel = new ChildSpec();
        wheel.name = "wheel_fl";
        wheel.type = "wheel";
        wheel.position = new float[] { -0.8f, 0.3f, 1.2f };
        var light = new ChildSpec();
        light.name = "light";
        light.type = "box";
        light.rotation = new float[] { 0, (float) Math.PI / 2, 0 };
        var children = List.of(ChildObjects.build(wheel).orElseThrow(), ChildObjects.build(light).orElseThrow());

        var output = dir.resolve("car.glb");
        new GlbExporter().export(ModelAsset.rigid("car", box(), children, 0.7f, 0.02f), output);

        var root = readGlb(output);
        var scene = root.path("scenes").get(0).path("nodes");
        assertEquals(1, scene.size());
        var group = root.path("nodes").get(scene.get(0).asInt());
        assertEquals("car", group.path("name").asText());
        assertEquals(3, group.path("children").size());

        var wheelNode = root.path("nodes").get(group.path("children").get(1).asInt());
        assertEquals("wheel_fl", wheelNode.path("name").asText());
        assertEquals(-0.8, wheelNode.path("translation").get(0).asDouble(), 1e-6);
        assertFalse(wheelNode.has("rotation"));
        // tire, hub and five spokes, each with its own material
        assertEquals(7, root.path("meshes").get(wheelNode.path("mesh").asInt()).path("primitives").size());

        var lightNode = root.path("nodes").get(group.path("children").get(2).asInt());
        var rotation = lightNode.path("rotation");
        assertEquals(4, rotation.size());
        assertEquals(Math.sin(Math.PI / 4), rotation.get(1).asDouble(), 1e-6);
        assertEquals(1 + 7 + 1, root.path("materials").size());
    }

    @Test
    public void testSkinnedCharacter() throws Exception {
        var mesh = box();
        var skeleton = HumanoidRig.skeleton();
        var skin = new SkinWeightAssigner(skeleton).assign(mesh);
        var clips = ClipTable.humanoid();
        var output = dir.resolve("character.glb");
        new GlbExporter().export(ModelAsset.skinned("character", mesh, skeleton, skin, clips, 0.7f, 0.02f), output);

        var root = readGlb(output);
        var nodes = root.path("nodes");
        assertEquals(1 + skeleton.size(), nodes.size());
        assertEquals("CharacterMesh", nodes.get(0).path("name").asText());
        assertEquals(0, nodes.get(0).path("skin").asInt());

        var skinNode = root.path("skins").get(0);
        assertEquals(skeleton.size(), skinNode.path("joints").size());
        var rootJoint = skinNode.path("skeleton").asInt();
        assertEquals("Root", nodes.get(rootJoint).path("name").asText());
        assertEquals(0.95, nodes.get(rootJoint).path("translation").get(1).asDouble(), 1e-6);
        // Root's children: Spine, L_Hip, R_Hip
        assertEquals(3, nodes.get(rootJoint).path("children").size());

        var inverseBind = root.path("accessors").get(skinNode.path("inverseBindMatrices").asInt());
        assertEquals("MAT4", inverseBind.path("type").asText());
        assertEquals(skeleton.size(), inverseBind.path("count").asInt());

        var attributes = root.path("meshes").get(0).path("primitives").get(0).path("attributes");
        var joints = root.path("accessors").get(attributes.path("JOINTS_0").asInt());
        assertEquals(GlbBufferBuilder.UNSIGNED_SHORT, joints.path("componentType").asInt());
        assertEquals("VEC4", joints.path("type").asText());
        assertTrue(attributes.has("WEIGHTS_0"));

        var animations = root.path("animations");
        assertEquals(clips.size(), animations.size());
        var walk = animations.get(1);
        assertEquals("walk", walk.path("name").asText());
        var paths = new HashSet<String>();
        for (var channel : walk.path("channels")) {
            paths.add(channel.path("target").path("path").asText());
            var target = channel.path("target").path("node").asInt();
            assertTrue(target >= rootJoint && target < rootJoint + skeleton.size());
        }
        assertEquals(Set.of("rotation", "translation"), paths);
        var sampler = walk.path("samplers").get(0);
        assertEquals("LINEAR", sampler.path("interpolation").asText());
        var input = root.path("accessors").get(sampler.path("input").asInt());
        assertTrue(input.has("min") && input.has("max"));
    }

    @Test
    public void testInverseBindMatrices() {
        var matrices = GlbExporter.inverseBindMatrices(HumanoidRig.skeleton());
        assertEquals(16 * 16, matrices.length);
        var head = HumanoidRig.skeleton().indexOf("Head") * 16;
        assertEquals(1, matrices[head]);
        assertEquals(1, matrices[head + 15]);
        assertEquals(-1.65f, matrices[head + 13], 1e-5f);
        assertEquals(0, matrices[head + 3]);
    }
}
