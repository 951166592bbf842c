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

import com.hellblazer.loftsmith.loft.anim.AnimationClip;
import com.hellblazer.loftsmith.loft.anim.AnimationTrack;
import com.hellblazer.loftsmith.loft.child.ChildObject;
import com.hellblazer.loftsmith.loft.mesh.MeshMerger;
import com.hellblazer.loftsmith.loft.mesh.MeshPart;
import com.hellblazer.loftsmith.loft.pipeline.MeshExporter;
import com.hellblazer.loftsmith.loft.pipeline.ModelAsset;
import com.hellblazer.loftsmith.loft.skin.Skeleton;
import com.hellblazer.loftsmith.loft.skin.SkinBinding;
import de.javagl.jgltf.impl.v2.Animation;
import de.javagl.jgltf.impl.v2.AnimationChannel;
import de.javagl.jgltf.impl.v2.AnimationChannelTarget;
import de.javagl.jgltf.impl.v2.AnimationSampler;
import de.javagl.jgltf.impl.v2.Asset;
import de.javagl.jgltf.impl.v2.GlTF;
import de.javagl.jgltf.impl.v2.Material;
import de.javagl.jgltf.impl.v2.MaterialPbrMetallicRoughness;
import de.javagl.jgltf.impl.v2.Mesh;
import de.javagl.jgltf.impl.v2.MeshPrimitive;
import de.javagl.jgltf.impl.v2.Node;
import de.javagl.jgltf.impl.v2.Scene;
import de.javagl.jgltf.impl.v2.Skin;
import de.javagl.jgltf.model.io.GltfAssetWriter;
import de.javagl.jgltf.model.io.v2.GltfAssetV2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link ModelAsset} as binary glTF 2.0.
 * <p>
 * The merged mesh becomes one primitive with POSITION, NORMAL, COLOR_0, TEXCOORD_0 and 32 bit indices, shaded by
 * a metallic-roughness material tinted by the vertex colors. Skinned assets add JOINTS_0 and WEIGHTS_0, a joint
 * node hierarchy mirroring the skeleton, a skin whose inverse bind matrices undo each joint's bind position, and
 * one linearly interpolated animation per clip. Rigid assets with children are wrapped in a group node holding the
 * mesh node and one node per child.
 *
 * @author hal.hildebrand
 */
public class GlbExporter implements MeshExporter {
    public static final String GENERATOR = "Loftsmith";

    private static final Logger log = LoggerFactory.getLogger(GlbExporter.class);

    private static final int TRIANGLES = 4;

    /**
     * Column-major 4x4 matrices translating by the negated bind position of each joint.
     */
    static float[] inverseBindMatrices(Skeleton skeleton) {
        var matrices = new float[skeleton.size() * 16];
        for (int j = 0; j < skeleton.size(); j++) {
            var bind = skeleton.getBindPosition(j);
            var m = j * 16;
            matrices[m] = 1;
            matrices[m + 5] = 1;
            matrices[m + 10] = 1;
            matrices[m + 12] = -bind.x;
            matrices[m + 13] = -bind.y;
            matrices[m + 14] = -bind.z;
            matrices[m + 15] = 1;
        }
        return matrices;
    }

    @Override
    public void export(ModelAsset asset, Path output) throws IOException {
        var gltf = new GlTF();
        var header = new Asset();
        header.setVersion("2.0");
        header.setGenerator(GENERATOR);
        gltf.setAsset(header);

        var buffers = new GlbBufferBuilder(gltf);
        var scene = new Scene();
        scene.setName(asset.name());

        var material = addMaterial(gltf, asset.name() + "_material", asset.roughness(), asset.metalness());
        var attributes = vertexAttributes(buffers, asset.mesh().getPositions(), asset.mesh().getNormals(),
                                          asset.mesh().getColors(), asset.mesh().getUvs());
        if (asset.isSkinned()) {
            addSkinAttributes(buffers, asset.skin(), attributes);
        }
        var mesh = addMesh(gltf, asset.name(),
                           List.of(primitive(attributes, buffers.addIndices(asset.mesh().getIndices()), material)));
        var meshNode = new Node();
        meshNode.setMesh(mesh);
        var meshNodeIndex = addNode(gltf, meshNode);

        if (asset.isSkinned()) {
            meshNode.setName("CharacterMesh");
            var rootJoint = addSkeleton(gltf, buffers, asset.skeleton());
            meshNode.setSkin(0);
            scene.addNodes(meshNodeIndex);
            scene.addNodes(rootJoint);
            var animated = 0;
            for (var clip : asset.clips().clips()) {
                if (addAnimation(gltf, buffers, clip, asset.skeleton(), rootJoint)) {
                    animated++;
                }
            }
            log.debug("Wrote {} joints and {} animations", asset.skeleton().size(), animated);
        } else if (!asset.children().isEmpty()) {
            meshNode.setName(asset.name() + "_mesh");
            var group = new Node();
            group.setName(asset.name());
            group.addChildren(meshNodeIndex);
            for (var child : asset.children()) {
                group.addChildren(addChild(gltf, buffers, child));
            }
            scene.addNodes(addNode(gltf, group));
        } else {
            meshNode.setName(asset.name());
            scene.addNodes(meshNodeIndex);
        }

        gltf.addScenes(scene);
        gltf.setScene(0);
        var binary = buffers.finish();
        log.debug("Binary chunk: {} bytes, {} accessors", binary.remaining(), gltf.getAccessors().size());

        try (var out = Files.newOutputStream(output)) {
            new GltfAssetWriter().writeBinary(new GltfAssetV2(gltf, binary), out);
        }
    }

    private boolean addAnimation(GlTF gltf, GlbBufferBuilder buffers, AnimationClip clip, Skeleton skeleton,
                                 int jointBase) {
        var animation = new Animation();
        animation.setName(clip.name());
        for (var track : clip.tracks()) {
            var bone = skeleton.indexOf(track.bone());
            if (bone < 0) {
                log.warn("Clip {} targets unknown bone {}, skipping track", clip.name(), track.bone());
                continue;
            }
            var rotation = track.kind() == AnimationTrack.Kind.ROTATION;
            var sampler = new AnimationSampler();
            sampler.setInput(buffers.addBoundedFloats(track.times(), "SCALAR", null));
            sampler.setOutput(buffers.addFloats(track.values(), rotation ? "VEC4" : "VEC3", null));
            sampler.setInterpolation("LINEAR");
            animation.addSamplers(sampler);

            var target = new AnimationChannelTarget();
            target.setNode(jointBase + bone);
            target.setPath(rotation ? "rotation" : "translation");
            var channel = new AnimationChannel();
            channel.setSampler(animation.getSamplers().size() - 1);
            channel.setTarget(target);
            animation.addChannels(channel);
        }
        if (animation.getChannels() == null || animation.getChannels().isEmpty()) {
            return false;
        }
        gltf.addAnimations(animation);
        return true;
    }

    private int addChild(GlTF gltf, GlbBufferBuilder buffers, ChildObject child) {
        var primitives = new ArrayList<MeshPrimitive>();
        var partIndex = 0;
        for (var part : child.parts()) {
            var mesh = part.mesh();
            var material = addMaterial(gltf, child.name() + "_" + partIndex++, part.roughness(), part.metalness());
            primitives.add(primitive(partAttributes(buffers, mesh), buffers.addIndices(mesh.getIndices()), material));
        }
        var node = new Node();
        node.setName(child.name());
        node.setMesh(addMesh(gltf, child.name(), primitives));
        var t = child.translation();
        node.setTranslation(new float[] { t.x, t.y, t.z });
        if (!child.rotation().isIdentity()) {
            node.setRotation(child.rotation().components());
        }
        return addNode(gltf, node);
    }

    private int addMaterial(GlTF gltf, String name, float roughness, float metalness) {
        var pbr = new MaterialPbrMetallicRoughness();
        pbr.setBaseColorFactor(new float[] { 1, 1, 1, 1 });
        pbr.setRoughnessFactor(roughness);
        pbr.setMetallicFactor(metalness);
        var material = new Material();
        material.setName(name);
        material.setPbrMetallicRoughness(pbr);
        gltf.addMaterials(material);
        return gltf.getMaterials().size() - 1;
    }

    private int addMesh(GlTF gltf, String name, List<MeshPrimitive> primitives) {
        var mesh = new Mesh();
        mesh.setName(name);
        mesh.setPrimitives(primitives);
        gltf.addMeshes(mesh);
        return gltf.getMeshes().size() - 1;
    }

    private int addNode(GlTF gltf, Node node) {
        gltf.addNodes(node);
        return gltf.getNodes().size() - 1;
    }

    /**
     * One node per bone, parented as in the skeleton, positioned by the bone's local offset.
     *
     * @return the node index of the first (root) joint
     */
    private int addSkeleton(GlTF gltf, GlbBufferBuilder buffers, Skeleton skeleton) {
        var base = gltf.getNodes().size();
        var joints = new ArrayList<Integer>();
        for (var bone : skeleton.bones()) {
            var node = new Node();
            node.setName(bone.name());
            node.setTranslation(new float[] { bone.offsetX(), bone.offsetY(), bone.offsetZ() });
            joints.add(addNode(gltf, node));
        }
        for (int i = 0; i < skeleton.size(); i++) {
            var parent = skeleton.bone(i).parentIndex();
            if (parent >= 0) {
                gltf.getNodes().get(base + parent).addChildren(base + i);
            }
        }
        var skin = new Skin();
        skin.setName("Armature");
        skin.setJoints(joints);
        skin.setSkeleton(base);
        skin.setInverseBindMatrices(buffers.addFloats(inverseBindMatrices(skeleton), "MAT4", null));
        gltf.addSkins(skin);
        return base;
    }

    private void addSkinAttributes(GlbBufferBuilder buffers, SkinBinding[] skin, Map<String, Integer> attributes) {
        var joints = new int[skin.length * 4];
        var weights = new float[skin.length * 4];
        for (int v = 0; v < skin.length; v++) {
            var binding = skin[v];
            joints[v * 4] = binding.bone1();
            weights[v * 4] = binding.weight1();
            if (binding.influenceCount() == 2) {
                joints[v * 4 + 1] = binding.bone2();
                weights[v * 4 + 1] = binding.weight2();
            }
        }
        attributes.put("JOINTS_0", buffers.addUnsignedShorts(joints, "VEC4", GlbBufferBuilder.ARRAY_BUFFER));
        attributes.put("WEIGHTS_0", buffers.addFloats(weights, "VEC4", GlbBufferBuilder.ARRAY_BUFFER));
    }

    private Map<String, Integer> partAttributes(GlbBufferBuilder buffers, MeshPart part) {
        var positions = part.getPositions();
        var colors = part.hasColors() ? part.getColors() : new float[positions.length];
        var uvs = part.hasUvs() ? part.getUvs() : new float[part.getVertexCount() * 2];
        return vertexAttributes(buffers, positions, MeshMerger.computeNormals(positions, part.getIndices()), colors,
                                uvs);
    }

    private MeshPrimitive primitive(Map<String, Integer> attributes, int indices, int material) {
        var primitive = new MeshPrimitive();
        primitive.setAttributes(attributes);
        primitive.setIndices(indices);
        primitive.setMaterial(material);
        primitive.setMode(TRIANGLES);
        return primitive;
    }

    private Map<String, Integer> vertexAttributes(GlbBufferBuilder buffers, float[] positions, float[] normals,
                                                  float[] colors, float[] uvs) {
        var attributes = new LinkedHashMap<String, Integer>();
        attributes.put("POSITION", buffers.addBoundedFloats(positions, "VEC3", GlbBufferBuilder.ARRAY_BUFFER));
        attributes.put("NORMAL", buffers.addFloats(normals, "VEC3", GlbBufferBuilder.ARRAY_BUFFER));
        attributes.put("COLOR_0", buffers.addFloats(colors, "VEC3", GlbBufferBuilder.ARRAY_BUFFER));
        attributes.put("TEXCOORD_0", buffers.addFloats(uvs, "VEC2", GlbBufferBuilder.ARRAY_BUFFER));
        return attributes;
    }
}
