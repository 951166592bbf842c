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

import com.hellblazer.loftsmith.loft.anim.ClipTable;
import com.hellblazer.loftsmith.loft.child.ChildObject;
import com.hellblazer.loftsmith.loft.mesh.MergedMesh;
import com.hellblazer.loftsmith.loft.skin.Skeleton;
import com.hellblazer.loftsmith.loft.skin.SkinBinding;

import java.util.List;

/**
 * Everything handed to a {@link MeshExporter}. A skinned asset carries a skeleton, one binding per vertex and its
 * clips, and no children; a rigid asset carries only the mesh and its children.
 *
 * @author hal.hildebrand
 */
public record ModelAsset(String name, MergedMesh mesh, Skeleton skeleton, SkinBinding[] skin, ClipTable clips,
                         List<ChildObject> children, float roughness, float metalness) {

    public ModelAsset {
        children = List.copyOf(children);
        if (skeleton != null && (skin == null || skin.length != mesh.getVertexCount())) {
            throw new IllegalArgumentException("A skinned asset needs one binding per vertex");
        }
    }

    public static ModelAsset rigid(String name, MergedMesh mesh, List<ChildObject> children, float roughness,
                                   float metalness) {
        return new ModelAsset(name, mesh, null, null, null, children, roughness, metalness);
    }

    public static ModelAsset skinned(String name, MergedMesh mesh, Skeleton skeleton, SkinBinding[] skin,
                                     ClipTable clips, float roughness, float metalness) {
        return new ModelAsset(name, mesh, skeleton, skin, clips, List.of(), roughness, metalness);
    }

    public boolean isSkinned() {
        return skeleton != null;
    }
}
