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

package com.hellblazer.loftsmith.loft.skin;

import com.hellblazer.loftsmith.loft.mesh.MergedMesh;

import javax.vecmath.Point3f;

/**
 * Distance-based skin weights: each vertex follows its nearest bone, blending with the second nearest only when
 * it sits close to a joint.
 *
 * @author hal.hildebrand
 */
public final class SkinWeightAssigner {

    public static final float DEFAULT_JOINT_THRESHOLD = 0.15f;

    private final Point3f[] bonePositions;
    private final float     jointThreshold;

    public SkinWeightAssigner(Skeleton skeleton) {
        this(skeleton.getBindPositions(), DEFAULT_JOINT_THRESHOLD);
    }

    public SkinWeightAssigner(Point3f[] bonePositions, float jointThreshold) {
        if (bonePositions.length == 0) {
            throw new IllegalArgumentException("No bones to bind to");
        }
        this.bonePositions = bonePositions;
        this.jointThreshold = jointThreshold;
    }

    public SkinBinding[] assign(MergedMesh mesh) {
        var bindings = new SkinBinding[mesh.getVertexCount()];
        for (int v = 0; v < bindings.length; v++) {
            bindings[v] = bind(mesh.getPosition(v));
        }
        return bindings;
    }

    public SkinBinding bind(Point3f vertex) {
        var d1 = Float.POSITIVE_INFINITY;
        var d2 = Float.POSITIVE_INFINITY;
        int bone1 = 0, bone2 = 0;
        for (int b = 0; b < bonePositions.length; b++) {
            var d = vertex.distance(bonePositions[b]);
            if (d < d1) {
                d2 = d1;
                bone2 = bone1;
                d1 = d;
                bone1 = b;
            } else if (d < d2) {
                d2 = d;
                bone2 = b;
            }
        }
        var total = d1 + d2;
        if (d1 < jointThreshold && d2 < 2 * jointThreshold && bone1 != bone2 && total > 0) {
            var w1 = 1 - d1 / total;
            var w2 = 1 - d2 / total;
            var norm = w1 + w2;
            return new SkinBinding(bone1, w1 / norm, bone2, w2 / norm);
        }
        return SkinBinding.single(bone1);
    }
}
