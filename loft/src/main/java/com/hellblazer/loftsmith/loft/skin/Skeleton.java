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

import javax.vecmath.Point3f;
import java.util.List;

/**
 * An ordered bone table with bind-pose world positions accumulated through each bone's parent chain. Parents must
 * precede their children.
 *
 * @author hal.hildebrand
 */
public final class Skeleton {

    private final List<BoneDef> bones;
    private final Point3f[]     bindWorld;

    public Skeleton(List<BoneDef> bones) {
        this.bones = List.copyOf(bones);
        this.bindWorld = new Point3f[this.bones.size()];
        for (int i = 0; i < this.bones.size(); i++) {
            var bone = this.bones.get(i);
            if (bone.parentIndex() >= i) {
                throw new IllegalArgumentException(
                "Bone " + bone.name() + " at " + i + " references parent " + bone.parentIndex() + " out of order");
            }
            var world = new Point3f(bone.offsetX(), bone.offsetY(), bone.offsetZ());
            if (!bone.isRoot()) {
                world.add(bindWorld[bone.parentIndex()]);
            }
            bindWorld[i] = world;
        }
    }

    public BoneDef bone(int index) {
        return bones.get(index);
    }

    public List<BoneDef> bones() {
        return bones;
    }

    public Point3f getBindPosition(int index) {
        return new Point3f(bindWorld[index]);
    }

    public Point3f[] getBindPositions() {
        var copy = new Point3f[bindWorld.length];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = new Point3f(bindWorld[i]);
        }
        return copy;
    }

    /**
     * @return the index of the named bone, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < bones.size(); i++) {
            if (bones.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return bones.size();
    }
}
