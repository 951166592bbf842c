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

import java.util.List;

/**
 * The fixed 16-bone humanoid rig. Root sits at hip height; legs hang from the root and arms from the chest.
 *
 * @author hal.hildebrand
 */
public final class HumanoidRig {

    public static final List<BoneDef> BONES = List.of(new BoneDef("Root", -1, 0, 0.95f, 0),
                                                      new BoneDef("Spine", 0, 0, 0.2f, 0),
                                                      new BoneDef("Chest", 1, 0, 0.2f, 0),
                                                      new BoneDef("Head", 2, 0, 0.3f, 0),
                                                      new BoneDef("L_Shoulder", 2, -0.38f, 0, 0),
                                                      new BoneDef("L_Elbow", 4, 0, -0.3f, 0),
                                                      new BoneDef("L_Hand", 5, 0, -0.3f, 0),
                                                      new BoneDef("R_Shoulder", 2, 0.38f, 0, 0),
                                                      new BoneDef("R_Elbow", 7, 0, -0.3f, 0),
                                                      new BoneDef("R_Hand", 8, 0, -0.3f, 0),
                                                      new BoneDef("L_Hip", 0, -0.12f, 0, 0),
                                                      new BoneDef("L_Knee", 10, 0, -0.4f, 0),
                                                      new BoneDef("L_Foot", 11, 0, -0.4f, 0),
                                                      new BoneDef("R_Hip", 0, 0.12f, 0, 0),
                                                      new BoneDef("R_Knee", 13, 0, -0.4f, 0),
                                                      new BoneDef("R_Foot", 14, 0, -0.4f, 0));

    private static final Skeleton SKELETON = new Skeleton(BONES);

    private HumanoidRig() {
    }

    public static Skeleton skeleton() {
        return SKELETON;
    }
}
