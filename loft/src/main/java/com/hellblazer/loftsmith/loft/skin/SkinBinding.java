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

/**
 * Up to two bone influences for one vertex. A single influence has {@code bone2 == -1} and {@code weight2 == 0}.
 *
 * @author hal.hildebrand
 */
public record SkinBinding(int bone1, float weight1, int bone2, float weight2) {

    public static SkinBinding single(int bone) {
        return new SkinBinding(bone, 1.0f, -1, 0.0f);
    }

    public int influenceCount() {
        return bone2 < 0 ? 1 : 2;
    }
}
