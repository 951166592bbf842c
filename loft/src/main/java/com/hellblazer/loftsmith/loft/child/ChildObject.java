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

package com.hellblazer.loftsmith.loft.child;

import com.hellblazer.loftsmith.geometry.EulerRotation;

import javax.vecmath.Vector3f;
import java.util.List;

/**
 * A named rigid attachment: parts in local space, placed by its own rotation and translation.
 *
 * @author hal.hildebrand
 */
public record ChildObject(String name, Vector3f translation, EulerRotation rotation, List<ChildPart> parts) {

    public ChildObject {
        translation = new Vector3f(translation);
        parts = List.copyOf(parts);
    }

    @Override
    public Vector3f translation() {
        return new Vector3f(translation);
    }
}
