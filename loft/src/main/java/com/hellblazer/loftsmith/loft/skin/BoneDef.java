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
 * One bone of a rig: its parent (-1 for the root) and its offset from the parent in the bind pose.
 *
 * @author hal.hildebrand
 */
public record BoneDef(String name, int parentIndex, float offsetX, float offsetY, float offsetZ) {

    public boolean isRoot() {
        return parentIndex < 0;
    }
}
