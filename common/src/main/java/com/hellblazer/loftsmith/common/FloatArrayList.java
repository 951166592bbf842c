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

package com.hellblazer.loftsmith.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Growable float buffer for interleaved-free vertex attributes (positions, colors, uvs). Mirrors
 * {@link IntArrayList}.
 *
 * @author hal.hildebrand
 */
public final class FloatArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 16;

    private float[] array;
    private int     size;

    public FloatArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public FloatArrayList(int capacity) {
        array = new float[Math.max(1, capacity)];
    }

    public void add(float element) {
        ensureCapacity(size + 1);
        array[size++] = element;
    }

    public void add(float x, float y) {
        ensureCapacity(size + 2);
        array[size++] = x;
        array[size++] = y;
    }

    public void add(float x, float y, float z) {
        ensureCapacity(size + 3);
        array[size++] = x;
        array[size++] = y;
        array[size++] = z;
    }

    public void addAll(float[] values) {
        ensureCapacity(size + values.length);
        System.arraycopy(values, 0, array, size, values.length);
        size += values.length;
    }

    /**
     * Append {@code count} zeros. Fills the span of an attribute a mesh part does not carry.
     */
    public void addZeros(int count) {
        if (count <= 0) {
            return;
        }
        ensureCapacity(size + count);
        Arrays.fill(array, size, size + count, 0.0f);
        size += count;
    }

    public float get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index:" + index + ", Size:" + size);
        }
        return array[index];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    public float[] toArray() {
        return Arrays.copyOf(array, size);
    }

    private void ensureCapacity(int required) {
        if (required <= array.length) {
            return;
        }
        int length = Math.max(required, ((array.length * 3) / 2) + 1);
        array = Arrays.copyOf(array, length);
    }
}
