// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.hellblazer.loftsmith.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Chopped down implementation specialized for triangle index buffers. Append-only apart from
 * {@link #setInt(int, int)}.
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 10;

    /** The backing store for the list. */
    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int capacity) {
        array = new int[Math.max(1, capacity)];
        size = 0;
    }

    public void addInt(int element) {
        ensureCapacity(size + 1);
        array[size++] = element;
    }

    /**
     * Append three indices forming one triangle.
     */
    public void addTriangle(int a, int b, int c) {
        ensureCapacity(size + 3);
        array[size++] = a;
        array[size++] = b;
        array[size++] = c;
    }

    /**
     * Append every element of {@code values}, adding {@code offset} to each one. Used to rebase the indices of a
     * mesh part onto the running vertex count of a merged buffer.
     */
    public void addAll(int[] values, int offset) {
        if (values.length == 0) {
            return;
        }
        int overflow = Integer.MAX_VALUE - size;
        if (overflow < values.length) {
            // We can't actually represent a list this large.
            throw new OutOfMemoryError();
        }
        ensureCapacity(size + values.length);
        for (int i = 0; i < values.length; i++) {
            array[size++] = values[i] + offset;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final IntArrayList other)) {
            return false;
        }
        if (size != other.size) {
            return false;
        }

        final int[] arr = other.array;
        for (int i = 0; i < size; i++) {
            if (array[i] != arr[i]) {
                return false;
            }
        }

        return true;
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int setInt(int index, int element) {
        ensureIndexInRange(index);
        int previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    private void ensureCapacity(int required) {
        if (required <= array.length) {
            return;
        }
        // Resize to 1.5x the size
        int length = Math.max(required, ((array.length * 3) / 2) + 1);
        array = Arrays.copyOf(array, length);
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(makeOutOfBoundsExceptionMessage(index));
        }
    }

    private String makeOutOfBoundsExceptionMessage(int index) {
        return "Index:" + index + ", Size:" + size;
    }
}
