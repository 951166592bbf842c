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

import de.javagl.jgltf.impl.v2.Accessor;
import de.javagl.jgltf.impl.v2.Buffer;
import de.javagl.jgltf.impl.v2.BufferView;
import de.javagl.jgltf.impl.v2.GlTF;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs attribute data into the single binary buffer of a GLB, adding one buffer view and one accessor per array.
 * Every view starts on a 4 byte boundary.
 *
 * @author hal.hildebrand
 */
class GlbBufferBuilder {
    static final int ARRAY_BUFFER         = 34962;
    static final int ELEMENT_ARRAY_BUFFER = 34963;
    static final int FLOAT                = 5126;
    static final int UNSIGNED_INT         = 5125;
    static final int UNSIGNED_SHORT       = 5123;

    private final GlTF                  gltf;
    private final ByteArrayOutputStream data = new ByteArrayOutputStream();

    GlbBufferBuilder(GlTF gltf) {
        this.gltf = gltf;
    }

    static int components(String type) {
        return switch (type) {
            case "SCALAR" -> 1;
            case "VEC2" -> 2;
            case "VEC3" -> 3;
            case "VEC4" -> 4;
            case "MAT4" -> 16;
            default -> throw new IllegalArgumentException("Unsupported accessor type: " + type);
        };
    }

    /**
     * Float data with per-component bounds, as position and animation input accessors require.
     */
    int addBoundedFloats(float[] values, String type, Integer target) {
        var width = components(type);
        var min = new Number[width];
        var max = new Number[width];
        for (int c = 0; c < width; c++) {
            var lo = Float.POSITIVE_INFINITY;
            var hi = Float.NEGATIVE_INFINITY;
            for (int i = c; i < values.length; i += width) {
                lo = Math.min(lo, values[i]);
                hi = Math.max(hi, values[i]);
            }
            min[c] = lo;
            max[c] = hi;
        }
        var accessor = addFloats(values, type, target);
        gltf.getAccessors().get(accessor).setMin(min);
        gltf.getAccessors().get(accessor).setMax(max);
        return accessor;
    }

    int addFloats(float[] values, String type, Integer target) {
        var bytes = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        bytes.asFloatBuffer().put(values);
        var view = addView(bytes.array(), target);
        return addAccessor(view, FLOAT, values.length / components(type), type);
    }

    int addIndices(int[] indices) {
        var bytes = ByteBuffer.allocate(indices.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        bytes.asIntBuffer().put(indices);
        var view = addView(bytes.array(), ELEMENT_ARRAY_BUFFER);
        return addAccessor(view, UNSIGNED_INT, indices.length, "SCALAR");
    }

    int addUnsignedShorts(int[] values, String type, Integer target) {
        var bytes = ByteBuffer.allocate(values.length * Short.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (var value : values) {
            if (value < 0 || value > 0xffff) {
                throw new IllegalArgumentException("Value out of unsigned short range: " + value);
            }
            bytes.putShort((short) value);
        }
        var view = addView(bytes.array(), target);
        return addAccessor(view, UNSIGNED_SHORT, values.length / components(type), type);
    }

    /**
     * Declare the buffer and hand back its content.
     */
    ByteBuffer finish() {
        var bytes = data.toByteArray();
        var buffer = new Buffer();
        buffer.setByteLength(bytes.length);
        gltf.addBuffers(buffer);
        return ByteBuffer.wrap(bytes);
    }

    int size() {
        return data.size();
    }

    private int addAccessor(int view, int componentType, int count, String type) {
        var accessor = new Accessor();
        accessor.setBufferView(view);
        accessor.setComponentType(componentType);
        accessor.setCount(count);
        accessor.setType(type);
        gltf.addAccessors(accessor);
        return gltf.getAccessors().size() - 1;
    }

    private int addView(byte[] bytes, Integer target) {
        var view = new BufferView();
        view.setBuffer(0);
        view.setByteOffset(data.size());
        view.setByteLength(bytes.length);
        if (target != null) {
            view.setTarget(target);
        }
        data.writeBytes(bytes);
        while (data.size() % 4 != 0) {
            data.write(0);
        }
        gltf.addBufferViews(view);
        return gltf.getBufferViews().size() - 1;
    }
}
