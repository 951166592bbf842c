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

package com.hellblazer.loftsmith.geometry;

import javax.vecmath.Matrix3f;
import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;

/**
 * Euler angles in radians applied in X, Y, Z order: the rotation matrix is {@code Rx * Ry * Rz}, so a point is
 * rotated about Z first, then Y, then X.
 *
 * @author hal.hildebrand
 */
public record EulerRotation(float x, float y, float z) {

    public static final EulerRotation IDENTITY = new EulerRotation(0, 0, 0);

    /**
     * @param angles {x, y, z} in radians, or null for the identity
     */
    public static EulerRotation of(float[] angles) {
        if (angles == null || angles.length < 3) {
            return IDENTITY;
        }
        return new EulerRotation(angles[0], angles[1], angles[2]);
    }

    public boolean isIdentity() {
        return x == 0.0f && y == 0.0f && z == 0.0f;
    }

    public Matrix3f matrix() {
        var m = new Matrix3f();
        m.rotX(x);
        var ry = new Matrix3f();
        ry.rotY(y);
        var rz = new Matrix3f();
        rz.rotZ(z);
        m.mul(ry);
        m.mul(rz);
        return m;
    }

    public Quat4f quaternion() {
        var q = components();
        return new Quat4f(q[0], q[1], q[2], q[3]);
    }

    /**
     * @return the unit quaternion as {x, y, z, w}
     */
    public float[] components() {
        double c1 = Math.cos(x / 2.0), c2 = Math.cos(y / 2.0), c3 = Math.cos(z / 2.0);
        double s1 = Math.sin(x / 2.0), s2 = Math.sin(y / 2.0), s3 = Math.sin(z / 2.0);
        return new float[] { (float) (s1 * c2 * c3 + c1 * s2 * s3), (float) (c1 * s2 * c3 - s1 * c2 * s3),
                             (float) (c1 * c2 * s3 + s1 * s2 * c3), (float) (c1 * c2 * c3 - s1 * s2 * s3) };
    }

    /**
     * Rotate {@code p} in place.
     */
    public void transform(Point3f p) {
        if (!isIdentity()) {
            matrix().transform(p);
        }
    }
}
