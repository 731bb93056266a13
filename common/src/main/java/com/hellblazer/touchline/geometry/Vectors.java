/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.touchline.geometry;

import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Vector helpers that tolerate the degenerate zero vector
 *
 * @author hal.hildebrand
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * The vector from one point to another
     */
    public static Vector3f between(Tuple3f from, Tuple3f to) {
        return new Vector3f(to.x - from.x, to.y - from.y, to.z - from.z);
    }

    /**
     * A unit copy of the vector, or the zero vector when the input has no length
     */
    public static Vector3f normalized(Tuple3f v) {
        var result = new Vector3f(v);
        var lengthSq = result.lengthSquared();
        if (lengthSq == 0) {
            return result;
        }
        result.scale((float) (1.0 / Math.sqrt(lengthSq)));
        return result;
    }

    /**
     * Scale the vector in place so its length does not exceed the limit
     */
    public static Vector3f truncate(Vector3f v, float maxLength) {
        var lengthSq = v.lengthSquared();
        if (lengthSq > maxLength * maxLength) {
            v.scale((float) (maxLength / Math.sqrt(lengthSq)));
        }
        return v;
    }
}
