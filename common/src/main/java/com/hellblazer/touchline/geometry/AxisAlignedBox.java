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

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * Axis aligned box given by its minimum and maximum corners
 *
 * @author hal.hildebrand
 */
public record AxisAlignedBox(Point3f min, Point3f max) {

    public AxisAlignedBox {
        if (min.x > max.x || min.y > max.y || min.z > max.z) {
            throw new IllegalArgumentException("Box minimum " + min + " exceeds maximum " + max);
        }
        min = new Point3f(min);
        max = new Point3f(max);
    }

    /**
     * Box centered on a point with the given half extents
     */
    public static AxisAlignedBox centeredAt(Point3f center, Vector3f halfExtents) {
        var min = new Point3f(center);
        min.sub(halfExtents);
        var max = new Point3f(center);
        max.add(halfExtents);
        return new AxisAlignedBox(min, max);
    }

    public Point3f getCenter() {
        var center = new Point3f();
        center.interpolate(min, max, 0.5f);
        return center;
    }

    public Vector3f getHalfExtents() {
        var half = new Vector3f();
        half.sub(max, min);
        half.scale(0.5f);
        return half;
    }

    public boolean contains(Point3f point) {
        return point.x >= min.x && point.x <= max.x && point.y >= min.y && point.y <= max.y && point.z >= min.z
        && point.z <= max.z;
    }
}
