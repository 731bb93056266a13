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
package com.hellblazer.touchline.simulation.soccer;

import javax.vecmath.Point3f;
import java.util.random.RandomGenerator;

/**
 * Axis aligned rectangle of the pitch in the x-z plane. Top and bottom bound z, left and right bound x.
 *
 * @author hal.hildebrand
 */
public class Region {
    private final int     id;
    private final float   top;
    private final float   right;
    private final float   left;
    private final float   bottom;
    private final float   width;
    private final float   height;
    private final float   length;
    private final float   breadth;
    private final Point3f center;

    public Region(float top, float right, float left, float bottom, int id) {
        this.top = top;
        this.right = right;
        this.left = left;
        this.bottom = bottom;
        this.id = id;
        width = Math.abs(right - left);
        height = Math.abs(top - bottom);
        center = new Point3f((right + left) * 0.5f, 0, (top + bottom) * 0.5f);
        length = Math.max(width, height);
        breadth = Math.min(width, height);
    }

    public float getBottom() {
        return bottom;
    }

    public float getBreadth() {
        return breadth;
    }

    public Point3f getCenter() {
        return new Point3f(center);
    }

    public float getHeight() {
        return height;
    }

    public int getId() {
        return id;
    }

    public float getLeft() {
        return left;
    }

    public float getLength() {
        return length;
    }

    /**
     * @return a uniformly distributed position inside the region
     */
    public Point3f getRandomPosition(RandomGenerator random) {
        return new Point3f(between(random, left, right), 0, between(random, bottom, top));
    }

    public float getRight() {
        return right;
    }

    public float getTop() {
        return top;
    }

    public float getWidth() {
        return width;
    }

    public boolean isInside(Point3f position) {
        return isInside(position, false);
    }

    /**
     * Strict containment test. The half size variant shrinks the region by a quarter of its width and height on every
     * side, so it only accepts positions in the central half.
     */
    public boolean isInside(Point3f position, boolean halfSize) {
        var marginX = halfSize ? width * 0.25f : 0;
        var marginZ = halfSize ? height * 0.25f : 0;
        return position.x > left + marginX && position.x < right - marginX && position.z > bottom + marginZ
        && position.z < top - marginZ;
    }

    @Override
    public String toString() {
        return String.format("Region[%d]{left=%.1f, right=%.1f, bottom=%.1f, top=%.1f}", id, left, right, bottom,
                             top);
    }

    private static float between(RandomGenerator random, float a, float b) {
        var low = Math.min(a, b);
        var high = Math.max(a, b);
        return low == high ? low : random.nextFloat(low, high);
    }
}
