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
import javax.vecmath.Vector3f;

/**
 * A goal on one of the short sides of the pitch. The posts lie on the goal line, the front face of the goal box,
 * and a goal counts when the ball crosses the line between two ticks.
 *
 * @author hal.hildebrand
 */
public class Goal {
    private final Point3f  position;
    private final Vector3f size;
    private final Vector3f facing;
    private final Point3f  leftPost  = new Point3f();
    private final Point3f  rightPost = new Point3f();
    private final Point3f  center    = new Point3f();
    private       int      goalsScored;

    /**
     * @param position center of the goal box
     * @param size     extents of the goal box; z is the width of the mouth
     * @param facing   direction the goal mouth opens towards
     */
    public Goal(Point3f position, Vector3f size, Vector3f facing) {
        if (facing.x == 0) {
            throw new IllegalArgumentException("A goal must face along the x axis: " + facing);
        }
        this.position = new Point3f(position);
        this.size = new Vector3f(size);
        this.facing = new Vector3f(facing);

        var lineX = facing.x > 0 ? position.x + size.x * 0.5f : position.x - size.x * 0.5f;
        leftPost.set(lineX, 0, position.z - size.z * 0.5f);
        rightPost.set(lineX, 0, position.z + size.z * 0.5f);
        center.interpolate(leftPost, rightPost, 0.5f);
    }

    public Point3f getCenter() {
        return new Point3f(center);
    }

    public Vector3f getFacing() {
        return new Vector3f(facing);
    }

    public int getGoalsScored() {
        return goalsScored;
    }

    public Point3f getLeftPost() {
        return new Point3f(leftPost);
    }

    public Point3f getPosition() {
        return new Point3f(position);
    }

    public Point3f getRightPost() {
        return new Point3f(rightPost);
    }

    public Vector3f getSize() {
        return new Vector3f(size);
    }

    public float getWidth() {
        return size.z;
    }

    /**
     * Test whether the ball crossed the goal line since its last update. A crossing increments the goal count.
     */
    public boolean isScored(Ball ball) {
        var current = ball.getPosition();
        var previous = ball.getPreviousPosition();
        boolean scored;
        if (facing.x > 0) {
            scored = current.x < center.x && previous.x > center.x;
        } else {
            scored = current.x > center.x && previous.x < center.x;
        }
        if (scored) {
            goalsScored++;
        }
        return scored;
    }

    public void resetGoalsScored() {
        goalsScored = 0;
    }

    @Override
    public String toString() {
        return String.format("Goal{center=%s, facing=%s, scored=%d}", center, facing, goalsScored);
    }
}
