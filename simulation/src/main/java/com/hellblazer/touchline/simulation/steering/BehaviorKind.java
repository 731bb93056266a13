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
package com.hellblazer.touchline.simulation.steering;

/**
 * The steering behaviors, declared in the order prioritized summation evaluates them
 *
 * @author hal.hildebrand
 */
public enum BehaviorKind {
    WALL_AVOIDANCE(10),
    OBSTACLE_AVOIDANCE(10),
    EVADE(1),
    SEPARATION(1),
    ALIGNMENT(1),
    COHESION(4),
    FLEE(1),
    SEEK(1),
    ARRIVE(1),
    WANDER(1),
    PURSUIT(1),
    OFFSET_PURSUIT(1),
    INTERPOSE(1),
    HIDE(1),
    FOLLOW_PATH(1);

    private final float defaultWeight;

    BehaviorKind(float defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public float defaultWeight() {
        return defaultWeight;
    }

    /**
     * @return true for the behaviors that need the neighborhood of the agent
     */
    public boolean isGroupBehavior() {
        return this == SEPARATION || this == ALIGNMENT || this == COHESION;
    }
}
