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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable weights and distances of the steering behaviors. Immutable; use the {@code with} methods to derive
 * variations.
 *
 * @param weights                   force multiplier per behavior
 * @param distanceFromBoundary      distance a hiding spot keeps from its obstacle
 * @param deceleration              rate used by arrive when a behavior does not impose its own
 * @param panicDistance             flee and evade ignore threats further away than this
 * @param waypointSeekDistance      distance at which path following moves to the next waypoint
 * @param wallDetectionFeelerLength length of the forward wall feeler; the side feelers are half as long
 * @param wanderRadius              radius of the wander circle
 * @param wanderDistance            distance the wander circle is projected ahead of the agent
 * @param wanderJitter              maximum random displacement of the wander target per second
 * @param viewDistance              radius of the neighborhood used by the group behaviors
 * @author hal.hildebrand
 */
public record SteeringParameters(Map<BehaviorKind, Float> weights, float distanceFromBoundary, float deceleration,
                                 float panicDistance, float waypointSeekDistance, float wallDetectionFeelerLength,
                                 float wanderRadius, float wanderDistance, float wanderJitter, float viewDistance) {

    public static final float DEFAULT_DISTANCE_FROM_BOUNDARY       = 10;
    public static final float DEFAULT_DECELERATION                 = 1;
    public static final float DEFAULT_PANIC_DISTANCE               = 50;
    public static final float DEFAULT_WAYPOINT_SEEK_DISTANCE       = 5;
    public static final float DEFAULT_WALL_DETECTION_FEELER_LENGTH = 20;
    public static final float DEFAULT_WANDER_RADIUS                = 5;
    public static final float DEFAULT_WANDER_DISTANCE              = 10;
    public static final float DEFAULT_WANDER_JITTER                = 80;
    public static final float DEFAULT_VIEW_DISTANCE                = 200;

    public SteeringParameters {
        var copy = new EnumMap<BehaviorKind, Float>(BehaviorKind.class);
        for (var kind : BehaviorKind.values()) {
            copy.put(kind, weights.getOrDefault(kind, kind.defaultWeight()));
        }
        weights = Collections.unmodifiableMap(copy);
        if (deceleration <= 0) {
            throw new IllegalArgumentException("deceleration must be positive: " + deceleration);
        }
        if (panicDistance < 0 || viewDistance < 0 || waypointSeekDistance < 0) {
            throw new IllegalArgumentException("distances cannot be negative");
        }
        if (wallDetectionFeelerLength <= 0) {
            throw new IllegalArgumentException(
            "wallDetectionFeelerLength must be positive: " + wallDetectionFeelerLength);
        }
    }

    public static SteeringParameters defaultConfig() {
        return new SteeringParameters(Map.of(), DEFAULT_DISTANCE_FROM_BOUNDARY, DEFAULT_DECELERATION,
                                      DEFAULT_PANIC_DISTANCE, DEFAULT_WAYPOINT_SEEK_DISTANCE,
                                      DEFAULT_WALL_DETECTION_FEELER_LENGTH, DEFAULT_WANDER_RADIUS,
                                      DEFAULT_WANDER_DISTANCE, DEFAULT_WANDER_JITTER, DEFAULT_VIEW_DISTANCE);
    }

    public float weight(BehaviorKind kind) {
        return weights.get(kind);
    }

    public SteeringParameters withWeight(BehaviorKind kind, float weight) {
        var copy = new EnumMap<>(weights);
        copy.put(kind, weight);
        return new SteeringParameters(copy, distanceFromBoundary, deceleration, panicDistance, waypointSeekDistance,
                                      wallDetectionFeelerLength, wanderRadius, wanderDistance, wanderJitter,
                                      viewDistance);
    }

    public SteeringParameters withPanicDistance(float panicDistance) {
        return new SteeringParameters(weights, distanceFromBoundary, deceleration, panicDistance, waypointSeekDistance,
                                      wallDetectionFeelerLength, wanderRadius, wanderDistance, wanderJitter,
                                      viewDistance);
    }

    public SteeringParameters withViewDistance(float viewDistance) {
        return new SteeringParameters(weights, distanceFromBoundary, deceleration, panicDistance, waypointSeekDistance,
                                      wallDetectionFeelerLength, wanderRadius, wanderDistance, wanderJitter,
                                      viewDistance);
    }
}
