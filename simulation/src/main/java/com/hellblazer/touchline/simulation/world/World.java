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
package com.hellblazer.touchline.simulation.world;

import com.hellblazer.touchline.simulation.entity.MovingEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The static colliders and the moving agents that steering behaviors query: walls, obstacles and neighbors.
 *
 * @author hal.hildebrand
 */
public class World {
    private final List<Wall>         walls     = new ArrayList<>();
    private final List<Obstacle>     obstacles = new ArrayList<>();
    private final List<MovingEntity> agents    = new ArrayList<>();

    public void addAgent(MovingEntity agent) {
        agents.add(agent);
    }

    public void addObstacle(Obstacle obstacle) {
        obstacles.add(obstacle);
    }

    public void addWall(Wall wall) {
        walls.add(wall);
    }

    /**
     * The agents other than the given one within the view distance
     *
     * @param agent        the agent looking around
     * @param viewDistance radius of the neighborhood
     * @return the neighbors, in insertion order
     */
    public List<MovingEntity> calculateNeighbors(MovingEntity agent, float viewDistance) {
        var neighbors = new ArrayList<MovingEntity>();
        var position = agent.getPosition();
        var limit = viewDistance * viewDistance;
        for (var other : agents) {
            if (other != agent && other.getPosition().distanceSquared(position) < limit) {
                neighbors.add(other);
            }
        }
        return neighbors;
    }

    public List<MovingEntity> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public List<Obstacle> getObstacles() {
        return Collections.unmodifiableList(obstacles);
    }

    public List<Wall> getWalls() {
        return Collections.unmodifiableList(walls);
    }

    public boolean removeAgent(MovingEntity agent) {
        return agents.remove(agent);
    }
}
