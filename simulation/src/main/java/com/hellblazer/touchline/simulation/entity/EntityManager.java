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
package com.hellblazer.touchline.simulation.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of the entities in a simulation. Hands out sequential ids and updates entities in insertion order.
 *
 * @author hal.hildebrand
 */
public class EntityManager {
    private static final Logger log = LoggerFactory.getLogger(EntityManager.class);

    private final Map<Integer, GameEntity> entities = new LinkedHashMap<>();
    private final AtomicInteger            counter;

    public EntityManager() {
        this(0);
    }

    public EntityManager(int firstId) {
        counter = new AtomicInteger(firstId);
    }

    /**
     * Register an entity
     *
     * @throws IllegalArgumentException if another entity already uses the id
     */
    public <T extends GameEntity> T add(T entity) {
        var previous = entities.putIfAbsent(entity.getId(), entity);
        if (previous != null && previous != entity) {
            throw new IllegalArgumentException("Duplicate entity id " + entity.getId() + ": " + previous);
        }
        log.trace("Added {}", entity);
        return entity;
    }

    public Collection<GameEntity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * @throws NoSuchElementException if no entity has the id
     */
    public GameEntity getEntity(int id) {
        var entity = entities.get(id);
        if (entity == null) {
            throw new NoSuchElementException("No entity with id " + id);
        }
        return entity;
    }

    /**
     * Reserve the next free id
     */
    public int nextId() {
        return counter.getAndIncrement();
    }

    public boolean remove(GameEntity entity) {
        return entities.remove(entity.getId(), entity);
    }

    public int size() {
        return entities.size();
    }

    /**
     * Update every registered entity once
     */
    public void update(float delta) {
        for (var entity : new ArrayList<>(entities.values())) {
            entity.update(delta);
        }
    }
}
