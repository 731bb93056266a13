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
 * How hard arrive brakes: the desired speed is the remaining distance divided by the rate
 *
 * @author hal.hildebrand
 */
public enum Deceleration {
    VERY_FAST(1.5f), FAST(3), MIDDLE(4), SLOW(5), VERY_SLOW(6);

    private final float rate;

    Deceleration(float rate) {
        this.rate = rate;
    }

    public float rate() {
        return rate;
    }
}
