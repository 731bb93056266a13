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

/**
 * The two sides of a match. Blue defends the goal at the negative x end of the pitch, red the one at the positive
 * end.
 *
 * @author hal.hildebrand
 */
public enum TeamColor {
    BLUE(new int[] { 1, 6, 8, 3, 5 }, new int[] { 1, 12, 14, 6, 4 }, new int[] { 1, 6, 8, 3, 5 }),
    RED(new int[] { 16, 9, 11, 12, 14 }, new int[] { 16, 3, 5, 9, 13 }, new int[] { 16, 9, 11, 12, 14 });

    private final int[] kickOffRegions;
    private final int[] attackingRegions;
    private final int[] defendingRegions;

    TeamColor(int[] kickOffRegions, int[] attackingRegions, int[] defendingRegions) {
        this.kickOffRegions = kickOffRegions;
        this.attackingRegions = attackingRegions;
        this.defendingRegions = defendingRegions;
    }

    /**
     * Home region of the player at the index while the team attacks
     */
    public int attackingRegion(int playerIndex) {
        return attackingRegions[playerIndex];
    }

    /**
     * Home region of the player at the index while the team defends
     */
    public int defendingRegion(int playerIndex) {
        return defendingRegions[playerIndex];
    }

    /**
     * Region the player at the index starts in and returns to before kick off
     */
    public int kickOffRegion(int playerIndex) {
        return kickOffRegions[playerIndex];
    }
}
