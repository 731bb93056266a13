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

import com.hellblazer.touchline.common.Regulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scores a fixed grid of candidate positions in the opponents' half and remembers the best one for a supporting
 * attacker to run to. Recalculation is rate limited.
 *
 * @author hal.hildebrand
 */
public class SupportSpotCalculator {
    public static final int   SPOTS_X          = 13;
    public static final int   SPOTS_Y          = 6;
    public static final float CAN_PASS_SCORE   = 2;
    public static final float CAN_SCORE_SCORE  = 1;
    public static final float DISTANCE_SCORE   = 2;
    public static final float OPTIMAL_DISTANCE = 20;

    private static final Logger log = LoggerFactory.getLogger(SupportSpotCalculator.class);

    private final Team       team;
    private final List<Spot> spots = new ArrayList<>();
    private final Regulator  regulator;
    private       Spot       bestSupportSpot;

    public SupportSpotCalculator(Team team, Regulator regulator) {
        this.team = team;
        this.regulator = regulator;
        layoutSpots(team.getColor() == TeamColor.RED);
    }

    /**
     * Score every spot and pick the best. Between openings of the regulator the previous result is returned.
     * Ties go to the spot seen first.
     *
     * @return the best supporting spot
     */
    public Point3f calculateBestSupportingPosition() {
        if (!regulator.isReady() && bestSupportSpot != null) {
            return bestSupportSpot.getPosition();
        }
        var config = team.getPitch().getConfiguration();
        var controlling = team.getControllingPlayer();
        var origin = controlling != null ? controlling.getPosition() : team.getPitch().getBall().getPosition();

        bestSupportSpot = null;
        var bestScoreSoFar = -1f;
        for (var spot : spots) {
            spot.score = 0;
            if (team.isPassSafeFromAllOpponents(origin, spot.position, null, config.maxPassingForce())) {
                spot.score += CAN_PASS_SCORE;
            }
            if (team.isShootPossible(spot.position, config.maxShootingForce()).isPresent()) {
                spot.score += CAN_SCORE_SCORE;
            }
            if (team.getSupportingPlayer() != null) {
                var distance = origin.distance(spot.position);
                var offset = Math.abs(OPTIMAL_DISTANCE - distance);
                if (offset < OPTIMAL_DISTANCE) {
                    spot.score += DISTANCE_SCORE * (OPTIMAL_DISTANCE - offset) / OPTIMAL_DISTANCE;
                }
            }
            if (spot.score > bestScoreSoFar) {
                bestScoreSoFar = spot.score;
                bestSupportSpot = spot;
            }
        }
        log.trace("{} best support spot {} scored {}", team, bestSupportSpot.position, bestScoreSoFar);
        return bestSupportSpot.getPosition();
    }

    /**
     * @return the best spot of the last calculation, calculating it first if there is none
     */
    public Point3f getBestSupportingSpot() {
        if (bestSupportSpot == null) {
            return calculateBestSupportingPosition();
        }
        return bestSupportSpot.getPosition();
    }

    public List<Spot> getSpots() {
        return Collections.unmodifiableList(spots);
    }

    /**
     * Spread the spots over the central 90% by 80% of the playing area, in the half the team attacks. Red attacks the
     * left half, blue the right one.
     */
    private void layoutSpots(boolean leftSide) {
        var field = team.getPitch().getPlayingArea();
        var width = field.getWidth() * 0.9f;
        var height = field.getHeight() * 0.8f;
        var sliceX = width / SPOTS_X;
        var sliceY = height / SPOTS_Y;

        var top = field.getTop() - (field.getHeight() - height) * 0.5f - sliceY * 0.5f;
        var right = field.getRight() - (field.getWidth() - width) * 0.5f - sliceX * 0.5f;
        var left = field.getLeft() + (field.getWidth() - width) * 0.5f + sliceX * 0.5f;

        for (int x = 0; x < SPOTS_X * 0.5f - 1; x++) {
            for (int y = 0; y < SPOTS_Y; y++) {
                var spotX = leftSide ? left + x * sliceX : right - x * sliceX;
                spots.add(new Spot(new Point3f(spotX, 0, top - y * sliceY)));
            }
        }
    }

    /**
     * A candidate position and its score from the last calculation
     */
    public static class Spot {
        private final Point3f position;
        private       float   score;

        Spot(Point3f position) {
            this.position = position;
        }

        public Point3f getPosition() {
            return new Point3f(position);
        }

        public float getScore() {
            return score;
        }
    }
}
