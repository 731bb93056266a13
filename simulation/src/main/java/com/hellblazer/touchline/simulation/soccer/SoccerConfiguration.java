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
 * Tuning of a match. Distances are in pitch units, speeds and forces are per tick, chances are probabilities per
 * decision.
 *
 * @param pitchLength                   extent of the playing area along x
 * @param pitchWidth                    extent of the playing area along z
 * @param goalWidth                     distance between the goal posts
 * @param keeperInTargetRange           keeper is at its target within this distance
 * @param keeperInterceptRange          keeper intercepts balls this close to its goal
 * @param keeperTendingDistance         keeper stays this far in front of the goal mouth
 * @param keeperMinPassDistance         keeper only passes to players at least this far away
 * @param receivingRange                player controls the ball within this distance
 * @param inTargetRange                 player is at its target within this distance
 * @param kickingDistance               reach beyond the ball's radius within which a player can kick
 * @param kickFrequency                 maximum kicks per second per player
 * @param passThreatRadius              opponents this close make a receiver pursue the ball
 * @param strikeAttempts                random shot targets tried along the goal mouth
 * @param comfortZone                   opponents closer than this in front threaten the player
 * @param brakingRate                   velocity multiplier for players without steering force
 * @param chanceOfUsingArriveToReceive  probability a receiver waits at the target instead of pursuing
 * @param chanceOfPotShot               probability of shooting without a clear chance
 * @param chanceOfHandlingPassRequest   probability a pass request is considered at all
 * @param minPassDistance               minimum distance of a pass between field players
 * @param playerMass                    mass of a player
 * @param playerRadius                  bounding radius of a player
 * @param maxSpeedWithBall              speed limit while controlling the ball
 * @param maxSpeedWithoutBall           speed limit otherwise
 * @param maxForce                      steering force limit of a player
 * @param maxTurnRate                   radians a player may turn per tick
 * @param maxDribbleForce               kick force of a dribble towards goal
 * @param maxDribbleAndTurnForce        kick force of a dribble that turns the player
 * @param maxShootingForce              kick force of a shot
 * @param maxPassingForce               kick force of a pass
 * @param ballRadius                    bounding radius of the ball
 * @param ballMass                      mass of the ball
 * @param supportSpotUpdateFrequency    support spot recalculations per second
 * @author hal.hildebrand
 */
public record SoccerConfiguration(float pitchLength, float pitchWidth, float goalWidth, float keeperInTargetRange,
                                  float keeperInterceptRange, float keeperTendingDistance,
                                  float keeperMinPassDistance, float receivingRange, float inTargetRange,
                                  float kickingDistance, float kickFrequency, float passThreatRadius,
                                  int strikeAttempts, float comfortZone, float brakingRate,
                                  float chanceOfUsingArriveToReceive, float chanceOfPotShot,
                                  float chanceOfHandlingPassRequest, float minPassDistance, float playerMass,
                                  float playerRadius, float maxSpeedWithBall, float maxSpeedWithoutBall,
                                  float maxForce, float maxTurnRate, float maxDribbleForce,
                                  float maxDribbleAndTurnForce, float maxShootingForce, float maxPassingForce,
                                  float ballRadius, float ballMass, float supportSpotUpdateFrequency) {

    public SoccerConfiguration {
        if (pitchLength <= 0 || pitchWidth <= 0) {
            throw new IllegalArgumentException("Pitch dimensions must be positive: " + pitchLength + " x " + pitchWidth);
        }
        if (goalWidth <= 0 || goalWidth >= pitchWidth) {
            throw new IllegalArgumentException("Goal width must be positive and narrower than the pitch: " + goalWidth);
        }
        if (playerMass <= 0 || ballMass <= 0) {
            throw new IllegalArgumentException("Masses must be positive");
        }
        if (strikeAttempts < 1) {
            throw new IllegalArgumentException("strikeAttempts must be at least 1: " + strikeAttempts);
        }
        checkProbability("chanceOfUsingArriveToReceive", chanceOfUsingArriveToReceive);
        checkProbability("chanceOfPotShot", chanceOfPotShot);
        checkProbability("chanceOfHandlingPassRequest", chanceOfHandlingPassRequest);
        checkProbability("brakingRate", brakingRate);
    }

    public static SoccerConfiguration defaultConfig() {
        return new SoccerConfiguration(100,      // pitchLength
                                       60,       // pitchWidth
                                       10,       // goalWidth
                                       2,        // keeperInTargetRange
                                       15,       // keeperInterceptRange
                                       4,        // keeperTendingDistance
                                       5,        // keeperMinPassDistance
                                       2,        // receivingRange
                                       2,        // inTargetRange
                                       1.5f,     // kickingDistance
                                       8,        // kickFrequency
                                       15,       // passThreatRadius
                                       5,        // strikeAttempts
                                       10,       // comfortZone
                                       0.8f,     // brakingRate
                                       0.5f,     // chanceOfUsingArriveToReceive
                                       0.005f,   // chanceOfPotShot
                                       0.1f,     // chanceOfHandlingPassRequest
                                       15,       // minPassDistance
                                       1,        // playerMass
                                       1,        // playerRadius
                                       0.085f,   // maxSpeedWithBall
                                       0.11f,    // maxSpeedWithoutBall
                                       1,        // maxForce
                                       0.1f,     // maxTurnRate
                                       0.18f,    // maxDribbleForce
                                       0.12f,    // maxDribbleAndTurnForce
                                       0.8f,     // maxShootingForce
                                       0.5f,     // maxPassingForce
                                       1,        // ballRadius
                                       1,        // ballMass
                                       1         // supportSpotUpdateFrequency
        );
    }

    private static void checkProbability(String name, float value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be between 0 and 1: " + value);
        }
    }

    public SoccerConfiguration withBall(float radius, float mass) {
        return new SoccerConfiguration(pitchLength, pitchWidth, goalWidth, keeperInTargetRange, keeperInterceptRange,
                                       keeperTendingDistance, keeperMinPassDistance, receivingRange, inTargetRange,
                                       kickingDistance, kickFrequency, passThreatRadius, strikeAttempts, comfortZone,
                                       brakingRate, chanceOfUsingArriveToReceive, chanceOfPotShot,
                                       chanceOfHandlingPassRequest, minPassDistance, playerMass, playerRadius,
                                       maxSpeedWithBall, maxSpeedWithoutBall, maxForce, maxTurnRate, maxDribbleForce,
                                       maxDribbleAndTurnForce, maxShootingForce, maxPassingForce, radius, mass,
                                       supportSpotUpdateFrequency);
    }

    public SoccerConfiguration withChances(float arriveToReceive, float potShot, float handlingPassRequest) {
        return new SoccerConfiguration(pitchLength, pitchWidth, goalWidth, keeperInTargetRange, keeperInterceptRange,
                                       keeperTendingDistance, keeperMinPassDistance, receivingRange, inTargetRange,
                                       kickingDistance, kickFrequency, passThreatRadius, strikeAttempts, comfortZone,
                                       brakingRate, arriveToReceive, potShot, handlingPassRequest, minPassDistance,
                                       playerMass, playerRadius, maxSpeedWithBall, maxSpeedWithoutBall, maxForce,
                                       maxTurnRate, maxDribbleForce, maxDribbleAndTurnForce, maxShootingForce,
                                       maxPassingForce, ballRadius, ballMass, supportSpotUpdateFrequency);
    }

    public SoccerConfiguration withKickFrequency(float kickFrequency) {
        return new SoccerConfiguration(pitchLength, pitchWidth, goalWidth, keeperInTargetRange, keeperInterceptRange,
                                       keeperTendingDistance, keeperMinPassDistance, receivingRange, inTargetRange,
                                       kickingDistance, kickFrequency, passThreatRadius, strikeAttempts, comfortZone,
                                       brakingRate, chanceOfUsingArriveToReceive, chanceOfPotShot,
                                       chanceOfHandlingPassRequest, minPassDistance, playerMass, playerRadius,
                                       maxSpeedWithBall, maxSpeedWithoutBall, maxForce, maxTurnRate, maxDribbleForce,
                                       maxDribbleAndTurnForce, maxShootingForce, maxPassingForce, ballRadius, ballMass,
                                       supportSpotUpdateFrequency);
    }

    public SoccerConfiguration withSupportSpotUpdateFrequency(float frequency) {
        return new SoccerConfiguration(pitchLength, pitchWidth, goalWidth, keeperInTargetRange, keeperInterceptRange,
                                       keeperTendingDistance, keeperMinPassDistance, receivingRange, inTargetRange,
                                       kickingDistance, kickFrequency, passThreatRadius, strikeAttempts, comfortZone,
                                       brakingRate, chanceOfUsingArriveToReceive, chanceOfPotShot,
                                       chanceOfHandlingPassRequest, minPassDistance, playerMass, playerRadius,
                                       maxSpeedWithBall, maxSpeedWithoutBall, maxForce, maxTurnRate, maxDribbleForce,
                                       maxDribbleAndTurnForce, maxShootingForce, maxPassingForce, ballRadius, ballMass,
                                       frequency);
    }
}
