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
import com.hellblazer.touchline.simulation.entity.EntityManager;
import com.hellblazer.touchline.simulation.messaging.MessageDispatcher;
import com.hellblazer.touchline.simulation.world.Wall;
import com.hellblazer.touchline.simulation.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;
import java.util.random.RandomGenerator;

/**
 * The match. The pitch owns the ball, the goals, both teams, the walls around the playing area and the regions the
 * teams position their players in. Each call to {@link #update()} advances the match by one tick.
 *
 * @author hal.hildebrand
 */
public class Pitch {
    public static final int   REGIONS_HORIZONTAL = 6;
    public static final int   REGIONS_VERTICAL   = 3;
    /** Time step of one update; speeds and forces of the match are expressed per tick */
    public static final float TICK               = 1;

    private static final Logger log = LoggerFactory.getLogger(Pitch.class);

    private final SoccerConfiguration configuration;
    private final RandomGenerator     random;
    private final LongSupplier        nanoClock;
    private final EntityManager       entityManager  = new EntityManager();
    private final MessageDispatcher   dispatcher     = new MessageDispatcher();
    private final World               world          = new World();
    private final List<Region>        regions        = new ArrayList<>();
    private final List<ScoreListener> scoreListeners = new CopyOnWriteArrayList<>();
    private final Region              playingArea;
    private final Ball                ball;
    private final Goal                redGoal;
    private final Goal                blueGoal;
    private final Team                blueTeam;
    private final Team                redTeam;
    private       boolean             gameOn;
    private       boolean             paused;
    private       boolean             goalKeeperInBallPossession;

    public Pitch() {
        this(SoccerConfiguration.defaultConfig(), new Random(), System::nanoTime);
    }

    /**
     * @param configuration tuning of the match
     * @param random        source of all decisions left to chance
     * @param nanoClock     time source of the rate limited decisions
     */
    public Pitch(SoccerConfiguration configuration, RandomGenerator random, LongSupplier nanoClock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");

        var halfLength = configuration.pitchLength() * 0.5f;
        var halfWidth = configuration.pitchWidth() * 0.5f;
        playingArea = new Region(halfWidth, halfLength, -halfLength, -halfWidth, -1);
        createRegions();

        ball = entityManager.add(
        new Ball(entityManager.nextId(), configuration.ballRadius(), configuration.ballMass(), world));
        var goalSize = new Vector3f(2, 6, configuration.goalWidth());
        redGoal = new Goal(new Point3f(playingArea.getRight() + 1, goalSize.y * 0.5f, 0), goalSize,
                           new Vector3f(-1, 0, 0));
        blueGoal = new Goal(new Point3f(playingArea.getLeft() - 1, goalSize.y * 0.5f, 0), goalSize,
                            new Vector3f(1, 0, 0));

        blueTeam = entityManager.add(new Team(entityManager.nextId(), this, TeamColor.BLUE, blueGoal, redGoal));
        redTeam = entityManager.add(new Team(entityManager.nextId(), this, TeamColor.RED, redGoal, blueGoal));
        blueTeam.setOpponents(redTeam);
        redTeam.setOpponents(blueTeam);

        createWalls();
        gameOn = true;
        log.info("Kick off on a {} x {} pitch", configuration.pitchLength(), configuration.pitchWidth());
    }

    public void addScoreListener(ScoreListener listener) {
        scoreListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * A regulator driven by the pitch's clock and random source
     */
    public Regulator createRegulator(double updatesPerSecond) {
        return new Regulator(updatesPerSecond, nanoClock, random);
    }

    public Ball getBall() {
        return ball;
    }

    public Goal getBlueGoal() {
        return blueGoal;
    }

    public Team getBlueTeam() {
        return blueTeam;
    }

    public SoccerConfiguration getConfiguration() {
        return configuration;
    }

    public MessageDispatcher getDispatcher() {
        return dispatcher;
    }

    public EntityManager getEntityManager() {
        return entityManager;
    }

    public Region getPlayingArea() {
        return playingArea;
    }

    public RandomGenerator getRandom() {
        return random;
    }

    public Goal getRedGoal() {
        return redGoal;
    }

    public Team getRedTeam() {
        return redTeam;
    }

    /**
     * @throws IllegalArgumentException if no region has the id
     */
    public Region getRegionById(int id) {
        if (id < 0 || id >= regions.size()) {
            throw new IllegalArgumentException("No region " + id + ", the pitch has " + regions.size());
        }
        return regions.get(id);
    }

    public List<Region> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public World getWorld() {
        return world;
    }

    public boolean isGameOn() {
        return gameOn;
    }

    public void setGameOn(boolean gameOn) {
        this.gameOn = gameOn;
    }

    public boolean isGoalKeeperInBallPossession() {
        return goalKeeperInBallPossession;
    }

    public void setGoalKeeperInBallPossession(boolean goalKeeperInBallPossession) {
        this.goalKeeperInBallPossession = goalKeeperInBallPossession;
    }

    public boolean isPaused() {
        return paused;
    }

    public void removeScoreListener(ScoreListener listener) {
        scoreListeners.remove(listener);
    }

    public void togglePause() {
        paused = !paused;
        log.debug("Match {}", paused ? "paused" : "resumed");
    }

    @Override
    public String toString() {
        return String.format("Pitch{blue=%d, red=%d, gameOn=%s, paused=%s}", redGoal.getGoalsScored(),
                             blueGoal.getGoalsScored(), gameOn, paused);
    }

    /**
     * Advance the match by one tick: the ball moves, then the red team and the blue team act. A goal resets the
     * match for kick off.
     */
    public void update() {
        if (paused) {
            return;
        }
        ball.update(TICK);
        redTeam.update(TICK);
        blueTeam.update(TICK);

        if (redGoal.isScored(ball) || blueGoal.isScored(ball)) {
            gameOn = false;
            ball.placeAtPosition();
            redTeam.getStateMachine().changeState(TeamStates.PREPARE_FOR_KICK_OFF);
            blueTeam.getStateMachine().changeState(TeamStates.PREPARE_FOR_KICK_OFF);

            var goalsBlue = redGoal.getGoalsScored();
            var goalsRed = blueGoal.getGoalsScored();
            log.info("Goal! Blue {} : {} Red", goalsBlue, goalsRed);
            for (var listener : scoreListeners) {
                listener.scoreChanged(goalsBlue, goalsRed);
            }
        }
    }

    /**
     * Split the playing area into a grid of regions, column by column from the left, each column from the bottom
     */
    private void createRegions() {
        var width = playingArea.getWidth() / REGIONS_HORIZONTAL;
        var height = playingArea.getHeight() / REGIONS_VERTICAL;
        var id = 0;
        for (int col = 0; col < REGIONS_HORIZONTAL; col++) {
            for (int row = 0; row < REGIONS_VERTICAL; row++) {
                regions.add(new Region(playingArea.getBottom() + (row + 1) * height,
                                       playingArea.getLeft() + (col + 1) * width, playingArea.getLeft() + col * width,
                                       playingArea.getBottom() + row * height, id++));
            }
        }
    }

    /**
     * Enclose the playing area. The short sides are open between the goal posts.
     */
    private void createWalls() {
        var left = playingArea.getLeft();
        var right = playingArea.getRight();
        var top = playingArea.getTop();
        var bottom = playingArea.getBottom();
        var blueLine = blueGoal.getCenter().x;
        var redLine = redGoal.getCenter().x;

        world.addWall(new Wall(new Point3f(left, 0, bottom), new Point3f(right, 0, bottom), new Vector3f(0, 0, 1)));
        world.addWall(new Wall(new Point3f(left, 0, top), new Point3f(right, 0, top), new Vector3f(0, 0, -1)));

        world.addWall(new Wall(new Point3f(blueLine, 0, blueGoal.getRightPost().z), new Point3f(blueLine, 0, top),
                               new Vector3f(1, 0, 0)));
        world.addWall(new Wall(new Point3f(blueLine, 0, bottom), new Point3f(blueLine, 0, blueGoal.getLeftPost().z),
                               new Vector3f(1, 0, 0)));
        world.addWall(new Wall(new Point3f(redLine, 0, redGoal.getRightPost().z), new Point3f(redLine, 0, top),
                               new Vector3f(-1, 0, 0)));
        world.addWall(new Wall(new Point3f(redLine, 0, bottom), new Point3f(redLine, 0, redGoal.getLeftPost().z),
                               new Vector3f(-1, 0, 0)));
    }
}
