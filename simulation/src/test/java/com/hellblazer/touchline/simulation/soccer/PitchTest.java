package com.hellblazer.touchline.simulation.soccer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class PitchTest {
    private static final long  FRAME   = 16_666_667L;
    private static final float EPSILON = 0.0001f;

    private AtomicLong clock;
    private Pitch      pitch;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong();
        pitch = new Pitch(SoccerConfiguration.defaultConfig(), new Random(42), clock::get);
    }

    private void tick() {
        clock.addAndGet(FRAME);
        pitch.update();
    }

    @Test
    void testRegions() {
        var regions = pitch.getRegions();
        assertEquals(Pitch.REGIONS_HORIZONTAL * Pitch.REGIONS_VERTICAL, regions.size());
        for (int i = 0; i < regions.size(); i++) {
            assertEquals(i, regions.get(i).getId());
        }
        var corner = pitch.getRegionById(0);
        assertEquals(pitch.getPlayingArea().getLeft(), corner.getLeft(), EPSILON);
        assertEquals(pitch.getPlayingArea().getBottom(), corner.getBottom(), EPSILON);
        assertTrue(pitch.getRegionById(8).isInside(new Point3f(-10, 0, 20)), "Ids run column by column");

        assertThrows(IllegalArgumentException.class, () -> pitch.getRegionById(-1));
        assertThrows(IllegalArgumentException.class, () -> pitch.getRegionById(18));
    }

    @Test
    void testLayout() {
        assertEquals(100, pitch.getPlayingArea().getWidth(), EPSILON);
        assertEquals(60, pitch.getPlayingArea().getHeight(), EPSILON);
        assertEquals(-50, pitch.getBlueGoal().getCenter().x, EPSILON);
        assertEquals(50, pitch.getRedGoal().getCenter().x, EPSILON);
        assertEquals(6, pitch.getWorld().getWalls().size());
        assertEquals(10, pitch.getWorld().getAgents().size());
        assertEquals(13, pitch.getEntityManager().size(), "Ball, two teams and ten players");
        assertTrue(pitch.isGameOn());
        assertFalse(pitch.isPaused());
    }

    @Test
    void testMatchRunsWithinLimits() {
        var config = pitch.getConfiguration();
        var players = new ArrayList<PlayerBase>();
        players.addAll(pitch.getBlueTeam().getPlayers());
        players.addAll(pitch.getRedTeam().getPlayers());

        for (int i = 0; i < 600; i++) {
            tick();
            for (var player : players) {
                assertTrue(player.getSpeed() <= config.maxSpeedWithoutBall() + EPSILON,
                           player + " too fast at tick " + i + ": " + player.getSpeed());
            }
            var ball = pitch.getBall().getPosition();
            assertTrue(Math.abs(ball.z) <= config.pitchWidth() * 0.5f + config.ballRadius(),
                       "Ball left the pitch at tick " + i + ": " + ball);
        }
    }

    @Test
    void testPauseFreezesMatch() {
        var ball = pitch.getBall();
        ball.kick(new Vector3f(0, 0, 1), 0.5f);
        pitch.togglePause();
        assertTrue(pitch.isPaused());

        var before = ball.getPosition();
        for (int i = 0; i < 10; i++) {
            tick();
        }
        assertEquals(before, ball.getPosition());

        pitch.togglePause();
        tick();
        assertNotEquals(before, ball.getPosition());
    }

    @Test
    void testGoalResetsForKickOff() {
        var scores = new ArrayList<int[]>();
        pitch.addScoreListener((goalsBlue, goalsRed) -> scores.add(new int[] { goalsBlue, goalsRed }));
        var ball = pitch.getBall();
        ball.placeAtPosition(new Point3f(-49.5f, 0, 0));
        ball.kick(new Vector3f(-1, 0, 0), 0.8f);

        tick();

        assertEquals(1, scores.size());
        assertArrayEquals(new int[] { 0, 1 }, scores.get(0), "Red scored into the blue goal");
        assertFalse(pitch.isGameOn());
        assertEquals(new Point3f(), ball.getPosition());
        assertEquals(0, ball.getSpeed(), EPSILON);
        assertTrue(pitch.getBlueTeam().getStateMachine().isInState(TeamStates.PREPARE_FOR_KICK_OFF));
        assertTrue(pitch.getRedTeam().getStateMachine().isInState(TeamStates.PREPARE_FOR_KICK_OFF));
    }

    @Test
    void testRemovedListenerNotNotified() {
        var notified = new ArrayList<Integer>();
        ScoreListener listener = (goalsBlue, goalsRed) -> notified.add(goalsBlue);
        pitch.addScoreListener(listener);
        pitch.removeScoreListener(listener);
        var ball = pitch.getBall();
        ball.placeAtPosition(new Point3f(49.5f, 0, 0));
        ball.kick(new Vector3f(1, 0, 0), 0.8f);

        tick();

        assertTrue(notified.isEmpty());
        assertEquals(1, pitch.getRedGoal().getGoalsScored());
    }

    @Test
    void testShotFromCenterSpotScoresOnCrossingTick() {
        var scores = new ArrayList<int[]>();
        pitch.addScoreListener((goalsBlue, goalsRed) -> scores.add(new int[] { goalsBlue, goalsRed }));
        // keep the red keeper out of the line of the shot
        pitch.getRedTeam().getPlayers().get(0).setPosition(new Point3f(45, 0, -28));
        var ball = pitch.getBall();
        var goalLine = pitch.getRedGoal().getCenter();
        var force = 0.8f;
        var time = ball.calculateTimeToCoverDistance(ball.getPosition(), goalLine, force);
        assertTrue(time > 0, "The kick must be strong enough to reach the goal line");

        ball.kick(new Vector3f(1, 0, 0), force);
        var scoredAt = -1;
        for (int i = 1; i <= 200 && scoredAt < 0; i++) {
            var before = ball.getPosition();
            tick();
            if (!scores.isEmpty()) {
                scoredAt = i;
                assertTrue(before.x < goalLine.x, "Scored before the crossing tick");
            } else {
                assertTrue(ball.getPosition().x < goalLine.x, "Crossing at tick " + i + " missed");
            }
        }

        assertEquals(Math.ceil(time), scoredAt, 1);
        assertArrayEquals(new int[] { 1, 0 }, scores.get(0), "Blue scored into the red goal");
        assertEquals(new Point3f(), ball.getPosition());
    }

    @Test
    void testPlayResumesAfterGoal() {
        var ball = pitch.getBall();
        ball.placeAtPosition(new Point3f(-49.5f, 0, 0));
        ball.kick(new Vector3f(-1, 0, 0), 0.8f);
        tick();
        assertFalse(pitch.isGameOn());

        var ticks = 0;
        while (!pitch.isGameOn() && ticks < 5000) {
            tick();
            ticks++;
        }

        assertTrue(pitch.isGameOn(), "Teams never got back into position");
        var blue = pitch.getBlueTeam().getStateMachine();
        var red = pitch.getRedTeam().getStateMachine();
        assertTrue(blue.isInState(TeamStates.DEFENDING) || red.isInState(TeamStates.DEFENDING),
                   "Kick off leaves the preparing state: blue " + blue + ", red " + red);
        assertEquals(1, pitch.getBlueGoal().getGoalsScored());
    }
}
