package com.hellblazer.touchline.simulation.soccer;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class GoalTest {
    private static final float EPSILON = 0.0001f;

    @Test
    void testPostsAndCenter() {
        var goal = new Goal(new Point3f(51, 3, 0), new Vector3f(2, 6, 10), new Vector3f(-1, 0, 0));
        assertEquals(new Point3f(50, 0, -5), goal.getLeftPost());
        assertEquals(new Point3f(50, 0, 5), goal.getRightPost());
        assertEquals(new Point3f(50, 0, 0), goal.getCenter());
        assertEquals(10, goal.getWidth(), EPSILON);
    }

    @Test
    void testGoalMustFaceAlongX() {
        assertThrows(IllegalArgumentException.class,
                     () -> new Goal(new Point3f(), new Vector3f(2, 6, 10), new Vector3f(0, 0, 1)));
    }

    @Test
    void testShotIntoGoal() {
        var clock = new AtomicLong();
        var pitch = new Pitch(SoccerConfiguration.defaultConfig(), new Random(42), clock::get);
        var ball = pitch.getBall();
        var blueGoal = pitch.getBlueGoal();
        var redGoal = pitch.getRedGoal();
        var goalLine = blueGoal.getCenter().x;

        ball.placeAtPosition(new Point3f());
        var target = new Point3f(-60, 0, 0);
        var time = ball.calculateTimeToCoverDistance(ball.getPosition(), blueGoal.getCenter(), 0.8f);
        assertTrue(time > 0, "The shot must reach the goal line");
        ball.kick(new Vector3f(target), 0.8f);

        var scoredAt = -1;
        for (int tick = 1; tick <= 200 && scoredAt < 0; tick++) {
            ball.update(Pitch.TICK);
            assertFalse(redGoal.isScored(ball));
            if (blueGoal.isScored(ball)) {
                scoredAt = tick;
                assertTrue(ball.getPreviousPosition().x > goalLine);
                assertTrue(ball.getPosition().x < goalLine);
            } else {
                assertTrue(ball.getPosition().x > goalLine, "Crossing tick missed at " + tick);
            }
        }
        assertTrue(scoredAt > 0, "Ball never crossed the goal line");
        assertEquals(Math.ceil(time), scoredAt, 1);
        assertEquals(1, blueGoal.getGoalsScored());
        assertEquals(0, redGoal.getGoalsScored());
    }
}
