package com.hellblazer.touchline.simulation.soccer;

import com.hellblazer.touchline.simulation.world.Wall;
import com.hellblazer.touchline.simulation.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class BallTest {
    private static final float EPSILON = 0.0001f;

    private World world;
    private Ball  ball;

    @BeforeEach
    void setUp() {
        world = new World();
        ball = new Ball(0, 1, 1, world);
    }

    @Test
    void testTimeToCoverDistance() {
        var time = ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(50, 0, 0), 0.8f);
        var expected = (Math.sqrt(0.8 * 0.8 + 2 * 50 * Ball.FRICTION) - 0.8) / Ball.FRICTION;
        assertEquals(expected, time, 0.01);
    }

    @Test
    void testTimeToCoverUnreachableDistance() {
        assertEquals(-1, ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(100, 0, 0), 0.1f));
        assertEquals(-1, ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(0, 0, 40), 0.5f),
                     "Friction stops the ball after 25 units");
        assertTrue(ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(0, 0, 20), 0.5f) > 0);
    }

    @Test
    void testHeavierBallIsSlower() {
        var heavy = new Ball(1, 1, 2, world);
        var light = ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(10, 0, 0), 0.8f);
        var slow = heavy.calculateTimeToCoverDistance(new Point3f(), new Point3f(10, 0, 0), 0.8f);
        assertTrue(slow > light);
    }

    @Test
    void testKickAndTrap() {
        ball.kick(new Vector3f(0, 0, 3), 0.5f);
        assertEquals(0.5f, ball.getSpeed(), EPSILON);
        assertEquals(1, ball.getVelocity().z / ball.getSpeed(), EPSILON);

        ball.trap();
        assertEquals(0, ball.getSpeed(), EPSILON);

        ball.kick(new Vector3f(), 0.5f);
        assertEquals(0, ball.getSpeed(), EPSILON, "Kick without direction leaves the ball at rest");
    }

    @Test
    void testFrictionSlowsAndStops() {
        ball.kick(new Vector3f(1, 0, 0), 0.02f);
        ball.update(1);
        assertEquals(0.015f, ball.getSpeed(), EPSILON);
        assertEquals(0.015f, ball.getPosition().x, EPSILON);
        assertEquals(0, ball.getPreviousPosition().x, EPSILON);

        for (int i = 0; i < 5; i++) {
            ball.update(1);
        }
        assertEquals(0, ball.getSpeed(), EPSILON, "Friction should have stopped the ball");
        var rest = ball.getPosition();
        ball.update(1);
        assertEquals(rest, ball.getPosition());
    }

    @Test
    void testFuturePosition() {
        assertEquals(new Point3f(), ball.calculateFuturePosition(10), "A ball at rest stays put");

        ball.kick(new Vector3f(1, 0, 0), 0.5f);
        var future = ball.calculateFuturePosition(10);
        assertEquals(5 + 0.5f * Ball.FRICTION * 100, future.x, EPSILON);
        assertEquals(0, future.z, EPSILON);
    }

    @Test
    void testPlaceAtPosition() {
        ball.kick(new Vector3f(1, 0, 0), 0.5f);
        ball.update(1);
        ball.placeAtPosition(new Point3f(3, 0, 4));

        assertEquals(new Point3f(3, 0, 4), ball.getPosition());
        assertEquals(new Point3f(3, 0, 4), ball.getPreviousPosition());
        assertEquals(0, ball.getSpeed(), EPSILON);
    }

    @Test
    void testNoiseKeepsDistanceAndBoundsAngle() {
        var random = new Random(42);
        var target = new Point3f(20, 0, 0);
        var maxAngle = Math.PI - Math.PI * Ball.ACCURACY;
        for (int i = 0; i < 100; i++) {
            var noisy = ball.addNoiseToKick(target, random);
            assertEquals(20, noisy.distance(new Point3f()), 0.001f);
            var angle = new Vector3f(1, 0, 0).angle(new Vector3f(noisy));
            assertTrue(angle <= maxAngle + EPSILON, "Angle " + angle);
        }
    }

    @Test
    void testBounceOffWall() {
        world.addWall(new Wall(new Point3f(-10, 0, 2), new Point3f(10, 0, 2), new Vector3f(0, 0, -1)));
        ball.placeAtPosition(new Point3f(0, 0, 1.2f));
        ball.kick(new Vector3f(1, 0, 1), 0.5f);
        var before = ball.getVelocity();

        ball.testCollisionWithWalls();

        var after = ball.getVelocity();
        assertEquals(before.x, after.x, EPSILON, "Tangential velocity is kept");
        assertEquals(-before.z, after.z, EPSILON, "Normal velocity is reflected");
    }

    @Test
    void testWallOutOfReachIgnored() {
        world.addWall(new Wall(new Point3f(-10, 0, 5), new Point3f(10, 0, 5), new Vector3f(0, 0, -1)));
        ball.kick(new Vector3f(0, 0, 1), 0.5f);

        ball.testCollisionWithWalls();

        assertEquals(0.5f, ball.getVelocity().z, EPSILON);
    }
}
