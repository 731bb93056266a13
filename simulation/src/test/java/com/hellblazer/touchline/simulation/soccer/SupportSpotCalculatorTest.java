package com.hellblazer.touchline.simulation.soccer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SupportSpotCalculatorTest {
    private static final long SECOND = 1_000_000_000L;

    private AtomicLong clock;
    private Pitch      pitch;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong();
        pitch = new Pitch(SoccerConfiguration.defaultConfig(), new Random(42), clock::get);
    }

    @Test
    void testSpotsCoverAttackingHalf() {
        var blueSpots = pitch.getBlueTeam().getSupportSpotCalculator().getSpots();
        var redSpots = pitch.getRedTeam().getSupportSpotCalculator().getSpots();
        assertEquals(36, blueSpots.size());
        assertEquals(36, redSpots.size());

        var area = pitch.getPlayingArea();
        for (var spot : blueSpots) {
            assertTrue(spot.getPosition().x > 0, "Blue attacks the right half: " + spot.getPosition());
            assertTrue(area.isInside(spot.getPosition()));
        }
        for (var spot : redSpots) {
            assertTrue(spot.getPosition().x < 0, "Red attacks the left half: " + spot.getPosition());
            assertTrue(area.isInside(spot.getPosition()));
        }
    }

    @Test
    void testBestSpotHasHighestScore() {
        var team = pitch.getBlueTeam();
        team.setControllingPlayer(team.getPlayers().get(1));
        var calculator = team.getSupportSpotCalculator();

        var best = calculator.calculateBestSupportingPosition();

        var highest = calculator.getSpots().stream().mapToDouble(SupportSpotCalculator.Spot::getScore).max();
        var bestSpot = calculator.getSpots()
                                 .stream()
                                 .filter(s -> s.getPosition().equals(best))
                                 .findFirst()
                                 .orElseThrow();
        assertEquals(highest.getAsDouble(), bestSpot.getScore(), 0.0001);
        assertTrue(bestSpot.getScore() <= SupportSpotCalculator.CAN_PASS_SCORE + SupportSpotCalculator.CAN_SCORE_SCORE
                   + SupportSpotCalculator.DISTANCE_SCORE);
    }

    @Test
    void testBestSpotWithoutController() {
        var calculator = pitch.getRedTeam().getSupportSpotCalculator();
        assertNotNull(calculator.calculateBestSupportingPosition(), "Scoring falls back to the ball position");
    }

    @Test
    void testRecalculationIsRateLimited() {
        var team = pitch.getBlueTeam();
        team.setControllingPlayer(team.getPlayers().get(1));
        var calculator = team.getSupportSpotCalculator();
        var first = calculator.calculateBestSupportingPosition();

        var ball = pitch.getBall();
        ball.placeAtPosition(new Point3f(40, 0, 25));
        team.getPlayers().get(1).setPosition(new Point3f(40, 0, 25));
        assertEquals(first, calculator.calculateBestSupportingPosition(), "Cached until the regulator opens");

        clock.addAndGet(2 * SECOND);
        assertNotNull(calculator.calculateBestSupportingPosition());
        assertEquals(calculator.getBestSupportingSpot(), team.getSupportSpot());
    }
}
