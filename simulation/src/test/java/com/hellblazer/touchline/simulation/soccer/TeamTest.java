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
class TeamTest {
    private static final float EPSILON = 0.001f;

    private Pitch pitch;
    private Team  blue;
    private Team  red;

    @BeforeEach
    void setUp() {
        var clock = new AtomicLong();
        pitch = new Pitch(SoccerConfiguration.defaultConfig(), new Random(42), clock::get);
        blue = pitch.getBlueTeam();
        red = pitch.getRedTeam();
    }

    private void moveOpponentsTo(float x, float z) {
        for (var opponent : red.getPlayers()) {
            opponent.setPosition(new Point3f(x, 0, z));
        }
    }

    @Test
    void testRoster() {
        var players = blue.getPlayers();
        assertEquals(5, players.size());
        assertInstanceOf(GoalKeeper.class, players.get(0));
        assertEquals(PlayerRole.ATTACKER, players.get(1).getRole());
        assertEquals(PlayerRole.ATTACKER, players.get(2).getRole());
        assertEquals(PlayerRole.DEFENDER, players.get(3).getRole());
        assertEquals(PlayerRole.DEFENDER, players.get(4).getRole());
        for (int i = 0; i < players.size(); i++) {
            assertEquals(TeamColor.BLUE.kickOffRegion(i), players.get(i).getHomeRegionId());
            assertTrue(pitch.getDispatcher().isRegistered(players.get(i).getId()));
        }
        assertSame(red, blue.getOpponents());
        assertSame(blue, red.getOpponents());
    }

    @Test
    void testTangentPoints() {
        var center = new Point3f(1, 0, 1);
        var viewpoint = new Point3f(3, 0, 1);
        var tangents = Team.getTangentPoints(center, 1, viewpoint);
        assertTrue(tangents.isPresent());
        for (var p : new Point3f[] { tangents.get().first(), tangents.get().second() }) {
            assertEquals(1, p.distance(center), EPSILON, "Tangent point must lie on the circle");
            var radial = new Point3f(p);
            radial.sub(center);
            var tangent = new Point3f(viewpoint);
            tangent.sub(p);
            assertEquals(0, radial.x * tangent.x + radial.z * tangent.z, EPSILON, "Tangent must be perpendicular");
        }
        assertNotEquals(tangents.get().first(), tangents.get().second());
    }

    @Test
    void testNoTangentsFromInside() {
        assertTrue(Team.getTangentPoints(new Point3f(), 2, new Point3f(1, 0, 1)).isEmpty());
        assertTrue(Team.getTangentPoints(new Point3f(), 2, new Point3f(2, 0, 0)).isEmpty());
    }

    @Test
    void testOpponentBehindPassIsSafe() {
        var opponent = red.getPlayers().get(1);
        opponent.setPosition(new Point3f(-5, 0, 0.5f));
        assertTrue(blue.isPassSafeFromOpponent(new Point3f(), new Point3f(20, 0, 0), null, opponent, 0.5f));
    }

    @Test
    void testOpponentInLaneIntercepts() {
        var opponent = red.getPlayers().get(1);
        opponent.setPosition(new Point3f(10, 0, 0.5f));
        assertFalse(blue.isPassSafeFromOpponent(new Point3f(), new Point3f(20, 0, 0), null, opponent, 0.5f));

        opponent.setPosition(new Point3f(10, 0, 15));
        assertTrue(blue.isPassSafeFromOpponent(new Point3f(), new Point3f(20, 0, 0), null, opponent, 0.5f),
                   "Opponent too far from the lane to reach the ball");
    }

    @Test
    void testOpponentBeyondTarget() {
        var opponent = red.getPlayers().get(1);
        var receiver = blue.getPlayers().get(1);
        var start = new Point3f();
        var target = new Point3f(20, 0, 0);

        opponent.setPosition(new Point3f(30, 0, 1));
        assertTrue(blue.isPassSafeFromOpponent(start, target, null, opponent, 0.5f));

        receiver.setPosition(new Point3f(19, 0, 0));
        assertTrue(blue.isPassSafeFromOpponent(start, target, receiver, opponent, 0.5f),
                   "Receiver is closer to the target");

        opponent.setPosition(new Point3f(25, 0, 0));
        receiver.setPosition(new Point3f(12, 0, 0));
        assertFalse(blue.isPassSafeFromOpponent(start, target, receiver, opponent, 0.5f),
                    "Opponent is closer to the target");
    }

    @Test
    void testPassToFurthestForwardReceiver() {
        moveOpponentsTo(-45, 0);
        var players = blue.getPlayers();
        var passer = players.get(1);
        passer.setPosition(new Point3f());
        players.get(0).setPosition(new Point3f(-40, 0, 0));
        players.get(2).setPosition(new Point3f(20, 0, 0));
        players.get(3).setPosition(new Point3f(25, 0, 5));
        players.get(4).setPosition(new Point3f(10, 0, -5));
        pitch.getBall().placeAtPosition(new Point3f());

        var pass = blue.isPassPossible(passer, 0.5f, 15);

        assertTrue(pass.isPresent());
        assertSame(players.get(2), pass.get().receiver());
        assertTrue(pass.get().target().x >= 18, "Pass should reach the forward receiver: " + pass.get().target());
        assertTrue(pass.get().target().distance(players.get(2).getPosition()) < 2);
    }

    @Test
    void testNoPassWhenOutOfRange() {
        moveOpponentsTo(-45, 0);
        var players = blue.getPlayers();
        for (int i = 1; i < players.size(); i++) {
            players.get(i).setPosition(new Point3f(40, 0, -20 + 10 * i));
        }
        players.get(0).setPosition(new Point3f(-40, 0, 0));
        pitch.getBall().placeAtPosition(new Point3f());
        assertTrue(blue.isPassPossible(players.get(1), 0.5f, 15).isEmpty());
    }

    @Test
    void testShotAtOpenGoal() {
        moveOpponentsTo(-40, 25);
        var target = blue.isShootPossible(new Point3f(40, 0, 0), 0.8f);
        assertTrue(target.isPresent());
        var goal = blue.getOpponentsGoal();
        assertEquals(goal.getCenter().x, target.get().x, EPSILON);
        assertTrue(target.get().z >= goal.getLeftPost().z && target.get().z <= goal.getRightPost().z);
    }

    @Test
    void testShotTargetStaysBetweenThePosts() {
        var nearlyOne = new Random(42) {
            @Override
            public double nextDouble() {
                return 0.999;
            }
        };
        var config = SoccerConfiguration.defaultConfig().withBall(0.25f, 1);
        var narrowBall = new Pitch(config, nearlyOne, new AtomicLong()::get);
        var team = narrowBall.getBlueTeam();
        for (var opponent : narrowBall.getRedTeam().getPlayers()) {
            opponent.setPosition(new Point3f(-40, 0, 25));
        }

        var target = team.isShootPossible(new Point3f(40, 0, 0), 0.8f);

        assertTrue(target.isPresent());
        var maxZ = team.getOpponentsGoal().getRightPost().z - config.ballRadius();
        assertEquals(maxZ, target.get().z, EPSILON, "The last step past the right post is clamped");
    }

    @Test
    void testShotAtBlockedGoal() {
        var z = -4;
        for (var opponent : red.getPlayers()) {
            opponent.setPosition(new Point3f(45, 0, z));
            z += 2;
        }
        assertTrue(blue.isShootPossible(new Point3f(40, 0, 0), 0.8f).isEmpty());
    }

    @Test
    void testControlPassesBetweenTeams() {
        var blueAttacker = blue.getPlayers().get(1);
        var redAttacker = red.getPlayers().get(1);
        red.setControllingPlayer(redAttacker);
        assertTrue(red.isInControl());

        blue.setControllingPlayer(blueAttacker);

        assertTrue(blue.isInControl());
        assertFalse(red.isInControl(), "Opponents lose control");
        assertTrue(blueAttacker.isControllingPlayer());
    }

    @Test
    void testLosingControlEndsAttack() {
        blue.setControllingPlayer(blue.getPlayers().get(1));
        blue.getStateMachine().changeState(TeamStates.ATTACKING);
        assertTrue(blue.getStateMachine().isInState(TeamStates.ATTACKING));
        for (int i = 0; i < 5; i++) {
            assertEquals(TeamColor.BLUE.attackingRegion(i), blue.getPlayers().get(i).getHomeRegionId());
        }

        blue.lostControl();
        blue.getStateMachine().update();

        assertTrue(blue.getStateMachine().isInState(TeamStates.DEFENDING));
        assertNull(blue.getSupportingPlayer());
        for (int i = 0; i < 5; i++) {
            assertEquals(TeamColor.BLUE.defendingRegion(i), blue.getPlayers().get(i).getHomeRegionId());
        }
    }

    @Test
    void testGainingControlStartsAttack() {
        assertTrue(blue.getStateMachine().isInState(TeamStates.DEFENDING));
        blue.getStateMachine().update();
        assertTrue(blue.getStateMachine().isInState(TeamStates.DEFENDING), "No control, no attack");

        blue.setControllingPlayer(blue.getPlayers().get(1));
        blue.getStateMachine().update();

        assertTrue(blue.getStateMachine().isInState(TeamStates.ATTACKING));
        for (int i = 0; i < 5; i++) {
            assertEquals(TeamColor.BLUE.attackingRegion(i), blue.getPlayers().get(i).getHomeRegionId());
        }
    }

    @Test
    void testKickOffOnceBothTeamsAreHome() {
        pitch.setGameOn(false);
        blue.getStateMachine().changeState(TeamStates.PREPARE_FOR_KICK_OFF);
        red.getStateMachine().changeState(TeamStates.PREPARE_FOR_KICK_OFF);
        var straggler = red.getPlayers().get(3);
        var home = straggler.getPosition();
        straggler.setPosition(new Point3f());

        blue.getStateMachine().update();

        assertTrue(blue.getStateMachine().isInState(TeamStates.PREPARE_FOR_KICK_OFF), "Waits for the opponents");
        assertFalse(pitch.isGameOn());

        straggler.setPosition(home);
        blue.getStateMachine().update();

        assertTrue(blue.getStateMachine().isInState(TeamStates.DEFENDING));
        assertTrue(pitch.isGameOn());
        for (int i = 0; i < 5; i++) {
            assertEquals(TeamColor.BLUE.defendingRegion(i), blue.getPlayers().get(i).getHomeRegionId());
        }
    }

    @Test
    void testNoPositionsWhilePreparingKickOff() {
        blue.getStateMachine().changeState(TeamStates.PREPARE_FOR_KICK_OFF);
        assertThrows(IllegalStateException.class, () -> blue.setupTeamPositions());
    }

    @Test
    void testClosestPlayerToBall() {
        var defender = blue.getPlayers().get(3);
        pitch.getBall().placeAtPosition(defender.getPosition());

        blue.calculateClosestPlayerToBall();

        assertSame(defender, blue.getPlayerClosestToBall());
        assertEquals(0, blue.getDistanceSqToBallOfClosestPlayer(), EPSILON);
        assertTrue(defender.isClosestTeamMemberToBall());
    }

    @Test
    void testPassRequestWithoutControllerIgnored() {
        assertDoesNotThrow(() -> blue.requestPass(blue.getPlayers().get(2)));
    }

    @Test
    void testResetKeyPlayers() {
        var players = blue.getPlayers();
        blue.setControllingPlayer(players.get(1));
        blue.setSupportingPlayer(players.get(2));
        blue.setReceivingPlayer(players.get(3));

        blue.resetKeyPlayers();

        assertNull(blue.getControllingPlayer());
        assertNull(blue.getSupportingPlayer());
        assertNull(blue.getReceivingPlayer());
        assertNull(blue.getPlayerClosestToBall());
    }
}
