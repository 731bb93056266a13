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

import com.hellblazer.touchline.simulation.fsm.State;

/**
 * Team level behavior: switching between attack and defense, and regrouping before kick off.
 *
 * @author hal.hildebrand
 */
public enum TeamStates implements State<Team> {
    ATTACKING {
        @Override
        public void enter(Team team) {
            team.setupTeamPositions();
            team.updateTargetsOfWaitingPlayers();
        }

        @Override
        public void execute(Team team) {
            if (!team.isInControl()) {
                team.getStateMachine().changeState(DEFENDING);
                return;
            }
            team.calculateBestSupportingPosition();
        }

        @Override
        public void exit(Team team) {
            team.setSupportingPlayer(null);
        }
    },
    DEFENDING {
        @Override
        public void enter(Team team) {
            team.setupTeamPositions();
            team.updateTargetsOfWaitingPlayers();
        }

        @Override
        public void execute(Team team) {
            if (team.isInControl()) {
                team.getStateMachine().changeState(ATTACKING);
            }
        }
    },
    /**
     * Everybody walks back to the kick off positions. Play resumes once both teams are in place.
     */
    PREPARE_FOR_KICK_OFF {
        @Override
        public void enter(Team team) {
            team.resetKeyPlayers();
            team.returnAllFieldPlayersToHome(true);
        }

        @Override
        public void execute(Team team) {
            if (team.isAllPlayersAtHome() && team.getOpponents().isAllPlayersAtHome()) {
                team.getStateMachine().changeState(DEFENDING);
            }
        }

        @Override
        public void exit(Team team) {
            team.getPitch().setGameOn(true);
        }
    }
}
