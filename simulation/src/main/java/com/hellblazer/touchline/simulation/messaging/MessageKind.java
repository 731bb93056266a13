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
package com.hellblazer.touchline.simulation.messaging;

/**
 * The fixed vocabulary of telegrams exchanged between players and teams
 *
 * @author hal.hildebrand
 */
public enum MessageKind {
    /** A pass is on its way; payload is the {@code Point3f} the ball is kicked towards */
    RECEIVE_BALL,
    /** A teammate asks the controlling player for a pass; payload is the requesting player */
    PASS_TO_ME,
    /** Move to the best supporting spot */
    SUPPORT_ATTACKER,
    /** Return to the home region */
    GO_HOME
}
