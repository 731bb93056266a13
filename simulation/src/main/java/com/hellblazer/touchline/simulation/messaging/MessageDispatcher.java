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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point to point, synchronous delivery of telegrams between registered handlers. Each pitch owns its own dispatcher
 * and hands it to the entities that talk through it.
 * <p>
 * Telegrams addressed from or to an unregistered id are dropped and logged at warn level. Telegrams the receiver
 * does not consume are part of normal play and only logged at debug level. Delivery runs on the caller's thread
 * before {@link #send} returns.
 *
 * @author hal.hildebrand
 */
public class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final Map<Integer, MessageHandler> registry = new HashMap<>();

    public void register(MessageHandler handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        var previous = registry.putIfAbsent(handler.getId(), handler);
        if (previous != null && previous != handler) {
            throw new IllegalArgumentException("Id " + handler.getId() + " is already registered to " + previous);
        }
    }

    public boolean isRegistered(int id) {
        return registry.containsKey(id);
    }

    public void unregister(MessageHandler handler) {
        registry.remove(handler.getId(), handler);
    }

    /**
     * Deliver a telegram without payload
     */
    public boolean send(int sender, int receiver, MessageKind kind) {
        return send(new Telegram(sender, receiver, kind));
    }

    /**
     * Deliver a telegram with payload
     */
    public boolean send(int sender, int receiver, MessageKind kind, Object payload) {
        return send(new Telegram(sender, receiver, kind, payload));
    }

    /**
     * Deliver the telegram to its receiver
     *
     * @return true if the receiver consumed the telegram
     */
    public boolean send(Telegram telegram) {
        if (!registry.containsKey(telegram.sender())) {
            log.warn("Sender {} of {} is not registered", telegram.sender(), telegram);
            return false;
        }
        var receiver = registry.get(telegram.receiver());
        if (receiver == null) {
            log.warn("Receiver {} of {} is not registered", telegram.receiver(), telegram);
            return false;
        }
        var handled = receiver.handleMessage(telegram);
        if (!handled) {
            log.debug("{} was not handled by {}", telegram, receiver);
        }
        return handled;
    }
}
