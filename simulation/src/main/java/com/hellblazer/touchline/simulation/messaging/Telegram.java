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

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable message delivered synchronously from one registered entity to another. The payload is optional and its
 * type depends on the {@link MessageKind}.
 *
 * @author hal.hildebrand
 */
public record Telegram(int sender, int receiver, MessageKind kind, Object payload) {

    public Telegram {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public Telegram(int sender, int receiver, MessageKind kind) {
        this(sender, receiver, kind, null);
    }

    /**
     * The payload viewed as the expected type
     *
     * @throws IllegalStateException if the payload is missing or of another type
     */
    public <T> T payload(Class<T> type) {
        return payloadAs(type).orElseThrow(
        () -> new IllegalStateException("Telegram " + kind + " carries no " + type.getSimpleName() + ": " + payload));
    }

    public <T> Optional<T> payloadAs(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    @Override
    public String toString() {
        return String.format("Telegram{%s %d -> %d}", kind, sender, receiver);
    }
}
