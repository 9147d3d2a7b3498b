package com.ivamare.kernelbus.event;

import java.time.Instant;

/**
 * An ephemeral event delivered to subscribers. Never persisted by the dispatcher.
 *
 * @param type Event type (name and payload class)
 * @param payload Event payload (may be null)
 * @param emittedAt When {@code publish} was called
 * @param <T> payload type
 */
public record Event<T>(
    EventType<T> type,
    T payload,
    Instant emittedAt
) {
    public String name() {
        return type.name();
    }
}
