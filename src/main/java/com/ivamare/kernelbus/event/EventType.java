package com.ivamare.kernelbus.event;

import java.util.Objects;

/**
 * Typed key for an event name.
 *
 * <p>Declaring an event once as a constant gives compile-time checked
 * {@code publish}/{@code subscribe} pairs:
 * <pre>
 * public static final EventType&lt;Login&gt; LOGIN = EventType.of("user:login", Login.class);
 *
 * dispatcher.subscribe(LOGIN, event -&gt; greet(event.payload().userId()));
 * dispatcher.publish(LOGIN, new Login("alice"));
 * </pre>
 *
 * <p>Two event types are equal when their names are equal; the dispatcher keys
 * its registry by name only.
 *
 * @param <T> payload type
 */
public final class EventType<T> {

    private final String name;
    private final Class<T> payloadType;

    private EventType(String name, Class<T> payloadType) {
        this.name = Objects.requireNonNull(name, "name");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    public static <T> EventType<T> of(String name, Class<T> payloadType) {
        return new EventType<>(name, payloadType);
    }

    /**
     * Untyped event type, used for subscribers discovered by annotation.
     */
    public static EventType<Object> named(String name) {
        return new EventType<>(name, Object.class);
    }

    public String name() {
        return name;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventType<?> other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
