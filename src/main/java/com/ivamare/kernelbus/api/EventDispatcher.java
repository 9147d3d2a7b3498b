package com.ivamare.kernelbus.api;

import com.ivamare.kernelbus.event.EventType;
import com.ivamare.kernelbus.event.Subscription;
import com.ivamare.kernelbus.handler.AsyncEventHandler;
import com.ivamare.kernelbus.handler.EventHandler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * In-process publish/subscribe dispatcher.
 *
 * <p>The EventDispatcher provides the main API for:
 * <ul>
 *   <li>Registering and removing subscribers per event name</li>
 *   <li>Fire-and-forget publishing with per-subscriber fault isolation</li>
 *   <li>Waiting for outstanding deliveries ({@link #drain()})</li>
 *   <li>Observing handler faults</li>
 * </ul>
 *
 * <p>Delivery guarantees:
 * <ul>
 *   <li>Publishes of the same event name reach each handler in publish order</li>
 *   <li>Within one publish, handlers are scheduled in registration order but
 *       never wait for each other</li>
 *   <li>No ordering between different event names</li>
 *   <li>A throwing, slow or timed-out handler does not delay or affect the others</li>
 * </ul>
 */
public interface EventDispatcher {

    // --- Subscription ---

    /**
     * Register a handler for an event.
     *
     * @param type The event type
     * @param handler The handler
     * @param <T> payload type
     * @return handle that removes exactly this registration
     */
    <T> Subscription subscribe(EventType<T> type, EventHandler<T> handler);

    /**
     * Register an asynchronous handler for an event.
     *
     * @param type The event type
     * @param handler The handler; the invocation ends when its returned stage completes
     * @param <T> payload type
     * @return handle that removes exactly this registration
     */
    <T> Subscription subscribeAsync(EventType<T> type, AsyncEventHandler<T> handler);

    /**
     * Register a handler that is invoked at most once.
     *
     * <p>The registration is removed before the handler runs, so re-entrant or
     * already queued publishes never reach it a second time.
     *
     * @param type The event type
     * @param handler The handler
     * @param <T> payload type
     * @return handle that removes the registration if it has not fired yet
     */
    <T> Subscription subscribeOnce(EventType<T> type, EventHandler<T> handler);

    /**
     * Remove every registration of the given handler reference for an event.
     * No-op if the handler is not registered.
     *
     * @param type The event type
     * @param handler The handler reference passed to a subscribe method
     */
    void unsubscribe(EventType<?> type, Object handler);

    /**
     * Remove every subscription for every event and reset the handler error counter.
     */
    void clear();

    /**
     * @param eventName The event name
     * @return number of active registrations for the event
     */
    int listenerCount(String eventName);

    /**
     * @param type The event type
     * @return number of active registrations for the event
     */
    default int listenerCount(EventType<?> type) {
        return listenerCount(type.name());
    }

    // --- Publishing ---

    /**
     * Publish an event to the current subscribers.
     *
     * <p>The subscriber list is snapshotted synchronously; delivery happens on the
     * dispatcher's threads. Returns immediately and never throws.
     *
     * @param type The event type
     * @param payload The payload (may be null)
     * @param <T> payload type
     */
    <T> void publish(EventType<T> type, T payload);

    /**
     * Wait for every delivery scheduled by earlier {@code publish} calls.
     *
     * @return future completing once those invocations have settled
     *     (succeeded, failed or timed out)
     */
    CompletableFuture<Void> drain();

    // --- Observability ---

    /**
     * @return cumulative number of handler invocations that threw or timed out
     */
    long handlerErrorCount();

    /**
     * Reset the handler error counter to zero.
     */
    void resetHandlerErrorCount();

    /**
     * @return number of publishes whose delivery has not settled yet
     */
    int pendingCount();

    // --- Configuration & lifecycle ---

    /**
     * Set the ceiling on a single handler invocation. An invocation exceeding it
     * is counted as failed but is not interrupted.
     *
     * @param timeout The timeout; {@link Duration#ZERO} disables it
     */
    void setHandlerTimeout(Duration timeout);

    /**
     * @return current handler timeout
     */
    Duration getHandlerTimeout();

    /**
     * Stop accepting publishes, wait for outstanding deliveries and release threads.
     *
     * @param timeout Maximum time to wait for outstanding deliveries
     */
    void shutdown(Duration timeout);
}
