package com.ivamare.kernelbus.handler;

import com.ivamare.kernelbus.event.Event;

/**
 * Functional interface for synchronous event subscribers.
 *
 * <p>Any exception thrown is caught by the dispatcher, counted as a handler
 * fault and logged; it never reaches the publisher or other subscribers.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface EventHandler<T> {

    /**
     * Handle an event.
     *
     * @param event The delivered event
     * @throws Exception on processing failure
     */
    void handle(Event<T> event) throws Exception;
}
