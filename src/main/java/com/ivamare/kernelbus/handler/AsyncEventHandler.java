package com.ivamare.kernelbus.handler;

import com.ivamare.kernelbus.event.Event;

import java.util.concurrent.CompletionStage;

/**
 * Functional interface for asynchronous event subscribers.
 *
 * <p>The invocation is complete when the returned stage completes. An
 * exceptionally completed stage counts as a handler fault, as does a stage that
 * does not complete within the dispatcher's handler timeout.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface AsyncEventHandler<T> {

    /**
     * Handle an event.
     *
     * @param event The delivered event
     * @return stage completing when handling is done (null is treated as done)
     */
    CompletionStage<?> handle(Event<T> event);
}
