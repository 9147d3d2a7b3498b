package com.ivamare.kernelbus.model;

import java.time.Instant;

/**
 * Payload of {@code system:handler_error}, published when a subscriber fails.
 *
 * @param event Name of the event whose handler failed
 * @param error Error message
 * @param handler Description of the failing handler
 * @param timedOut Whether the failure was a handler timeout
 * @param timestamp When the failure was observed
 */
public record HandlerError(
    String event,
    String error,
    String handler,
    boolean timedOut,
    Instant timestamp
) {}
