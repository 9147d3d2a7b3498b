package com.ivamare.kernelbus.model;

import java.time.Instant;

/**
 * Payload of {@code audit:unavailable}, published when an audit request could not
 * be persisted after every retry.
 *
 * @param action Action of the request that was lost
 * @param reason Last storage error
 * @param attempts Number of attempts made
 * @param timestamp When the bridge gave up
 */
public record AuditUnavailable(
    String action,
    String reason,
    int attempts,
    Instant timestamp
) {}
