package com.ivamare.kernelbus.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An audit entry before it is sequenced and hashed by the chain appender.
 *
 * @param action Audited action
 * @param actor Actor that performed it
 * @param trustLevel Trust level of the actor
 * @param details Structured details
 * @param recordedAt When the action was recorded
 */
public record AuditRecord(
    String action,
    String actor,
    TrustLevel trustLevel,
    Map<String, Object> details,
    Instant recordedAt
) {
    public AuditRecord {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(trustLevel, "trustLevel");
        Objects.requireNonNull(recordedAt, "recordedAt");
        details = details != null ? details : Map.of();
    }

    /**
     * Stamp an audit request with the time it was recorded.
     */
    public static AuditRecord from(AuditRequest request, Instant recordedAt) {
        return new AuditRecord(
            request.action(),
            request.actor(),
            request.trustLevel(),
            request.details(),
            recordedAt
        );
    }
}
