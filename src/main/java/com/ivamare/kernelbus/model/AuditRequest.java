package com.ivamare.kernelbus.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of the reserved {@code audit:log} event.
 *
 * @param action What happened (e.g. "login")
 * @param actor Who did it
 * @param trustLevel Trust level of the actor
 * @param details Structured details; copied on construction
 */
public record AuditRequest(
    String action,
    String actor,
    TrustLevel trustLevel,
    Map<String, Object> details
) {
    public AuditRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(trustLevel, "trustLevel");
        details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Map.of();
    }

    /**
     * Create a request without details.
     */
    public static AuditRequest of(String action, String actor, TrustLevel trustLevel) {
        return new AuditRequest(action, actor, trustLevel, Map.of());
    }
}
