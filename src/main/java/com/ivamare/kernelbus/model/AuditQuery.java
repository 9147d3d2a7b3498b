package com.ivamare.kernelbus.model;

import java.time.Instant;

/**
 * Filter for reading audit entries. Every field is optional.
 *
 * @param action Only entries with this action (nullable)
 * @param since Only entries recorded at or after this instant (nullable)
 * @param until Only entries recorded at or before this instant (nullable)
 * @param limit Maximum number of entries to return (nullable = unbounded)
 * @param offset Number of matching entries to skip (nullable = 0)
 */
public record AuditQuery(
    String action,
    Instant since,
    Instant until,
    Integer limit,
    Integer offset
) {
    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null);
    }

    public static AuditQuery forAction(String action) {
        return new AuditQuery(action, null, null, null, null);
    }

    public AuditQuery withAction(String action) {
        return new AuditQuery(action, since, until, limit, offset);
    }

    public AuditQuery between(Instant since, Instant until) {
        return new AuditQuery(action, since, until, limit, offset);
    }

    public AuditQuery page(int offset, int limit) {
        return new AuditQuery(action, since, until, limit, offset);
    }

    /**
     * Check whether an entry passes the action and time filters.
     */
    public boolean matches(AuditEntry entry) {
        if (action != null && !action.equals(entry.action())) {
            return false;
        }
        if (since != null && entry.recordedAt().isBefore(since)) {
            return false;
        }
        return until == null || !entry.recordedAt().isAfter(until);
    }
}
