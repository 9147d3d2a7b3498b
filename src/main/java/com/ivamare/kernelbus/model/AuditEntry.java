package com.ivamare.kernelbus.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted, hash-chained audit entry.
 *
 * <p>{@code hash} covers every other field; {@code prevHash} equals the hash of
 * the entry with {@code sequence - 1}, or the genesis hash for sequence 0.
 *
 * @param sequence Monotonic, gapless position in the chain (0-based)
 * @param action Audited action
 * @param actor Actor that performed it
 * @param trustLevel Trust level of the actor
 * @param details Structured details
 * @param recordedAt When the action was recorded
 * @param prevHash Hash of the previous entry
 * @param hash SHA-256 of this entry's canonical form, lower-case hex
 */
@JsonPropertyOrder({"sequence", "action", "actor", "trustLevel", "details", "recordedAt", "prevHash", "hash"})
public record AuditEntry(
    long sequence,
    String action,
    String actor,
    TrustLevel trustLevel,
    Map<String, Object> details,
    Instant recordedAt,
    String prevHash,
    String hash
) {
    public AuditEntry {
        details = details != null ? details : Map.of();
    }
}
