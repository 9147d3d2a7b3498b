package com.ivamare.kernelbus.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.TrustLevel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Computes entry hashes over a canonical form.
 *
 * <p>The canonical form is the compact JSON array
 * {@code [sequence, action, actor, trustLevel, details, recordedAt, prevHash]}
 * where object keys inside {@code details} are sorted recursively and
 * {@code recordedAt} is ISO-8601 UTC. It does not depend on locale, on map
 * iteration order or on the configuration of any application ObjectMapper.
 */
public final class EntryHasher {

    /** prevHash of the entry with sequence 0. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    /**
     * Canonical string of an entry's hashed fields.
     */
    public String canonicalize(long sequence, String action, String actor, TrustLevel trustLevel,
                               Map<String, Object> details, Instant recordedAt, String prevHash) {
        ArrayNode node = CANONICAL_MAPPER.createArrayNode();
        node.add(sequence);
        node.add(action);
        node.add(actor);
        node.add(trustLevel.getValue());
        node.add(normalize(CANONICAL_MAPPER.valueToTree(details != null ? details : Map.of())));
        node.add(DateTimeFormatter.ISO_INSTANT.format(recordedAt));
        node.add(prevHash);
        try {
            return CANONICAL_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot canonicalize audit entry " + sequence, e);
        }
    }

    /**
     * Hash of an entry's fields.
     */
    public String hash(long sequence, String action, String actor, TrustLevel trustLevel,
                       Map<String, Object> details, Instant recordedAt, String prevHash) {
        return sha256Hex(canonicalize(sequence, action, actor, trustLevel, details, recordedAt, prevHash));
    }

    /**
     * Recompute the hash of a stored entry from its own fields.
     */
    public String hash(AuditEntry entry) {
        return rehash(entry, entry.prevHash());
    }

    /**
     * Recompute the hash of a stored entry as if it followed {@code prevHash}.
     */
    public String rehash(AuditEntry entry, String prevHash) {
        return hash(entry.sequence(), entry.action(), entry.actor(), entry.trustLevel(),
            entry.details(), entry.recordedAt(), prevHash);
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static JsonNode normalize(JsonNode node) {
        if (node == null || node.isNull()) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            ObjectNode sorted = CANONICAL_MAPPER.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String field : fields) {
                sorted.set(field, normalize(node.get(field)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = CANONICAL_MAPPER.createArrayNode();
            for (JsonNode item : node) {
                array.add(normalize(item));
            }
            return array;
        }
        return node;
    }
}
