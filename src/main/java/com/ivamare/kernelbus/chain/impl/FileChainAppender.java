package com.ivamare.kernelbus.chain.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.chain.EntryHasher;
import com.ivamare.kernelbus.checkpoint.CheckpointManager;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.exception.InvalidOperationException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditQuery;
import com.ivamare.kernelbus.model.AuditRecord;
import com.ivamare.kernelbus.store.JsonLinesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Chain appender backed by a JSON Lines file.
 *
 * <p>Appends are serialized on this instance. An entry is written and forced to
 * disk before it becomes visible in the index, and the checkpoint manager is
 * notified after that.
 */
public class FileChainAppender implements ChainAppender {

    private static final Logger log = LoggerFactory.getLogger(FileChainAppender.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final JsonLinesStore<AuditEntry> store;
    private final ObjectMapper objectMapper;
    private final EntryHasher hasher;

    private final ConcurrentNavigableMap<Long, AuditEntry> index = new ConcurrentSkipListMap<>();

    private volatile CheckpointManager checkpointManager;
    private volatile boolean loaded;

    public FileChainAppender(JsonLinesStore<AuditEntry> store, ObjectMapper objectMapper, EntryHasher hasher) {
        this.store = Objects.requireNonNull(store, "store");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    /**
     * Attach the checkpoint manager notified after every append.
     *
     * @param checkpointManager The manager (nullable to detach)
     */
    public void setCheckpointManager(CheckpointManager checkpointManager) {
        this.checkpointManager = checkpointManager;
    }

    @Override
    public synchronized void load() {
        List<AuditEntry> entries = store.readAll();
        index.clear();
        for (AuditEntry entry : entries) {
            index.put(entry.sequence(), entry);
        }
        loaded = true;

        if (entries.isEmpty()) {
            log.info("Audit store {} is empty", store.path());
        } else {
            log.info("Loaded {} audit entries from {} (tip sequence={})",
                entries.size(), store.path(), index.lastKey());
        }
    }

    @Override
    public synchronized AuditEntry append(AuditRecord record) {
        if (!loaded) {
            throw new InvalidOperationException("Audit chain must be loaded before appending");
        }

        Map.Entry<Long, AuditEntry> tip = index.lastEntry();
        long sequence = tip == null ? 0 : tip.getKey() + 1;
        String prevHash = tip == null ? EntryHasher.GENESIS_HASH : tip.getValue().hash();
        Map<String, Object> details = normalizeDetails(record.details());

        String hash = hasher.hash(sequence, record.action(), record.actor(), record.trustLevel(),
            details, record.recordedAt(), prevHash);
        AuditEntry entry = new AuditEntry(
            sequence,
            record.action(),
            record.actor(),
            record.trustLevel(),
            details,
            record.recordedAt(),
            prevHash,
            hash
        );

        store.append(entry);
        index.put(sequence, entry);
        log.debug("Audit entry appended (sequence={}, action={})", sequence, record.action());

        notifyCheckpointManager(sequence);
        return entry;
    }

    private void notifyCheckpointManager(long sequence) {
        CheckpointManager manager = checkpointManager;
        if (manager == null) {
            return;
        }
        try {
            manager.maybeCheckpoint(sequence);
        } catch (AuditStorageException e) {
            // The entry itself is durable; the manager retries on the next append
            log.warn("Checkpoint after sequence {} failed: {}", sequence, e.getMessage());
        }
    }

    /**
     * Round-trip details through JSON text, so the in-memory entry holds exactly
     * the values a later read of the store produces and hashes the same.
     */
    private Map<String, Object> normalizeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        try {
            String json = objectMapper.writeValueAsString(details);
            return Collections.unmodifiableMap(objectMapper.readValue(json, DETAILS_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit details are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public List<AuditEntry> getEntries() {
        return List.copyOf(index.values());
    }

    @Override
    public Optional<AuditEntry> getEntry(long sequence) {
        return Optional.ofNullable(index.get(sequence));
    }

    @Override
    public Optional<AuditEntry> getTip() {
        Map.Entry<Long, AuditEntry> tip = index.lastEntry();
        return tip == null ? Optional.empty() : Optional.of(tip.getValue());
    }

    @Override
    public long size() {
        return index.size();
    }

    @Override
    public List<AuditEntry> query(AuditQuery query) {
        int offset = query.offset() != null ? Math.max(0, query.offset()) : 0;
        long limit = query.limit() != null ? Math.max(0, query.limit()) : Long.MAX_VALUE;
        return index.values().stream()
            .filter(query::matches)
            .skip(offset)
            .limit(limit)
            .toList();
    }

    @Override
    public List<AuditEntry> readStoredEntries() {
        return store.readAll();
    }

    @Override
    public boolean storeExists() {
        return store.exists();
    }
}
