package com.ivamare.kernelbus.checkpoint.impl;

import com.ivamare.kernelbus.chain.ChainReader;
import com.ivamare.kernelbus.checkpoint.CheckpointManager;
import com.ivamare.kernelbus.checkpoint.CheckpointSigner;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.Checkpoint;
import com.ivamare.kernelbus.store.JsonLinesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Checkpoint manager backed by a JSON Lines file.
 *
 * <p>A checkpoint is due after every {@code everyEntries}-th entry, when
 * {@code interval} has elapsed since the last checkpoint (or since load), or
 * when the previous attempt to write one failed.
 */
public class FileCheckpointManager implements CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointManager.class);

    private final JsonLinesStore<Checkpoint> store;
    private final ChainReader chain;
    private final CheckpointSigner signer;
    private final long everyEntries;
    private final Duration interval;
    private final Clock clock;

    private final List<Checkpoint> checkpoints = new CopyOnWriteArrayList<>();

    // Guarded by this
    private Instant lastCheckpointAt;
    private boolean retryPending;

    /**
     * @param store Checkpoint store
     * @param chain Chain whose tip is checkpointed
     * @param signer HMAC signer
     * @param everyEntries Entry-count cadence; 0 disables it
     * @param interval Wall-clock cadence; {@link Duration#ZERO} disables it
     * @param clock Clock for the wall-clock cadence and {@code recordedAt}
     */
    public FileCheckpointManager(JsonLinesStore<Checkpoint> store, ChainReader chain, CheckpointSigner signer,
                                 long everyEntries, Duration interval, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (everyEntries < 0) {
            throw new IllegalArgumentException("everyEntries must not be negative: " + everyEntries);
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative: " + interval);
        }
        this.everyEntries = everyEntries;
        this.lastCheckpointAt = clock.instant();
    }

    @Override
    public synchronized void load() {
        List<Checkpoint> stored = store.readAll();
        checkpoints.clear();
        checkpoints.addAll(stored.stream()
            .sorted(Comparator.comparingLong(Checkpoint::atSequence))
            .toList());
        lastCheckpointAt = clock.instant();
        retryPending = false;
        log.info("Loaded {} checkpoints from {}", checkpoints.size(), store.path());
    }

    @Override
    public synchronized void maybeCheckpoint(long afterSequence) {
        if (!isDue(afterSequence)) {
            return;
        }
        Optional<AuditEntry> entry = chain.getEntry(afterSequence);
        if (entry.isEmpty()) {
            log.warn("Cannot checkpoint sequence {}: entry not loaded", afterSequence);
            return;
        }
        record(entry.get());
    }

    @Override
    public synchronized Optional<Checkpoint> checkpoint() {
        Optional<AuditEntry> tip = chain.getTip();
        if (tip.isEmpty()) {
            return Optional.empty();
        }
        Checkpoint last = lastCheckpoint();
        if (last != null && last.atSequence() == tip.get().sequence()) {
            return Optional.of(last);
        }
        return Optional.of(record(tip.get()));
    }

    private boolean isDue(long afterSequence) {
        if (retryPending) {
            return true;
        }
        if (everyEntries > 0 && (afterSequence + 1) % everyEntries == 0) {
            return true;
        }
        return !interval.isZero() && !clock.instant().isBefore(lastCheckpointAt.plus(interval));
    }

    private Checkpoint record(AuditEntry entry) {
        Checkpoint last = lastCheckpoint();
        if (last != null && last.atSequence() >= entry.sequence()) {
            retryPending = false;
            return last;
        }

        Instant now = clock.instant();
        Checkpoint checkpoint = new Checkpoint(
            entry.sequence(),
            entry.hash(),
            now,
            signer.sign(entry.sequence(), entry.hash())
        );

        try {
            store.append(checkpoint);
        } catch (AuditStorageException e) {
            retryPending = true;
            throw e;
        }

        checkpoints.add(checkpoint);
        lastCheckpointAt = now;
        retryPending = false;
        log.info("Checkpoint recorded at sequence {}", entry.sequence());
        return checkpoint;
    }

    private Checkpoint lastCheckpoint() {
        return checkpoints.isEmpty() ? null : checkpoints.get(checkpoints.size() - 1);
    }

    @Override
    public List<Checkpoint> getCheckpoints() {
        return List.copyOf(checkpoints);
    }

    @Override
    public List<Checkpoint> readStoredCheckpoints() {
        return store.readAll();
    }
}
