package com.ivamare.kernelbus.verify;

import com.ivamare.kernelbus.chain.ChainReader;
import com.ivamare.kernelbus.chain.EntryHasher;
import com.ivamare.kernelbus.checkpoint.CheckpointManager;
import com.ivamare.kernelbus.checkpoint.CheckpointSigner;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.ChainVerification;
import com.ivamare.kernelbus.model.Checkpoint;
import com.ivamare.kernelbus.model.CheckpointVerification;
import com.ivamare.kernelbus.model.CheckpointVerification.Mismatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Verifies the stored audit chain and its checkpoints.
 *
 * <p>Both checks read a snapshot of the durable stores taken at call time, so
 * they see out-of-band modifications and may run concurrently with appends.
 * Integrity violations are reported as results; only storage faults are thrown.
 */
public class IntegrityVerifier {

    private static final Logger log = LoggerFactory.getLogger(IntegrityVerifier.class);

    /** Reported as {@code actual} when a checkpoint points past the end of the chain. */
    public static final String MISSING = "<missing>";

    private final ChainReader chain;
    private final CheckpointManager checkpoints;
    private final EntryHasher hasher;
    private final CheckpointSigner signer;

    public IntegrityVerifier(ChainReader chain, CheckpointManager checkpoints,
                             EntryHasher hasher, CheckpointSigner signer) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    /**
     * Walk the chain from entry 0 and stop at the first break.
     *
     * @return verification result; an empty or missing store is valid
     * @throws AuditStorageException if the store cannot be read or parsed
     */
    public ChainVerification verifyChain() {
        List<AuditEntry> entries = chain.readStoredEntries();

        String expectedPrevHash = EntryHasher.GENESIS_HASH;
        long checked = 0;
        for (AuditEntry entry : entries) {
            if (entry.sequence() != checked) {
                return broken(entry.sequence(),
                    "Sequence mismatch: expected " + checked + ", found " + entry.sequence(), checked);
            }
            String missing = missingField(entry);
            if (missing != null) {
                return broken(entry.sequence(),
                    "Malformed entry at sequence " + entry.sequence() + ": missing " + missing, checked);
            }
            if (!expectedPrevHash.equals(entry.prevHash())) {
                return broken(entry.sequence(), "Hash chain broken at sequence " + entry.sequence(), checked);
            }
            String computed = hasher.hash(entry);
            if (!computed.equals(entry.hash())) {
                return broken(entry.sequence(), "Hash verification failed at sequence " + entry.sequence(), checked);
            }
            expectedPrevHash = entry.hash();
            checked++;
        }

        log.debug("Audit chain verified ({} entries)", checked);
        return ChainVerification.valid(checked);
    }

    /**
     * Recompute the chain hash up to each checkpoint and its signature.
     *
     * @return every disagreeing field, in checkpoint order
     * @throws AuditStorageException if either store cannot be read or parsed
     */
    public CheckpointVerification verifyCheckpoints() {
        List<Checkpoint> stored = checkpoints.readStoredCheckpoints().stream()
            .sorted(Comparator.comparingLong(Checkpoint::atSequence))
            .toList();
        List<AuditEntry> entries = chain.readStoredEntries();

        List<String> rolling = rollingHashes(entries);
        List<Mismatch> mismatches = new ArrayList<>();

        for (Checkpoint checkpoint : stored) {
            long at = checkpoint.atSequence();
            String recomputed = at >= 0 && at < rolling.size() ? rolling.get((int) at) : MISSING;
            if (!recomputed.equals(checkpoint.tipHash())) {
                mismatches.add(new Mismatch(at, Mismatch.TIP_HASH, checkpoint.tipHash(), recomputed));
            }

            String signature = signer.sign(at, checkpoint.tipHash());
            if (!signer.verify(at, checkpoint.tipHash(), checkpoint.signature())) {
                mismatches.add(new Mismatch(at, Mismatch.SIGNATURE, signature, checkpoint.signature()));
            }
        }

        if (!mismatches.isEmpty()) {
            log.warn("Checkpoint verification found {} mismatches across {} checkpoints",
                mismatches.size(), stored.size());
        }
        return CheckpointVerification.of(stored.size(), mismatches);
    }

    /**
     * Hash of each position when the chain is rebuilt from genesis using the
     * stored fields but recomputed links. Stops at the first sequence gap or
     * malformed entry.
     */
    private List<String> rollingHashes(List<AuditEntry> entries) {
        List<String> hashes = new ArrayList<>(entries.size());
        String prevHash = EntryHasher.GENESIS_HASH;
        for (AuditEntry entry : entries) {
            if (entry.sequence() != hashes.size() || missingField(entry) != null) {
                break;
            }
            prevHash = hasher.rehash(entry, prevHash);
            hashes.add(prevHash);
        }
        return hashes;
    }

    /**
     * @return name of the first hashed field absent from a stored entry, or null
     */
    private static String missingField(AuditEntry entry) {
        if (entry.action() == null) {
            return "action";
        }
        if (entry.actor() == null) {
            return "actor";
        }
        if (entry.trustLevel() == null) {
            return "trustLevel";
        }
        if (entry.recordedAt() == null) {
            return "recordedAt";
        }
        if (entry.prevHash() == null) {
            return "prevHash";
        }
        if (entry.hash() == null) {
            return "hash";
        }
        return null;
    }

    private static ChainVerification broken(long sequence, String details, long checked) {
        log.warn("Audit chain verification failed: {}", details);
        return ChainVerification.broken(sequence, details, checked);
    }
}
