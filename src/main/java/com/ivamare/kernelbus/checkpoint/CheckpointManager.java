package com.ivamare.kernelbus.checkpoint;

import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.Checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Records signed snapshots of the chain tip so that truncation or rollback of
 * the audit store can be detected.
 */
public interface CheckpointManager {

    /**
     * Read stored checkpoints and reset the wall-clock cadence.
     *
     * @throws AuditStorageException if the checkpoint store cannot be read
     */
    void load();

    /**
     * Called after every append. Records a checkpoint at {@code afterSequence}
     * when the entry-count or wall-clock cadence is due.
     *
     * @param afterSequence Sequence of the entry just appended
     * @throws AuditStorageException if a due checkpoint cannot be written
     */
    void maybeCheckpoint(long afterSequence);

    /**
     * Record a checkpoint at the current tip regardless of cadence.
     *
     * @return the checkpoint, or empty if the chain is empty
     */
    Optional<Checkpoint> checkpoint();

    /**
     * @return loaded checkpoints ordered by sequence
     */
    List<Checkpoint> getCheckpoints();

    /**
     * Read a snapshot of the checkpoint store, bypassing the in-memory list.
     *
     * @return stored checkpoints in file order
     */
    List<Checkpoint> readStoredCheckpoints();
}
