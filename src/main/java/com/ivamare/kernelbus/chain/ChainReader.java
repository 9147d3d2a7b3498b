package com.ivamare.kernelbus.chain;

import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditQuery;

import java.util.List;
import java.util.Optional;

/**
 * Read API of the audit chain.
 */
public interface ChainReader {

    /**
     * @return copy of the loaded entries, ordered by sequence
     */
    List<AuditEntry> getEntries();

    /**
     * @param sequence Entry sequence
     * @return the loaded entry, if present
     */
    Optional<AuditEntry> getEntry(long sequence);

    /**
     * @return the last loaded entry, if any
     */
    Optional<AuditEntry> getTip();

    /**
     * @return number of loaded entries
     */
    long size();

    /**
     * Filter loaded entries by action and time, then apply offset and limit.
     *
     * @param query The filter
     * @return matching entries ordered by sequence
     */
    List<AuditEntry> query(AuditQuery query);

    /**
     * Read a snapshot of the durable store, bypassing the in-memory index.
     *
     * @return stored entries in file order
     * @throws AuditStorageException if the store cannot be read or parsed
     */
    List<AuditEntry> readStoredEntries();

    /**
     * @return false on a fresh install (no store yet)
     */
    boolean storeExists();
}
