package com.ivamare.kernelbus.chain;

import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.exception.InvalidOperationException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditRecord;

/**
 * Sole writer of the hash-chained audit store.
 *
 * <p>Single-writer: only the audit bridge is expected to call {@link #append}.
 * Implementations serialize appends within one process; other processes
 * writing the same store are not supported.
 */
public interface ChainAppender extends ChainReader {

    /**
     * Read the durable store into the in-memory index. Safe to call repeatedly;
     * each call re-reads the store. A missing store is an empty chain.
     *
     * @throws AuditStorageException if the store cannot be read or parsed
     */
    void load();

    /**
     * Sequence, link, hash and durably append a record.
     *
     * @param record The record to append
     * @return the persisted entry
     * @throws AuditStorageException if the store cannot be written
     * @throws InvalidOperationException if {@link #load()} has not been called
     * @throws IllegalArgumentException if the details cannot be represented as JSON
     */
    AuditEntry append(AuditRecord record);
}
