package com.ivamare.kernelbus.exception;

import java.nio.file.Path;

/**
 * Thrown when the durable audit store cannot be read or written.
 *
 * <p>Callers must treat this as "integrity unknown", which is distinct from
 * a detected integrity violation (those are reported as values).
 */
public class AuditStorageException extends KernelBusException {

    private final Path path;

    public AuditStorageException(Path path, String message) {
        super(message + " (" + path + ")");
        this.path = path;
    }

    public AuditStorageException(Path path, String message, Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
