package com.ivamare.kernelbus.exception;

/**
 * Base exception for all Kernel Bus errors.
 */
public class KernelBusException extends RuntimeException {

    public KernelBusException(String message) {
        super(message);
    }

    public KernelBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
