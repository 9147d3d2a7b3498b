package com.ivamare.kernelbus.exception;

/**
 * Thrown when an operation is attempted in a state that does not allow it.
 */
public class InvalidOperationException extends KernelBusException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
