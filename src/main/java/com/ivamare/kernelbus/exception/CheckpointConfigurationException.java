package com.ivamare.kernelbus.exception;

/**
 * Thrown at startup when checkpoints cannot be signed safely,
 * e.g. no HMAC secret is configured or the secret is too short.
 */
public class CheckpointConfigurationException extends KernelBusException {

    public CheckpointConfigurationException(String message) {
        super(message);
    }

    public CheckpointConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
