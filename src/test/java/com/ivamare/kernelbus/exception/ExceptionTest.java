package com.ivamare.kernelbus.exception;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Nested
    class KernelBusExceptionTest {

        @Test
        void shouldCreateWithMessage() {
            KernelBusException exception = new KernelBusException("Test message");
            assertEquals("Test message", exception.getMessage());
            assertNull(exception.getCause());
        }

        @Test
        void shouldCreateWithMessageAndCause() {
            RuntimeException cause = new RuntimeException("Original error");
            KernelBusException exception = new KernelBusException("Test message", cause);
            assertEquals("Test message", exception.getMessage());
            assertEquals(cause, exception.getCause());
        }

        @Test
        void shouldBeRuntimeException() {
            KernelBusException exception = new KernelBusException("Test");
            assertInstanceOf(RuntimeException.class, exception);
        }
    }

    @Nested
    class AuditStorageExceptionTest {

        @Test
        void shouldIncludePathInMessage() {
            Path path = Path.of("data", "audit.jsonl");
            AuditStorageException exception = new AuditStorageException(path, "Cannot read store");

            assertEquals("Cannot read store (" + path + ")", exception.getMessage());
            assertEquals(path, exception.getPath());
            assertInstanceOf(KernelBusException.class, exception);
        }

        @Test
        void shouldKeepCause() {
            IOException cause = new IOException("No space left on device");
            AuditStorageException exception = new AuditStorageException(Path.of("a"), "Cannot append", cause);

            assertSame(cause, exception.getCause());
        }
    }

    @Nested
    class CheckpointConfigurationExceptionTest {

        @Test
        void shouldBeKernelBusException() {
            CheckpointConfigurationException exception = new CheckpointConfigurationException("No secret");

            assertEquals("No secret", exception.getMessage());
            assertInstanceOf(KernelBusException.class, exception);
        }
    }

    @Nested
    class InvalidOperationExceptionTest {

        @Test
        void shouldBeKernelBusException() {
            InvalidOperationException exception = new InvalidOperationException("Not loaded");

            assertEquals("Not loaded", exception.getMessage());
            assertInstanceOf(KernelBusException.class, exception);
        }
    }
}
