package com.ivamare.kernelbus.event;

import com.ivamare.kernelbus.model.AuditRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeTest {

    @Test
    void shouldCompareByName() {
        EventType<String> typed = EventType.of("user:login", String.class);
        EventType<Object> named = EventType.named("user:login");

        assertEquals(typed, named);
        assertEquals(typed.hashCode(), named.hashCode());
        assertNotEquals(typed, EventType.of("user:logout", String.class));
    }

    @Test
    void shouldExposeNameAndPayloadType() {
        assertEquals("audit:log", KernelEvents.AUDIT_LOG.name());
        assertEquals(AuditRequest.class, KernelEvents.AUDIT_LOG.payloadType());
        assertEquals("system:handler_error", KernelEvents.HANDLER_ERROR.toString());
    }

    @Test
    void shouldRequireName() {
        assertThrows(NullPointerException.class, () -> EventType.of(null, String.class));
    }
}
