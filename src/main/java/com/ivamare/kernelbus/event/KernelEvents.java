package com.ivamare.kernelbus.event;

import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditRequest;
import com.ivamare.kernelbus.model.AuditUnavailable;
import com.ivamare.kernelbus.model.HandlerError;

/**
 * Event types reserved by the kernel.
 */
public final class KernelEvents {

    private KernelEvents() {
    }

    /** Audit ingestion channel. Any component may publish; only the audit bridge subscribes. */
    public static final EventType<AuditRequest> AUDIT_LOG =
        EventType.of("audit:log", AuditRequest.class);

    /** Published by the audit bridge after an entry has been appended. */
    public static final EventType<AuditEntry> AUDIT_LOGGED =
        EventType.of("audit:logged", AuditEntry.class);

    /** Published by the audit bridge when a request could not be persisted after retries. */
    public static final EventType<AuditUnavailable> AUDIT_UNAVAILABLE =
        EventType.of("audit:unavailable", AuditUnavailable.class);

    /** Published by the dispatcher when a subscriber throws or times out. */
    public static final EventType<HandlerError> HANDLER_ERROR =
        EventType.of("system:handler_error", HandlerError.class);
}
