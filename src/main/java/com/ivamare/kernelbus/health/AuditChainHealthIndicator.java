package com.ivamare.kernelbus.health;

import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.chain.ChainReader;
import com.ivamare.kernelbus.event.KernelEvents;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.ChainVerification;
import com.ivamare.kernelbus.model.CheckpointVerification;
import com.ivamare.kernelbus.verify.IntegrityVerifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the audit chain.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP when no store exists yet (fresh install) or the chain and checkpoints verify</li>
 *   <li>DOWN on a broken chain or a checkpoint mismatch</li>
 *   <li>DEGRADED when the most recent audit outcome was {@code audit:unavailable}</li>
 *   <li>UNKNOWN when the store cannot be read</li>
 * </ul>
 */
public class AuditChainHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Audit requests are being dropped");

    private final ChainReader chain;
    private final IntegrityVerifier verifier;

    private final AtomicReference<Instant> lastLogged = new AtomicReference<>();
    private final AtomicReference<Instant> lastUnavailable = new AtomicReference<>();

    public AuditChainHealthIndicator(ChainReader chain, IntegrityVerifier verifier, EventDispatcher dispatcher) {
        this.chain = chain;
        this.verifier = verifier;
        dispatcher.subscribe(KernelEvents.AUDIT_LOGGED, event -> lastLogged.set(event.emittedAt()));
        dispatcher.subscribe(KernelEvents.AUDIT_UNAVAILABLE, event -> lastUnavailable.set(event.emittedAt()));
    }

    @Override
    public Health health() {
        try {
            if (!chain.storeExists()) {
                return Health.up()
                    .withDetail("entries", 0)
                    .withDetail("message", "No audit store yet")
                    .build();
            }

            ChainVerification chainResult = verifier.verifyChain();
            if (!chainResult.valid()) {
                return Health.down()
                    .withDetail("brokenAtSequence", chainResult.brokenAtSequence())
                    .withDetail("error", chainResult.details())
                    .build();
            }

            CheckpointVerification checkpointResult = verifier.verifyCheckpoints();
            if (!checkpointResult.valid()) {
                return Health.down()
                    .withDetail("entries", chainResult.entriesChecked())
                    .withDetail("checkpoints", checkpointResult.checked())
                    .withDetail("mismatches", checkpointResult.mismatches())
                    .build();
            }

            Health.Builder builder = isDegraded() ? Health.status(DEGRADED) : Health.up();
            return builder
                .withDetail("entries", chainResult.entriesChecked())
                .withDetail("checkpoints", checkpointResult.checked())
                .build();

        } catch (AuditStorageException e) {
            return Health.unknown()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isDegraded() {
        Instant unavailable = lastUnavailable.get();
        if (unavailable == null) {
            return false;
        }
        Instant logged = lastLogged.get();
        return logged == null || unavailable.isAfter(logged);
    }
}
