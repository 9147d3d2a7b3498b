package com.ivamare.kernelbus.health;

import com.ivamare.kernelbus.api.EventDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Health indicator for the event dispatcher.
 *
 * <p>Looks at the handler errors since the previous check: none is UP, fewer than
 * the threshold is DEGRADED, otherwise DOWN.
 */
public class DispatcherHealthIndicator implements HealthIndicator {

    private final EventDispatcher dispatcher;
    private final int errorThreshold;
    private final AtomicLong lastErrorCount = new AtomicLong(0);

    public DispatcherHealthIndicator(EventDispatcher dispatcher, int errorThreshold) {
        this.dispatcher = dispatcher;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        long current = dispatcher.handlerErrorCount();
        long previous = lastErrorCount.getAndSet(current);
        // Counter was reset since the last check
        long delta = current >= previous ? current - previous : current;

        Health.Builder builder;
        if (delta == 0) {
            builder = Health.up();
        } else if (delta < errorThreshold) {
            builder = Health.status(AuditChainHealthIndicator.DEGRADED.getCode());
        } else {
            builder = Health.down();
        }

        return builder
            .withDetail("handlerErrors", current)
            .withDetail("handlerErrorsSinceLastCheck", delta)
            .withDetail("pendingDeliveries", dispatcher.pendingCount())
            .build();
    }
}
