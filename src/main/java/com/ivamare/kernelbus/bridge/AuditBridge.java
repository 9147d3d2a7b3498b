package com.ivamare.kernelbus.bridge;

import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.event.Event;
import com.ivamare.kernelbus.event.KernelEvents;
import com.ivamare.kernelbus.event.Subscription;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.handler.AsyncEventHandler;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditRecord;
import com.ivamare.kernelbus.model.AuditRequest;
import com.ivamare.kernelbus.model.AuditUnavailable;
import com.ivamare.kernelbus.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sole subscriber of {@code audit:log}: turns audit requests into chain entries.
 *
 * <p>Storage failures are retried per the {@link RetryPolicy} without blocking a
 * dispatcher thread between attempts. When every attempt fails the request is
 * dropped, {@code audit:unavailable} is published and the invocation completes
 * normally. Invalid requests fail the invocation and are counted by the
 * dispatcher as handler faults.
 */
public class AuditBridge implements AsyncEventHandler<AuditRequest> {

    private static final Logger log = LoggerFactory.getLogger(AuditBridge.class);

    private final EventDispatcher dispatcher;
    private final ChainAppender appender;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    private volatile Subscription subscription;

    public AuditBridge(EventDispatcher dispatcher, ChainAppender appender, RetryPolicy retryPolicy, Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.appender = Objects.requireNonNull(appender, "appender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Subscribe to {@code audit:log}. No-op if already started.
     */
    public synchronized void start() {
        if (subscription != null && subscription.isActive()) {
            return;
        }
        subscription = dispatcher.subscribeAsync(KernelEvents.AUDIT_LOG, this);
        log.info("Audit bridge started (maxAttempts={})", retryPolicy.maxAttempts());
    }

    /**
     * Unsubscribe from {@code audit:log}. Requests already queued still run.
     */
    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.unsubscribe();
        subscription = null;
        log.info("Audit bridge stopped");
    }

    public boolean isRunning() {
        Subscription current = subscription;
        return current != null && current.isActive();
    }

    /**
     * @return number of requests dropped since the last successful append
     */
    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public CompletionStage<?> handle(Event<AuditRequest> event) {
        AuditRequest request = event.payload();
        if (request == null) {
            throw new IllegalArgumentException("audit:log published without a request");
        }
        AuditRecord record = AuditRecord.from(request, clock.instant().truncatedTo(ChronoUnit.MILLIS));
        return attempt(record, 1);
    }

    private CompletableFuture<Void> attempt(AuditRecord record, int attempt) {
        try {
            AuditEntry entry = appender.append(record);
            consecutiveFailures.set(0);
            dispatcher.publish(KernelEvents.AUDIT_LOGGED, entry);
            return CompletableFuture.completedFuture(null);
        } catch (AuditStorageException e) {
            if (!retryPolicy.shouldRetry(attempt)) {
                giveUp(record, attempt, e);
                return CompletableFuture.completedFuture(null);
            }

            Duration delay = retryPolicy.getBackoff(attempt);
            log.warn("Audit append for {} failed (attempt {}/{}), retrying in {}ms: {}",
                record.action(), attempt, retryPolicy.maxAttempts(), delay.toMillis(), e.getMessage());

            Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
            return CompletableFuture
                .supplyAsync(() -> attempt(record, attempt + 1), delayed)
                .thenCompose(next -> next);
        }
    }

    private void giveUp(AuditRecord record, int attempts, AuditStorageException error) {
        int failures = consecutiveFailures.incrementAndGet();
        log.error("Audit append for {} by {} failed after {} attempts ({} consecutive); audit is unavailable",
            record.action(), record.actor(), attempts, failures, error);
        dispatcher.publish(KernelEvents.AUDIT_UNAVAILABLE,
            new AuditUnavailable(record.action(), error.getMessage(), attempts, clock.instant()));
    }
}
