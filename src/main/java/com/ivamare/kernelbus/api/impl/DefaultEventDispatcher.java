package com.ivamare.kernelbus.api.impl;

import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.event.Event;
import com.ivamare.kernelbus.event.EventType;
import com.ivamare.kernelbus.event.KernelEvents;
import com.ivamare.kernelbus.event.Subscription;
import com.ivamare.kernelbus.handler.AsyncEventHandler;
import com.ivamare.kernelbus.handler.EventHandler;
import com.ivamare.kernelbus.model.HandlerError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default dispatcher implementation.
 *
 * <p>Each registration owns a delivery lane: a chain of futures to which every
 * publish of its event appends one invocation. A registration therefore sees
 * publishes in publish order, while a slow or hung handler only holds up its
 * own lane. Per publish, lanes are scheduled in registration order. Handlers
 * run on the dispatcher's executor, never on the publisher's thread.
 * {@link #drain()} waits for every publish accepted before the call.
 */
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventDispatcher.class);

    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofSeconds(30);

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final Map<String, CopyOnWriteArrayList<Registration>> registry = new ConcurrentHashMap<>();

    // Guarded by laneLock
    private final Map<Registration, CompletableFuture<Void>> lanes = new HashMap<>();
    private final Set<CompletableFuture<Void>> inFlight = new HashSet<>();
    private final Object laneLock = new Object();

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Clock clock;

    private final AtomicLong handlerErrors = new AtomicLong(0);
    private final AtomicInteger pending = new AtomicInteger(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private volatile Duration handlerTimeout;

    /**
     * Creates a dispatcher with its own thread pool and the default handler timeout.
     */
    public DefaultEventDispatcher() {
        this(DEFAULT_HANDLER_TIMEOUT);
    }

    /**
     * Creates a dispatcher with its own thread pool.
     *
     * @param handlerTimeout Handler timeout ({@link Duration#ZERO} disables it)
     */
    public DefaultEventDispatcher(Duration handlerTimeout) {
        this(newDispatchExecutor(), true, handlerTimeout, Clock.systemUTC());
    }

    /**
     * Creates a dispatcher on a caller-supplied executor (for testing or sharing pools).
     * The executor is not shut down by {@link #shutdown(Duration)}.
     *
     * @param executor Executor running handler invocations
     * @param handlerTimeout Handler timeout ({@link Duration#ZERO} disables it)
     * @param clock Clock stamping {@link Event#emittedAt()}
     */
    public DefaultEventDispatcher(ExecutorService executor, Duration handlerTimeout, Clock clock) {
        this(executor, false, handlerTimeout, clock);
    }

    private DefaultEventDispatcher(ExecutorService executor, boolean ownsExecutor,
                                   Duration handlerTimeout, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.clock = Objects.requireNonNull(clock, "clock");
        setHandlerTimeout(handlerTimeout);
    }

    // --- Subscription ---

    @Override
    @SuppressWarnings("unchecked")
    public <T> Subscription subscribe(EventType<T> type, EventHandler<T> handler) {
        Objects.requireNonNull(handler, "handler");
        return register(type, handler, event -> {
            handler.handle((Event<T>) event);
            return null;
        }, false);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Subscription subscribeAsync(EventType<T> type, AsyncEventHandler<T> handler) {
        Objects.requireNonNull(handler, "handler");
        return register(type, handler, event -> handler.handle((Event<T>) event), false);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Subscription subscribeOnce(EventType<T> type, EventHandler<T> handler) {
        Objects.requireNonNull(handler, "handler");
        return register(type, handler, event -> {
            handler.handle((Event<T>) event);
            return null;
        }, true);
    }

    private Subscription register(EventType<?> type, Object handler, Invoker invoker, boolean once) {
        Objects.requireNonNull(type, "type");
        Registration registration = new Registration(type.name(), handler, invoker, once);
        registry.compute(type.name(), (name, list) -> {
            CopyOnWriteArrayList<Registration> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(registration);
            return target;
        });
        log.debug("Subscribed {} to {} (once={})", registration.describe(), type.name(), once);
        return registration;
    }

    @Override
    public void unsubscribe(EventType<?> type, Object handler) {
        List<Registration> registrations = registry.get(type.name());
        if (registrations == null) {
            return;
        }
        for (Registration registration : registrations) {
            if (registration.handler == handler) {
                registration.unsubscribe();
            }
        }
    }

    private void remove(Registration registration) {
        registry.computeIfPresent(registration.eventName, (name, list) -> {
            list.remove(registration);
            return list.isEmpty() ? null : list;
        });
        log.debug("Unsubscribed {} from {}", registration.describe(), registration.eventName);
    }

    @Override
    public void clear() {
        int removed = 0;
        for (List<Registration> registrations : registry.values()) {
            for (Registration registration : registrations) {
                registration.active.set(false);
                removed++;
            }
        }
        registry.clear();
        handlerErrors.set(0);
        log.info("Cleared {} subscriptions", removed);
    }

    @Override
    public int listenerCount(String eventName) {
        List<Registration> registrations = registry.get(eventName);
        return registrations != null ? registrations.size() : 0;
    }

    // --- Publishing ---

    @Override
    public <T> void publish(EventType<T> type, T payload) {
        try {
            if (shutdown.get()) {
                log.warn("Dispatcher is shut down, dropping event {}", type.name());
                return;
            }
            Event<T> event = new Event<>(type, payload, clock.instant());
            synchronized (laneLock) {
                List<Registration> registrations = registry.get(type.name());
                if (registrations == null || registrations.isEmpty()) {
                    log.trace("No subscribers for {}", type.name());
                    return;
                }
                enqueue(event, List.copyOf(registrations));
            }
        } catch (RuntimeException e) {
            log.error("Failed to schedule event {}", type != null ? type.name() : null, e);
        }
    }

    // Caller holds laneLock
    private void enqueue(Event<?> event, List<Registration> snapshot) {
        pending.incrementAndGet();

        CompletableFuture<?>[] deliveries = new CompletableFuture<?>[snapshot.size()];
        for (int i = 0; i < snapshot.size(); i++) {
            deliveries[i] = append(snapshot.get(i), event);
        }

        CompletableFuture<Void> settled = CompletableFuture.allOf(deliveries)
            .thenRun(pending::decrementAndGet);
        inFlight.add(settled);
        settled.whenComplete((ignored, error) -> {
            synchronized (laneLock) {
                inFlight.remove(settled);
            }
        });
    }

    // Caller holds laneLock
    private CompletableFuture<Void> append(Registration registration, Event<?> event) {
        CompletableFuture<Void> tail = lanes.getOrDefault(registration, DONE);
        CompletableFuture<Void> next = tail
            .thenCompose(ignored -> invoke(registration, event))
            .exceptionally(error -> {
                log.error("Delivery lane of {} for {} failed", registration.describe(), event.name(), error);
                return null;
            });
        lanes.put(registration, next);

        next.whenComplete((ignored, error) -> {
            synchronized (laneLock) {
                lanes.remove(registration, next);
            }
        });
        return next;
    }

    private CompletableFuture<Void> invoke(Registration registration, Event<?> event) {
        if (registration.once && !registration.claim()) {
            return DONE;
        }

        CompletableFuture<Object> invocation;
        try {
            invocation = CompletableFuture
                .supplyAsync(() -> call(registration, event), executor)
                .thenCompose(stage -> stage);
        } catch (RejectedExecutionException e) {
            invocation = CompletableFuture.failedFuture(e);
        }

        Duration timeout = handlerTimeout;
        if (!timeout.isZero()) {
            invocation = invocation.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return invocation.handle((result, error) -> {
            if (error != null) {
                onHandlerFailure(registration, event, unwrap(error));
            }
            return null;
        });
    }

    private CompletionStage<Object> call(Registration registration, Event<?> event) {
        try {
            CompletionStage<?> stage = registration.invoker.invoke(event);
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.thenApply(result -> (Object) result);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private void onHandlerFailure(Registration registration, Event<?> event, Throwable error) {
        handlerErrors.incrementAndGet();
        boolean timedOut = error instanceof TimeoutException;
        String handler = registration.describe();

        if (timedOut) {
            log.warn("Handler {} for {} exceeded timeout of {}ms; counted as failed",
                handler, event.name(), handlerTimeout.toMillis());
        } else {
            log.error("Error in handler {} for {}", handler, event.name(), error);
        }

        // Failures of these handlers would recurse
        String name = event.name();
        if (!name.equals(KernelEvents.HANDLER_ERROR.name()) && !name.equals(KernelEvents.AUDIT_LOG.name())) {
            String message = timedOut
                ? "Handler exceeded timeout of " + handlerTimeout.toMillis() + "ms"
                : String.valueOf(error.getMessage());
            publish(KernelEvents.HANDLER_ERROR,
                new HandlerError(name, message, handler, timedOut, clock.instant()));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public CompletableFuture<Void> drain() {
        List<CompletableFuture<Void>> publishes;
        synchronized (laneLock) {
            publishes = new ArrayList<>(inFlight);
        }
        if (publishes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(publishes.toArray(new CompletableFuture<?>[0]));
    }

    // --- Observability ---

    @Override
    public long handlerErrorCount() {
        return handlerErrors.get();
    }

    @Override
    public void resetHandlerErrorCount() {
        handlerErrors.set(0);
    }

    @Override
    public int pendingCount() {
        return pending.get();
    }

    // --- Configuration & lifecycle ---

    @Override
    public void setHandlerTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Handler timeout must not be negative: " + timeout);
        }
        this.handlerTimeout = timeout;
    }

    @Override
    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    @Override
    public void shutdown(Duration timeout) {
        if (shutdown.getAndSet(true)) {
            return;
        }

        log.info("Shutting down dispatcher, waiting for {} pending deliveries", pending.get());

        try {
            drain().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timeout waiting for {} pending deliveries", pending.get());
        } catch (ExecutionException e) {
            log.warn("Pending deliveries completed with error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Dispatcher stopped");
    }

    private static ExecutorService newDispatchExecutor() {
        AtomicInteger threads = new AtomicInteger(0);
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "kernel-dispatch-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @FunctionalInterface
    private interface Invoker {
        CompletionStage<?> invoke(Event<?> event) throws Exception;
    }

    private final class Registration implements Subscription {

        private final String eventName;
        private final Object handler;
        private final Invoker invoker;
        private final boolean once;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(String eventName, Object handler, Invoker invoker, boolean once) {
            this.eventName = eventName;
            this.handler = handler;
            this.invoker = invoker;
            this.once = once;
        }

        @Override
        public String eventName() {
            return eventName;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        /**
         * Claim a once-registration for its single delivery, removing it from the registry.
         */
        private boolean claim() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            remove(this);
            return true;
        }

        private String describe() {
            return handler.getClass().getName();
        }
    }
}
