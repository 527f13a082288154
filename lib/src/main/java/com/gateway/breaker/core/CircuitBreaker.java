package com.gateway.breaker.core;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.core.CircuitBreakerException.BreakerTimeoutException;
import com.gateway.breaker.core.CircuitBreakerException.CircuitOpenException;
import com.gateway.breaker.event.BreakerEvent;
import com.gateway.breaker.event.BreakerEventListener;
import com.gateway.breaker.event.BreakerEventType;
import com.gateway.breaker.model.BreakerStatus;
import com.gateway.breaker.model.CircuitState;
import com.gateway.breaker.model.LifetimeMetrics;
import com.gateway.breaker.statemachine.CircuitStateMachine;
import com.gateway.breaker.statemachine.StateTransition;
import com.gateway.breaker.window.LatencyRecorder;
import com.gateway.breaker.window.RollingWindow;
import com.gateway.breaker.window.WindowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Guards asynchronous calls to one downstream dependency.
 * <p>
 * Every call passes through {@link #execute(Supplier)}: an open circuit refuses
 * it, otherwise the call is raced against the configured timeout, its outcome is
 * counted into the rolling window, and the state machine decides whether the
 * circuit opens, stays put or closes. Lifecycle events are pushed to the
 * listeners given at construction.
 * <p>
 * Bucket rotation runs between {@link #start()} and {@link #close()}. A closed
 * breaker still executes calls, as long as its scheduler is alive.
 */
public class CircuitBreaker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final BreakerConfig config;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final List<BreakerEventListener> listeners;
    private final RollingWindow window;
    private final LatencyRecorder latencies = new LatencyRecorder();
    private final HealthCheckRecovery recovery;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object lock = new Object();
    // guarded by lock
    private final CircuitStateMachine stateMachine;
    private long requests;
    private long successes;
    private long failures;
    private long timeouts;
    private long rejections;

    public CircuitBreaker(String name, BreakerConfig config, ScheduledExecutorService scheduler) {
        this(name, config, scheduler, Clock.systemUTC(), List.of());
    }

    public CircuitBreaker(String name, BreakerConfig config, ScheduledExecutorService scheduler,
                          Clock clock, List<? extends BreakerEventListener> listeners) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Breaker name is required");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listeners = List.copyOf(listeners);
        this.stateMachine = new CircuitStateMachine(config, clock);
        this.window = new RollingWindow(name, config.getRollingWindow(), config.getBucketInterval(), clock);
        this.recovery = config.getHealthCheck()
                .map(probe -> new HealthCheckRecovery(name, probe, config.getResetTimeout(), config.getTimeout(),
                        scheduler, new BreakerRecoveryTarget()))
                .orElse(null);
    }

    /**
     * Starts bucket rotation. Has no effect on a started or closed breaker.
     */
    public void start() {
        if (closed.get()) {
            return;
        }
        window.start(scheduler);
        logger.info("Circuit breaker {} started: {}", name, config);
    }

    /**
     * Stops bucket rotation and health check recovery.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            window.stop();
            if (recovery != null) {
                recovery.stop();
            }
            logger.info("Circuit breaker {} closed", name);
        }
    }

    /**
     * Executes an operation under the protection of this breaker, using the
     * configured fallback, if any.
     *
     * @param operation supplies the stage of the guarded call
     * @return a future completing with the operation's result, or failing with
     * {@link CircuitOpenException}, {@link BreakerTimeoutException} or the
     * operation's own error
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        return execute(operation, this.<T>configuredFallback());
    }

    /**
     * Executes a single-argument operation under the protection of this breaker.
     */
    public <A, T> CompletableFuture<T> execute(Function<? super A, ? extends CompletionStage<T>> operation,
                                               A argument) {
        Objects.requireNonNull(operation, "operation");
        return execute(() -> operation.apply(argument));
    }

    /**
     * Executes an operation with a call-specific fallback. The fallback receives the
     * failure cause (rejection, timeout or operation error) and its outcome replaces
     * the outcome of the call. A null fallback propagates failures unchanged.
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation,
                                            Function<Throwable, ? extends CompletionStage<T>> fallback) {
        Objects.requireNonNull(operation, "operation");

        CircuitOpenException rejection = acquirePermission();
        if (rejection != null) {
            logger.debug("Circuit breaker {} rejected call, next attempt at {}", name, rejection.getNextAttemptAt());
            return fallback != null ? invokeFallback(fallback, rejection) : CompletableFuture.failedFuture(rejection);
        }

        long startNanos = System.nanoTime();
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean(false);

        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(() -> {
                if (settled.compareAndSet(false, true)) {
                    BreakerTimeoutException timeout = new BreakerTimeoutException(name, config.getTimeout());
                    onFailure(timeout, elapsedSince(startNanos));
                    completeWithFailure(result, timeout, fallback);
                }
            }, config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // the call never ran, so it is not counted
            synchronized (lock) {
                requests--;
            }
            logger.warn("Circuit breaker {} could not schedule call timeout, scheduler rejected it", name);
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<T> stage;
        try {
            stage = operation.get();
            if (stage == null) {
                stage = CompletableFuture.failedFuture(
                        new IllegalStateException("Operation returned no completion stage"));
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            timer.cancel(false);
            if (!settled.compareAndSet(false, true)) {
                logger.debug("Discarding late outcome of timed out call on {}", name);
                return;
            }
            Duration elapsed = elapsedSince(startNanos);
            if (error == null) {
                onSuccess(elapsed);
                result.complete(value);
            } else {
                Throwable cause = unwrap(error);
                onFailure(cause, elapsed);
                completeWithFailure(result, cause, fallback);
            }
        });
        return result;
    }

    /**
     * Executes a reactive operation under the protection of this breaker. The
     * operation is subscribed once per subscription to the returned Mono.
     */
    public <T> Mono<T> executeMono(Supplier<? extends Mono<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        return Mono.defer(() -> Mono.fromFuture(execute(() -> operation.get().toFuture())));
    }

    /**
     * Forces the circuit open. Has no effect on an open circuit.
     */
    public void forceOpen() {
        if (transition(stateMachine::toOpen)) {
            logger.warn("Circuit breaker {} forced to OPEN state", name);
        }
    }

    /**
     * Forces the circuit closed. Has no effect on a closed circuit.
     */
    public void forceClose() {
        if (transition(stateMachine::toClosed)) {
            logger.info("Circuit breaker {} forced to CLOSED state", name);
        }
    }

    /**
     * Returns the circuit to CLOSED and clears the consecutive counters and the
     * rolling window. Lifetime metrics are kept.
     */
    public void reset() {
        BreakerEvent event;
        synchronized (lock) {
            CircuitState previous = stateMachine.reset();
            window.clear();
            if (recovery != null) {
                recovery.cancel();
            }
            event = event(BreakerEventType.RESET).build();
            logger.info("Circuit breaker {} has been reset (was {})", name, previous);
        }
        publish(List.of(event));
    }

    /**
     * Reports whether the guarded dependency is healthy: the outcome of the
     * configured health check, or whether the circuit is closed when there is none.
     * A failing health check reports {@code false}.
     */
    public CompletableFuture<Boolean> healthCheck() {
        if (config.getHealthCheck().isEmpty()) {
            return CompletableFuture.completedFuture(getState() == CircuitState.CLOSED);
        }
        CompletableFuture<Boolean> outcome;
        try {
            CompletionStage<Boolean> stage = config.getHealthCheck().get().get();
            outcome = stage == null
                    ? CompletableFuture.completedFuture(false)
                    : stage.toCompletableFuture().thenApply(Boolean.TRUE::equals);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        return outcome.exceptionally(error -> {
            logger.debug("Health check failed for {}: {}", name, unwrap(error).getMessage());
            return false;
        });
    }

    public BreakerStatus getStatus() {
        synchronized (lock) {
            return BreakerStatus.builder()
                    .name(name)
                    .state(stateMachine.getState())
                    .lifetimeMetrics(lifetimeMetrics())
                    .windowMetrics(window.getMetrics())
                    .averageLatencyMs(latencies.getAverageMs())
                    .consecutiveFailures(stateMachine.getConsecutiveFailures())
                    .nextAttemptAt(stateMachine.getNextAttemptAt().orElse(null))
                    .lastFailureTime(stateMachine.getLastFailureTime().orElse(null))
                    .lastStateChange(stateMachine.getLastStateChange())
                    .errorRateHistory(window.getErrorRateHistory())
                    .configuration(config)
                    .build();
        }
    }

    public CircuitState getState() {
        synchronized (lock) {
            return stateMachine.getState();
        }
    }

    public LifetimeMetrics getLifetimeMetrics() {
        synchronized (lock) {
            return lifetimeMetrics();
        }
    }

    public WindowMetrics getWindowMetrics() {
        return window.getMetrics();
    }

    public int getConsecutiveFailures() {
        synchronized (lock) {
            return stateMachine.getConsecutiveFailures();
        }
    }

    public int getConsecutiveSuccesses() {
        synchronized (lock) {
            return stateMachine.getConsecutiveSuccesses();
        }
    }

    public Optional<Instant> getNextAttemptAt() {
        synchronized (lock) {
            return stateMachine.getNextAttemptAt();
        }
    }

    public String getName() {
        return name;
    }

    public BreakerConfig getConfig() {
        return config;
    }

    public boolean isRunning() {
        return window.isRunning();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Rolls the window over immediately instead of waiting for the next tick.
     */
    void rotateWindow() {
        window.rotate();
    }

    boolean isRecoveryPending() {
        return recovery != null && recovery.isPending();
    }

    private CircuitOpenException acquirePermission() {
        List<BreakerEvent> events = new ArrayList<>(2);
        CircuitOpenException rejection = null;
        synchronized (lock) {
            if (stateMachine.getState() == CircuitState.OPEN) {
                if (stateMachine.isResetDue()) {
                    stateMachine.toHalfOpen().ifPresent(t -> onTransition(t, events));
                } else {
                    rejections++;
                    rejection = new CircuitOpenException(name, stateMachine.getNextAttemptAt().orElse(null));
                    events.add(event(BreakerEventType.CALL_REJECTED).failure(rejection).build());
                }
            }
            if (rejection == null) {
                requests++;
            }
        }
        publish(events);
        return rejection;
    }

    private void onSuccess(Duration elapsed) {
        List<BreakerEvent> events = new ArrayList<>(2);
        synchronized (lock) {
            successes++;
            window.recordSuccess();
            latencies.record(elapsed.toMillis());
            stateMachine.onSuccess().ifPresent(t -> onTransition(t, events));
            events.add(event(BreakerEventType.SUCCESS).duration(elapsed).build());
        }
        publish(events);
    }

    private void onFailure(Throwable cause, Duration elapsed) {
        boolean timeout = cause instanceof BreakerTimeoutException;
        List<BreakerEvent> events = new ArrayList<>(2);
        synchronized (lock) {
            failures++;
            if (timeout) {
                timeouts++;
            }
            window.recordFailure(timeout);
            stateMachine.onFailure(window.getMetrics()).ifPresent(t -> onTransition(t, events));
            events.add(event(BreakerEventType.FAILURE)
                    .duration(elapsed)
                    .failure(cause)
                    .consecutiveFailures(stateMachine.getConsecutiveFailures())
                    .build());
        }
        if (timeout) {
            logger.debug("Call on {} timed out after {}ms", name, elapsed.toMillis());
        }
        publish(events);
    }

    private boolean transition(Supplier<Optional<StateTransition>> action) {
        List<BreakerEvent> events = new ArrayList<>(1);
        synchronized (lock) {
            action.get().ifPresent(t -> onTransition(t, events));
        }
        publish(events);
        return !events.isEmpty();
    }

    // caller holds lock
    private void onTransition(StateTransition transition, List<BreakerEvent> events) {
        switch (transition.getTo()) {
            case OPEN -> {
                logger.warn("Circuit breaker {} state transition: {} (consecutive failures: {}, next attempt at {})",
                        name, transition, stateMachine.getConsecutiveFailures(),
                        stateMachine.getNextAttemptAt().orElse(null));
                if (recovery != null && !closed.get()) {
                    recovery.schedule(stateMachine.getOpenGeneration());
                }
                events.add(event(BreakerEventType.OPEN)
                        .consecutiveFailures(stateMachine.getConsecutiveFailures())
                        .build());
            }
            case HALF_OPEN -> {
                logger.info("Circuit breaker {} state transition: {}", name, transition);
                if (recovery != null) {
                    recovery.cancel();
                }
                events.add(event(BreakerEventType.HALF_OPEN).build());
            }
            case CLOSED -> {
                logger.info("Circuit breaker {} state transition: {}", name, transition);
                if (recovery != null) {
                    recovery.cancel();
                }
                Duration recoveryTime = stateMachine.getLastFailureTime()
                        .map(lastFailure -> Duration.between(lastFailure, transition.getTimestamp()))
                        .orElse(null);
                events.add(event(BreakerEventType.CLOSE).duration(recoveryTime).build());
            }
        }
    }

    // caller holds lock
    private BreakerEvent.Builder event(BreakerEventType type) {
        return BreakerEvent.builder(type, name)
                .state(stateMachine.getState())
                .timestamp(clock.instant());
    }

    private LifetimeMetrics lifetimeMetrics() {
        return new LifetimeMetrics(requests, successes, failures, timeouts, rejections, stateMachine.getCircuitOpens());
    }

    private void publish(List<BreakerEvent> events) {
        for (BreakerEvent event : events) {
            for (BreakerEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    logger.warn("Breaker event listener failed on {} event for {}: {}",
                            event.getType(), name, e.getMessage(), e);
                }
            }
        }
    }

    private <T> void completeWithFailure(CompletableFuture<T> result, Throwable cause,
                                         Function<Throwable, ? extends CompletionStage<T>> fallback) {
        if (fallback == null) {
            result.completeExceptionally(cause);
            return;
        }
        invokeFallback(fallback, cause).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(unwrap(error));
            }
        });
    }

    private <T> CompletableFuture<T> invokeFallback(Function<Throwable, ? extends CompletionStage<T>> fallback,
                                                    Throwable cause) {
        CompletableFuture<T> outcome = new CompletableFuture<>();
        try {
            CompletionStage<T> stage = fallback.apply(cause);
            if (stage == null) {
                outcome.completeExceptionally(new IllegalStateException("Fallback returned no completion stage"));
                return outcome;
            }
            stage.whenComplete((value, error) -> {
                if (error == null) {
                    outcome.complete(value);
                } else {
                    outcome.completeExceptionally(unwrap(error));
                }
            });
        } catch (RuntimeException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    /**
     * Adapts the configured fallback to the result type of a call. The configured
     * fallback is shared by calls of every type, so its value is handed to the
     * caller as is.
     */
    private <T> Function<Throwable, CompletionStage<T>> configuredFallback() {
        Function<Throwable, ? extends CompletionStage<?>> fallback = config.getFallback().orElse(null);
        if (fallback == null) {
            return null;
        }
        return cause -> (CompletionStage<T>) fallback.apply(cause);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private class BreakerRecoveryTarget implements HealthCheckRecovery.RecoveryTarget {

        @Override
        public boolean isAwaitingRecovery(long generation) {
            synchronized (lock) {
                return !closed.get()
                        && stateMachine.getState() == CircuitState.OPEN
                        && stateMachine.getOpenGeneration() == generation;
            }
        }

        @Override
        public void probeSucceeded(long generation) {
            List<BreakerEvent> events = new ArrayList<>(1);
            synchronized (lock) {
                if (isAwaitingRecovery(generation)) {
                    stateMachine.toHalfOpen().ifPresent(t -> onTransition(t, events));
                }
            }
            publish(events);
        }

        @Override
        public void probeFailed(long generation, Throwable cause) {
            List<BreakerEvent> events = new ArrayList<>(1);
            synchronized (lock) {
                if (!isAwaitingRecovery(generation)) {
                    return;
                }
                stateMachine.postponeNextAttempt();
                events.add(event(BreakerEventType.HEALTH_CHECK_FAILED).failure(cause).build());
                recovery.schedule(generation);
            }
            publish(events);
        }
    }
}
