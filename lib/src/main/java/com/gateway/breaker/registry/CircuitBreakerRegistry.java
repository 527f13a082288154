package com.gateway.breaker.registry;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.config.BreakerPolicies;
import com.gateway.breaker.core.CircuitBreaker;
import com.gateway.breaker.event.BreakerEventListener;
import com.gateway.breaker.model.BreakerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Owns one circuit breaker per downstream dependency name.
 * <p>
 * Breakers are created on first use and share the registry's scheduler for
 * timeouts, bucket rotation and health check recovery. The registry is meant to
 * be created once and handed to the routing layer; it is not a global singleton.
 */
public class CircuitBreakerRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private static final int DEFAULT_SCHEDULER_THREADS = 2;

    private final BreakerPolicies policies;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final List<BreakerEventListener> listeners;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CircuitBreakerRegistry() {
        this(BreakerPolicies.defaults(), List.of());
    }

    public CircuitBreakerRegistry(BreakerPolicies policies, List<? extends BreakerEventListener> listeners) {
        this(policies, listeners, createScheduler(), true, Clock.systemUTC());
    }

    /**
     * Creates a registry on an externally managed scheduler, which {@link #close()} leaves running.
     */
    public CircuitBreakerRegistry(BreakerPolicies policies, List<? extends BreakerEventListener> listeners,
                                  ScheduledExecutorService scheduler, Clock clock) {
        this(policies, listeners, scheduler, false, clock);
    }

    private CircuitBreakerRegistry(BreakerPolicies policies, List<? extends BreakerEventListener> listeners,
                                   ScheduledExecutorService scheduler, boolean ownsScheduler, Clock clock) {
        this.policies = policies;
        this.listeners = List.copyOf(listeners);
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
    }

    /**
     * Gets the breaker for a dependency, creating it from the matching policy.
     *
     * @param name the dependency name
     * @return the breaker registered under the name
     */
    public CircuitBreaker getBreaker(String name) {
        return getBreaker(name, policies.resolve(name));
    }

    /**
     * Gets the breaker for a dependency, creating and starting it with the given
     * configuration if none exists. Concurrent callers racing on an unseen name
     * all receive the same instance. The configuration is ignored when the
     * breaker already exists.
     *
     * @param name the dependency name
     * @param config configuration for a newly created breaker
     * @return the breaker registered under the name
     */
    public CircuitBreaker getBreaker(String name, BreakerConfig config) {
        if (closed.get()) {
            throw new IllegalStateException("Circuit breaker registry is closed");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Breaker name is required");
        }
        return breakers.computeIfAbsent(name, key -> createBreaker(key, config));
    }

    public Optional<CircuitBreaker> findBreaker(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public List<CircuitBreaker> getAllBreakers() {
        return new ArrayList<>(breakers.values());
    }

    public List<BreakerStatus> getAllStatuses() {
        return breakers.values().stream()
                .map(CircuitBreaker::getStatus)
                .collect(Collectors.toList());
    }

    /**
     * Resets every breaker to CLOSED and clears its counters.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        logger.info("Reset {} circuit breakers", breakers.size());
    }

    /**
     * Evicts a breaker and stops its background tasks. Calls already holding the
     * evicted breaker complete against it normally.
     *
     * @param name the dependency name
     * @return true if a breaker was removed
     */
    public boolean removeBreaker(String name) {
        CircuitBreaker removed = breakers.remove(name);
        if (removed == null) {
            return false;
        }
        removed.close();
        logger.info("Removed circuit breaker {}", name);
        return true;
    }

    public int getBreakerCount() {
        return breakers.size();
    }

    public BreakerPolicies getPolicies() {
        return policies;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing circuit breaker registry with {} breakers", breakers.size());

            breakers.values().forEach(breaker -> {
                try {
                    breaker.close();
                } catch (Exception e) {
                    logger.warn("Error closing circuit breaker {}: {}", breaker.getName(), e.getMessage());
                }
            });
            breakers.clear();

            if (ownsScheduler) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }

            logger.info("Circuit breaker registry closed");
        }
    }

    CircuitBreaker createBreaker(String name, BreakerConfig config) {
        CircuitBreaker breaker = new CircuitBreaker(name, config, scheduler, clock, listeners);
        breaker.start();
        logger.info("Created circuit breaker {}", name);
        return breaker;
    }

    /**
     * Creates a daemon scheduler that drops cancelled timers immediately, so
     * calls that settle before their timeout leave nothing queued behind.
     */
    public static ScheduledExecutorService createScheduler() {
        AtomicInteger threadCount = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(DEFAULT_SCHEDULER_THREADS, r -> {
            Thread thread = new Thread(r, "circuit-breaker-scheduler-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
