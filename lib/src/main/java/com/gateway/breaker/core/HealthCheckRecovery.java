package com.gateway.breaker.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Probes an open circuit out of band and reports the outcome to its breaker.
 * <p>
 * Each scheduled probe is tagged with the open generation it was scheduled for.
 * The breaker ignores results for a generation that is no longer current, so a
 * probe can never move a breaker that has already left the open period it was
 * scheduled for.
 */
class HealthCheckRecovery {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckRecovery.class);

    /**
     * Callbacks into the breaker being recovered.
     */
    interface RecoveryTarget {

        boolean isAwaitingRecovery(long generation);

        void probeSucceeded(long generation);

        void probeFailed(long generation, Throwable cause);
    }

    private final String name;
    private final Supplier<? extends CompletionStage<Boolean>> probe;
    private final Duration interval;
    private final Duration probeTimeout;
    private final ScheduledExecutorService scheduler;
    private final RecoveryTarget target;

    private ScheduledFuture<?> pending;
    private boolean stopped;

    HealthCheckRecovery(String name, Supplier<? extends CompletionStage<Boolean>> probe, Duration interval,
                        Duration probeTimeout, ScheduledExecutorService scheduler, RecoveryTarget target) {
        this.name = name;
        this.probe = probe;
        this.interval = interval;
        this.probeTimeout = probeTimeout;
        this.scheduler = scheduler;
        this.target = target;
    }

    /**
     * Schedules a probe one interval from now, replacing any pending probe.
     */
    synchronized void schedule(long generation) {
        if (stopped) {
            return;
        }
        cancelPending();
        pending = scheduler.schedule(() -> runProbe(generation), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.debug("Health check for {} scheduled in {}ms", name, interval.toMillis());
    }

    synchronized void cancel() {
        cancelPending();
    }

    /**
     * Cancels the pending probe and refuses further scheduling.
     */
    synchronized void stop() {
        stopped = true;
        cancelPending();
    }

    synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void runProbe(long generation) {
        if (!target.isAwaitingRecovery(generation)) {
            return;
        }
        CompletableFuture<Boolean> outcome;
        try {
            CompletionStage<Boolean> stage = probe.get();
            outcome = stage == null
                    ? CompletableFuture.failedFuture(new IllegalStateException("Health check returned no result"))
                    : stage.toCompletableFuture().thenApply(Function.identity());
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        outcome.orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((healthy, error) -> {
                    if (error == null && Boolean.TRUE.equals(healthy)) {
                        logger.info("Health check passed for {}", name);
                        target.probeSucceeded(generation);
                    } else {
                        Throwable cause = error != null
                                ? unwrap(error)
                                : new IllegalStateException("Health check reported unhealthy");
                        logger.debug("Health check failed for {}: {}", name, cause.getMessage());
                        target.probeFailed(generation, cause);
                    }
                });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
