package com.gateway.breaker.window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Time-bucketed call statistics over a trailing window.
 * <p>
 * A call is counted, request and outcome together, into the bucket that is
 * current when the call settles, so every bucket holds as many requests as
 * outcomes even when a call outlives a rotation. A periodic rotation appends the
 * current bucket to the retained sequence, drops buckets that started before
 * the window, and opens a fresh bucket. Window totals are summed on demand
 * from the retained buckets plus the current one.
 */
public class RollingWindow {

    private static final Logger logger = LoggerFactory.getLogger(RollingWindow.class);

    static final int ERROR_RATE_HISTORY_SIZE = 100;

    private final String name;
    private final Duration windowDuration;
    private final Duration bucketInterval;
    private final Clock clock;
    private final Deque<Bucket> buckets = new ArrayDeque<>();
    private final Deque<ErrorRateSample> errorRateHistory = new ArrayDeque<>();

    // current bucket, guarded by this
    private Instant currentStartedAt;
    private long requests;
    private long successes;
    private long failures;
    private long timeouts;

    private ScheduledFuture<?> rotationTask;

    public RollingWindow(String name, Duration windowDuration, Duration bucketInterval, Clock clock) {
        this.name = name;
        this.windowDuration = windowDuration;
        this.bucketInterval = bucketInterval;
        this.clock = clock;
        this.currentStartedAt = clock.instant();
    }

    /**
     * Starts periodic bucket rotation on the given scheduler. Has no effect if already started.
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (rotationTask != null) {
            return;
        }
        long intervalMs = bucketInterval.toMillis();
        rotationTask = scheduler.scheduleAtFixedRate(this::rotateSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Bucket rotation started for {} every {}ms", name, intervalMs);
    }

    /**
     * Cancels periodic rotation. Counting keeps working; the current bucket simply stops rotating.
     */
    public synchronized void stop() {
        if (rotationTask != null) {
            rotationTask.cancel(false);
            rotationTask = null;
            logger.debug("Bucket rotation stopped for {}", name);
        }
    }

    public synchronized boolean isRunning() {
        return rotationTask != null;
    }

    public synchronized void recordSuccess() {
        requests++;
        successes++;
    }

    public synchronized void recordFailure(boolean timeout) {
        requests++;
        failures++;
        if (timeout) {
            timeouts++;
        }
    }

    /**
     * Moves the current bucket into the retained sequence and prunes expired buckets.
     */
    public synchronized void rotate() {
        Instant now = clock.instant();
        buckets.addLast(currentBucket());
        Instant cutoff = now.minus(windowDuration);
        while (!buckets.isEmpty() && buckets.peekFirst().getStartedAt().isBefore(cutoff)) {
            buckets.removeFirst();
        }
        currentStartedAt = now;
        requests = 0;
        successes = 0;
        failures = 0;
        timeouts = 0;

        WindowMetrics metrics = getMetrics();
        if (metrics.getTotal() > 0) {
            errorRateHistory.addLast(new ErrorRateSample(now, metrics.getErrorRate()));
            if (errorRateHistory.size() > ERROR_RATE_HISTORY_SIZE) {
                errorRateHistory.removeFirst();
            }
        }
    }

    /**
     * Sums the retained buckets and the current bucket.
     */
    public synchronized WindowMetrics getMetrics() {
        WindowMetrics metrics = WindowMetrics.empty();
        for (Bucket bucket : buckets) {
            metrics = metrics.plus(bucket);
        }
        return metrics.plus(currentBucket());
    }

    public synchronized List<Bucket> getBuckets() {
        List<Bucket> snapshot = new ArrayList<>(buckets);
        snapshot.add(currentBucket());
        return snapshot;
    }

    public synchronized List<ErrorRateSample> getErrorRateHistory() {
        return new ArrayList<>(errorRateHistory);
    }

    /**
     * Drops every bucket and starts a fresh current bucket. The error rate history is kept.
     */
    public synchronized void clear() {
        buckets.clear();
        currentStartedAt = clock.instant();
        requests = 0;
        successes = 0;
        failures = 0;
        timeouts = 0;
    }

    private Bucket currentBucket() {
        return new Bucket(currentStartedAt, requests, successes, failures, timeouts);
    }

    private void rotateSafely() {
        try {
            rotate();
        } catch (Exception e) {
            // an exception would silently cancel the periodic task
            logger.error("Bucket rotation failed for {}", name, e);
        }
    }

    /**
     * Window error rate observed at a rotation.
     */
    public static final class ErrorRateSample {
        private final Instant timestamp;
        private final double rate;

        public ErrorRateSample(Instant timestamp, double rate) {
            this.timestamp = timestamp;
            this.rate = rate;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public double getRate() {
            return rate;
        }

        @Override
        public String toString() {
            return String.format("ErrorRateSample{timestamp=%s, rate=%.1f%%}", timestamp, rate);
        }
    }
}
