package com.gateway.breaker.model;

/**
 * Monotonic call totals of a breaker since it was created.
 */
public final class LifetimeMetrics {

    private final long requests;
    private final long successes;
    private final long failures;
    private final long timeouts;
    private final long rejections;
    private final long circuitOpens;

    public LifetimeMetrics(long requests, long successes, long failures, long timeouts,
                           long rejections, long circuitOpens) {
        this.requests = requests;
        this.successes = successes;
        this.failures = failures;
        this.timeouts = timeouts;
        this.rejections = rejections;
        this.circuitOpens = circuitOpens;
    }

    public long getRequests() {
        return requests;
    }

    public long getSuccesses() {
        return successes;
    }

    /**
     * Failed calls, timeouts included.
     */
    public long getFailures() {
        return failures;
    }

    public long getTimeouts() {
        return timeouts;
    }

    /**
     * Calls refused without being attempted.
     */
    public long getRejections() {
        return rejections;
    }

    public long getCircuitOpens() {
        return circuitOpens;
    }

    @Override
    public String toString() {
        return String.format("LifetimeMetrics{requests=%d, successes=%d, failures=%d, timeouts=%d, " +
                "rejections=%d, circuitOpens=%d}", requests, successes, failures, timeouts, rejections, circuitOpens);
    }
}
