package com.gateway.breaker.window;

/**
 * Totals across the buckets of a rolling window. Derived on demand, never stored.
 */
public final class WindowMetrics {

    private static final WindowMetrics EMPTY = new WindowMetrics(0, 0, 0, 0);

    private final long total;
    private final long successes;
    private final long failures;
    private final long timeouts;

    public WindowMetrics(long total, long successes, long failures, long timeouts) {
        this.total = total;
        this.successes = successes;
        this.failures = failures;
        this.timeouts = timeouts;
    }

    public static WindowMetrics empty() {
        return EMPTY;
    }

    WindowMetrics plus(Bucket bucket) {
        return new WindowMetrics(
                total + bucket.getRequests(),
                successes + bucket.getSuccesses(),
                failures + bucket.getFailures(),
                timeouts + bucket.getTimeouts());
    }

    public long getTotal() {
        return total;
    }

    public long getSuccesses() {
        return successes;
    }

    public long getFailures() {
        return failures;
    }

    public long getTimeouts() {
        return timeouts;
    }

    /**
     * Gets the failure percentage of the window.
     *
     * @return error rate (0.0 to 100.0), 0.0 when the window saw no calls
     */
    public double getErrorRate() {
        if (total == 0) {
            return 0.0;
        }
        return (double) failures / total * 100.0;
    }

    @Override
    public String toString() {
        return String.format("WindowMetrics{total=%d, successes=%d, failures=%d, timeouts=%d, errorRate=%.2f%%}",
                total, successes, failures, timeouts, getErrorRate());
    }
}
