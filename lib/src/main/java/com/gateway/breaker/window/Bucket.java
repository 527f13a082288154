package com.gateway.breaker.window;

import java.time.Instant;

/**
 * Call counters for one rotation interval of a rolling window.
 * A bucket is immutable once it has been rotated out of the current position.
 */
public final class Bucket {

    private final Instant startedAt;
    private final long requests;
    private final long successes;
    private final long failures;
    private final long timeouts;

    public Bucket(Instant startedAt, long requests, long successes, long failures, long timeouts) {
        this.startedAt = startedAt;
        this.requests = requests;
        this.successes = successes;
        this.failures = failures;
        this.timeouts = timeouts;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getRequests() {
        return requests;
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

    @Override
    public String toString() {
        return String.format("Bucket{startedAt=%s, requests=%d, successes=%d, failures=%d, timeouts=%d}",
                startedAt, requests, successes, failures, timeouts);
    }
}
