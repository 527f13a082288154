package com.gateway.breaker.event;

import com.gateway.breaker.model.CircuitState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable event describing something that happened to a circuit breaker.
 */
public class BreakerEvent {

    private final BreakerEventType type;
    private final String breakerName;
    private final CircuitState state;
    private final Instant timestamp;
    private final Duration duration;
    private final Throwable failure;
    private final int consecutiveFailures;

    private BreakerEvent(Builder builder) {
        this.type = builder.type;
        this.breakerName = builder.breakerName;
        this.state = builder.state;
        this.timestamp = builder.timestamp;
        this.duration = builder.duration;
        this.failure = builder.failure;
        this.consecutiveFailures = builder.consecutiveFailures;
    }

    public BreakerEventType getType() {
        return type;
    }

    public String getBreakerName() {
        return breakerName;
    }

    /**
     * State of the breaker after the event was applied.
     */
    public CircuitState getState() {
        return state;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Call duration for {@code SUCCESS} and {@code FAILURE}; time since the last
     * failure for {@code CLOSE}.
     */
    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<String> getFailureReason() {
        return getFailure().map(Throwable::getMessage);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public static Builder builder(BreakerEventType type, String breakerName) {
        return new Builder(type, breakerName);
    }

    @Override
    public String toString() {
        return String.format("BreakerEvent{type=%s, breaker='%s', state=%s, duration=%s, failure=%s, timestamp=%s}",
                type, breakerName, state, duration, getFailureReason().orElse(null), timestamp);
    }

    public static class Builder {
        private final BreakerEventType type;
        private final String breakerName;
        private CircuitState state;
        private Instant timestamp = Instant.now();
        private Duration duration;
        private Throwable failure;
        private int consecutiveFailures;

        private Builder(BreakerEventType type, String breakerName) {
            this.type = type;
            this.breakerName = breakerName;
        }

        public Builder state(CircuitState state) {
            this.state = state;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder failure(Throwable failure) {
            this.failure = failure;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public BreakerEvent build() {
            return new BreakerEvent(this);
        }
    }
}
