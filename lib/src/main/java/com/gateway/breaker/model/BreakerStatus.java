package com.gateway.breaker.model;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.window.RollingWindow.ErrorRateSample;
import com.gateway.breaker.window.WindowMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of a circuit breaker for monitoring and administration.
 */
public class BreakerStatus {

    private final String name;
    private final CircuitState state;
    private final LifetimeMetrics lifetimeMetrics;
    private final WindowMetrics windowMetrics;
    private final double averageLatencyMs;
    private final int consecutiveFailures;
    private final Instant nextAttemptAt;
    private final Instant lastFailureTime;
    private final Instant lastStateChange;
    private final List<ErrorRateSample> errorRateHistory;
    private final BreakerConfig configuration;

    private BreakerStatus(Builder builder) {
        this.name = builder.name;
        this.state = builder.state;
        this.lifetimeMetrics = builder.lifetimeMetrics;
        this.windowMetrics = builder.windowMetrics;
        this.averageLatencyMs = builder.averageLatencyMs;
        this.consecutiveFailures = builder.consecutiveFailures;
        this.nextAttemptAt = builder.nextAttemptAt;
        this.lastFailureTime = builder.lastFailureTime;
        this.lastStateChange = builder.lastStateChange;
        this.errorRateHistory = builder.errorRateHistory;
        this.configuration = builder.configuration;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public LifetimeMetrics getLifetimeMetrics() {
        return lifetimeMetrics;
    }

    public WindowMetrics getWindowMetrics() {
        return windowMetrics;
    }

    /**
     * Gets the error rate of the current rolling window.
     *
     * @return error rate percentage (0.0 to 100.0)
     */
    public double getErrorRate() {
        return windowMetrics.getErrorRate();
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Optional<Instant> getNextAttemptAt() {
        return Optional.ofNullable(nextAttemptAt);
    }

    public Optional<Instant> getLastFailureTime() {
        return Optional.ofNullable(lastFailureTime);
    }

    public Instant getLastStateChange() {
        return lastStateChange;
    }

    public List<ErrorRateSample> getErrorRateHistory() {
        return errorRateHistory;
    }

    public BreakerConfig getConfiguration() {
        return configuration;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("BreakerStatus{name='%s', state=%s, errorRate=%.2f%%, averageLatencyMs=%.2f, %s, %s}",
                name, state, getErrorRate(), averageLatencyMs, lifetimeMetrics, windowMetrics);
    }

    public static class Builder {
        private String name;
        private CircuitState state;
        private LifetimeMetrics lifetimeMetrics;
        private WindowMetrics windowMetrics = WindowMetrics.empty();
        private double averageLatencyMs;
        private int consecutiveFailures;
        private Instant nextAttemptAt;
        private Instant lastFailureTime;
        private Instant lastStateChange;
        private List<ErrorRateSample> errorRateHistory = List.of();
        private BreakerConfig configuration;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder state(CircuitState state) {
            this.state = state;
            return this;
        }

        public Builder lifetimeMetrics(LifetimeMetrics lifetimeMetrics) {
            this.lifetimeMetrics = lifetimeMetrics;
            return this;
        }

        public Builder windowMetrics(WindowMetrics windowMetrics) {
            this.windowMetrics = windowMetrics;
            return this;
        }

        public Builder averageLatencyMs(double averageLatencyMs) {
            this.averageLatencyMs = averageLatencyMs;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder lastFailureTime(Instant lastFailureTime) {
            this.lastFailureTime = lastFailureTime;
            return this;
        }

        public Builder lastStateChange(Instant lastStateChange) {
            this.lastStateChange = lastStateChange;
            return this;
        }

        public Builder errorRateHistory(List<ErrorRateSample> errorRateHistory) {
            this.errorRateHistory = List.copyOf(errorRateHistory);
            return this;
        }

        public Builder configuration(BreakerConfig configuration) {
            this.configuration = configuration;
            return this;
        }

        public BreakerStatus build() {
            return new BreakerStatus(this);
        }
    }
}
