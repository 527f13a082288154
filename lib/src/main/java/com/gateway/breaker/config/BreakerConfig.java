package com.gateway.breaker.config;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Circuit breaker configuration for a single downstream dependency.
 * Instances are immutable; use {@link #toBuilder()} to derive a variant.
 */
public class BreakerConfig {

    private final Duration timeout;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Duration rollingWindow;
    private final int volumeThreshold;
    private final double errorThresholdPercentage;
    private final Duration bucketInterval;
    private final Function<Throwable, ? extends CompletionStage<?>> fallback;
    private final Supplier<? extends CompletionStage<Boolean>> healthCheck;

    private BreakerConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeout = builder.resetTimeout;
        this.rollingWindow = builder.rollingWindow;
        this.volumeThreshold = builder.volumeThreshold;
        this.errorThresholdPercentage = builder.errorThresholdPercentage;
        this.bucketInterval = builder.bucketInterval;
        this.fallback = builder.fallback;
        this.healthCheck = builder.healthCheck;
    }

    /**
     * Time after which a call is treated as a timeout.
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Consecutive failures that open a closed circuit.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * Time an open circuit waits before a half-open attempt is permitted.
     */
    public Duration getResetTimeout() {
        return resetTimeout;
    }

    public Duration getRollingWindow() {
        return rollingWindow;
    }

    /**
     * Minimum window volume before the error rate may open the circuit. Also the
     * number of consecutive half-open successes required to close it again.
     */
    public int getVolumeThreshold() {
        return volumeThreshold;
    }

    public double getErrorThresholdPercentage() {
        return errorThresholdPercentage;
    }

    public Duration getBucketInterval() {
        return bucketInterval;
    }

    public Optional<Function<Throwable, ? extends CompletionStage<?>>> getFallback() {
        return Optional.ofNullable(fallback);
    }

    public Optional<Supplier<? extends CompletionStage<Boolean>>> getHealthCheck() {
        return Optional.ofNullable(healthCheck);
    }

    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .rollingWindow(rollingWindow)
                .volumeThreshold(volumeThreshold)
                .errorThresholdPercentage(errorThresholdPercentage)
                .bucketInterval(bucketInterval)
                .fallback(fallback)
                .healthCheck(healthCheck);
    }

    public static BreakerConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Creates a relaxed configuration that tolerates more failures before opening,
     * suitable for non-critical or flaky dependencies.
     */
    public static BreakerConfig relaxedConfig() {
        return builder()
                .failureThreshold(10)
                .errorThresholdPercentage(80.0)
                .volumeThreshold(20)
                .resetTimeout(Duration.ofSeconds(15))
                .build();
    }

    /**
     * Creates a strict configuration that opens quickly and probes recovery slowly.
     */
    public static BreakerConfig strictConfig() {
        return builder()
                .timeout(Duration.ofSeconds(2))
                .failureThreshold(3)
                .errorThresholdPercentage(25.0)
                .volumeThreshold(5)
                .resetTimeout(Duration.ofSeconds(60))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("BreakerConfig{timeout=%s, failureThreshold=%d, resetTimeout=%s, rollingWindow=%s, " +
                        "volumeThreshold=%d, errorThresholdPercentage=%.1f, fallback=%s, healthCheck=%s}",
                timeout, failureThreshold, resetTimeout, rollingWindow, volumeThreshold,
                errorThresholdPercentage, fallback != null, healthCheck != null);
    }

    public static class Builder {
        private Duration timeout = Duration.ofSeconds(10);
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private Duration rollingWindow = Duration.ofSeconds(10);
        private int volumeThreshold = 10;
        private double errorThresholdPercentage = 50.0;
        private Duration bucketInterval = Duration.ofSeconds(1);
        private Function<Throwable, ? extends CompletionStage<?>> fallback;
        private Supplier<? extends CompletionStage<Boolean>> healthCheck;

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }

        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        public Builder rollingWindow(Duration rollingWindow) {
            this.rollingWindow = rollingWindow;
            return this;
        }

        public Builder volumeThreshold(int volumeThreshold) {
            this.volumeThreshold = volumeThreshold;
            return this;
        }

        public Builder errorThresholdPercentage(double percentage) {
            this.errorThresholdPercentage = percentage;
            return this;
        }

        public Builder bucketInterval(Duration bucketInterval) {
            this.bucketInterval = bucketInterval;
            return this;
        }

        /**
         * Substitute invoked with the failure cause when a call is rejected, fails or
         * times out. Its outcome replaces the outcome of the call.
         */
        public Builder fallback(Function<Throwable, ? extends CompletionStage<?>> fallback) {
            this.fallback = fallback;
            return this;
        }

        /**
         * Out-of-band probe used to move an open circuit to half-open without live traffic.
         * A probe succeeds when its stage completes with {@code true}.
         */
        public Builder healthCheck(Supplier<? extends CompletionStage<Boolean>> healthCheck) {
            this.healthCheck = healthCheck;
            return this;
        }

        public BreakerConfig build() {
            requirePositive(timeout, "Timeout");
            requirePositive(resetTimeout, "Reset timeout");
            requirePositive(rollingWindow, "Rolling window");
            requirePositive(bucketInterval, "Bucket interval");
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("Failure threshold must be at least 1");
            }
            if (volumeThreshold < 1) {
                throw new IllegalArgumentException("Volume threshold must be at least 1");
            }
            if (errorThresholdPercentage < 0.0 || errorThresholdPercentage > 100.0) {
                throw new IllegalArgumentException("Error threshold percentage must be between 0 and 100");
            }
            return new BreakerConfig(this);
        }

        private static void requirePositive(Duration duration, String label) {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException(label + " must be a positive duration");
            }
        }
    }
}
