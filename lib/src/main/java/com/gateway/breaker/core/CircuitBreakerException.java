package com.gateway.breaker.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Failure raised by a circuit breaker itself, as opposed to an error of the guarded call.
 * Callers can use {@link #getCode()} to tell the breaker's protective failures apart
 * from downstream application errors.
 */
public class CircuitBreakerException extends RuntimeException {

    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";
    public static final String TIMEOUT = "TIMEOUT";

    private final String breakerName;
    private final String code;

    public CircuitBreakerException(String breakerName, String code, String message) {
        super(message);
        this.breakerName = breakerName;
        this.code = code;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public String getCode() {
        return code;
    }

    /**
     * Thrown when a call is refused because the circuit is open and the reset timeout has not elapsed.
     */
    public static class CircuitOpenException extends CircuitBreakerException {
        private final Instant nextAttemptAt;

        public CircuitOpenException(String breakerName, Instant nextAttemptAt) {
            super(breakerName, CIRCUIT_OPEN, String.format("Circuit breaker is OPEN for %s", breakerName));
            this.nextAttemptAt = nextAttemptAt;
        }

        /**
         * Earliest time at which the breaker will attempt a call again, or null if unknown.
         */
        public Instant getNextAttemptAt() {
            return nextAttemptAt;
        }
    }

    /**
     * Thrown when a guarded call does not settle within the configured timeout.
     */
    public static class BreakerTimeoutException extends CircuitBreakerException {
        private final Duration timeout;

        public BreakerTimeoutException(String breakerName, Duration timeout) {
            super(breakerName, TIMEOUT, String.format("Circuit breaker %s timed out after %dms",
                    breakerName, timeout.toMillis()));
            this.timeout = timeout;
        }

        public Duration getTimeout() {
            return timeout;
        }
    }
}
