package com.gateway.breaker.statemachine;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.model.CircuitState;
import com.gateway.breaker.window.WindowMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * CLOSED / OPEN / HALF_OPEN lifecycle of a circuit breaker.
 * <pre>
 *     CLOSED ──(consecutive failures or window error rate)──> OPEN
 *        ^                                                      │
 *        │                                             (reset timeout elapsed)
 *  (volumeThreshold successes)                                  │
 *        │                                                      v
 *        └───────────────────── HALF_OPEN ──(any failure)──> OPEN
 * </pre>
 * The state only changes through {@link #toOpen()}, {@link #toHalfOpen()},
 * {@link #toClosed()} and {@link #reset()}; each transition is a no-op when the
 * machine is already in the target state.
 * <p>
 * Not thread-safe. The owning breaker serializes access.
 */
public class CircuitStateMachine {

    private final BreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant nextAttemptAt;
    private Instant lastFailureTime;
    private Instant lastStateChange;
    private long circuitOpens;
    private long openGeneration;

    public CircuitStateMachine(BreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    /**
     * Whether an open circuit has waited long enough to attempt a call.
     */
    public boolean isResetDue() {
        return state == CircuitState.OPEN && !clock.instant().isBefore(nextAttemptAt);
    }

    public Optional<StateTransition> onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            consecutiveSuccesses++;
            if (consecutiveSuccesses >= config.getVolumeThreshold()) {
                return toClosed();
            }
        } else if (state == CircuitState.CLOSED) {
            consecutiveFailures = 0;
        }
        return Optional.empty();
    }

    /**
     * Records a failure and evaluates the open guards.
     *
     * @param window current rolling window totals
     * @return the transition to OPEN, if one happened
     */
    public Optional<StateTransition> onFailure(WindowMetrics window) {
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            return toOpen();
        }
        if (state == CircuitState.CLOSED) {
            consecutiveFailures++;
            if (shouldOpen(window)) {
                return toOpen();
            }
        }
        return Optional.empty();
    }

    private boolean shouldOpen(WindowMetrics window) {
        if (consecutiveFailures >= config.getFailureThreshold()) {
            return true;
        }
        // low traffic never trips the error-rate guard
        return window.getTotal() >= config.getVolumeThreshold()
                && window.getErrorRate() >= config.getErrorThresholdPercentage();
    }

    public Optional<StateTransition> toOpen() {
        if (state == CircuitState.OPEN) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        nextAttemptAt = now.plus(config.getResetTimeout());
        circuitOpens++;
        openGeneration++;
        return changeState(CircuitState.OPEN, now);
    }

    public Optional<StateTransition> toHalfOpen() {
        if (state == CircuitState.HALF_OPEN) {
            return Optional.empty();
        }
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        return changeState(CircuitState.HALF_OPEN, clock.instant());
    }

    public Optional<StateTransition> toClosed() {
        if (state == CircuitState.CLOSED) {
            return Optional.empty();
        }
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        nextAttemptAt = null;
        return changeState(CircuitState.CLOSED, clock.instant());
    }

    /**
     * Forces CLOSED and clears every counter except the number of opens.
     *
     * @return the state before the reset
     */
    public CircuitState reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        nextAttemptAt = null;
        lastFailureTime = null;
        lastStateChange = clock.instant();
        return previous;
    }

    /**
     * Pushes the next permitted attempt of an open circuit one reset timeout into the future.
     */
    public void postponeNextAttempt() {
        if (state == CircuitState.OPEN) {
            nextAttemptAt = clock.instant().plus(config.getResetTimeout());
        }
    }

    private Optional<StateTransition> changeState(CircuitState target, Instant now) {
        CircuitState previous = state;
        state = target;
        lastStateChange = now;
        return Optional.of(new StateTransition(previous, target, now));
    }

    public CircuitState getState() {
        return state;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
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

    public long getCircuitOpens() {
        return circuitOpens;
    }

    /**
     * Incremented on every transition to OPEN; lets background work detect that
     * the open period it was scheduled for has ended.
     */
    public long getOpenGeneration() {
        return openGeneration;
    }
}
