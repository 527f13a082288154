package com.gateway.breaker.statemachine;

import com.gateway.breaker.model.CircuitState;

import java.time.Instant;

/**
 * A state change performed by a {@link CircuitStateMachine}.
 */
public final class StateTransition {

    private final CircuitState from;
    private final CircuitState to;
    private final Instant timestamp;

    public StateTransition(CircuitState from, CircuitState to, Instant timestamp) {
        this.from = from;
        this.to = to;
        this.timestamp = timestamp;
    }

    public CircuitState getFrom() {
        return from;
    }

    public CircuitState getTo() {
        return to;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
