package com.gateway.breaker.model;

/**
 * Circuit breaker state for a downstream dependency.
 */
public enum CircuitState {

    /**
     * Circuit is closed - calls are allowed through.
     */
    CLOSED,

    /**
     * Circuit is open - calls are rejected to prevent cascading failures.
     */
    OPEN,

    /**
     * Circuit is half-open - calls are attempted to test recovery.
     */
    HALF_OPEN
}
