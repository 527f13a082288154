package com.gateway.breaker.event;

/**
 * Lifecycle events emitted by a circuit breaker.
 */
public enum BreakerEventType {

    /**
     * A guarded call completed successfully.
     */
    SUCCESS,

    /**
     * A guarded call failed or timed out.
     */
    FAILURE,

    /**
     * A call was refused without being attempted because the circuit is open.
     */
    CALL_REJECTED,

    /**
     * The circuit transitioned to OPEN.
     */
    OPEN,

    /**
     * The circuit transitioned to HALF_OPEN and will attempt calls again.
     */
    HALF_OPEN,

    /**
     * The circuit transitioned to CLOSED.
     */
    CLOSE,

    /**
     * The breaker was reset to CLOSED and its counters cleared.
     */
    RESET,

    /**
     * A recovery probe of an open circuit failed; the circuit stays open.
     */
    HEALTH_CHECK_FAILED
}
