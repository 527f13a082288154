package com.gateway.breaker.event;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Functional interface for breaker event listeners.
 * Listeners are passed to a breaker at construction and invoked on the thread
 * that caused the event, outside the breaker's internal lock.
 */
@FunctionalInterface
public interface BreakerEventListener {

    /**
     * Called when a breaker event occurs.
     *
     * @param event the event
     */
    void onEvent(BreakerEvent event);

    /**
     * Creates a listener that only receives events of the given types.
     *
     * @param consumer the event consumer
     * @param types the event types to forward
     * @return BreakerEventListener that delegates matching events to the consumer
     */
    static BreakerEventListener filtering(Consumer<BreakerEvent> consumer, BreakerEventType... types) {
        Set<BreakerEventType> accepted = EnumSet.noneOf(BreakerEventType.class);
        Collections.addAll(accepted, types);
        return event -> {
            if (accepted.contains(event.getType())) {
                consumer.accept(event);
            }
        };
    }
}
