package com.gateway.breaker.observability;

import com.gateway.breaker.event.BreakerEvent;
import com.gateway.breaker.event.BreakerEventListener;
import com.gateway.breaker.event.BreakerEventType;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bridges breaker event callbacks to a reactive stream.
 * Register the publisher as a {@link BreakerEventListener} on breakers or a
 * registry, then subscribe to the stream for real-time monitoring and alerting.
 */
public class BreakerEventPublisher implements BreakerEventListener {

    private static final Logger logger = LoggerFactory.getLogger(BreakerEventPublisher.class);

    private final Sinks.Many<BreakerEvent> eventSink;
    private final ConcurrentMap<String, Boolean> subscribers;
    private final AtomicLong subscriberSequence;

    public BreakerEventPublisher() {
        this.eventSink = Sinks.many().multicast().directBestEffort();
        this.subscribers = new ConcurrentHashMap<>();
        this.subscriberSequence = new AtomicLong();

        logger.info("BreakerEventPublisher initialized");
    }

    @Override
    public void onEvent(BreakerEvent event) {
        Sinks.EmitResult result;
        // sinks reject concurrent emission; breakers emit from caller and scheduler threads
        synchronized (eventSink) {
            result = eventSink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.warn("Failed to publish {} event for breaker {}: {}",
                    event.getType(), event.getBreakerName(), result);
        } else {
            logger.debug("Published breaker event: {}", event);
        }
    }

    /**
     * Subscribes to all breaker events.
     *
     * @param listener the callback for breaker events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(Consumer<BreakerEvent> listener) {
        return subscribe(getEventStream(), listener);
    }

    /**
     * Subscribes to state transitions only (open, half-open, close, reset).
     *
     * @param listener the callback for transition events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribeToTransitions(Consumer<BreakerEvent> listener) {
        return subscribe(getEventStream().filter(BreakerEventPublisher::isTransition), listener);
    }

    /**
     * Gets the current number of active subscribers.
     *
     * @return number of active subscribers
     */
    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Gets the event stream for advanced reactive operations.
     *
     * @return Flux of breaker events
     */
    public Flux<BreakerEvent> getEventStream() {
        return eventSink.asFlux();
    }

    /**
     * Closes the publisher and completes the event stream.
     */
    public void close() {
        logger.info("Closing BreakerEventPublisher with {} active subscribers", subscribers.size());

        synchronized (eventSink) {
            eventSink.tryEmitComplete();
        }
        subscribers.clear();

        logger.info("BreakerEventPublisher closed");
    }

    private Disposable subscribe(Flux<BreakerEvent> stream, Consumer<BreakerEvent> listener) {
        String subscriberId = "breaker-" + subscriberSequence.incrementAndGet();
        subscribers.put(subscriberId, Boolean.TRUE);

        logger.info("New breaker event subscriber: {} (total subscribers: {})",
                subscriberId, subscribers.size());

        return stream
                .doOnCancel(() -> {
                    subscribers.remove(subscriberId);
                    logger.info("Breaker event subscription cancelled: {} (remaining: {})",
                            subscriberId, subscribers.size());
                })
                .subscribe(
                        listener,
                        error -> logger.error("Breaker event subscriber {} failed", subscriberId, error)
                );
    }

    private static boolean isTransition(BreakerEvent event) {
        BreakerEventType type = event.getType();
        return type == BreakerEventType.OPEN
                || type == BreakerEventType.HALF_OPEN
                || type == BreakerEventType.CLOSE
                || type == BreakerEventType.RESET;
    }
}
