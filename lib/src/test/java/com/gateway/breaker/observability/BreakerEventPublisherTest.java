package com.gateway.breaker.observability;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.core.CircuitBreaker;
import com.gateway.breaker.event.BreakerEvent;
import com.gateway.breaker.event.BreakerEventType;
import com.gateway.breaker.model.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BreakerEventPublisherTest {

    private BreakerEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new BreakerEventPublisher();
    }

    @AfterEach
    void tearDown() {
        publisher.close();
    }

    @Test
    void testStreamDeliversEventsInOrder() {
        BreakerEvent open = event(BreakerEventType.OPEN, CircuitState.OPEN);
        BreakerEvent halfOpen = event(BreakerEventType.HALF_OPEN, CircuitState.HALF_OPEN);

        StepVerifier.create(publisher.getEventStream().take(2))
                .then(() -> {
                    publisher.onEvent(open);
                    publisher.onEvent(halfOpen);
                })
                .expectNext(open, halfOpen)
                .expectComplete()
                .verify(Duration.ofSeconds(1));
    }

    @Test
    void testPublishingWithoutSubscribersIsHarmless() {
        assertDoesNotThrow(() -> publisher.onEvent(event(BreakerEventType.SUCCESS, CircuitState.CLOSED)));
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testTransitionSubscriptionFiltersCallEvents() {
        List<BreakerEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribeToTransitions(received::add);

        publisher.onEvent(event(BreakerEventType.SUCCESS, CircuitState.CLOSED));
        publisher.onEvent(event(BreakerEventType.FAILURE, CircuitState.CLOSED));
        publisher.onEvent(event(BreakerEventType.OPEN, CircuitState.OPEN));
        publisher.onEvent(event(BreakerEventType.RESET, CircuitState.CLOSED));

        assertEquals(List.of(BreakerEventType.OPEN, BreakerEventType.RESET),
                received.stream().map(BreakerEvent::getType).toList());
        subscription.dispose();
    }

    @Test
    void testSubscriberCountTracksDisposal() {
        Disposable first = publisher.subscribe(event -> { });
        Disposable second = publisher.subscribe(event -> { });
        assertEquals(2, publisher.getSubscriberCount());

        first.dispose();
        assertEquals(1, publisher.getSubscriberCount());

        second.dispose();
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testCloseCompletesStream() {
        StepVerifier.create(publisher.getEventStream())
                .then(publisher::close)
                .expectComplete()
                .verify(Duration.ofSeconds(1));
    }

    @Test
    void testCloseCompletesStreamWhileEventsArePublished() {
        ExecutorService emitter = Executors.newSingleThreadExecutor();
        AtomicBoolean emitting = new AtomicBoolean(true);
        AtomicBoolean started = new AtomicBoolean(false);
        try {
            StepVerifier.create(publisher.getEventStream().doOnTerminate(() -> emitting.set(false)))
                    .then(() -> emitter.submit(() -> {
                        while (emitting.get()) {
                            publisher.onEvent(event(BreakerEventType.SUCCESS, CircuitState.CLOSED));
                            started.set(true);
                        }
                    }))
                    .then(() -> {
                        while (!started.get()) {
                            Thread.onSpinWait();
                        }
                        publisher.close();
                    })
                    .thenConsumeWhile(event -> true)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        } finally {
            emitting.set(false);
            emitter.shutdownNow();
        }
    }

    @Test
    void testBreakerEventsReachStream() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            CircuitBreaker breaker = new CircuitBreaker("inventory", BreakerConfig.defaultConfig(), scheduler,
                    Clock.systemUTC(), List.of(publisher));

            StepVerifier.create(publisher.getEventStream().take(2))
                    .then(() -> {
                        breaker.forceOpen();
                        breaker.reset();
                    })
                    .assertNext(event -> {
                        assertEquals(BreakerEventType.OPEN, event.getType());
                        assertEquals("inventory", event.getBreakerName());
                    })
                    .assertNext(event -> assertEquals(BreakerEventType.RESET, event.getType()))
                    .expectComplete()
                    .verify(Duration.ofSeconds(1));
        } finally {
            scheduler.shutdownNow();
        }
    }

    private static BreakerEvent event(BreakerEventType type, CircuitState state) {
        return BreakerEvent.builder(type, "inventory")
                .state(state)
                .build();
    }
}
