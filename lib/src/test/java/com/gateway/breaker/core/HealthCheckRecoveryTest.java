package com.gateway.breaker.core;

import com.gateway.breaker.config.BreakerConfig;
import com.gateway.breaker.event.BreakerEvent;
import com.gateway.breaker.event.BreakerEventListener;
import com.gateway.breaker.event.BreakerEventType;
import com.gateway.breaker.model.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for out-of-band recovery of an open circuit through its health check.
 */
class HealthCheckRecoveryTest {

    private static final Duration RECOVERY_INTERVAL = Duration.ofMillis(100);

    private ScheduledExecutorService scheduler;
    private List<BreakerEvent> events;
    private AtomicInteger probes;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        events = new CopyOnWriteArrayList<>();
        probes = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testHealthyProbeMovesOpenCircuitToHalfOpen() throws Exception {
        CircuitBreaker breaker = newBreaker(() -> {
            probes.incrementAndGet();
            return CompletableFuture.completedFuture(true);
        });

        breaker.forceOpen();
        assertTrue(breaker.isRecoveryPending());

        awaitCondition(() -> breaker.getState() == CircuitState.HALF_OPEN);
        assertEquals(1, probes.get());
        assertFalse(breaker.isRecoveryPending());
        assertTrue(events.stream().anyMatch(event -> event.getType() == BreakerEventType.HALF_OPEN));
    }

    @Test
    void testUnhealthyProbeKeepsCircuitOpenAndRetries() throws Exception {
        CircuitBreaker breaker = newBreaker(() -> {
            probes.incrementAndGet();
            return CompletableFuture.completedFuture(false);
        });

        breaker.forceOpen();
        Instant firstAttempt = breaker.getNextAttemptAt().orElseThrow();

        awaitCondition(() -> probes.get() >= 2);
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertTrue(breaker.getNextAttemptAt().orElseThrow().isAfter(firstAttempt));
        assertTrue(events.stream().anyMatch(event -> event.getType() == BreakerEventType.HEALTH_CHECK_FAILED));

        breaker.close();
        assertFalse(breaker.isRecoveryPending());
    }

    @Test
    void testFailingProbeReportsCause() throws Exception {
        IOException error = new IOException("unreachable");
        CircuitBreaker breaker = newBreaker(() -> CompletableFuture.failedFuture(error));

        breaker.forceOpen();

        awaitCondition(() -> healthCheckFailures() > 0);
        BreakerEvent failure = events.stream()
                .filter(event -> event.getType() == BreakerEventType.HEALTH_CHECK_FAILED)
                .findFirst()
                .orElseThrow();
        assertSame(error, failure.getFailure().orElseThrow());
        assertEquals(CircuitState.OPEN, breaker.getState());
        breaker.close();
    }

    @Test
    void testHangingProbeTimesOut() throws Exception {
        CircuitBreaker breaker = newBreaker(CompletableFuture::new);

        breaker.forceOpen();

        awaitCondition(() -> healthCheckFailures() > 0);
        BreakerEvent failure = events.stream()
                .filter(event -> event.getType() == BreakerEventType.HEALTH_CHECK_FAILED)
                .findFirst()
                .orElseThrow();
        assertTrue(failure.getFailure().orElseThrow() instanceof TimeoutException);
        breaker.close();
    }

    @Test
    void testLeavingOpenStateCancelsProbe() throws Exception {
        CircuitBreaker breaker = newBreaker(() -> {
            probes.incrementAndGet();
            return CompletableFuture.completedFuture(true);
        });

        breaker.forceOpen();
        breaker.forceClose();
        assertFalse(breaker.isRecoveryPending());

        Thread.sleep(RECOVERY_INTERVAL.toMillis() * 3);
        assertEquals(0, probes.get());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testResetCancelsProbe() {
        CircuitBreaker breaker = newBreaker(() -> CompletableFuture.completedFuture(true));

        breaker.forceOpen();
        breaker.reset();

        assertFalse(breaker.isRecoveryPending());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testClosedBreakerDoesNotScheduleProbes() {
        CircuitBreaker breaker = newBreaker(() -> CompletableFuture.completedFuture(true));
        breaker.close();

        breaker.forceOpen();

        assertFalse(breaker.isRecoveryPending());
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void testBreakerWithoutHealthCheckHasNoRecovery() {
        CircuitBreaker breaker = new CircuitBreaker("orders", BreakerConfig.defaultConfig(), scheduler);

        breaker.forceOpen();

        assertFalse(breaker.isRecoveryPending());
    }

    private CircuitBreaker newBreaker(Supplier<? extends CompletionStage<Boolean>> healthCheck) {
        BreakerConfig config = BreakerConfig.builder()
                .resetTimeout(RECOVERY_INTERVAL)
                .timeout(Duration.ofMillis(100))
                .healthCheck(healthCheck)
                .build();
        BreakerEventListener collector = events::add;
        return new CircuitBreaker("orders", config, scheduler, Clock.systemUTC(), List.of(collector));
    }

    private long healthCheckFailures() {
        return events.stream()
                .filter(event -> event.getType() == BreakerEventType.HEALTH_CHECK_FAILED)
                .count();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
