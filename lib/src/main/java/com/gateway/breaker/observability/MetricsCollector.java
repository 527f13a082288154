package com.gateway.breaker.observability;

import com.gateway.breaker.core.CircuitBreakerException.BreakerTimeoutException;
import com.gateway.breaker.event.BreakerEvent;
import com.gateway.breaker.event.BreakerEventListener;
import com.gateway.breaker.model.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records breaker events as Micrometer meters.
 * Provides observability into call outcomes, latency and circuit state per breaker.
 */
public class MetricsCollector implements BreakerEventListener {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    static final String CALLS = "gateway.breaker.calls";
    static final String LATENCY = "gateway.breaker.call.latency";
    static final String REJECTIONS = "gateway.breaker.rejections";
    static final String TRANSITIONS = "gateway.breaker.transitions";
    static final String HEALTH_CHECK_FAILURES = "gateway.breaker.health_check.failures";
    static final String STATE = "gateway.breaker.state";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, BreakerMetrics> breakerMetrics;

    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.breakerMetrics = new ConcurrentHashMap<>();

        logger.info("Breaker metrics collector initialized");
    }

    @Override
    public void onEvent(BreakerEvent event) {
        BreakerMetrics metrics = breakerMetrics.computeIfAbsent(event.getBreakerName(),
                name -> new BreakerMetrics(name, meterRegistry));

        switch (event.getType()) {
            case SUCCESS -> metrics.recordCall(event, "success");
            case FAILURE -> metrics.recordCall(event, isTimeout(event) ? "timeout" : "failure");
            case CALL_REJECTED -> metrics.rejections.increment();
            case HEALTH_CHECK_FAILED -> metrics.healthCheckFailures.increment();
            case OPEN, HALF_OPEN, CLOSE, RESET -> metrics.recordTransition(event);
        }
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private static boolean isTimeout(BreakerEvent event) {
        return event.getFailure()
                .filter(BreakerTimeoutException.class::isInstance)
                .isPresent();
    }

    /**
     * Gauge value for a circuit state: 0 closed, 1 half-open, 2 open.
     */
    static int stateValue(CircuitState state) {
        if (state == null) {
            return 0;
        }
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    /**
     * Breaker-specific metrics container.
     */
    private static class BreakerMetrics {
        private final String breakerName;
        private final MeterRegistry registry;
        private final Timer latency;
        private final Counter rejections;
        private final Counter healthCheckFailures;
        private final AtomicInteger state;

        BreakerMetrics(String breakerName, MeterRegistry registry) {
            this.breakerName = breakerName;
            this.registry = registry;
            this.state = new AtomicInteger(0);

            this.latency = Timer.builder(LATENCY)
                    .tag("breaker", breakerName)
                    .description("Latency of calls guarded by the breaker")
                    .register(registry);

            this.rejections = Counter.builder(REJECTIONS)
                    .tag("breaker", breakerName)
                    .description("Calls refused by an open circuit")
                    .register(registry);

            this.healthCheckFailures = Counter.builder(HEALTH_CHECK_FAILURES)
                    .tag("breaker", breakerName)
                    .description("Failed recovery probes of an open circuit")
                    .register(registry);

            Gauge.builder(STATE, state, AtomicInteger::doubleValue)
                    .tag("breaker", breakerName)
                    .description("Circuit state (0 closed, 1 half-open, 2 open)")
                    .register(registry);
        }

        void recordCall(BreakerEvent event, String outcome) {
            Counter.builder(CALLS)
                    .tag("breaker", breakerName)
                    .tag("outcome", outcome)
                    .description("Calls guarded by the breaker")
                    .register(registry)
                    .increment();
            event.getDuration().ifPresent(latency::record);
            state.set(stateValue(event.getState()));
        }

        void recordTransition(BreakerEvent event) {
            Counter.builder(TRANSITIONS)
                    .tag("breaker", breakerName)
                    .tag("type", event.getType().name().toLowerCase())
                    .description("Circuit state transitions")
                    .register(registry)
                    .increment();
            state.set(stateValue(event.getState()));
        }
    }
}
