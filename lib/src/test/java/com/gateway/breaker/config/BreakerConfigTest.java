package com.gateway.breaker.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BreakerConfig defaults, presets and validation.
 */
class BreakerConfigTest {

    @Test
    void testDefaultConfiguration() {
        BreakerConfig config = BreakerConfig.defaultConfig();

        assertEquals(Duration.ofSeconds(10), config.getTimeout());
        assertEquals(5, config.getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), config.getResetTimeout());
        assertEquals(Duration.ofSeconds(10), config.getRollingWindow());
        assertEquals(10, config.getVolumeThreshold());
        assertEquals(50.0, config.getErrorThresholdPercentage());
        assertEquals(Duration.ofSeconds(1), config.getBucketInterval());
        assertTrue(config.getFallback().isEmpty());
        assertTrue(config.getHealthCheck().isEmpty());
    }

    @Test
    void testRelaxedConfiguration() {
        BreakerConfig config = BreakerConfig.relaxedConfig();

        assertEquals(10, config.getFailureThreshold());
        assertEquals(80.0, config.getErrorThresholdPercentage());
        assertEquals(20, config.getVolumeThreshold());
        assertEquals(Duration.ofSeconds(15), config.getResetTimeout());
    }

    @Test
    void testStrictConfiguration() {
        BreakerConfig config = BreakerConfig.strictConfig();

        assertEquals(Duration.ofSeconds(2), config.getTimeout());
        assertEquals(3, config.getFailureThreshold());
        assertEquals(25.0, config.getErrorThresholdPercentage());
        assertEquals(5, config.getVolumeThreshold());
        assertEquals(Duration.ofSeconds(60), config.getResetTimeout());
    }

    @Test
    void testToBuilderKeepsEveryField() {
        BreakerConfig original = BreakerConfig.builder()
                .timeout(Duration.ofMillis(250))
                .failureThreshold(7)
                .healthCheck(() -> CompletableFuture.completedFuture(true))
                .fallback(error -> CompletableFuture.completedFuture("cached"))
                .build();

        BreakerConfig derived = original.toBuilder().volumeThreshold(3).build();

        assertEquals(Duration.ofMillis(250), derived.getTimeout());
        assertEquals(7, derived.getFailureThreshold());
        assertEquals(3, derived.getVolumeThreshold());
        assertTrue(derived.getHealthCheck().isPresent());
        assertTrue(derived.getFallback().isPresent());
        assertEquals(10, original.getVolumeThreshold());
    }

    @Test
    void testRejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().resetTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().rollingWindow(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().bucketInterval(Duration.ZERO).build());
    }

    @Test
    void testRejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().failureThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().volumeThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().errorThresholdPercentage(100.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerConfig.builder().errorThresholdPercentage(-1).build());
    }

    @Test
    void testToStringDoesNotExposeCallbacks() {
        BreakerConfig config = BreakerConfig.builder()
                .fallback(error -> CompletableFuture.completedFuture("cached"))
                .build();

        String description = config.toString();
        assertTrue(description.contains("failureThreshold=5"));
        assertTrue(description.contains("fallback=true"));
        assertTrue(description.contains("healthCheck=false"));
    }
}
