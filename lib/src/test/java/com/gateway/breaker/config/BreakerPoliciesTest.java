package com.gateway.breaker.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BreakerPoliciesTest {

    @Test
    void testGatewayDefaultsForAdminApi() {
        BreakerPolicies policies = BreakerPolicies.gatewayDefaults();

        BreakerConfig admin = policies.resolve(BreakerPolicies.ADMIN_API);
        assertEquals(5, admin.getFailureThreshold());
        assertEquals(Duration.ofSeconds(60), admin.getTimeout());
        assertEquals(Duration.ofSeconds(30), admin.getResetTimeout());
    }

    @Test
    void testGatewayDefaultsForCustomerApi() {
        BreakerPolicies policies = BreakerPolicies.gatewayDefaults();

        BreakerConfig customer = policies.resolve(BreakerPolicies.CUSTOMER_API);
        assertEquals(10, customer.getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), customer.getTimeout());
        assertEquals(Duration.ofSeconds(15), customer.getResetTimeout());
    }

    @Test
    void testUnknownDependencyResolvesToDefault() {
        BreakerConfig fallbackDefault = BreakerConfig.strictConfig();
        BreakerPolicies policies = BreakerPolicies.builder()
                .defaultConfig(fallbackDefault)
                .policy("billing", BreakerConfig.relaxedConfig())
                .build();

        assertSame(fallbackDefault, policies.resolve("inventory"));
        assertFalse(policies.hasPolicy("inventory"));
        assertTrue(policies.hasPolicy("billing"));
        assertEquals(1, policies.getPolicies().size());
    }

    @Test
    void testPoliciesAreImmutable() {
        BreakerPolicies policies = BreakerPolicies.gatewayDefaults();

        assertThrows(UnsupportedOperationException.class,
                () -> policies.getPolicies().put("other", BreakerConfig.defaultConfig()));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> BreakerPolicies.builder().policy(" ", BreakerConfig.defaultConfig()));
        assertThrows(IllegalArgumentException.class,
                () -> BreakerPolicies.builder().policy("orders", null).build());
        assertThrows(IllegalArgumentException.class,
                () -> BreakerPolicies.builder().defaultConfig(null).build());
    }
}
