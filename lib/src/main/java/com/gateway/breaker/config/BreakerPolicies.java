package com.gateway.breaker.config;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-dependency breaker policies. Dependencies without an explicit policy
 * fall back to the default configuration.
 */
public class BreakerPolicies {

    public static final String ADMIN_API = "admin-api";
    public static final String CUSTOMER_API = "customer-api";

    private final BreakerConfig defaultConfig;
    private final Map<String, BreakerConfig> policies;

    private BreakerPolicies(Builder builder) {
        this.defaultConfig = builder.defaultConfig;
        this.policies = Collections.unmodifiableMap(new HashMap<>(builder.policies));
    }

    /**
     * Resolves the configuration for a dependency.
     *
     * @param name the dependency name
     * @return the configured policy, or the default configuration
     */
    public BreakerConfig resolve(String name) {
        return policies.getOrDefault(name, defaultConfig);
    }

    public boolean hasPolicy(String name) {
        return policies.containsKey(name);
    }

    public BreakerConfig getDefaultConfig() {
        return defaultConfig;
    }

    public Map<String, BreakerConfig> getPolicies() {
        return policies;
    }

    public static BreakerPolicies defaults() {
        return builder().build();
    }

    /**
     * Policies used by the gateway for its downstream back ends.
     */
    public static BreakerPolicies gatewayDefaults() {
        return builder()
                .policy(ADMIN_API, BreakerConfig.builder()
                        .failureThreshold(5)
                        .timeout(Duration.ofSeconds(60))
                        .resetTimeout(Duration.ofSeconds(30))
                        .build())
                .policy(CUSTOMER_API, BreakerConfig.builder()
                        .failureThreshold(10)
                        .timeout(Duration.ofSeconds(30))
                        .resetTimeout(Duration.ofSeconds(15))
                        .build())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BreakerConfig defaultConfig = BreakerConfig.defaultConfig();
        private final Map<String, BreakerConfig> policies = new HashMap<>();

        public Builder defaultConfig(BreakerConfig config) {
            this.defaultConfig = config;
            return this;
        }

        public Builder policy(String name, BreakerConfig config) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Policy name is required");
            }
            this.policies.put(name, config);
            return this;
        }

        public BreakerPolicies build() {
            if (defaultConfig == null) {
                throw new IllegalArgumentException("Default configuration must be specified");
            }
            policies.forEach((name, config) -> {
                if (config == null) {
                    throw new IllegalArgumentException("Policy " + name + " has no configuration");
                }
            });
            return new BreakerPolicies(this);
        }
    }
}
