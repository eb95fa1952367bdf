package com.example.policy.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the process-wide capability tree cache.
 */
@ConfigurationProperties(prefix = "app.capability-cache")
public record CapabilityCacheProperties(
        int maximumSize
) {
    public CapabilityCacheProperties {
        if (maximumSize <= 0) {
            maximumSize = 64;
        }
    }

    public static CapabilityCacheProperties defaults() {
        return new CapabilityCacheProperties(64);
    }
}
