package com.vigil.monitorservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from the {@code vigil.service.*} prefix:
 *
 * <pre>
 * vigil:
 *   service:
 *     name: monitor-service
 *     environment: production
 *     description: Batch health checks
 * </pre>
 *
 * @param name Service name used for logging, metrics, and tracing. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for the info endpoint.
 */
@ConfigurationProperties(prefix = "vigil.service")
@Validated
public record MonitorServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public MonitorServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
