package com.vigil.monitorservice;

import com.vigil.monitorservice.config.EngineProperties;
import com.vigil.monitorservice.config.MonitorServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil monitor service: runs check batches submitted over HTTP.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation from HTTP into batch worker threads
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({MonitorServiceProperties.class, EngineProperties.class})
public class MonitorServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(MonitorServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MonitorServiceApplication.class, args);
        log.info("Vigil monitor service started successfully");
    }
}
