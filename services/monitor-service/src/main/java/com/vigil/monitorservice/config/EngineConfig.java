package com.vigil.monitorservice.config;

import com.vigil.batch.BatchCoordinator;
import com.vigil.batch.BatchMetrics;
import com.vigil.check.CheckInvoker;
import com.vigil.check.CheckRegistry;
import com.vigil.checks.BuiltinChecks;
import com.vigil.observability.MetricFactory;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the check registry, invoker and batch coordinator into the Spring context.
 *
 * <p>Metrics go to the actuator's {@link MeterRegistry} (Prometheus in production). Spans go to
 * the global OpenTelemetry instance, which is a no-op unless an agent or SDK installs one.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    static final String INSTRUMENTATION_NAME = "com.vigil.monitor-service";

    @Bean
    public CheckRegistry checkRegistry() {
        CheckRegistry registry = BuiltinChecks.registerAll(new CheckRegistry());
        log.info("Check registry ready with types {}", registry.types());
        return registry;
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public CheckInvoker checkInvoker(CheckRegistry registry, SpanHelper spanHelper, SensitiveDataRedactor redactor) {
        return new CheckInvoker(registry, spanHelper, redactor);
    }

    @Bean
    public BatchMetrics batchMetrics(ObjectProvider<MeterRegistry> meterRegistry, MonitorServiceProperties service) {
        MeterRegistry registry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
        return new BatchMetrics(new MetricFactory(registry, service.name()));
    }

    @Bean
    public BatchCoordinator batchCoordinator(CheckInvoker invoker, BatchMetrics metrics) {
        return new BatchCoordinator(invoker, metrics);
    }
}
