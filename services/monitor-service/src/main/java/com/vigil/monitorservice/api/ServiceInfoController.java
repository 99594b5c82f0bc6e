package com.vigil.monitorservice.api;

import com.vigil.check.CheckRegistry;
import com.vigil.monitorservice.config.MonitorServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime info; actuator's {@code /actuator/info} carries build metadata.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final MonitorServiceProperties properties;
    private final CheckRegistry registry;

    public ServiceInfoController(MonitorServiceProperties properties, CheckRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "check_types", registry.types(),
                "timestamp", Instant.now().toString());
    }
}
