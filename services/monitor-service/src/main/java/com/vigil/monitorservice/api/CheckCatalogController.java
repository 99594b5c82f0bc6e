package com.vigil.monitorservice.api;

import com.vigil.check.CheckDescriptor;
import com.vigil.check.CheckRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lists the registered check types and the configuration keys each understands.
 */
@RestController
@RequestMapping("/api/v1/checks")
public class CheckCatalogController {

    private final CheckRegistry registry;

    public CheckCatalogController(CheckRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<Map<String, Object>> catalogue() {
        return registry.descriptors().values().stream().map(CheckCatalogController::toDocument).toList();
    }

    @GetMapping("/{type}")
    public Map<String, Object> describe(@PathVariable String type) {
        CheckDescriptor descriptor = registry.descriptors().get(type);
        if (descriptor == null) {
            throw new UnknownCheckTypeException(type);
        }
        return toDocument(descriptor);
    }

    private static Map<String, Object> toDocument(CheckDescriptor descriptor) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("type", descriptor.type());
        document.put("description", descriptor.description());
        document.put("required_config", descriptor.requiredConfig());
        document.put("optional_config", descriptor.optionalConfig());
        return document;
    }
}
