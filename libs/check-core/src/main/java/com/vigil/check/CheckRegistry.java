package com.vigil.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of check implementations keyed by check-type tag.
 * <p>
 * The registry is an ordinary object built once at startup and handed to the {@link CheckInvoker};
 * there is no process-wide instance, so tests can build a registry of fake checks in isolation.
 * Lookups are safe from worker threads.
 */
public final class CheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistry.class);

    private final Map<String, Check> checks = new ConcurrentHashMap<>();

    /**
     * Registers a check under the given type tag.
     *
     * @param type  check type tag (e.g., "website_status", "dns_record")
     * @param check the implementation
     * @return this registry, for chained registration
     * @throws IllegalArgumentException if the type is blank, the check is null, or the type is
     *                                  already registered
     */
    public CheckRegistry register(String type, Check check) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (checks.putIfAbsent(type, check) != null) {
            throw new IllegalArgumentException("A check named '" + type + "' is already registered");
        }
        log.info("Registered check type: {}", type);
        return this;
    }

    /**
     * Removes a check by type tag.
     *
     * @param type check type to deregister
     * @return true if a check was removed
     */
    public boolean deregister(String type) {
        return type != null && checks.remove(type) != null;
    }

    /**
     * Looks up the implementation registered under a type tag.
     */
    public Optional<Check> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(checks.get(type));
    }

    /**
     * Returns the registered type tags in alphabetical order.
     */
    public List<String> types() {
        return checks.keySet().stream().sorted().toList();
    }

    /**
     * Returns the catalogue of registered checks, keyed by type in alphabetical order.
     */
    public Map<String, CheckDescriptor> descriptors() {
        Map<String, CheckDescriptor> catalogue = new LinkedHashMap<>();
        for (String type : types()) {
            Check check = checks.get(type);
            if (check != null) {
                catalogue.put(type, check.descriptor(type));
            }
        }
        return Collections.unmodifiableMap(catalogue);
    }

    /**
     * Returns the number of registered checks.
     */
    public int size() {
        return checks.size();
    }
}
