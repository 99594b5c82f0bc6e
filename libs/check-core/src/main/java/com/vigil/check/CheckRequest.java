package com.vigil.check;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a batch: which check to run, with which configuration, under which identity.
 * <p>
 * Construction never fails on missing fields: a request without a check type is accepted here and
 * rejected by the batch coordinator, so it is reported in the batch result instead of aborting the
 * whole batch.
 *
 * @param identity  caller-supplied identity, or null to have the coordinator assign an ordinal
 * @param checkType tag of the check to run
 * @param config    check-specific configuration (never null; null values allowed)
 */
public record CheckRequest(String identity, String checkType, Map<String, Object> config) {

    public CheckRequest {
        config = config == null || config.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Creates a request without an identity.
     */
    public static CheckRequest of(String checkType, Map<String, Object> config) {
        return new CheckRequest(null, checkType, config);
    }

    /**
     * Returns a copy carrying the given identity.
     */
    public CheckRequest withIdentity(String newIdentity) {
        return new CheckRequest(newIdentity, checkType, config);
    }

    /**
     * True if the caller supplied a non-blank identity.
     */
    public boolean hasIdentity() {
        return identity != null && !identity.isBlank();
    }
}
