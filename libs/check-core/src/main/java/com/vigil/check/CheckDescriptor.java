package com.vigil.check;

import java.util.List;

/**
 * Catalogue entry describing a registered check type and the configuration keys it understands.
 *
 * @param type           the check type tag (e.g. "website_status")
 * @param description    human-readable description
 * @param requiredConfig configuration keys that must be present
 * @param optionalConfig configuration keys that may be present
 */
public record CheckDescriptor(
        String type,
        String description,
        List<String> requiredConfig,
        List<String> optionalConfig
) {

    /** Description used when a check does not describe itself. */
    public static final String NO_DESCRIPTION = "No description available";

    public CheckDescriptor {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        description = description == null || description.isBlank() ? NO_DESCRIPTION : description;
        requiredConfig = requiredConfig == null ? List.of() : List.copyOf(requiredConfig);
        optionalConfig = optionalConfig == null ? List.of() : List.copyOf(optionalConfig);
    }

    /**
     * Creates a descriptor with no documented configuration.
     */
    public static CheckDescriptor undocumented(String type) {
        return new CheckDescriptor(type, NO_DESCRIPTION, List.of(), List.of());
    }
}
