package com.vigil.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets in check configurations before they are logged or echoed back in outcome raw
 * data.
 * <p>
 * A value is replaced by {@value #REDACTED} when its key contains one of the sensitive fragments
 * (case-insensitive; defaults: password, token, secret, authorization, apikey, api_key,
 * credential). Nested maps, lists and the user-info part of URLs ({@code https://user:pw@host})
 * are masked as well.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS =
            Set.of("password", "token", "secret", "authorization", "apikey", "api_key", "credential");

    private static final Pattern URL_USER_INFO = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*://)([^/@\\s]+)@");

    private final Set<String> sensitivePatterns;
    private final Pattern sensitiveKey;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key fragments to treat as sensitive
     * @throws IllegalArgumentException if patterns is null or empty
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        this.sensitiveKey = Pattern.compile(
                String.join("|", sensitivePatterns.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a masked copy of a configuration map; null or empty input gives an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> masked = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> masked.put(key, isSensitive(key) ? REDACTED : mask(value)));
        return masked;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && sensitiveKey.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Object mask(Object value) {
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> keyed = new LinkedHashMap<>();
            nested.forEach((k, v) -> keyed.put(String.valueOf(k), v));
            return redact(keyed);
        }
        if (value instanceof List<?> list) {
            List<Object> masked = new ArrayList<>(list.size());
            list.forEach(item -> masked.add(mask(item)));
            return masked;
        }
        if (value instanceof String text) {
            Matcher matcher = URL_USER_INFO.matcher(text);
            if (matcher.find()) {
                return matcher.group(1) + REDACTED + "@" + text.substring(matcher.end());
            }
        }
        return value;
    }
}
