package com.vigil.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SensitiveDataRedactor}: checks redaction of check configuration, nested
 * structures, case insensitivity and custom patterns.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact credentials in a mail server configuration")
        void shouldRedactMailCredentials() {
            Map<String, Object> config = Map.of(
                    "hostname", "mail.example.com", "username", "ops", "password", "s3cr3t");

            Map<String, Object> result = redactor.redact(config);

            assertThat(result.get("hostname")).isEqualTo("mail.example.com");
            assertThat(result.get("username")).isEqualTo("ops");
            assertThat(result.get("password")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should match keys containing a pattern, case-insensitively")
        void shouldMatchContainedPatterns() {
            Map<String, Object> config = Map.of("auth_password", "x", "API_KEY", "y", "X-Auth-Token", "z");

            Map<String, Object> result = redactor.redact(config);

            assertThat(result.values()).containsOnly(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should redact nested header maps")
        void shouldRedactNestedMaps() {
            Map<String, Object> config = Map.of(
                    "url", "https://example.com",
                    "headers", Map.of("Authorization", "Bearer abc", "Accept", "text/html"));

            @SuppressWarnings("unchecked")
            Map<String, Object> headers = (Map<String, Object>) redactor.redact(config).get("headers");

            assertThat(headers.get("Authorization")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(headers.get("Accept")).isEqualTo("text/html");
        }

        @Test
        @DisplayName("should redact maps inside lists")
        void shouldRedactMapsInLists() {
            Map<String, Object> config = Map.of(
                    "resolvers", List.of(Map.of("ip", "8.8.8.8", "secret", "k")));

            @SuppressWarnings("unchecked")
            List<Map<String, Object>> resolvers =
                    (List<Map<String, Object>>) redactor.redact(config).get("resolvers");

            assertThat(resolvers.get(0).get("ip")).isEqualTo("8.8.8.8");
            assertThat(resolvers.get(0).get("secret")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }
    }

    @Nested
    @DisplayName("URLs")
    class Urls {

        @Test
        @DisplayName("should mask credentials embedded in a URL")
        void shouldMaskUserInfo() {
            Map<String, Object> result = redactor.redact(Map.of("url", "https://ops:pw@status.example.com/health"));

            assertThat(result.get("url")).isEqualTo("https://[REDACTED]@status.example.com/health");
        }

        @Test
        @DisplayName("should leave URLs without credentials untouched")
        void shouldKeepPlainUrls() {
            Map<String, Object> result = redactor.redact(Map.of("url", "https://status.example.com/a@b"));

            assertThat(result.get("url")).isEqualTo("https://status.example.com/a@b");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should return empty map for null or empty input")
        void shouldHandleEmptyInput() {
            assertThat(redactor.redact(null)).isEmpty();
            assertThat(redactor.redact(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("should keep null values of non-sensitive keys")
        void shouldKeepNullValues() {
            Map<String, Object> config = new HashMap<>();
            config.put("expected_content", null);

            assertThat(redactor.redact(config)).containsEntry("expected_content", null);
        }

        @Test
        @DisplayName("should not treat a null key as sensitive")
        void shouldHandleNullFieldName() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Custom patterns")
    class CustomPatterns {

        @Test
        @DisplayName("should use only the supplied patterns")
        void shouldUseCustomPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("community"));

            Map<String, Object> result = custom.redact(Map.of("community", "public", "password", "p"));

            assertThat(result.get("community")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("password")).isEqualTo("p");
            assertThat(custom.sensitivePatterns()).containsExactly("community");
        }

        @Test
        @DisplayName("should reject empty pattern set")
        void shouldRejectEmptyPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
