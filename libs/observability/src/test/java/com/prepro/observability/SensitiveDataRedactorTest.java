package com.prepro.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SensitiveDataRedactor} over flat and nested payloads.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact password attributes and keep the rest")
        void shouldRedactPassword() {
            Map<String, Object> result = redactor.redact(
                    Map.of("name", "jane", "password", "s3cr3t", "passwordConfirmation", "s3cr3t"));

            assertThat(result.get("name")).isEqualTo("jane");
            assertThat(result.get("password")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("passwordConfirmation")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should match case-insensitively")
        void caseInsensitive() {
            assertThat(redactor.isSensitive("API_KEY")).isTrue();
            assertThat(redactor.isSensitive("AccessToken")).isTrue();
            assertThat(redactor.isSensitive("title")).isFalse();
        }

        @Test
        @DisplayName("should redact inside nested attribute maps")
        void nested() {
            Map<String, Object> payload = Map.of(
                    "name", "x",
                    "integration", Map.of("url", "https://example.org", "secret", "abc"));

            @SuppressWarnings("unchecked")
            var nested = (Map<String, Object>) redactor.redact(payload).get("integration");

            assertThat(nested).containsEntry("url", "https://example.org")
                    .containsEntry("secret", SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should preserve attribute order")
        void preservesOrder() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("b", 1);
            payload.put("token", "t");
            payload.put("a", 2);

            assertThat(redactor.redact(payload).keySet()).containsExactly("b", "token", "a");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("null and empty payloads yield an empty map")
        void nullAndEmpty() {
            assertThat(redactor.redact(null)).isEmpty();
            assertThat(redactor.redact(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("null attribute name is not sensitive")
        void nullName() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }

        @Test
        @DisplayName("custom patterns replace the defaults")
        void customPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("ssn"));

            assertThat(custom.isSensitive("ssn")).isTrue();
            assertThat(custom.isSensitive("password")).isFalse();
            assertThat(custom.sensitivePatterns()).containsExactly("ssn");
        }

        @Test
        @DisplayName("empty custom pattern set is rejected")
        void emptyCustomPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("patterns");
        }
    }
}
