package com.prepro.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive attributes from payloads before they reach a log statement.
 * <p>
 * Attribute payloads handed to create and update frequently carry credentials (a user
 * record's password, an integration's API key). Default sensitive patterns: password,
 * token, secret, authorization, apikey, credential. Matching is a case-insensitive
 * substring match on the attribute name, so {@code passwordConfirmation} and
 * {@code api_token} are both redacted. Nested maps are redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive attribute patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive attribute patterns (case-insensitive).
     *
     * @param patterns attribute name patterns to treat as sensitive, must not be empty
     * @throws IllegalArgumentException if patterns is null or empty
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of the payload with sensitive values replaced by {@value #REDACTED}.
     * Iteration order is preserved. Null input returns an empty map.
     *
     * @param payload attribute payload (keys are attribute names)
     * @return a new map safe to log
     */
    public Map<String, Object> redact(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(payload.size());
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redact(stringKeyed(nested)));
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    /**
     * Checks whether an attribute name matches any sensitive pattern (case-insensitive).
     *
     * @param attributeName the attribute name to check
     * @return true if the name contains a sensitive pattern
     */
    public boolean isSensitive(String attributeName) {
        if (attributeName == null) {
            return false;
        }
        return compiledPattern.matcher(attributeName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
