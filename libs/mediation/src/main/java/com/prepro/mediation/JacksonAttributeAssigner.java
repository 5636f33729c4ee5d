package com.prepro.mediation;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mass-assigns attribute payloads onto bean-style records with Jackson, for
 * {@link RecordProvider} implementations that have no assignment mechanism of their own.
 * <p>
 * Values are converted the way Jackson converts JSON, so {@code "2024-01-31T10:00:00Z"} lands in
 * an {@code Instant} property and {@code "42"} in a {@code long}. Unknown attributes fail.
 * <p>
 * Assignment roles restrict which attributes a payload may touch: for each role name an
 * allowlist of attribute names. A {@code null} role resolves to {@value #DEFAULT_ROLE}. A role
 * without an allowlist may assign everything.
 */
public final class JacksonAttributeAssigner {

    /** The role used when a caller supplies none. */
    public static final String DEFAULT_ROLE = "default";

    private final ObjectMapper mapper;
    private final Map<String, Set<String>> accessibleByRole;

    /**
     * Creates an assigner with a mapper that understands {@code java.time} and no role
     * restrictions.
     */
    public JacksonAttributeAssigner() {
        this(defaultMapper(), Map.of());
    }

    /**
     * @param mapper           the mapper used for conversion
     * @param accessibleByRole allowlists of attribute names keyed by role name
     */
    public JacksonAttributeAssigner(ObjectMapper mapper, Map<String, Set<String>> accessibleByRole) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        if (accessibleByRole == null) {
            throw new IllegalArgumentException("accessibleByRole must not be null");
        }
        this.mapper = mapper;
        this.accessibleByRole = Map.copyOf(accessibleByRole);
    }

    /** Returns a mapper with {@link JavaTimeModule} registered and ISO-8601 date output. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Applies {@code attributes} onto {@code record} in place.
     *
     * @param role assignment role, or {@code null} for {@value #DEFAULT_ROLE}
     * @throws AttributeAssignmentException if an attribute is not accessible for the role,
     *                                      unknown, or of the wrong type
     */
    public void assign(Object record, Map<String, ?> attributes, String role) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        if (attributes == null || attributes.isEmpty()) {
            return;
        }
        checkAccessible(attributes.keySet(), role);
        try {
            mapper.updateValue(record, attributes);
        } catch (JsonMappingException | IllegalArgumentException e) {
            throw new AttributeAssignmentException(
                    "Cannot assign %s to %s: %s".formatted(
                            new TreeSet<>(attributes.keySet()), record.getClass().getSimpleName(), describe(e)),
                    e);
        }
    }

    private static String describe(Exception e) {
        return e instanceof JsonMappingException mapping ? mapping.getOriginalMessage() : e.getMessage();
    }

    /** Returns the allowlist for a role, or {@code null} if the role is unrestricted. */
    public Set<String> accessibleAttributes(String role) {
        return accessibleByRole.get(role == null ? DEFAULT_ROLE : role);
    }

    private void checkAccessible(Set<String> names, String role) {
        Set<String> accessible = accessibleAttributes(role);
        if (accessible == null) {
            return;
        }
        Set<String> denied = new TreeSet<>(names);
        denied.removeAll(accessible);
        if (!denied.isEmpty()) {
            throw new AttributeAssignmentException("Attributes %s are not assignable as role '%s'"
                    .formatted(denied, role == null ? DEFAULT_ROLE : role));
        }
    }
}
