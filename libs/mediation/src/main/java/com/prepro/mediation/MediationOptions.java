package com.prepro.mediation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-call options for the mediators.
 *
 * @param enforcePermissions whether read operations consult the access policy; write
 *                           operations always do. Only trusted internal call paths turn
 *                           this off.
 * @param assignmentRole     role handed to the provider when mass-assigning attributes,
 *                           or {@code null} for the default role
 * @param extras             free-form options for hooks and formatting helpers
 */
public record MediationOptions(boolean enforcePermissions, String assignmentRole, Map<String, Object> extras) {

    private static final MediationOptions DEFAULTS = new MediationOptions(true, null, Map.of());

    public MediationOptions {
        extras = extras == null || extras.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /** Permissions enforced, default assignment role, no extras. */
    public static MediationOptions defaults() {
        return DEFAULTS;
    }

    /** Options for trusted internal reads that skip the access policy. */
    public static MediationOptions trusted() {
        return DEFAULTS.withEnforcePermissions(false);
    }

    public MediationOptions withEnforcePermissions(boolean enforce) {
        return new MediationOptions(enforce, assignmentRole, extras);
    }

    public MediationOptions withAssignmentRole(String role) {
        return new MediationOptions(enforcePermissions, role, extras);
    }

    /** Returns a copy with one extra option added or replaced. */
    public MediationOptions withExtra(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>(extras);
        copy.put(key, value);
        return new MediationOptions(enforcePermissions, assignmentRole, copy);
    }

    public Optional<Object> extra(String key) {
        return Optional.ofNullable(extras.get(key));
    }
}
