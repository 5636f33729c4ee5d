package com.prepro.mediation;

/**
 * The single point where an access policy verdict turns into a failure.
 */
public final class PermissionEnforcer {

    private PermissionEnforcer() {
        // utility class
    }

    /**
     * Does nothing if {@code granted}, otherwise fails the operation.
     *
     * @param granted    the access policy verdict
     * @param operation  the operation being checked
     * @param recordType the record type the operation targets
     * @throws AuthorizationException if the verdict is negative
     */
    public static void enforce(boolean granted, Operation operation, Class<?> recordType) {
        if (!granted) {
            throw new AuthorizationException(operation, recordType);
        }
    }
}
