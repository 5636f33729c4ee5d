package com.prepro.observability;

import org.slf4j.MDC;

/**
 * Scoped SLF4J MDC entries describing the mediation call in progress.
 * <p>
 * While a scope is open, every log statement on the current thread (including those made by
 * hooks and providers) carries the operation name and the record type.
 * Closing the scope restores whatever values were present before it was opened, so scopes
 * nest: a write hook that presents another record gets its own scope and the outer values
 * come back afterwards.
 *
 * <pre>
 * try (var scope = MediationLogScope.open("update", "Article")) {
 *     ...
 * }
 * </pre>
 */
public final class MediationLogScope implements AutoCloseable {

    /** MDC key for the mediation operation (list, view, create, update, destroy). */
    public static final String MDC_OPERATION = "mediation.operation";

    /** MDC key for the simple name of the record type being mediated. */
    public static final String MDC_RECORD_TYPE = "mediation.recordType";

    private final String previousOperation;
    private final String previousRecordType;
    private boolean closed;

    private MediationLogScope(String operation, String recordType) {
        this.previousOperation = MDC.get(MDC_OPERATION);
        this.previousRecordType = MDC.get(MDC_RECORD_TYPE);
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_RECORD_TYPE, recordType);
    }

    /**
     * Opens a scope for the given operation and record type.
     *
     * @param operation  operation name, must not be blank
     * @param recordType record type name, must not be blank
     * @throws IllegalArgumentException if either argument is null or blank
     */
    public static MediationLogScope open(String operation, String recordType) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be null or blank");
        }
        if (recordType == null || recordType.isBlank()) {
            throw new IllegalArgumentException("recordType must not be null or blank");
        }
        return new MediationLogScope(operation, recordType);
    }

    /**
     * Restores the MDC entries that were present when this scope was opened.
     * Closing twice is a no-op.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        restore(MDC_OPERATION, previousOperation);
        restore(MDC_RECORD_TYPE, previousRecordType);
    }

    private static void restore(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
