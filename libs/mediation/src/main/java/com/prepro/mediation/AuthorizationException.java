package com.prepro.mediation;

/**
 * Thrown when an access policy predicate denies an operation. Raised before any record is
 * changed or decorated, and never handled inside the mediators.
 */
public class AuthorizationException extends RuntimeException {

    private final Operation operation;
    private final Class<?> recordType;

    public AuthorizationException(Operation operation, Class<?> recordType) {
        super("Not authorized to %s %s".formatted(operation.label(), recordType.getSimpleName()));
        this.operation = operation;
        this.recordType = recordType;
    }

    public Operation operation() {
        return operation;
    }

    public Class<?> recordType() {
        return recordType;
    }
}
