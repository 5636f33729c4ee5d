package com.prepro.mediation;

/**
 * Thrown by a {@link RecordProvider} when no stored record has the requested id. The
 * mediators let it propagate unchanged.
 */
public class RecordNotFoundException extends RuntimeException {

    private final Class<?> recordType;
    private final Object id;

    public RecordNotFoundException(Class<?> recordType, Object id) {
        super("%s with id '%s' not found".formatted(recordType.getSimpleName(), id));
        this.recordType = recordType;
        this.id = id;
    }

    public Class<?> recordType() {
        return recordType;
    }

    public Object id() {
        return id;
    }
}
