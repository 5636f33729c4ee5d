package com.prepro.mediation;

import java.util.Map;

/**
 * The persistence layer a mediator delegates to. Validation and storage are both
 * decided here; the mediators only call these methods in a fixed order.
 *
 * @param <R> the record type
 */
public interface RecordProvider<R> {

    /** The concrete record type this provider loads and stores. */
    Class<R> recordType();

    /**
     * Loads a stored record.
     *
     * @param id a record identifier as supplied by the caller (a number or a string)
     * @return the record, never {@code null}
     * @throws RecordNotFoundException if no record has that id
     */
    R findById(Object id);

    /** Instantiates a blank, unsaved record. */
    R newRecord();

    /**
     * Instantiates an unsaved record initialised from attributes.
     *
     * @throws AttributeAssignmentException if the attributes cannot be applied
     */
    R newRecord(Map<String, Object> attributes);

    /**
     * Mass-assigns attributes onto a record without persisting it.
     *
     * @param role the assignment role restricting which attributes are accessible, or
     *             {@code null} for the default role
     * @throws AttributeAssignmentException if the attributes cannot be applied
     */
    void assign(R record, Map<String, Object> attributes, String role);

    /**
     * Persists a record.
     *
     * @return {@code false} if the record failed validation and was not stored
     */
    boolean save(R record);

    /** Removes a stored record. */
    void destroy(R record);
}
