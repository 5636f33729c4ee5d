package com.prepro.mediation;

/**
 * Thrown when an attribute payload cannot be applied to a record: an unknown attribute, a
 * value of the wrong type, or an attribute the assignment role may not touch.
 */
public class AttributeAssignmentException extends RuntimeException {

    public AttributeAssignmentException(String message) {
        super(message);
    }

    public AttributeAssignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
