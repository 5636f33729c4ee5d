package com.prepro.mediation;

/**
 * The operations a mediator gates behind an access policy predicate.
 */
public enum Operation {

    /** Listing a collection; checked once against the record type's {@link ListingPolicy}. */
    LIST("list"),
    /** Presenting a single record; checked with {@link AccessPolicy#viewableBy}. */
    VIEW("view"),
    /** Creating a record; checked with {@link AccessPolicy#creatableBy}. */
    CREATE("create"),
    /** Updating a record; checked with {@link AccessPolicy#updatableBy}. */
    UPDATE("update"),
    /** Destroying a record; checked with {@link AccessPolicy#destroyableBy}. */
    DESTROY("destroy");

    private final String label;

    Operation(String label) {
        this.label = label;
    }

    /** Lower-case name used in log scopes and metric tags. */
    public String label() {
        return label;
    }
}
