package com.prepro.mediation;

/**
 * Type-level permission predicate deciding whether an actor may list records of a type.
 * Not tied to any single record.
 *
 * @param <A> the actor type
 */
@FunctionalInterface
public interface ListingPolicy<A> {

    boolean listableBy(A actor);

    /** A listing policy that admits every actor. */
    static <A> ListingPolicy<A> everyone() {
        return actor -> true;
    }
}
