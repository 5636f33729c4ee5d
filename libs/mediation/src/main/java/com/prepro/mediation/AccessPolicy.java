package com.prepro.mediation;

/**
 * Per-record permission predicates, implemented by every record type that passes through a
 * mediator.
 * <p>
 * The mediators only ever call these methods; how a record decides is entirely its own
 * business (ownership, roles, record state). The actor may be {@code null} for anonymous
 * callers, and implementations should treat that as the least privileged actor.
 *
 * @param <A> the actor type
 */
public interface AccessPolicy<A> {

    /** Whether the actor may see this record. */
    boolean viewableBy(A actor);

    /** Whether the actor may create this (blank, not yet assigned) record. */
    boolean creatableBy(A actor);

    /** Whether the actor may change this record, judged on its stored state. */
    boolean updatableBy(A actor);

    /** Whether the actor may destroy this record. */
    boolean destroyableBy(A actor);
}
