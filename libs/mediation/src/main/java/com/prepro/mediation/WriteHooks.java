package com.prepro.mediation;

/**
 * Interception points around mass-assignment and persistence in {@link WriteMediator}.
 * <p>
 * Invoked in a fixed order, only after the access policy check has passed:
 * <ol>
 *   <li>create: {@link #beforeAssignOnCreate}, assign, {@link #beforeSaveOnCreate}, save</li>
 *   <li>update: {@link #beforeAssignOnUpdate}, assign, {@link #beforeSaveOnUpdate}, save</li>
 * </ol>
 * All methods default to no-ops, so implementations override only what they need. An exception
 * thrown from a hook aborts the operation before persistence and propagates to the caller.
 *
 * @param <A> the actor type
 * @param <R> the record type
 */
public interface WriteHooks<A, R> {

    /** Runs on the blank record before the payload is assigned. */
    default void beforeAssignOnCreate(R record, RequestContext<A> context) {
    }

    /** Runs on the assigned record before it is saved. */
    default void beforeSaveOnCreate(R record, RequestContext<A> context) {
    }

    /** Runs on the stored record before the payload is assigned. */
    default void beforeAssignOnUpdate(R record, RequestContext<A> context) {
    }

    /** Runs on the assigned record before it is saved. */
    default void beforeSaveOnUpdate(R record, RequestContext<A> context) {
    }

    /** Hooks that do nothing. */
    static <A, R> WriteHooks<A, R> none() {
        return new WriteHooks<>() {
        };
    }
}
