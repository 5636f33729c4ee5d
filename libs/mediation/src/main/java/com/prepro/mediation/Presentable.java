package com.prepro.mediation;

/**
 * A record that can carry the {@link RequestContext} it was presented with, so that formatting
 * helpers called later (from a template, a serializer) can reach the actor and the view
 * context without re-threading them through every call.
 *
 * @param <A> the actor type
 */
public interface Presentable<A> {

    /**
     * Attaches the context of the presentation call. Called by {@link ReadMediator} only after
     * the access policy check has passed.
     */
    void attachRequestContext(RequestContext<A> context);

    /**
     * Returns the attached context, or {@code null} if this record was never presented.
     */
    RequestContext<A> requestContext();
}
