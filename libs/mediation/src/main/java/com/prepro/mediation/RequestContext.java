package com.prepro.mediation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a single mediated call knows about its caller, created fresh for each record and
 * discarded with it.
 *
 * @param actor       the actor the call is made for; {@code null} for anonymous callers
 * @param viewContext rendering primitives for presented records; {@code null} for writes
 * @param attributes  the attribute payload of a write, empty for reads
 * @param options     the call's options
 * @param <A>         the actor type
 */
public record RequestContext<A>(
        A actor,
        ViewContext viewContext,
        Map<String, Object> attributes,
        MediationOptions options
) {

    public RequestContext {
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (options == null) {
            options = MediationOptions.defaults();
        }
    }

    /** Context for presenting one record. */
    public static <A> RequestContext<A> forRead(A actor, ViewContext viewContext, MediationOptions options) {
        return new RequestContext<>(actor, viewContext, Map.of(), options);
    }

    /** Context for one create or update call. */
    public static <A> RequestContext<A> forWrite(A actor, Map<String, Object> attributes, MediationOptions options) {
        return new RequestContext<>(actor, null, attributes, options);
    }

    /**
     * Returns the view context.
     *
     * @throws IllegalStateException if this context carries none
     */
    public ViewContext requireViewContext() {
        if (viewContext == null) {
            throw new IllegalStateException("request context carries no view context");
        }
        return viewContext;
    }
}
