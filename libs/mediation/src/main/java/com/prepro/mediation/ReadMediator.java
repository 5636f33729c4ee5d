package com.prepro.mediation;

import com.prepro.observability.MediationLogScope;
import com.prepro.observability.MediationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads records for display, checks that the actor may see them, and decorates them with the
 * context of the call.
 * <p>
 * Use one per record type, typically as a field of the controller that renders it:
 *
 * <pre>
 * ReadMediator&lt;User, Article&gt; articles = new ReadMediator&lt;&gt;(articleProvider, Article::listableBy);
 * Article article = articles.presentOne(id, currentUser, viewContext);
 * </pre>
 *
 * Nothing is persisted. A denied check fails with {@link AuthorizationException} before any
 * record is decorated or returned.
 *
 * @param <A> the actor type
 * @param <R> the record type
 */
public class ReadMediator<A, R extends AccessPolicy<A> & Presentable<A>> extends MediatorSupport<R> {

    private static final Logger log = LoggerFactory.getLogger(ReadMediator.class);
    private static final Pattern ID_PREFIX = Pattern.compile("\\d");

    private final ListingPolicy<A> listingPolicy;

    /**
     * Creates a mediator that reports to Micrometer's global registry.
     *
     * @param provider      loads and instantiates records
     * @param listingPolicy decides whether an actor may list records of this type
     */
    public ReadMediator(RecordProvider<R> provider, ListingPolicy<A> listingPolicy) {
        this(provider, listingPolicy, MediationMetrics.global());
    }

    public ReadMediator(RecordProvider<R> provider, ListingPolicy<A> listingPolicy, MediationMetrics metrics) {
        super(provider, metrics);
        if (listingPolicy == null) {
            throw new IllegalArgumentException("listingPolicy must not be null");
        }
        this.listingPolicy = listingPolicy;
    }

    public Presentation<R> present(Object target, A actor, ViewContext viewContext) {
        return present(target, actor, viewContext, MediationOptions.defaults());
    }

    /**
     * Presents whatever {@code target} denotes.
     * <ul>
     *   <li>a {@link Collection} of records: a listing, see {@link #presentAll}</li>
     *   <li>an id, a {@link Map} of attributes, or a record: a single fetch, see {@link #presentOne}</li>
     * </ul>
     *
     * @throws AuthorizationException   if the access policy denies the actor
     * @throws RecordNotFoundException  if an id names no stored record
     * @throws IllegalArgumentException if the target is of an unsupported kind
     */
    public Presentation<R> present(Object target, A actor, ViewContext viewContext, MediationOptions options) {
        if (target instanceof Collection<?> collection) {
            return Presentation.ofCollection(presentAll(castAll(collection), actor, viewContext, options));
        }
        return Presentation.ofSingle(presentOne(target, actor, viewContext, options));
    }

    public List<R> presentAll(Collection<? extends R> records, A actor, ViewContext viewContext) {
        return presentAll(records, actor, viewContext, MediationOptions.defaults());
    }

    /**
     * Checks the listing policy once, then decorates every record, each with its own
     * {@link RequestContext}. An empty collection yields an empty list.
     *
     * @return the decorated records, in iteration order
     * @throws AuthorizationException if the listing policy denies the actor
     */
    public List<R> presentAll(Collection<? extends R> records, A actor, ViewContext viewContext,
                              MediationOptions options) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        MediationOptions effective = options == null ? MediationOptions.defaults() : options;
        long startedAt = System.nanoTime();
        try (MediationLogScope scope = openScope(Operation.LIST)) {
            if (effective.enforcePermissions()) {
                authorize(listingPolicy.listableBy(actor), Operation.LIST, startedAt);
            } else {
                log.debug("Listing {} without permission checks", typeName());
            }
            // all elements are checked before the first one is decorated
            List<R> decorated = new ArrayList<>(records.size());
            for (R record : records) {
                if (record == null) {
                    throw new IllegalArgumentException("records must not contain null");
                }
                decorated.add(record);
            }
            decorated.forEach(record -> record.attachRequestContext(
                    RequestContext.forRead(actor, viewContext, effective)));
            log.debug("Presented {} {} record(s)", decorated.size(), typeName());
            record(Operation.LIST, MediationMetrics.OUTCOME_GRANTED, startedAt);
            return Collections.unmodifiableList(decorated);
        } catch (RuntimeException e) {
            failed(Operation.LIST, e, startedAt);
            throw e;
        }
    }

    public R presentOne(Object target, A actor, ViewContext viewContext) {
        return presentOne(target, actor, viewContext, MediationOptions.defaults());
    }

    /**
     * Resolves a single record, checks {@link AccessPolicy#viewableBy}, and decorates it.
     * <p>
     * The target is resolved as follows: a {@link Number}, or a string starting with a digit, is
     * an id looked up through the provider; a {@link Map} is an attribute payload for a new,
     * unsaved record; an instance of the record type is used as is. Any other string is rejected.
     *
     * @throws AuthorizationException   if the record is not viewable by the actor
     * @throws RecordNotFoundException  if an id names no stored record
     * @throws IllegalArgumentException if the target is null or of an unsupported kind
     */
    public R presentOne(Object target, A actor, ViewContext viewContext, MediationOptions options) {
        MediationOptions effective = options == null ? MediationOptions.defaults() : options;
        long startedAt = System.nanoTime();
        try (MediationLogScope scope = openScope(Operation.VIEW)) {
            R record = resolve(target);
            if (effective.enforcePermissions()) {
                authorize(record.viewableBy(actor), Operation.VIEW, startedAt);
            } else {
                log.debug("Presenting {} without permission checks", typeName());
            }
            record.attachRequestContext(RequestContext.forRead(actor, viewContext, effective));
            record(Operation.VIEW, MediationMetrics.OUTCOME_GRANTED, startedAt);
            return record;
        } catch (RuntimeException e) {
            failed(Operation.VIEW, e, startedAt);
            throw e;
        }
    }

    /**
     * Turns a single-fetch target into a record. Overridable for record types with other
     * identifier shapes.
     */
    protected R resolve(Object target) {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        if (target instanceof Number) {
            return find(target);
        }
        if (target instanceof CharSequence chars && ID_PREFIX.matcher(chars).lookingAt()) {
            return find(chars.toString());
        }
        if (target instanceof Map<?, ?> attributes) {
            return provider.newRecord(stringKeyed(attributes));
        }
        if (recordType.isInstance(target)) {
            return recordType.cast(target);
        }
        throw new IllegalArgumentException("cannot present %s as %s"
                .formatted(target.getClass().getName(), typeName()));
    }

    private List<R> castAll(Collection<?> collection) {
        List<R> records = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (!recordType.isInstance(element)) {
                throw new IllegalArgumentException("collection element %s is not a %s"
                        .formatted(element == null ? "null" : element.getClass().getName(), typeName()));
            }
            records.add(recordType.cast(element));
        }
        return records;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes.size());
        attributes.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
