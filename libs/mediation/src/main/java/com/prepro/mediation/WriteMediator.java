package com.prepro.mediation;

import com.prepro.observability.MediationLogScope;
import com.prepro.observability.MediationMetrics;
import com.prepro.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates, updates, and destroys records on behalf of an actor.
 * <p>
 * Each operation runs the same sequence: resolve the record, check the access policy, run the
 * pre-assignment hook, mass-assign the payload, run the pre-save hook, persist, and report.
 * A denied check fails with {@link AuthorizationException} before anything is assigned or
 * persisted. Whether persistence succeeds is decided by the {@link RecordProvider} alone and is
 * reported through {@link WriteResult#success()}, never as an exception.
 * <p>
 * The {@value #ID_ATTRIBUTE} attribute locates the record to update and is never assigned.
 *
 * @param <A> the actor type
 * @param <R> the record type
 */
public class WriteMediator<A, R extends AccessPolicy<A>> extends MediatorSupport<R> {

    /** Payload key holding the id of the record to update. */
    public static final String ID_ATTRIBUTE = "id";

    private static final Logger log = LoggerFactory.getLogger(WriteMediator.class);
    private static final SensitiveDataRedactor REDACTOR = new SensitiveDataRedactor();

    private final WriteHooks<A, R> hooks;

    public WriteMediator(RecordProvider<R> provider) {
        this(provider, WriteHooks.none());
    }

    public WriteMediator(RecordProvider<R> provider, WriteHooks<A, R> hooks) {
        this(provider, hooks, MediationMetrics.global());
    }

    /**
     * @param provider persistence for the record type
     * @param hooks    interception points around assignment and persistence
     * @param metrics  operation metrics
     */
    public WriteMediator(RecordProvider<R> provider, WriteHooks<A, R> hooks, MediationMetrics metrics) {
        super(provider, metrics);
        if (hooks == null) {
            throw new IllegalArgumentException("hooks must not be null");
        }
        this.hooks = hooks;
    }

    public WriteResult<R> create(Map<String, ?> attributes, A actor) {
        return create(attributes, actor, MediationOptions.defaults());
    }

    /**
     * Instantiates a blank record, checks {@link AccessPolicy#creatableBy}, assigns the payload,
     * and saves.
     *
     * @throws AuthorizationException       if the actor may not create records of this type
     * @throws AttributeAssignmentException if the payload cannot be assigned
     */
    public WriteResult<R> create(Map<String, ?> attributes, A actor, MediationOptions options) {
        Map<String, Object> payload = copyOf(attributes);
        MediationOptions effective = options == null ? MediationOptions.defaults() : options;
        long startedAt = System.nanoTime();
        try (MediationLogScope scope = openScope(Operation.CREATE)) {
            log.debug("Creating {} with attributes {}", typeName(), REDACTOR.redact(payload));
            RequestContext<A> context = RequestContext.forWrite(actor, payload, effective);
            R record = provider.newRecord();
            authorize(record.creatableBy(actor), Operation.CREATE, startedAt);
            hooks.beforeAssignOnCreate(record, context);
            provider.assign(record, assignable(payload), effective.assignmentRole());
            hooks.beforeSaveOnCreate(record, context);
            return persist(record, Operation.CREATE, startedAt);
        } catch (RuntimeException e) {
            failed(Operation.CREATE, e, startedAt);
            throw e;
        }
    }

    public WriteResult<R> update(Map<String, ?> attributes, A actor) {
        return update(attributes, actor, MediationOptions.defaults());
    }

    /**
     * Loads the record named by the payload's {@value #ID_ATTRIBUTE}, checks
     * {@link AccessPolicy#updatableBy} against its stored state, assigns the payload, and saves.
     *
     * @throws IllegalArgumentException     if the payload carries no id
     * @throws RecordNotFoundException      if no record has that id
     * @throws AuthorizationException       if the actor may not update the record
     * @throws AttributeAssignmentException if the payload cannot be assigned
     */
    public WriteResult<R> update(Map<String, ?> attributes, A actor, MediationOptions options) {
        Map<String, Object> payload = copyOf(attributes);
        Object id = payload.get(ID_ATTRIBUTE);
        if (id == null) {
            throw new IllegalArgumentException("attributes must contain '" + ID_ATTRIBUTE + "'");
        }
        MediationOptions effective = options == null ? MediationOptions.defaults() : options;
        long startedAt = System.nanoTime();
        try (MediationLogScope scope = openScope(Operation.UPDATE)) {
            log.debug("Updating {} {} with attributes {}", typeName(), id, REDACTOR.redact(payload));
            RequestContext<A> context = RequestContext.forWrite(actor, payload, effective);
            R record = find(id);
            authorize(record.updatableBy(actor), Operation.UPDATE, startedAt);
            hooks.beforeAssignOnUpdate(record, context);
            provider.assign(record, assignable(payload), effective.assignmentRole());
            hooks.beforeSaveOnUpdate(record, context);
            return persist(record, Operation.UPDATE, startedAt);
        } catch (RuntimeException e) {
            failed(Operation.UPDATE, e, startedAt);
            throw e;
        }
    }

    public WriteResult<R> destroy(Object id, A actor) {
        return destroy(id, actor, MediationOptions.defaults());
    }

    /**
     * Loads the record, checks {@link AccessPolicy#destroyableBy}, and destroys it. A completed
     * destroy is always reported as successful.
     *
     * @throws RecordNotFoundException if no record has that id
     * @throws AuthorizationException  if the actor may not destroy the record
     */
    public WriteResult<R> destroy(Object id, A actor, MediationOptions options) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        long startedAt = System.nanoTime();
        try (MediationLogScope scope = openScope(Operation.DESTROY)) {
            R record = find(id);
            authorize(record.destroyableBy(actor), Operation.DESTROY, startedAt);
            provider.destroy(record);
            log.debug("Destroyed {} {}", typeName(), id);
            record(Operation.DESTROY, MediationMetrics.OUTCOME_DESTROYED, startedAt);
            return new WriteResult<>(record, true);
        } catch (RuntimeException e) {
            failed(Operation.DESTROY, e, startedAt);
            throw e;
        }
    }

    private WriteResult<R> persist(R record, Operation operation, long startedAt) {
        boolean success = provider.save(record);
        if (success) {
            record(operation, MediationMetrics.OUTCOME_SAVED, startedAt);
        } else {
            log.info("{} on {} was not persisted", operation.label(), typeName());
            record(operation, MediationMetrics.OUTCOME_REJECTED, startedAt);
        }
        return new WriteResult<>(record, success);
    }

    private static Map<String, Object> copyOf(Map<String, ?> attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("attributes must not be null");
        }
        return new LinkedHashMap<>(attributes);
    }

    private static Map<String, Object> assignable(Map<String, Object> payload) {
        if (!payload.containsKey(ID_ATTRIBUTE)) {
            return payload;
        }
        Map<String, Object> withoutId = new LinkedHashMap<>(payload);
        withoutId.remove(ID_ATTRIBUTE);
        return withoutId;
    }
}
