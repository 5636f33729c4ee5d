package com.prepro.mediation;

import com.prepro.observability.MediationLogScope;
import com.prepro.observability.MediationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Plumbing shared by the read and write mediators: the provider, permission enforcement with
 * logging and metrics, and record lookup.
 *
 * @param <R> the record type
 */
abstract class MediatorSupport<R> {

    private static final Logger log = LoggerFactory.getLogger(MediatorSupport.class);

    protected final RecordProvider<R> provider;
    protected final Class<R> recordType;
    protected final MediationMetrics metrics;

    protected MediatorSupport(RecordProvider<R> provider, MediationMetrics metrics) {
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
        if (provider.recordType() == null) {
            throw new IllegalArgumentException("provider must declare a record type");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.provider = provider;
        this.recordType = provider.recordType();
        this.metrics = metrics;
    }

    /** The record type this mediator works on. */
    public Class<R> recordType() {
        return recordType;
    }

    protected String typeName() {
        return recordType.getSimpleName();
    }

    protected MediationLogScope openScope(Operation operation) {
        return MediationLogScope.open(operation.label(), typeName());
    }

    /**
     * Applies an access policy verdict, recording a denial before failing.
     *
     * @throws AuthorizationException if {@code granted} is false
     */
    protected void authorize(boolean granted, Operation operation, long startedAt) {
        if (!granted) {
            log.warn("Denied {} on {}", operation.label(), typeName());
            record(operation, MediationMetrics.OUTCOME_DENIED, startedAt);
        }
        PermissionEnforcer.enforce(granted, operation, recordType);
    }

    /**
     * Loads a stored record through the provider. A provider that answers {@code null} instead of
     * throwing is treated as reporting the record missing.
     */
    protected R find(Object id) {
        R record = provider.findById(id);
        if (record == null) {
            throw new RecordNotFoundException(recordType, id);
        }
        return record;
    }

    /**
     * Records an operation that ended in an exception. Denials are already counted by
     * {@link #authorize} and are skipped here.
     */
    protected void failed(Operation operation, RuntimeException failure, long startedAt) {
        if (failure instanceof AuthorizationException) {
            return;
        }
        log.debug("{} on {} failed: {}", operation.label(), typeName(), failure.toString());
        record(operation, MediationMetrics.OUTCOME_ERROR, startedAt);
    }

    protected void record(Operation operation, String outcome, long startedAt) {
        metrics.record(operation.label(), typeName(), outcome, Duration.ofNanos(System.nanoTime() - startedAt));
    }
}
