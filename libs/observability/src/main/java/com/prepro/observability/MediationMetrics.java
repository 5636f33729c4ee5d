package com.prepro.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer instrumentation for read and write mediation.
 * <p>
 * Every mediated call increments {@value #OPERATIONS} tagged with the operation, the
 * record type and the outcome, and records its duration in {@value #DURATION}. All meters
 * carry a {@code service} tag so several applications can share one registry.
 */
public final class MediationMetrics {

    /** Counter of mediated operations. */
    public static final String OPERATIONS = "prepro.mediation.operations";

    /** Timer of mediated operation durations. */
    public static final String DURATION = "prepro.mediation.duration";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the operation (list, view, create, update, destroy). */
    public static final String TAG_OPERATION = "operation";

    /** Tag key for the record type. */
    public static final String TAG_RECORD_TYPE = "record_type";

    /** Tag key for the outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** The access policy allowed the operation (reads). */
    public static final String OUTCOME_GRANTED = "granted";

    /** The access policy rejected the operation. */
    public static final String OUTCOME_DENIED = "denied";

    /** The record provider persisted the record. */
    public static final String OUTCOME_SAVED = "saved";

    /** The record provider refused to persist the record (validation failure). */
    public static final String OUTCOME_REJECTED = "rejected";

    /** The record provider destroyed the record. */
    public static final String OUTCOME_DESTROYED = "destroyed";

    /** The operation failed with an exception other than a denial (missing record, bad payload). */
    public static final String OUTCOME_ERROR = "error";

    private static final String DEFAULT_SERVICE_NAME = "prepro";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag on every meter
     */
    public MediationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Metrics reporting to Micrometer's global composite registry. Meters are dropped
     * until a concrete registry is added to it.
     */
    public static MediationMetrics global() {
        return new MediationMetrics(Metrics.globalRegistry, DEFAULT_SERVICE_NAME);
    }

    /**
     * Records one mediated operation.
     *
     * @param operation  operation name
     * @param recordType record type name
     * @param outcome    one of the {@code OUTCOME_*} constants
     * @param elapsed    wall time spent in the mediator
     */
    public void record(String operation, String recordType, String outcome, Duration elapsed) {
        Tags tags = Tags.of(
                TAG_SERVICE, serviceName,
                TAG_OPERATION, operation,
                TAG_RECORD_TYPE, recordType,
                TAG_OUTCOME, outcome);
        Counter.builder(OPERATIONS)
                .description("Mediated record operations")
                .tags(tags)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time spent mediating record operations")
                .tags(tags)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a tag.
     */
    public String serviceName() {
        return serviceName;
    }
}
