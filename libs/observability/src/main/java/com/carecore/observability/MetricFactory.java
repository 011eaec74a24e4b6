package com.carecore.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters that carry the simulator's common tags.
 * <p>
 * Every meter created here is tagged with {@code service}; factories derived with
 * {@link #forRun(String)} also add a {@code run} tag so counters of consecutive simulation runs
 * in one process stay separate.
 */
public final class MetricFactory {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the simulation run id. */
    public static final String TAG_RUN = "run";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Tags commonTags;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        this(registry, serviceName, Tags.of(TAG_SERVICE, requireName(serviceName)));
    }

    private MetricFactory(MeterRegistry registry, String serviceName, Tags commonTags) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.commonTags = commonTags;
    }

    private static String requireName(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        return serviceName;
    }

    /**
     * Returns a factory that additionally tags every meter with the given run id.
     *
     * @param runId simulation run identifier
     */
    public MetricFactory forRun(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
        return new MetricFactory(registry, serviceName, commonTags.and(TAG_RUN, runId));
    }

    /**
     * Creates (or looks up) a counter with the common tags.
     *
     * @param name        metric name (e.g., "icu.alerts.raised")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(withCommonTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a timer with the common tags.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(withCommonTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a distribution summary with the common tags.
     */
    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(withCommonTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by a fresh {@link AtomicLong}.
     *
     * @return the AtomicLong that drives the gauge value
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(withCommonTags(tags))
                .register(registry);
        return value;
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the service name used as a default tag. */
    public String serviceName() {
        return serviceName;
    }

    private Tags withCommonTags(String... extraTags) {
        return extraTags.length > 0 ? commonTags.and(extraTags) : commonTags;
    }
}
