package com.carecore.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Aggregates {@link HealthCheck}s by component name and runs them concurrently.
 * <p>
 * A check that does not complete within the timeout, or completes exceptionally, is reported as
 * {@link HealthStatus#UNHEALTHY}. The overall status is the worst individual status.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (1 second). */
    public static final long DEFAULT_TIMEOUT_MS = 1000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a health check under the given component name, replacing any existing one.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a health check by component name.
     *
     * @return true if a check was removed
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs all registered health checks concurrently and aggregates the results.
     * Returns {@link HealthStatus#HEALTHY} when nothing is registered.
     */
    public HealthResult checkAll() {
        if (checks.isEmpty()) {
            return new HealthResult(HealthStatus.HEALTHY, Map.of(), Instant.now());
        }

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            futures.put(entry.getKey(), start(entry.getValue()));
        }

        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(name, result);
            overall = worst(overall, result.status());
        }

        return new HealthResult(overall, results, Instant.now());
    }

    private static CompletableFuture<ComponentHealth> start(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /** Returns the number of registered health checks. */
    public int size() {
        return checks.size();
    }

    /** Returns the configured timeout in milliseconds. */
    public long timeoutMs() {
        return timeoutMs;
    }
}
