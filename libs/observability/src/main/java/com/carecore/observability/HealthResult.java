package com.carecore.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of all registered checks.
 *
 * @param status    worst status among the checks
 * @param checks    individual results keyed by component name
 * @param timestamp when the checks ran
 */
public record HealthResult(
        HealthStatus status,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
