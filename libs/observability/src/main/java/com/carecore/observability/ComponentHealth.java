package com.carecore.observability;

/**
 * Health result for a single component.
 *
 * @param name component name (e.g., "message-bus", "agent-nurse")
 * @param status health status of this component
 * @param message optional human-readable detail
 * @param latencyMs time taken to check this component (in milliseconds)
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
