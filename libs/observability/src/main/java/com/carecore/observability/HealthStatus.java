package com.carecore.observability;

/**
 * Health status for an engine component or the engine as a whole.
 */
public enum HealthStatus {

    /** Working normally. */
    HEALTHY,

    /** Impaired (lagging, some failures) but still making progress. */
    DEGRADED,

    /** Stopped or unable to make progress. */
    UNHEALTHY
}
