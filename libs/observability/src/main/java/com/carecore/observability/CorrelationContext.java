package com.carecore.observability;

/**
 * Immutable logging context of one unit of work inside the simulator.
 * <p>
 * Engine units (clock, agent runtimes, alert engine, coordinator) and HTTP requests establish a
 * {@code CorrelationContext}; {@link CorrelationContextHolder} copies its values into the SLF4J MDC
 * so every log line carries the run, the unit and, where known, the agent role and patient.
 *
 * @param correlationId id of the causal chain (event correlation id, or a request id)
 * @param runId         simulation run identifier (nullable outside a run)
 * @param unit          engine unit name, e.g. "clock" or "agent-nurse" (nullable)
 * @param role          agent role acting in this context (nullable)
 * @param patientId     patient being processed (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String runId,
        String unit,
        String role,
        String patientId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for run ID. */
    public static final String MDC_RUN_ID = "runId";

    /** MDC key for the engine unit. */
    public static final String MDC_UNIT = "unit";

    /** MDC key for the agent role. */
    public static final String MDC_ROLE = "role";

    /** MDC key for the patient ID. */
    public static final String MDC_PATIENT_ID = "patientId";

    /**
     * Requires a non-blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for a long-running engine unit, before any event is being processed. */
    public static CorrelationContext forUnit(String runId, String unit) {
        return new CorrelationContext(runId + ":" + unit, runId, unit, null, null);
    }

    /** Returns a copy scoped to one event's causal chain and patient. */
    public CorrelationContext withEvent(String eventCorrelationId, String patient) {
        return new CorrelationContext(eventCorrelationId, runId, unit, role, patient);
    }

    /** Returns a copy carrying the given agent role. */
    public CorrelationContext withRole(String agentRole) {
        return new CorrelationContext(correlationId, runId, unit, agentRole, patientId);
    }
}
