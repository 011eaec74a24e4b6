package com.carecore.engine.agent;

import com.carecore.engine.model.AgentRole;

import java.time.Instant;

/**
 * Point-in-time view of one agent runtime.
 *
 * @param agentId               agent instance id, e.g. "NURSE_001"
 * @param role                  role played
 * @param active                true while the runtime loop is running
 * @param eventsProcessed       events pulled from the bus
 * @param decisionsMade         decisions published
 * @param messagesSent          messages published
 * @param timeouts              decision-function calls that timed out
 * @param failures              decision-function calls or act steps that failed
 * @param averageResponseMillis mean decision-function latency
 * @param averageConfidence     mean confidence of published decisions, 0 without decisions
 * @param lastDecisionAt        time of the last published decision, null if none
 */
public record AgentStatus(
        String agentId,
        AgentRole role,
        boolean active,
        long eventsProcessed,
        long decisionsMade,
        long messagesSent,
        long timeouts,
        long failures,
        double averageResponseMillis,
        double averageConfidence,
        Instant lastDecisionAt
) {
}
