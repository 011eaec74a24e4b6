package com.carecore.engine.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A clinical decision authored by an agent. Immutable; once committed it is never changed.
 *
 * @param decisionId unique decision id
 * @param patientId  patient the decision concerns
 * @param role       authoring role
 * @param kind       decision kind
 * @param urgency    urgency used for arbitration
 * @param confidence confidence in [0, 1]
 * @param details    kind-specific fields
 * @param rationale  free-text justification
 * @param decidedAt  when the agent produced it
 * @param tick       tick window the triggering event belongs to
 */
public record Decision(
        String decisionId,
        String patientId,
        AgentRole role,
        DecisionKind kind,
        Urgency urgency,
        double confidence,
        Map<String, String> details,
        String rationale,
        Instant decidedAt,
        long tick
) {

    public Decision {
        requireNonBlank(decisionId, "decisionId");
        requireNonBlank(patientId, "patientId");
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (urgency == null) {
            throw new IllegalArgumentException("urgency must not be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        details = details == null ? Map.of() : Map.copyOf(details);
        Set<String> missing = kind.missingDetails(details);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires details " + missing);
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt must not be null");
        }
        if (tick < 0) {
            throw new IllegalArgumentException("tick must not be negative");
        }
        rationale = rationale == null ? "" : rationale;
    }

    /**
     * Stamps a proposal with authoring role, patient, a fresh id, time and tick window.
     */
    public static Decision from(DecisionProposal proposal, String patientId, AgentRole role,
                                Instant decidedAt, long tick) {
        return new Decision(
                UUID.randomUUID().toString(),
                patientId,
                role,
                proposal.kind(),
                proposal.urgency(),
                proposal.confidence(),
                proposal.details(),
                proposal.rationale(),
                decidedAt,
                tick
        );
    }

    public String detail(String field) {
        return details.get(field);
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
