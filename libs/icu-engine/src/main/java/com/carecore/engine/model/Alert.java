package com.carecore.engine.model;

import java.time.Instant;

/**
 * A threshold breach emitted by the alert engine.
 *
 * @param alertId       unique alert id
 * @param patientId     patient concerned
 * @param ruleId        triggering rule
 * @param parameter     vital sign key or lab test name
 * @param observedValue value that breached the rule
 * @param severity      rule severity
 * @param raisedAt      time of the triggering reading
 * @param dedupKey      patient, rule and value bucket joined with '|'
 */
public record Alert(
        String alertId,
        String patientId,
        String ruleId,
        String parameter,
        double observedValue,
        Urgency severity,
        Instant raisedAt,
        String dedupKey
) {

    public Alert {
        if (alertId == null || alertId.isBlank()) {
            throw new IllegalArgumentException("alertId must not be null or blank");
        }
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId must not be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (raisedAt == null) {
            throw new IllegalArgumentException("raisedAt must not be null");
        }
    }
}
