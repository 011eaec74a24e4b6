package com.carecore.eventmodel;

import java.util.Optional;

/**
 * All event types carried by the ICU message bus.
 *
 * <p>The {@code value} field holds the canonical string stored in {@link EventEnvelope#eventType()}
 * and in JSON.
 */
public enum EventType {

    // ---- Data feed ----
    VITALS_UPDATED("VitalsUpdated"),
    LAB_RESULTED("LabResulted"),
    MEDICATION_CHANGED("MedicationChanged"),

    // ---- Alerting ----
    ALERT_RAISED("AlertRaised"),

    // ---- Agents ----
    AGENT_MESSAGE_SENT("AgentMessageSent"),
    DECISION_PROPOSED("DecisionProposed"),

    // ---- Coordination ----
    DECISION_COMMITTED("DecisionCommitted"),
    DECISION_SUPERSEDED("DecisionSuperseded");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "VitalsUpdated"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "AlertRaised")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
