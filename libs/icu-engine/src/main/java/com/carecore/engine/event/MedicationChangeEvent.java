package com.carecore.engine.event;

import com.carecore.engine.model.MedicationChange;

/**
 * Payload of {@code MedicationChanged}.
 *
 * @param patientId patient concerned
 * @param change    the start or stop
 * @param source    "feed" for data-feed changes, otherwise the ordering role's value
 */
public record MedicationChangeEvent(String patientId, MedicationChange change, String source) {

    public static final String FEED_SOURCE = "feed";

    public MedicationChangeEvent {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (change == null) {
            throw new IllegalArgumentException("change must not be null");
        }
        source = source == null ? FEED_SOURCE : source;
    }
}
