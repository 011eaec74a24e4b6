package com.carecore.engine.event;

import com.carecore.engine.model.VitalSigns;

import java.time.Instant;

/**
 * Payload of {@code VitalsUpdated}: the patient's vital signs after the tick's refresh.
 *
 * @param patientId patient concerned
 * @param vitals    merged vital signs as stored
 * @param timestamp measurement time of the refresh
 */
public record VitalUpdateEvent(String patientId, VitalSigns vitals, Instant timestamp) {

    public VitalUpdateEvent {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (vitals == null) {
            throw new IllegalArgumentException("vitals must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }
}
