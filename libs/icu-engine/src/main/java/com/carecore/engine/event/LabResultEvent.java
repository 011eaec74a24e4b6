package com.carecore.engine.event;

import com.carecore.engine.model.LabResult;

/** Payload of {@code LabResulted}. */
public record LabResultEvent(String patientId, LabResult result) {

    public LabResultEvent {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
    }
}
