package com.carecore.engine.model;

/**
 * A patient to admit at run start.
 *
 * @param patientId    stable identifier, e.g. "PATIENT_0001"
 * @param demographics admission demographics
 */
public record PatientAdmission(String patientId, Demographics demographics) {

    public PatientAdmission {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (demographics == null) {
            throw new IllegalArgumentException("demographics must not be null");
        }
    }
}
