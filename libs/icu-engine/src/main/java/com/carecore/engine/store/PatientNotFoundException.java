package com.carecore.engine.store;

import com.carecore.engine.NotFoundException;

/** Thrown when a patient id is not in the census. */
public class PatientNotFoundException extends NotFoundException {

    public PatientNotFoundException(String patientId) {
        super("Patient", patientId);
    }
}
