package com.carecore.engine.feed;

import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.PatientAdmission;
import com.carecore.engine.model.VitalSigns;

import java.util.List;
import java.util.Optional;

/**
 * Source of synthetic patient data driven by the simulation clock.
 *
 * <p>Called from the clock thread only. A method throwing for one patient only skips that patient
 * for the current tick.
 */
public interface DataFeed {

    /** The census to admit at run start. */
    List<PatientAdmission> admissions();

    /** Fresh vital signs for the patient, called once per tick. */
    VitalSigns generateVitals(String patientId);

    /** A lab result for this tick, or empty if none resulted. */
    Optional<LabResult> generateLab(String patientId);

    /** Medication starts and stops for this tick. */
    default List<MedicationChange> generateMedicationChanges(String patientId) {
        return List.of();
    }
}
