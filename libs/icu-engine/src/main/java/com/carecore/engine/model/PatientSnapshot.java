package com.carecore.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of one patient's state at a point in time.
 *
 * <p>Snapshots are detached from the store: later updates never show through, and a snapshot
 * always reflects whole updates (never a half-applied one).
 *
 * @param patientId    stable patient identifier
 * @param demographics admission demographics
 * @param vitals       latest vital signs
 * @param labs         latest result per lab test name
 * @param medications  active medications
 * @param version      per-patient mutation counter (0 right after admission)
 * @param capturedAt   when the snapshot was taken
 */
public record PatientSnapshot(
        String patientId,
        Demographics demographics,
        VitalSigns vitals,
        Map<String, LabResult> labs,
        List<Medication> medications,
        long version,
        Instant capturedAt
) {

    public PatientSnapshot {
        labs = labs == null ? Map.of() : Map.copyOf(labs);
        medications = medications == null ? List.of() : List.copyOf(medications);
        vitals = vitals == null ? VitalSigns.empty() : vitals;
    }

    public Optional<LabResult> lab(String testName) {
        return Optional.ofNullable(labs.get(testName));
    }

    /** True if a medication with the given drug name is active, ignoring case. */
    public boolean isOnDrug(String drugName) {
        return medications.stream().anyMatch(m -> m.isDrug(drugName));
    }
}
