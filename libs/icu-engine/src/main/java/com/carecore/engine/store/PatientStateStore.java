package com.carecore.engine.store;

import com.carecore.engine.model.Demographics;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.Medication;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.model.VitalSigns;
import com.carecore.observability.PhiRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Authoritative current state of every admitted patient.
 *
 * <p>Each patient is guarded by its own monitor: mutations of one patient are serialized and
 * readers never see a half-applied update, while different patients are mutated in parallel.
 * Callers only ever receive {@link PatientSnapshot} copies.
 */
public final class PatientStateStore {

    private static final Logger log = LoggerFactory.getLogger(PatientStateStore.class);
    private static final PhiRedactor REDACTOR = new PhiRedactor();

    private final Map<String, PatientRecord> patients = new ConcurrentHashMap<>();
    private final List<String> admissionOrder = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public PatientStateStore() {
        this(Clock.systemUTC());
    }

    public PatientStateStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Adds a patient to the census with empty vitals, labs and medications.
     *
     * @throws IllegalArgumentException if the id is blank or already admitted
     */
    public PatientSnapshot admit(String patientId, Demographics demographics) {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        if (demographics == null) {
            throw new IllegalArgumentException("demographics must not be null");
        }
        PatientRecord record = new PatientRecord(patientId, demographics);
        if (patients.putIfAbsent(patientId, record) != null) {
            throw new IllegalArgumentException("Patient already admitted: " + patientId);
        }
        admissionOrder.add(patientId);
        if (log.isDebugEnabled()) {
            log.debug("Admitted patient {}: {}", patientId, REDACTOR.redact(demographics.toLogFields()));
        }
        return record.snapshot(clock);
    }

    /** Returns a detached copy of the patient's current state. */
    public PatientSnapshot get(String patientId) {
        return find(patientId).snapshot(clock);
    }

    /** Overlays the given readings on the patient's vitals. Returns the state after the update. */
    public PatientSnapshot applyVitalUpdate(String patientId, VitalSigns vitals) {
        if (vitals == null) {
            throw new IllegalArgumentException("vitals must not be null");
        }
        PatientRecord record = find(patientId);
        synchronized (record) {
            record.vitals = record.vitals.mergedWith(vitals);
            record.version++;
            return record.snapshot(clock);
        }
    }

    /** Replaces the latest result for the lab's test name. */
    public PatientSnapshot applyLabResult(String patientId, LabResult lab) {
        if (lab == null) {
            throw new IllegalArgumentException("lab must not be null");
        }
        PatientRecord record = find(patientId);
        synchronized (record) {
            record.labs.put(lab.testName(), lab);
            record.version++;
            return record.snapshot(clock);
        }
    }

    /**
     * START adds (or replaces, by medication id) an active medication; STOP removes it by id, or
     * by drug name when no medication has that id. Stopping a medication that is not active
     * leaves the list unchanged but still counts as a mutation.
     */
    public PatientSnapshot applyMedicationChange(String patientId, MedicationChange change) {
        if (change == null) {
            throw new IllegalArgumentException("change must not be null");
        }
        PatientRecord record = find(patientId);
        synchronized (record) {
            Medication medication = change.medication();
            if (change.action() == MedicationChange.Action.START) {
                record.medications.put(medication.medicationId(), medication);
            } else if (record.medications.remove(medication.medicationId()) == null) {
                record.medications.values().removeIf(active -> active.isDrug(medication.drugName()));
            }
            record.version++;
            return record.snapshot(clock);
        }
    }

    /** Patient ids in admission order. */
    public List<String> patientIds() {
        return List.copyOf(admissionOrder);
    }

    public boolean contains(String patientId) {
        return patientId != null && patients.containsKey(patientId);
    }

    public int size() {
        return patients.size();
    }

    /** Snapshots of every patient, in admission order. */
    public List<PatientSnapshot> snapshots() {
        List<PatientSnapshot> snapshots = new ArrayList<>(admissionOrder.size());
        for (String patientId : admissionOrder) {
            snapshots.add(get(patientId));
        }
        return snapshots;
    }

    private PatientRecord find(String patientId) {
        PatientRecord record = patientId == null ? null : patients.get(patientId);
        if (record == null) {
            throw new PatientNotFoundException(patientId);
        }
        return record;
    }

    private static final class PatientRecord {

        private final String patientId;
        private final Demographics demographics;
        private final Map<String, LabResult> labs = new LinkedHashMap<>();
        private final Map<String, Medication> medications = new LinkedHashMap<>();
        private VitalSigns vitals = VitalSigns.empty();
        private long version;

        private PatientRecord(String patientId, Demographics demographics) {
            this.patientId = patientId;
            this.demographics = demographics;
        }

        private synchronized PatientSnapshot snapshot(Clock clock) {
            return new PatientSnapshot(
                    patientId,
                    demographics,
                    vitals,
                    labs,
                    new ArrayList<>(medications.values()),
                    version,
                    clock.instant()
            );
        }
    }
}
