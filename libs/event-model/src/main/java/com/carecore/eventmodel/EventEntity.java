package com.carecore.eventmodel;

/**
 * The entity an event relates to, plus the producer-assigned sequence number.
 *
 * @param entityType the kind of entity, e.g. "Patient"
 * @param entityId unique identifier of the entity instance (patient id for patient events)
 * @param sequence strictly increasing number per producer, used to check per-producer ordering
 */
public record EventEntity(String entityType, String entityId, long sequence) {

    /** Entity reference for a patient. */
    public static EventEntity patient(String patientId, long sequence) {
        return new EventEntity(EntityType.PATIENT.value(), patientId, sequence);
    }
}
