package com.carecore.engine.model;

/**
 * A change to a patient's active medication set, from the data feed or from an agent's order.
 *
 * @param action     whether the medication starts or stops
 * @param medication the medication concerned (for STOP only its id and drug name matter)
 */
public record MedicationChange(Action action, Medication medication) {

    /** Direction of the change. */
    public enum Action {
        START,
        STOP
    }

    public MedicationChange {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (medication == null) {
            throw new IllegalArgumentException("medication must not be null");
        }
    }

    public static MedicationChange start(Medication medication) {
        return new MedicationChange(Action.START, medication);
    }

    public static MedicationChange stop(Medication medication) {
        return new MedicationChange(Action.STOP, medication);
    }
}
