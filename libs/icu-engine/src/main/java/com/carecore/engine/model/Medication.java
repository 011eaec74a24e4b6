package com.carecore.engine.model;

import java.time.Instant;
import java.util.Locale;

/**
 * An active medication on a patient's chart.
 *
 * @param medicationId unique id of this order
 * @param drugName     generic drug name, e.g. "Furosemide"
 * @param dose         dose amount
 * @param doseUnit     dose unit, e.g. "mg"
 * @param route        administration route ("IV", "PO")
 * @param frequency    schedule ("continuous", "q6h")
 * @param startedAt    when the medication was started
 * @param orderedBy    who ordered it (prescriber id or agent role)
 */
public record Medication(
        String medicationId,
        String drugName,
        double dose,
        String doseUnit,
        String route,
        String frequency,
        Instant startedAt,
        String orderedBy
) {

    public Medication {
        if (medicationId == null || medicationId.isBlank()) {
            throw new IllegalArgumentException("medicationId must not be null or blank");
        }
        if (drugName == null || drugName.isBlank()) {
            throw new IllegalArgumentException("drugName must not be null or blank");
        }
        if (dose < 0) {
            throw new IllegalArgumentException("dose must not be negative");
        }
    }

    /** True if this is the given drug, ignoring case. */
    public boolean isDrug(String name) {
        return name != null && drugName.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT));
    }
}
