package com.carecore.engine.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demographic snapshot taken at admission. Never changes afterwards.
 *
 * @param mrn            medical record number
 * @param firstName      given name
 * @param lastName       family name
 * @param age            age in years
 * @param sex            "male" or "female"
 * @param weightKg       body weight
 * @param heightCm       height
 * @param admittedAt     ICU admission time
 * @param diagnosis      admitting diagnosis
 * @param acuity         admission acuity ("stable", "moderate", "critical")
 * @param allergies      known allergies
 * @param medicalHistory relevant history
 */
public record Demographics(
        String mrn,
        String firstName,
        String lastName,
        int age,
        String sex,
        double weightKg,
        int heightCm,
        Instant admittedAt,
        String diagnosis,
        String acuity,
        List<String> allergies,
        List<String> medicalHistory
) {

    public Demographics {
        if (age < 0) {
            throw new IllegalArgumentException("age must not be negative");
        }
        allergies = allergies == null ? List.of() : List.copyOf(allergies);
        medicalHistory = medicalHistory == null ? List.of() : List.copyOf(medicalHistory);
    }

    /** Field map for structured logging; pass it through a PHI redactor before logging. */
    public Map<String, Object> toLogFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("mrn", mrn);
        fields.put("firstName", firstName);
        fields.put("lastName", lastName);
        fields.put("age", age);
        fields.put("sex", sex);
        fields.put("diagnosis", diagnosis);
        fields.put("acuity", acuity);
        return fields;
    }
}
