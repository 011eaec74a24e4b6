package com.carecore.engine.model;

import java.util.Optional;

/** Vital-sign parameters tracked per patient. */
public enum VitalSign {
    HEART_RATE("heart_rate", "bpm"),
    SYSTOLIC_BP("systolic_bp", "mmHg"),
    DIASTOLIC_BP("diastolic_bp", "mmHg"),
    RESPIRATORY_RATE("respiratory_rate", "/min"),
    SPO2("spo2", "%"),
    TEMPERATURE("temperature", "°C");

    private final String key;
    private final String unit;

    VitalSign(String key, String unit) {
        this.key = key;
        this.unit = unit;
    }

    /** Parameter name used by alert rules and reports ("heart_rate"). */
    public String key() {
        return key;
    }

    public String unit() {
        return unit;
    }

    public static Optional<VitalSign> fromKey(String key) {
        for (VitalSign sign : values()) {
            if (sign.key.equals(key)) {
                return Optional.of(sign);
            }
        }
        return Optional.empty();
    }
}
