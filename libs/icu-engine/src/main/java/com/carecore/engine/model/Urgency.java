package com.carecore.engine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Totally ordered urgency scale shared by decisions (urgency) and alerts (severity).
 *
 * <p>Declaration order is the clinical order, so {@link #compareTo} ranks {@code ROUTINE} lowest and
 * {@code CRITICAL} highest.
 */
public enum Urgency {
    ROUTINE,
    ELEVATED,
    HIGH,
    CRITICAL;

    /** Lower-case name used in logs, JSON and configuration ("high"). */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True if this level is the same as or above {@code other}. */
    public boolean isAtLeast(Urgency other) {
        return compareTo(other) >= 0;
    }

    /** Case-insensitive lookup ("critical", "CRITICAL"). */
    public static Optional<Urgency> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Urgency urgency : values()) {
            if (urgency.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }
}
