package com.carecore.eventmodel;

/** Entities an ICU event can relate to. */
public enum EntityType {
    PATIENT("Patient"),
    AGENT("Agent"),
    RUN("Run");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
