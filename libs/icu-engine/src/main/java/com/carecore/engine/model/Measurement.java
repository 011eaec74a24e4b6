package com.carecore.engine.model;

import java.time.Instant;

/**
 * One reading of a vital sign.
 *
 * @param value      the measured value, in the unit of its {@link VitalSign}
 * @param measuredAt when the device took the reading
 */
public record Measurement(double value, Instant measuredAt) {

    public Measurement {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
        if (measuredAt == null) {
            throw new IllegalArgumentException("measuredAt must not be null");
        }
    }
}
