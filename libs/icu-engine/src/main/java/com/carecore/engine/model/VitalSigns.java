package com.carecore.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable set of vital-sign readings, each with its own measurement time.
 *
 * @param readings latest measurement per vital sign (absent signs were never measured)
 */
public record VitalSigns(Map<VitalSign, Measurement> readings) {

    public VitalSigns {
        EnumMap<VitalSign, Measurement> copy = new EnumMap<>(VitalSign.class);
        if (readings != null) {
            readings.forEach((sign, measurement) -> {
                if (sign == null || measurement == null) {
                    throw new IllegalArgumentException("readings must not contain null keys or values");
                }
                copy.put(sign, measurement);
            });
        }
        readings = Collections.unmodifiableMap(copy);
    }

    /** No readings at all. */
    public static VitalSigns empty() {
        return new VitalSigns(Map.of());
    }

    /** Readings that were all taken at the same instant. */
    public static VitalSigns of(Instant measuredAt, Map<VitalSign, Double> values) {
        EnumMap<VitalSign, Measurement> readings = new EnumMap<>(VitalSign.class);
        values.forEach((sign, value) -> readings.put(sign, new Measurement(value, measuredAt)));
        return new VitalSigns(readings);
    }

    public Optional<Measurement> get(VitalSign sign) {
        return Optional.ofNullable(readings.get(sign));
    }

    public OptionalDouble value(VitalSign sign) {
        Measurement measurement = readings.get(sign);
        return measurement == null ? OptionalDouble.empty() : OptionalDouble.of(measurement.value());
    }

    /**
     * Returns these readings overlaid with {@code newer}: signs present in {@code newer} replace
     * the current ones, the rest are kept.
     */
    public VitalSigns mergedWith(VitalSigns newer) {
        EnumMap<VitalSign, Measurement> merged = new EnumMap<>(VitalSign.class);
        merged.putAll(readings);
        merged.putAll(newer.readings());
        return new VitalSigns(merged);
    }

    /** Time of the most recent reading, if any. */
    public Optional<Instant> latestMeasuredAt() {
        return readings.values().stream()
                .map(Measurement::measuredAt)
                .max(Instant::compareTo);
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }
}
