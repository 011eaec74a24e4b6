package com.carecore.engine.model;

import java.time.Instant;

/**
 * A single resulted lab test.
 *
 * @param testName      lower-case test name, e.g. "potassium"
 * @param value         resulted value
 * @param unit          unit of the value
 * @param referenceLow  lower bound of the reference range
 * @param referenceHigh upper bound of the reference range
 * @param resultedAt    when the result became available
 */
public record LabResult(
        String testName,
        double value,
        String unit,
        double referenceLow,
        double referenceHigh,
        Instant resultedAt
) {

    public LabResult {
        if (testName == null || testName.isBlank()) {
            throw new IllegalArgumentException("testName must not be null or blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
        if (referenceLow > referenceHigh) {
            throw new IllegalArgumentException("referenceLow must not exceed referenceHigh");
        }
        if (resultedAt == null) {
            throw new IllegalArgumentException("resultedAt must not be null");
        }
    }

    /** "L" below the reference range, "H" above it, "" inside. */
    public String abnormalFlag() {
        if (value < referenceLow) {
            return "L";
        }
        return value > referenceHigh ? "H" : "";
    }

    public boolean isAbnormal() {
        return !abnormalFlag().isEmpty();
    }
}
