package com.carecore.engine.alert;

import com.carecore.engine.model.Urgency;

/**
 * A threshold rule on one vital sign or lab test.
 *
 * <p>The rule is breached when the value is strictly below {@code low} or strictly above
 * {@code high}; either bound may be absent.
 *
 * @param ruleId      unique rule id, part of the dedup key
 * @param source      whether {@code parameter} names a vital sign key or a lab test
 * @param parameter   vital sign key ("heart_rate") or lab test name ("potassium")
 * @param low         lower bound, or null
 * @param high        upper bound, or null
 * @param severity    severity of the emitted alert
 * @param bucketWidth width of the value buckets used for deduplication
 */
public record AlertRule(
        String ruleId,
        Source source,
        String parameter,
        Double low,
        Double high,
        Urgency severity,
        double bucketWidth
) {

    /** Where the evaluated value comes from. */
    public enum Source {
        VITAL,
        LAB
    }

    public AlertRule {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId must not be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("parameter must not be null or blank");
        }
        if (low == null && high == null) {
            throw new IllegalArgumentException("rule " + ruleId + " needs at least one bound");
        }
        if (low != null && high != null && low > high) {
            throw new IllegalArgumentException("rule " + ruleId + ": low must not exceed high");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (!(bucketWidth > 0)) {
            throw new IllegalArgumentException("bucketWidth must be positive");
        }
    }

    public static AlertRule below(String ruleId, Source source, String parameter, double low,
                                  Urgency severity, double bucketWidth) {
        return new AlertRule(ruleId, source, parameter, low, null, severity, bucketWidth);
    }

    public static AlertRule above(String ruleId, Source source, String parameter, double high,
                                  Urgency severity, double bucketWidth) {
        return new AlertRule(ruleId, source, parameter, null, high, severity, bucketWidth);
    }

    public static AlertRule outside(String ruleId, Source source, String parameter, double low,
                                    double high, Urgency severity, double bucketWidth) {
        return new AlertRule(ruleId, source, parameter, low, high, severity, bucketWidth);
    }

    public boolean isBreachedBy(double value) {
        return (low != null && value < low) || (high != null && value > high);
    }

    public long bucketOf(double value) {
        return (long) Math.floor(value / bucketWidth);
    }

    /** Dedup key: patient, rule and value bucket. */
    public String dedupKey(String patientId, double value) {
        return patientId + "|" + ruleId + "|" + bucketOf(value);
    }
}
