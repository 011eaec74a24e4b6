package com.carecore.engine.alert;

import com.carecore.engine.model.Urgency;
import com.carecore.engine.model.VitalSign;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.carecore.engine.alert.AlertRule.Source.LAB;
import static com.carecore.engine.alert.AlertRule.Source.VITAL;

/**
 * The configured alert rules together with the dedup cooldown window.
 *
 * @param rules    rules, ids unique
 * @param cooldown minimum time between two alerts with the same dedup key
 */
public record AlertRuleSet(List<AlertRule> rules, Duration cooldown) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);

    public AlertRuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
        Set<String> ids = new HashSet<>();
        for (AlertRule rule : rules) {
            if (!ids.add(rule.ruleId())) {
                throw new IllegalArgumentException("Duplicate alert rule id: " + rule.ruleId());
            }
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be null or negative");
        }
    }

    /** Thresholds used by ICU monitoring by default. */
    public static AlertRuleSet defaults() {
        return defaults(DEFAULT_COOLDOWN);
    }

    public static AlertRuleSet defaults(Duration cooldown) {
        return new AlertRuleSet(List.of(
                AlertRule.outside("hr-critical", VITAL, VitalSign.HEART_RATE.key(), 40, 150, Urgency.CRITICAL, 10),
                AlertRule.outside("hr-high", VITAL, VitalSign.HEART_RATE.key(), 50, 120, Urgency.HIGH, 10),
                AlertRule.below("spo2-critical", VITAL, VitalSign.SPO2.key(), 90, Urgency.CRITICAL, 2),
                AlertRule.below("spo2-high", VITAL, VitalSign.SPO2.key(), 92, Urgency.HIGH, 2),
                AlertRule.outside("sbp-high", VITAL, VitalSign.SYSTOLIC_BP.key(), 90, 180, Urgency.HIGH, 10),
                AlertRule.above("temp-elevated", VITAL, VitalSign.TEMPERATURE.key(), 38.0, Urgency.ELEVATED, 0.5),
                AlertRule.above("temp-high", VITAL, VitalSign.TEMPERATURE.key(), 39.5, Urgency.HIGH, 0.5),
                AlertRule.outside("potassium-elevated", LAB, "potassium", 3.5, 5.0, Urgency.ELEVATED, 0.5)
        ), cooldown);
    }

    public List<AlertRule> rulesFor(AlertRule.Source source, String parameter) {
        return rules.stream()
                .filter(rule -> rule.source() == source && rule.parameter().equals(parameter))
                .collect(Collectors.toList());
    }
}
