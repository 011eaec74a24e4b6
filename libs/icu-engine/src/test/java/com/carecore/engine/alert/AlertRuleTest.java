package com.carecore.engine.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.carecore.engine.model.Urgency;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AlertRule")
class AlertRuleTest {

    private static final AlertRule HR = AlertRule.outside("hr-high", AlertRule.Source.VITAL, "heart_rate",
            50, 120, Urgency.HIGH, 10);

    @Test
    @DisplayName("bounds are exclusive")
    void exclusiveBounds() {
        assertThat(HR.isBreachedBy(120)).isFalse();
        assertThat(HR.isBreachedBy(50)).isFalse();
        assertThat(HR.isBreachedBy(120.1)).isTrue();
        assertThat(HR.isBreachedBy(49.9)).isTrue();
    }

    @Test
    @DisplayName("values in the same bucket share a dedup key")
    void buckets() {
        assertThat(HR.dedupKey("P1", 131)).isEqualTo(HR.dedupKey("P1", 139.9));
        assertThat(HR.dedupKey("P1", 131)).isNotEqualTo(HR.dedupKey("P1", 141));
        assertThat(HR.dedupKey("P1", 131)).isNotEqualTo(HR.dedupKey("P2", 131));
    }

    @Test
    @DisplayName("needs at least one bound and a positive bucket width")
    void validation() {
        assertThatThrownBy(() -> new AlertRule("r", AlertRule.Source.VITAL, "spo2", null, null, Urgency.HIGH, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AlertRule.below("r", AlertRule.Source.VITAL, "spo2", 90, Urgency.HIGH, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rule ids must be unique within a rule set")
    void uniqueIds() {
        assertThatThrownBy(() -> new AlertRuleSet(List.of(HR, HR), Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hr-high");
    }

    @Test
    @DisplayName("cooldown table suppresses repeats until the window has passed")
    void cooldownTable() {
        var table = new CooldownTable(Duration.ofMinutes(5));
        var t0 = Instant.parse("2024-03-01T08:00:00Z");

        assertThat(table.tryFire("k", t0)).isTrue();
        assertThat(table.tryFire("k", t0.plusSeconds(299))).isFalse();
        assertThat(table.tryFire("k", t0.plusSeconds(300))).isTrue();
        assertThat(table.tryFire("other", t0)).isTrue();
        assertThat(table.size()).isEqualTo(2);
    }
}
