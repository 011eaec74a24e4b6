package com.carecore.engine.model;

import static com.carecore.engine.EngineFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VitalSigns")
class VitalSignsTest {

    @Test
    @DisplayName("merging keeps older readings for signs not re-measured")
    void merge() {
        var older = VitalSigns.of(T0, Map.of(VitalSign.HEART_RATE, 80.0, VitalSign.SPO2, 97.0));
        var newer = VitalSigns.of(T0.plusSeconds(5), Map.of(VitalSign.HEART_RATE, 95.0));

        var merged = older.mergedWith(newer);

        assertThat(merged.value(VitalSign.HEART_RATE)).hasValue(95.0);
        assertThat(merged.value(VitalSign.SPO2)).hasValue(97.0);
        assertThat(merged.get(VitalSign.SPO2).orElseThrow().measuredAt()).isEqualTo(T0);
        assertThat(merged.latestMeasuredAt()).contains(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("empty readings are allowed and have no timestamp")
    void empty() {
        assertThat(VitalSigns.empty().isEmpty()).isTrue();
        assertThat(new VitalSigns(null).latestMeasuredAt()).isEmpty();
        assertThat(VitalSigns.empty().value(VitalSign.TEMPERATURE)).isEmpty();
    }

    @Test
    @DisplayName("measurements must be finite")
    void finite() {
        assertThatThrownBy(() -> new Measurement(Double.NaN, T0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("lab flags follow the reference range")
    void labFlags() {
        assertThat(new LabResult("potassium", 3.1, "mEq/L", 3.5, 5.0, T0).abnormalFlag()).isEqualTo("L");
        assertThat(new LabResult("potassium", 5.6, "mEq/L", 3.5, 5.0, T0).abnormalFlag()).isEqualTo("H");
        assertThat(new LabResult("potassium", 4.2, "mEq/L", 3.5, 5.0, T0).isAbnormal()).isFalse();
    }
}
