package com.carecore.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link CorrelationContextHolder} and {@link CorrelationContext}: MDC population,
 * clearing, and restoration after scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    private static final CorrelationContext UNIT = CorrelationContext.forUnit("run-1", "agent-nurse");

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("CorrelationContext")
    class Context {

        @Test
        @DisplayName("rejects a blank correlation id")
        void rejectsBlank() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("derives event and role scoped copies")
        void derivesCopies() {
            var scoped = UNIT.withRole("nurse").withEvent("corr-7", "PATIENT_0001");

            assertThat(scoped.correlationId()).isEqualTo("corr-7");
            assertThat(scoped.runId()).isEqualTo("run-1");
            assertThat(scoped.unit()).isEqualTo("agent-nurse");
            assertThat(scoped.role()).isEqualTo("nurse");
            assertThat(scoped.patientId()).isEqualTo("PATIENT_0001");
        }
    }

    @Nested
    @DisplayName("set / clear")
    class SetAndClear {

        @Test
        @DisplayName("populates MDC with non-null values only")
        void populatesMdc() {
            CorrelationContextHolder.set(UNIT);

            assertThat(MDC.get(CorrelationContext.MDC_RUN_ID)).isEqualTo("run-1");
            assertThat(MDC.get(CorrelationContext.MDC_UNIT)).isEqualTo("agent-nurse");
            assertThat(MDC.get(CorrelationContext.MDC_PATIENT_ID)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clears() {
            CorrelationContextHolder.set(UNIT);
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class Scoped {

        @Test
        @DisplayName("runWithContext restores the previous context")
        void restoresPrevious() {
            CorrelationContextHolder.set(UNIT);
            var inner = UNIT.withEvent("corr-inner", "PATIENT_0002");
            var seen = new AtomicReference<String>();

            CorrelationContextHolder.runWithContext(inner, () -> seen.set(MDC.get("patientId")));

            assertThat(seen.get()).isEqualTo("PATIENT_0002");
            assertThat(CorrelationContextHolder.get()).contains(UNIT);
            assertThat(MDC.get("patientId")).isNull();
        }

        @Test
        @DisplayName("callWithContext returns the result and clears when nothing was set before")
        void callClears() throws Exception {
            String result = CorrelationContextHolder.callWithContext(UNIT,
                    () -> CorrelationContextHolder.get().orElseThrow().unit());

            assertThat(result).isEqualTo("agent-nurse");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("callWithContext propagates exceptions and still restores")
        void callPropagates() {
            assertThatThrownBy(() -> CorrelationContextHolder.callWithContext(UNIT, () -> {
                throw new java.io.IOException("boom");
            })).isInstanceOf(java.io.IOException.class);

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
