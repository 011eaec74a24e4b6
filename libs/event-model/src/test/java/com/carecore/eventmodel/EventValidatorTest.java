package com.carecore.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for EventValidator: every missing or malformed field is reported, all at once.
 */
@DisplayName("EventValidator")
class EventValidatorTest {

    private static final EventEntity VALID_ENTITY = EventEntity.patient("p-1", 1);

    private static EventEnvelope<String> envelope(
            String id, String type, Instant at, String producer, String runId,
            EventEntity entity, long tick, String payload) {
        return new EventEnvelope<>(id, type, 1, at, producer, runId, "c", "x", entity, tick, payload);
    }

    @Nested
    @DisplayName("valid events")
    class ValidEvents {

        @Test
        @DisplayName("factory-created event passes validation")
        void factoryEventValid() {
            var event = EventFactory.create(
                    EventType.VITALS_UPDATED, "clock", "run-1", VALID_ENTITY, 0, "data");
            var result = EventValidator.validate(event);
            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("invalid events")
    class InvalidEvents {

        @Test
        @DisplayName("null event fails")
        void nullEvent() {
            assertThat(EventValidator.validate(null).valid()).isFalse();
        }

        @Test
        @DisplayName("null eventId fails")
        void nullEventId() {
            var result = EventValidator.validate(envelope(
                    null, "VitalsUpdated", Instant.now(), "s", "r", VALID_ENTITY, 0, "p"));
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("eventId"));
        }

        @Test
        @DisplayName("unknown eventType fails")
        void unknownEventType() {
            var result = EventValidator.validate(envelope(
                    "id", "TradeExecuted", Instant.now(), "s", "r", VALID_ENTITY, 0, "p"));
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("not a known event type"));
        }

        @Test
        @DisplayName("blank runId fails")
        void blankRunId() {
            var result = EventValidator.validate(envelope(
                    "id", "VitalsUpdated", Instant.now(), "s", " ", VALID_ENTITY, 0, "p"));
            assertThat(result.errors()).anyMatch(e -> e.contains("runId"));
        }

        @Test
        @DisplayName("non-positive producer sequence fails")
        void zeroSequence() {
            var result = EventValidator.validate(envelope(
                    "id", "VitalsUpdated", Instant.now(), "s", "r",
                    EventEntity.patient("p-1", 0), 0, "p"));
            assertThat(result.errors()).anyMatch(e -> e.contains("entity.sequence"));
        }

        @Test
        @DisplayName("negative tick and null payload fail")
        void negativeTickNullPayload() {
            var result = EventValidator.validate(envelope(
                    "id", "VitalsUpdated", Instant.now(), "s", "r", VALID_ENTITY, -1, null));
            assertThat(result.errors())
                    .anyMatch(e -> e.contains("tick"))
                    .anyMatch(e -> e.contains("payload"));
        }

        @Test
        @DisplayName("collects every error in a single result")
        void collectsAllErrors() {
            var result = EventValidator.validate(
                    new EventEnvelope<>(null, null, 0, null, null, null, null, null, null, 0, null));
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSizeGreaterThanOrEqualTo(7);
            assertThat(result.summary()).contains("eventId").contains("producer");
        }
    }
}
