package com.carecore.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 *
 * <p>Encapsulates the defaults (UUID generation, version 1, "direct" causation) so publishers only
 * supply what is specific to their event.
 */
public final class EventFactory {

    /** Causation id used for events that start a causal chain. */
    public static final String DIRECT_CAUSATION = "direct";

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a root event (new correlation id) stamped with the current time.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String runId,
            EventEntity entity,
            long tick,
            T payload
    ) {
        return create(eventType, producer, runId, entity, tick, Instant.now(), payload);
    }

    /**
     * Creates a root event with an explicit occurrence time (the measurement time for feed data).
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String runId,
            EventEntity entity,
            long tick,
            Instant occurredAt,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                runId,
                UUID.randomUUID().toString(),
                DIRECT_CAUSATION,
                entity,
                tick,
                payload
        );
    }

    /**
     * Creates a child event that inherits run, correlation and tick window from its parent.
     * The child's causationId is set to the parent's eventId.
     */
    public static <T> EventEnvelope<T> createChild(
            EventEnvelope<?> parent,
            EventType eventType,
            String producer,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                Instant.now(),
                producer,
                parent.runId(),
                parent.correlationId(),
                parent.eventId(),
                entity,
                parent.tick(),
                payload
        );
    }
}
