package com.carecore.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for every event that travels over the ICU message bus.
 *
 * <p>Vital updates, lab results, medication changes, alerts, agent messages and decisions are all
 * wrapped in this envelope. The envelope carries the metadata the engine relies on for routing and
 * ordering (type, producer, per-producer sequence, tick window) alongside the domain payload.
 *
 * <p>Records are immutable: once an event is published nobody can alter it, which is what the
 * bus's exactly-once, per-producer FIFO delivery depends on.
 *
 * @param <T> the type of the domain-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** Canonical event type name (see {@link EventType#value()}), e.g. "VitalsUpdated". */
        String eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the unit that produced this event (e.g. "clock", "agent-nurse"). */
        String producer,

        /** Identifier of the simulation run the event belongs to. */
        String runId,

        /** Correlation ID linking the chain vital update → alert → decision. */
        String correlationId,

        /** ID of the event that directly caused this one ("direct" for roots). */
        String causationId,

        /** The entity (usually a patient) this event relates to, with the producer sequence. */
        EventEntity entity,

        /** Simulation tick during which the causal chain started. */
        long tick,

        /** Domain-specific event data. */
        T payload) {

    /**
     * Resolves {@link #eventType()} to its enum constant.
     *
     * @throws IllegalStateException if the type string is not a known event type
     */
    public EventType type() {
        return EventType.fromString(eventType)
                .orElseThrow(() -> new IllegalStateException("Unknown event type: " + eventType));
    }

    /** Shortcut for the entity id, which for patient events is the patient id. */
    public String entityId() {
        return entity == null ? null : entity.entityId();
    }
}
