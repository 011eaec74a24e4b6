package com.carecore.engine.bus;

import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides which events a subscription receives.
 */
@FunctionalInterface
public interface EventFilter {

    boolean accepts(EventEnvelope<?> event);

    static EventFilter all() {
        return event -> true;
    }

    static EventFilter types(EventType first, EventType... rest) {
        Set<EventType> types = EnumSet.of(first, rest);
        return event -> EventType.fromString(event.eventType()).map(types::contains).orElse(false);
    }

    default EventFilter and(EventFilter other) {
        return event -> accepts(event) && other.accepts(event);
    }
}
