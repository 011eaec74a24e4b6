package com.carecore.engine.agent;

import com.carecore.engine.model.AgentRole;

import java.time.Duration;

/**
 * A decision function did not return within its time budget. Never fatal: the runtime skips
 * the event and counts the timeout.
 */
public class DecisionTimeoutException extends RuntimeException {

    private final AgentRole role;
    private final String eventId;

    public DecisionTimeoutException(AgentRole role, String eventId, Duration timeout) {
        super(role.value() + " decision for event " + eventId + " exceeded " + timeout.toMillis() + " ms");
        this.role = role;
        this.eventId = eventId;
    }

    public AgentRole getRole() {
        return role;
    }

    public String getEventId() {
        return eventId;
    }
}
