package com.carecore.engine.model;

import java.util.List;
import java.util.Optional;

/**
 * Roles an autonomous clinical agent can play. One agent runtime runs per role.
 */
public enum AgentRole {

    PHYSICIAN("physician"),
    NURSE("nurse"),
    PHARMACIST("pharmacist");

    /** Default arbitration priority, highest first. */
    public static final List<AgentRole> DEFAULT_PRIORITY = List.of(PHYSICIAN, PHARMACIST, NURSE);

    private final String value;

    AgentRole(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "nurse"). */
    public String value() {
        return value;
    }

    /** Name of the engine unit running this role, e.g. "agent-nurse". */
    public String unitName() {
        return "agent-" + value;
    }

    /** Identifier of the single agent instance playing this role, e.g. "NURSE_001". */
    public String agentId() {
        return name() + "_001";
    }

    /**
     * Looks up a role by canonical value or enum name, ignoring case.
     */
    public static Optional<AgentRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AgentRole role : values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
