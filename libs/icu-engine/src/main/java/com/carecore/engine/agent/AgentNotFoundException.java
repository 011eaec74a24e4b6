package com.carecore.engine.agent;

import com.carecore.engine.NotFoundException;

/** Thrown when no runtime exists for a requested agent id or role. */
public class AgentNotFoundException extends NotFoundException {

    public AgentNotFoundException(String agentIdOrRole) {
        super("Agent", agentIdOrRole);
    }
}
