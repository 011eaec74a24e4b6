package com.carecore.engine.agent;

import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.eventmodel.EventEnvelope;

/**
 * What the agent runtime needs from a role: its identity, which events it perceives, and how it
 * reasons about them.
 */
public interface ClinicalAgent {

    AgentRole role();

    /** True if the runtime should hand this event to {@link #decide}. */
    boolean observes(EventEnvelope<?> event);

    AgentOutcome decide(EventEnvelope<?> event, PatientSnapshot snapshot) throws Exception;
}
