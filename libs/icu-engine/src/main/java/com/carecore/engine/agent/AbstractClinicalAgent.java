package com.carecore.engine.agent;

import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base for the role variants: a fixed set of observed event types plus a decision function.
 *
 * <p>Agent messages are only observed when addressed to this role or broadcast by another role,
 * so an agent never perceives its own messages.
 */
public abstract class AbstractClinicalAgent implements ClinicalAgent {

    private final AgentRole role;
    private final Set<EventType> observedTypes;
    private final DecisionFunction decisionFunction;

    protected AbstractClinicalAgent(AgentRole role, Set<EventType> observedTypes,
                                    DecisionFunction decisionFunction) {
        if (decisionFunction == null) {
            throw new IllegalArgumentException("decisionFunction must not be null");
        }
        this.role = role;
        this.observedTypes = EnumSet.copyOf(observedTypes);
        this.decisionFunction = decisionFunction;
    }

    @Override
    public AgentRole role() {
        return role;
    }

    @Override
    public boolean observes(EventEnvelope<?> event) {
        EventType type = EventType.fromString(event.eventType()).orElse(null);
        if (type == null || !observedTypes.contains(type)) {
            return false;
        }
        if (type == EventType.AGENT_MESSAGE_SENT) {
            return event.payload() instanceof AgentMessage message && message.isDeliverableTo(role);
        }
        return true;
    }

    @Override
    public AgentOutcome decide(EventEnvelope<?> event, PatientSnapshot snapshot) throws Exception {
        AgentOutcome outcome = decisionFunction.decide(event, snapshot);
        return outcome == null ? AgentOutcome.none() : outcome;
    }

    public Set<EventType> observedTypes() {
        return EnumSet.copyOf(observedTypes);
    }
}
