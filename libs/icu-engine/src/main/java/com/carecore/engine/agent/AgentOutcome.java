package com.carecore.engine.agent;

import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.MessageDraft;

import java.util.Optional;

/**
 * Result of one reasoning step: an optional decision and an optional message.
 */
public record AgentOutcome(Optional<DecisionProposal> decision, Optional<MessageDraft> message) {

    private static final AgentOutcome NONE = new AgentOutcome(Optional.empty(), Optional.empty());

    public AgentOutcome {
        decision = decision == null ? Optional.empty() : decision;
        message = message == null ? Optional.empty() : message;
    }

    public static AgentOutcome none() {
        return NONE;
    }

    public static AgentOutcome decide(DecisionProposal proposal) {
        return new AgentOutcome(Optional.of(proposal), Optional.empty());
    }

    public static AgentOutcome send(MessageDraft draft) {
        return new AgentOutcome(Optional.empty(), Optional.of(draft));
    }

    public static AgentOutcome of(DecisionProposal proposal, MessageDraft draft) {
        return new AgentOutcome(Optional.of(proposal), Optional.of(draft));
    }

    public boolean isEmpty() {
        return decision.isEmpty() && message.isEmpty();
    }
}
