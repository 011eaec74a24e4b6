package com.carecore.engine.agent;

import com.carecore.engine.event.VitalUpdateEvent;
import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Alert;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.MessageDraft;
import com.carecore.engine.model.MessageKind;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.model.Urgency;
import com.carecore.engine.model.VitalSign;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;

import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Nurse role: fever management, bedside response to critical alerts, care plans on handoff.
 */
public final class NurseAgent extends AbstractClinicalAgent {

    static final double FEVER_THRESHOLD = 38.0;

    public NurseAgent() {
        this(NurseAgent::reason);
    }

    public NurseAgent(DecisionFunction decisionFunction) {
        super(AgentRole.NURSE,
                EnumSet.of(EventType.VITALS_UPDATED, EventType.ALERT_RAISED, EventType.AGENT_MESSAGE_SENT),
                decisionFunction);
    }

    static AgentOutcome reason(EventEnvelope<?> event, PatientSnapshot snapshot) {
        Object payload = event.payload();
        if (payload instanceof VitalUpdateEvent update) {
            OptionalDouble temperature = update.vitals().value(VitalSign.TEMPERATURE);
            if (temperature.isPresent() && temperature.getAsDouble() > FEVER_THRESHOLD) {
                return AgentOutcome.decide(new DecisionProposal(
                        DecisionKind.NURSING_INTERVENTION,
                        Urgency.ELEVATED,
                        0.9,
                        Map.of("intervention", "fever_management",
                                "plan", "Administer antipyretic, cooling measures"),
                        "Standard nursing protocol"));
            }
            return AgentOutcome.none();
        }
        if (payload instanceof Alert alert && alert.severity() == Urgency.CRITICAL) {
            return AgentOutcome.of(
                    new DecisionProposal(DecisionKind.NURSING_INTERVENTION, Urgency.HIGH, 0.85,
                            Map.of("intervention", "continuous_monitoring"),
                            "Critical alert " + alert.ruleId()),
                    MessageDraft.to(AgentRole.PHYSICIAN, MessageKind.ESCALATION_NOTICE,
                            Map.of("reason", "Critical " + alert.parameter() + " " + alert.observedValue())));
        }
        if (payload instanceof AgentMessage message && message.kind() == MessageKind.HANDOFF_NOTE) {
            return AgentOutcome.decide(new DecisionProposal(DecisionKind.NURSING_CARE_PLAN, Urgency.ROUTINE, 0.8,
                    Map.of("carePlan", "Continue plan per handoff: " + message.payload().get("note")),
                    "Handoff from " + message.sender().value()));
        }
        return AgentOutcome.none();
    }
}
