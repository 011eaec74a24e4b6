package com.carecore.engine.agent;

import com.carecore.engine.event.VitalUpdateEvent;
import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Alert;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.model.Urgency;
import com.carecore.engine.model.VitalSign;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Physician role: reacts to critical vitals, high-severity alerts and peer escalations.
 */
public final class PhysicianAgent extends AbstractClinicalAgent {

    /** Normal range per vital sign; readings outside trigger an urgent intervention. */
    static final Map<VitalSign, double[]> CRITICAL_RANGES = criticalRanges();

    public PhysicianAgent() {
        this(PhysicianAgent::reason);
    }

    public PhysicianAgent(DecisionFunction decisionFunction) {
        super(AgentRole.PHYSICIAN,
                EnumSet.of(EventType.VITALS_UPDATED, EventType.ALERT_RAISED, EventType.AGENT_MESSAGE_SENT),
                decisionFunction);
    }

    static AgentOutcome reason(EventEnvelope<?> event, PatientSnapshot snapshot) {
        Object payload = event.payload();
        if (payload instanceof Alert alert) {
            if (!alert.severity().isAtLeast(Urgency.HIGH)) {
                return AgentOutcome.none();
            }
            return AgentOutcome.decide(new DecisionProposal(
                    DecisionKind.URGENT_INTERVENTION,
                    alert.severity(),
                    0.85,
                    Map.of("trigger", "clinical_alert",
                            "alertRule", alert.ruleId(),
                            "recommendation", "Bedside evaluation for abnormal " + alert.parameter()),
                    "Alert " + alert.ruleId() + " at " + alert.observedValue()));
        }
        if (payload instanceof VitalUpdateEvent update) {
            for (Map.Entry<VitalSign, double[]> range : CRITICAL_RANGES.entrySet()) {
                OptionalDouble value = update.vitals().value(range.getKey());
                if (value.isPresent()
                        && (value.getAsDouble() < range.getValue()[0] || value.getAsDouble() > range.getValue()[1])) {
                    return AgentOutcome.decide(new DecisionProposal(
                            DecisionKind.URGENT_INTERVENTION,
                            Urgency.HIGH,
                            0.8,
                            Map.of("trigger", "critical_vital",
                                    "parameter", range.getKey().key(),
                                    "value", String.valueOf(value.getAsDouble()),
                                    "recommendation", "Reassess " + range.getKey().key() + " and titrate support"),
                            "Critical vital sign outside " + range.getValue()[0] + "-" + range.getValue()[1]));
                }
            }
            return AgentOutcome.none();
        }
        if (payload instanceof AgentMessage message) {
            return switch (message.kind()) {
                case ESCALATION_NOTICE -> AgentOutcome.decide(new DecisionProposal(
                        DecisionKind.ESCALATION, Urgency.HIGH, 0.8,
                        Map.of("reason", message.payload().get("reason")),
                        "Escalated by " + message.sender().value()));
                case MEDICATION_QUERY -> AgentOutcome.decide(new DecisionProposal(
                        DecisionKind.MEDICATION_ORDER, Urgency.ELEVATED, 0.75,
                        Map.of("drug", message.payload().get("drug"), "action", "stop"),
                        "Pharmacist concern: " + message.payload().get("concern")));
                case CONSULT_REQUEST -> AgentOutcome.decide(new DecisionProposal(
                        DecisionKind.CLINICAL_ASSESSMENT, Urgency.ROUTINE, 0.7,
                        Map.of("assessment", "Consult reviewed: " + message.payload().get("question")),
                        "Consult from " + message.sender().value()));
                case HANDOFF_NOTE -> AgentOutcome.none();
            };
        }
        return AgentOutcome.none();
    }

    private static Map<VitalSign, double[]> criticalRanges() {
        Map<VitalSign, double[]> ranges = new LinkedHashMap<>();
        ranges.put(VitalSign.HEART_RATE, new double[] {50, 120});
        ranges.put(VitalSign.SYSTOLIC_BP, new double[] {90, 180});
        ranges.put(VitalSign.SPO2, new double[] {92, 100});
        return ranges;
    }
}
