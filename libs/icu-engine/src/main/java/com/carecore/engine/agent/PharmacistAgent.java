package com.carecore.engine.agent;

import com.carecore.engine.event.LabResultEvent;
import com.carecore.engine.event.MedicationChangeEvent;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.Medication;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.MessageDraft;
import com.carecore.engine.model.MessageKind;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.model.Urgency;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pharmacist role: interaction review on medication starts, dose review on electrolyte results.
 */
public final class PharmacistAgent extends AbstractClinicalAgent {

    /** Known interacting pairs, keyed by lower-case drug name. */
    static final Map<String, List<String>> INTERACTIONS = Map.of(
            "warfarin", List.of("aspirin", "heparin"),
            "aspirin", List.of("warfarin"),
            "heparin", List.of("warfarin"),
            "digoxin", List.of("furosemide"),
            "furosemide", List.of("digoxin"));

    static final Set<String> POTASSIUM_SENSITIVE = Set.of("digoxin", "furosemide");

    public PharmacistAgent() {
        this(PharmacistAgent::reason);
    }

    public PharmacistAgent(DecisionFunction decisionFunction) {
        super(AgentRole.PHARMACIST,
                EnumSet.of(EventType.MEDICATION_CHANGED, EventType.LAB_RESULTED, EventType.AGENT_MESSAGE_SENT),
                decisionFunction);
    }

    static AgentOutcome reason(EventEnvelope<?> event, PatientSnapshot snapshot) {
        Object payload = event.payload();
        if (payload instanceof MedicationChangeEvent change
                && change.change().action() == MedicationChange.Action.START) {
            String drug = change.change().medication().drugName();
            return interactingDrug(drug, change.change().medication().medicationId(), snapshot)
                    .map(other -> AgentOutcome.of(
                            new DecisionProposal(DecisionKind.DRUG_INTERACTION_ALERT, Urgency.HIGH, 0.95,
                                    Map.of("drug", drug, "interactsWith", other),
                                    "Drug interaction database match"),
                            MessageDraft.to(AgentRole.PHYSICIAN, MessageKind.MEDICATION_QUERY,
                                    Map.of("drug", drug, "concern", "Interacts with active " + other))))
                    .orElse(AgentOutcome.none());
        }
        if (payload instanceof LabResultEvent lab && "potassium".equals(lab.result().testName())
                && lab.result().isAbnormal()) {
            Optional<Medication> sensitive = snapshot.medications().stream()
                    .filter(m -> POTASSIUM_SENSITIVE.contains(m.drugName().toLowerCase(Locale.ROOT)))
                    .findFirst();
            if (sensitive.isPresent()) {
                LabResult result = lab.result();
                return AgentOutcome.decide(new DecisionProposal(DecisionKind.MEDICATION_ORDER, Urgency.ELEVATED, 0.8,
                        Map.of("drug", sensitive.get().drugName(), "action", "review_dose"),
                        "Potassium " + result.value() + " " + result.abnormalFlag()));
            }
        }
        return AgentOutcome.none();
    }

    private static Optional<String> interactingDrug(String drug, String medicationId, PatientSnapshot snapshot) {
        List<String> partners = INTERACTIONS.getOrDefault(drug.toLowerCase(Locale.ROOT), List.of());
        return snapshot.medications().stream()
                .filter(active -> !active.medicationId().equals(medicationId))
                .map(Medication::drugName)
                .filter(name -> partners.contains(name.toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
