package com.carecore.engine.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kinds of clinical decision, each with its conflict domain and required detail fields.
 *
 * <p>Two decisions conflict when their kinds share a {@link ConflictDomain}; only conflicting
 * decisions are arbitrated against each other.
 */
public enum DecisionKind {

    CLINICAL_ASSESSMENT(ConflictDomain.CARE_PLAN, "assessment"),
    URGENT_INTERVENTION(ConflictDomain.CARE_PLAN, "trigger", "recommendation"),
    ESCALATION(ConflictDomain.CARE_PLAN, "reason"),
    MEDICATION_ORDER(ConflictDomain.MEDICATION, "drug", "action"),
    DRUG_INTERACTION_ALERT(ConflictDomain.MEDICATION, "drug", "interactsWith"),
    NURSING_INTERVENTION(ConflictDomain.NURSING, "intervention"),
    NURSING_CARE_PLAN(ConflictDomain.NURSING, "carePlan");

    /** Groups of decision kinds that cannot both be acted on for the same patient and tick. */
    public enum ConflictDomain {
        CARE_PLAN,
        MEDICATION,
        NURSING
    }

    private final ConflictDomain domain;
    private final List<String> requiredDetails;

    DecisionKind(ConflictDomain domain, String... requiredDetails) {
        this.domain = domain;
        this.requiredDetails = List.of(requiredDetails);
    }

    public ConflictDomain domain() {
        return domain;
    }

    public List<String> requiredDetails() {
        return requiredDetails;
    }

    public boolean conflictsWith(DecisionKind other) {
        return other != null && domain == other.domain;
    }

    /** Required detail fields that are absent or blank in {@code details}. */
    public Set<String> missingDetails(Map<String, String> details) {
        return requiredDetails.stream()
                .filter(field -> details == null
                        || details.get(field) == null
                        || details.get(field).isBlank())
                .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
    }
}
