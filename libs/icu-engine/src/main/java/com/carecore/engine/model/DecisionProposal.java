package com.carecore.engine.model;

import java.util.Map;
import java.util.Set;

/**
 * What a decision function concludes, before the runtime stamps role, patient, id and time.
 *
 * @param kind       decision kind
 * @param urgency    urgency of the decision
 * @param confidence confidence in [0, 1]
 * @param details    kind-specific fields, see {@link DecisionKind#requiredDetails()}
 * @param rationale  free-text justification
 */
public record DecisionProposal(
        DecisionKind kind,
        Urgency urgency,
        double confidence,
        Map<String, String> details,
        String rationale
) {

    public DecisionProposal {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (urgency == null) {
            throw new IllegalArgumentException("urgency must not be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        details = details == null ? Map.of() : Map.copyOf(details);
        Set<String> missing = kind.missingDetails(details);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires details " + missing);
        }
        rationale = rationale == null ? "" : rationale;
    }
}
