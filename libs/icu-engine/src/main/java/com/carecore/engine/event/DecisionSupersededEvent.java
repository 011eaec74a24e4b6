package com.carecore.engine.event;

import com.carecore.engine.model.DecisionKind;

/**
 * Payload of {@code DecisionSuperseded}: authority in one arbitration group moved to another
 * decision.
 *
 * @param patientId                patient concerned
 * @param tick                     tick window of the group
 * @param domain                   conflict domain of the group
 * @param supersededDecisionId     decision that lost authority
 * @param authoritativeDecisionId  decision that now holds it
 */
public record DecisionSupersededEvent(
        String patientId,
        long tick,
        DecisionKind.ConflictDomain domain,
        String supersededDecisionId,
        String authoritativeDecisionId
) {
}
