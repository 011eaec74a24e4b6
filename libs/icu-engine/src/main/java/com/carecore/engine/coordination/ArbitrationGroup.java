package com.carecore.engine.coordination;

import com.carecore.engine.model.Decision;
import com.carecore.engine.model.DecisionKind;

/**
 * Decisions that compete for authority: same patient, same tick window, same conflict domain.
 */
public record ArbitrationGroup(String patientId, long tick, DecisionKind.ConflictDomain domain) {

    public static ArbitrationGroup of(Decision decision) {
        return new ArbitrationGroup(decision.patientId(), decision.tick(), decision.kind().domain());
    }
}
