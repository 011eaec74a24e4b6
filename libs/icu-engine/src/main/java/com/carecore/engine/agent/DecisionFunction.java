package com.carecore.engine.agent;

import com.carecore.engine.model.PatientSnapshot;
import com.carecore.eventmodel.EventEnvelope;

/**
 * Pluggable clinical reasoning of one role: given the triggering event and the patient's
 * current state, what (if anything) the agent decides and says.
 *
 * <p>Implementations may block or be slow; the runtime bounds every call with a timeout and
 * treats any exception as "no action this cycle".
 */
@FunctionalInterface
public interface DecisionFunction {

    AgentOutcome decide(EventEnvelope<?> event, PatientSnapshot snapshot) throws Exception;
}
