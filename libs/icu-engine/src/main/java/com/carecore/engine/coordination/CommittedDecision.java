package com.carecore.engine.coordination;

import com.carecore.engine.model.Decision;

import java.time.Instant;

/**
 * An entry of the decision log. Never modified after it is appended.
 *
 * @param logSequence global commit order, starting at 1
 * @param decision    the decision as proposed
 * @param committedAt commit time
 */
public record CommittedDecision(long logSequence, Decision decision, Instant committedAt) {
}
