package com.carecore.engine.coordination;

import java.util.Optional;

/**
 * Effect of appending one decision to the log.
 *
 * @param entry           the appended entry
 * @param authoritative   true if the new decision now holds its group's authority
 * @param displacedId     id of the decision it took authority from, if any
 * @param authoritativeId id of the group's authoritative decision after the append
 */
public record ArbitrationOutcome(
        CommittedDecision entry,
        boolean authoritative,
        Optional<String> displacedId,
        String authoritativeId
) {
}
