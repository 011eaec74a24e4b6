package com.carecore.engine.coordination;

import com.carecore.engine.model.Decision;

import java.time.Instant;

/**
 * A log entry together with its current arbitration status.
 *
 * @param logSequence  global commit order
 * @param decision     the decision
 * @param committedAt  commit time
 * @param status       whether it currently holds authority in its group
 * @param supersededBy id of the authoritative decision when superseded, otherwise null
 */
public record DecisionRecord(
        long logSequence,
        Decision decision,
        Instant committedAt,
        Status status,
        String supersededBy
) {

    /** Arbitration status of a committed decision. */
    public enum Status {
        AUTHORITATIVE,
        SUPERSEDED
    }

    public boolean isAuthoritative() {
        return status == Status.AUTHORITATIVE;
    }
}
