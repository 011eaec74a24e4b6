package com.carecore.engine.coordination;

import com.carecore.engine.model.Decision;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only log of committed decisions, indexed globally and per patient.
 *
 * <p>Single writer (the decision coordinator), any number of lock-free readers. Entries are never
 * changed or removed; arbitration status is derived from the current authority of each
 * {@link ArbitrationGroup}, which only the writer updates.
 */
public final class DecisionLog {

    private final ArbitrationPolicy policy;
    private final Queue<CommittedDecision> entries = new ConcurrentLinkedQueue<>();
    private final Map<String, Queue<CommittedDecision>> byPatient = new ConcurrentHashMap<>();
    private final Map<String, CommittedDecision> byId = new ConcurrentHashMap<>();
    private final Map<ArbitrationGroup, String> authority = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public DecisionLog(ArbitrationPolicy policy) {
        this.policy = policy;
    }

    /**
     * Appends a decision and re-arbitrates its group.
     *
     * <p>The group's authority is settled before the entry becomes visible to readers, so a
     * reader never sees a new entry under a stale authority.
     *
     * @throws IllegalArgumentException if a decision with the same id was already committed
     */
    public ArbitrationOutcome append(Decision decision, Instant committedAt) {
        if (byId.containsKey(decision.decisionId())) {
            throw new IllegalArgumentException("Decision already committed: " + decision.decisionId());
        }
        CommittedDecision entry = new CommittedDecision(sequence.incrementAndGet(), decision, committedAt);
        byId.put(decision.decisionId(), entry);

        ArbitrationOutcome outcome = arbitrate(entry);
        byPatient.computeIfAbsent(decision.patientId(), id -> new ConcurrentLinkedQueue<>()).add(entry);
        entries.add(entry);
        return outcome;
    }

    private ArbitrationOutcome arbitrate(CommittedDecision entry) {
        Decision decision = entry.decision();
        ArbitrationGroup group = ArbitrationGroup.of(decision);
        String currentId = authority.get(group);
        if (currentId == null) {
            authority.put(group, decision.decisionId());
            return new ArbitrationOutcome(entry, true, Optional.empty(), decision.decisionId());
        }
        Decision current = byId.get(currentId).decision();
        if (policy.winner(decision, current) == decision) {
            authority.put(group, decision.decisionId());
            return new ArbitrationOutcome(entry, true, Optional.of(currentId), decision.decisionId());
        }
        return new ArbitrationOutcome(entry, false, Optional.empty(), currentId);
    }

    /** Entries in commit order with their current status. */
    public List<DecisionRecord> all() {
        return toRecords(entries);
    }

    /** The last {@code limit} entries in commit order. */
    public List<DecisionRecord> tail(int limit) {
        List<DecisionRecord> all = all();
        return all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size());
    }

    public List<DecisionRecord> forPatient(String patientId) {
        Queue<CommittedDecision> patientEntries = byPatient.get(patientId);
        return patientEntries == null ? List.of() : toRecords(patientEntries);
    }

    public Optional<DecisionRecord> find(String decisionId) {
        return Optional.ofNullable(byId.get(decisionId)).map(this::toRecord);
    }

    /** The decision currently holding authority in the group, if the group has any decision. */
    public Optional<Decision> authoritative(ArbitrationGroup group) {
        return Optional.ofNullable(authority.get(group)).map(id -> byId.get(id).decision());
    }

    public int size() {
        return byId.size();
    }

    private List<DecisionRecord> toRecords(Queue<CommittedDecision> source) {
        List<DecisionRecord> records = new ArrayList<>();
        for (CommittedDecision entry : source) {
            records.add(toRecord(entry));
        }
        return Collections.unmodifiableList(records);
    }

    private DecisionRecord toRecord(CommittedDecision entry) {
        String authoritativeId = authority.get(ArbitrationGroup.of(entry.decision()));
        String decisionId = entry.decision().decisionId();
        if (authoritativeId == null || authoritativeId.equals(decisionId)) {
            return new DecisionRecord(entry.logSequence(), entry.decision(), entry.committedAt(),
                    DecisionRecord.Status.AUTHORITATIVE, null);
        }
        return new DecisionRecord(entry.logSequence(), entry.decision(), entry.committedAt(),
                DecisionRecord.Status.SUPERSEDED, authoritativeId);
    }
}
