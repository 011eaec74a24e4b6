package com.carecore.engine.coordination;

import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Decision;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Orders conflicting decisions so that the authoritative one comes first.
 *
 * <p>Precedence: higher urgency, then earlier decision time, then higher role priority, then
 * lexicographically smaller decision id. The order is total, so the winner of a group never
 * depends on the order decisions arrive in.
 */
public final class ArbitrationPolicy implements Comparator<Decision> {

    private final List<AgentRole> rolePriority;
    private final Comparator<Decision> order;

    /**
     * @param rolePriority roles from highest to lowest priority; roles not listed rank last, in
     *                     declaration order
     */
    public ArbitrationPolicy(List<AgentRole> rolePriority) {
        if (rolePriority == null) {
            throw new IllegalArgumentException("rolePriority must not be null");
        }
        Set<AgentRole> seen = EnumSet.noneOf(AgentRole.class);
        List<AgentRole> priority = new ArrayList<>();
        for (AgentRole role : rolePriority) {
            if (role == null || !seen.add(role)) {
                throw new IllegalArgumentException("rolePriority must list distinct, non-null roles");
            }
            priority.add(role);
        }
        for (AgentRole role : AgentRole.values()) {
            if (seen.add(role)) {
                priority.add(role);
            }
        }
        this.rolePriority = List.copyOf(priority);
        this.order = Comparator.comparing(Decision::urgency, Comparator.reverseOrder())
                .thenComparing(Decision::decidedAt)
                .thenComparingInt(decision -> this.rolePriority.indexOf(decision.role()))
                .thenComparing(Decision::decisionId);
    }

    /** Physician, then pharmacist, then nurse. */
    public static ArbitrationPolicy defaults() {
        return new ArbitrationPolicy(AgentRole.DEFAULT_PRIORITY);
    }

    @Override
    public int compare(Decision a, Decision b) {
        return order.compare(a, b);
    }

    /** The authoritative decision of the two. */
    public Decision winner(Decision a, Decision b) {
        return compare(a, b) <= 0 ? a : b;
    }

    public List<AgentRole> rolePriority() {
        return rolePriority;
    }
}
