package com.carecore.engine;

import com.carecore.engine.alert.AlertRuleSet;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.model.AgentRole;

import java.time.Duration;
import java.util.List;

/**
 * Immutable engine configuration. Null or non-positive values fall back to the defaults.
 *
 * @param duration         simulated run length
 * @param tickInterval     simulated time per tick, also the wall-clock pacing target
 * @param decisionTimeout  budget per decision-function call (defaults to the tick interval)
 * @param busCapacity      queue capacity per subscriber
 * @param backlogThreshold soft-barrier threshold on pending work across units
 * @param barrierTimeout   longest wait for the soft barrier per tick
 * @param drainTimeout     longest wait for units to drain and exit at the end of the run, and for
 *                         queue space on a clock publish before the bus counts as stalled
 * @param alertRules       alert rules and cooldown
 * @param rolePriority     arbitration tie-break order, highest first
 */
public record EngineSettings(
        Duration duration,
        Duration tickInterval,
        Duration decisionTimeout,
        int busCapacity,
        int backlogThreshold,
        Duration barrierTimeout,
        Duration drainTimeout,
        AlertRuleSet alertRules,
        List<AgentRole> rolePriority
) {

    public static final Duration DEFAULT_DURATION = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_BACKLOG_THRESHOLD = 0;
    public static final Duration DEFAULT_BARRIER_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);

    public EngineSettings {
        duration = positiveOr(duration, DEFAULT_DURATION);
        tickInterval = positiveOr(tickInterval, DEFAULT_TICK_INTERVAL);
        decisionTimeout = positiveOr(decisionTimeout, tickInterval);
        if (busCapacity <= 0) {
            busCapacity = MessageBus.DEFAULT_CAPACITY;
        }
        if (backlogThreshold < 0) {
            backlogThreshold = DEFAULT_BACKLOG_THRESHOLD;
        }
        barrierTimeout = positiveOr(barrierTimeout, DEFAULT_BARRIER_TIMEOUT);
        drainTimeout = positiveOr(drainTimeout, DEFAULT_DRAIN_TIMEOUT);
        alertRules = alertRules == null ? AlertRuleSet.defaults() : alertRules;
        rolePriority = rolePriority == null || rolePriority.isEmpty()
                ? AgentRole.DEFAULT_PRIORITY
                : List.copyOf(rolePriority);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, null, 0, -1, null, null, null, null);
    }

    /** Number of ticks in a full run: duration / tick interval, at least one. */
    public long tickCount() {
        return Math.max(1, duration.toNanos() / tickInterval.toNanos());
    }

    public EngineSettings withDuration(Duration newDuration, Duration newTickInterval) {
        return new EngineSettings(newDuration, newTickInterval, decisionTimeout, busCapacity, backlogThreshold,
                barrierTimeout, drainTimeout, alertRules, rolePriority);
    }

    public EngineSettings withDecisionTimeout(Duration timeout) {
        return new EngineSettings(duration, tickInterval, timeout, busCapacity, backlogThreshold,
                barrierTimeout, drainTimeout, alertRules, rolePriority);
    }

    public EngineSettings withAlertRules(AlertRuleSet rules) {
        return new EngineSettings(duration, tickInterval, decisionTimeout, busCapacity, backlogThreshold,
                barrierTimeout, drainTimeout, rules, rolePriority);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
