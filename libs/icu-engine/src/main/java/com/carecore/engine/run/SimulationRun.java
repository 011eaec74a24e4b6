package com.carecore.engine.run;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The one lifecycle object of a simulation run.
 *
 * <p>Created idle, moved to running by the clock, and finalized exactly once as completed or
 * failed. Counters are independent atomics; units only ever increment them.
 */
public final class SimulationRun {

    private final String runId;
    private final Duration configuredDuration;
    private final Duration tickInterval;
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.IDLE);

    private final AtomicLong decisions = new AtomicLong();
    private final AtomicLong messages = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();
    private final AtomicLong suppressedAlerts = new AtomicLong();
    private final AtomicLong decisionTimeouts = new AtomicLong();
    private final AtomicLong decisionFailures = new AtomicLong();
    private final AtomicLong rejectedDecisions = new AtomicLong();
    private final AtomicLong events = new AtomicLong();
    private final AtomicLong ticksExecuted = new AtomicLong();
    private final AtomicLong feedFailures = new AtomicLong();

    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String failureCause;
    private volatile int patientCount;
    private volatile int agentCount;

    public SimulationRun(String runId, Duration configuredDuration, Duration tickInterval) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
        if (configuredDuration == null || configuredDuration.isNegative() || configuredDuration.isZero()) {
            throw new IllegalArgumentException("configuredDuration must be positive");
        }
        if (tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        this.runId = runId;
        this.configuredDuration = configuredDuration;
        this.tickInterval = tickInterval;
    }

    public void markRunning(Instant now) {
        if (!status.compareAndSet(RunStatus.IDLE, RunStatus.RUNNING)) {
            throw new IllegalStateException("Run " + runId + " cannot start from " + status.get());
        }
        startedAt = now;
    }

    public void markCompleted(Instant now) {
        if (!status.compareAndSet(RunStatus.RUNNING, RunStatus.COMPLETED)) {
            throw new IllegalStateException("Run " + runId + " cannot complete from " + status.get());
        }
        finishedAt = now;
    }

    /** Fails the run from idle or running. The first recorded cause wins. */
    public void markFailed(Instant now, String cause) {
        RunStatus current = status.get();
        while (!current.isTerminal()) {
            if (status.compareAndSet(current, RunStatus.FAILED)) {
                failureCause = cause;
                finishedAt = now;
                if (startedAt == null) {
                    startedAt = now;
                }
                return;
            }
            current = status.get();
        }
        throw new IllegalStateException("Run " + runId + " already finalized as " + current);
    }

    public void recordDecision() {
        decisions.incrementAndGet();
    }

    public void recordMessage() {
        messages.incrementAndGet();
    }

    public void recordAlert() {
        alerts.incrementAndGet();
    }

    public void recordSuppressedAlert() {
        suppressedAlerts.incrementAndGet();
    }

    public void recordDecisionTimeout() {
        decisionTimeouts.incrementAndGet();
    }

    public void recordDecisionFailure() {
        decisionFailures.incrementAndGet();
    }

    public void recordRejectedDecision() {
        rejectedDecisions.incrementAndGet();
    }

    public void recordEvent() {
        events.incrementAndGet();
    }

    public void recordTick() {
        ticksExecuted.incrementAndGet();
    }

    public void recordFeedFailure() {
        feedFailures.incrementAndGet();
    }

    public void setCensus(int patients, int agents) {
        this.patientCount = patients;
        this.agentCount = agents;
    }

    public String runId() {
        return runId;
    }

    public RunStatus status() {
        return status.get();
    }

    public Duration configuredDuration() {
        return configuredDuration;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String failureCause() {
        return failureCause;
    }

    public int patientCount() {
        return patientCount;
    }

    public int agentCount() {
        return agentCount;
    }

    public long decisions() {
        return decisions.get();
    }

    public long messages() {
        return messages.get();
    }

    public long alerts() {
        return alerts.get();
    }

    public long suppressedAlerts() {
        return suppressedAlerts.get();
    }

    public long decisionTimeouts() {
        return decisionTimeouts.get();
    }

    public long decisionFailures() {
        return decisionFailures.get();
    }

    public long rejectedDecisions() {
        return rejectedDecisions.get();
    }

    public long events() {
        return events.get();
    }

    public long ticksExecuted() {
        return ticksExecuted.get();
    }

    public long feedFailures() {
        return feedFailures.get();
    }

    /** Simulated time covered by the executed ticks. */
    public Duration simulatedElapsed() {
        return tickInterval.multipliedBy(ticksExecuted.get());
    }
}
