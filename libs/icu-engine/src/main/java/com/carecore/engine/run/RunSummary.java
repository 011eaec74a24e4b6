package com.carecore.engine.run;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only result of a run, also the content of the final report.
 *
 * @param runId                run identifier
 * @param status               run status when the summary was taken
 * @param patientCount         patients admitted
 * @param agentCount           agent runtimes started
 * @param decisionCount        decisions committed
 * @param messageCount         inter-agent messages sent
 * @param alertCount           alerts emitted
 * @param suppressedAlertCount alerts suppressed by cooldown
 * @param decisionTimeouts     decision-function calls that timed out
 * @param decisionFailures     decision-function calls that threw
 * @param rejectedDecisions    decisions rejected by the coordinator
 * @param feedFailures         per-patient feed calls that failed and were skipped
 * @param eventCount           all events seen on the bus
 * @param ticksExecuted        ticks executed
 * @param startedAt            start time, null before start
 * @param finishedAt           finalization time, null while running
 * @param elapsed              simulated time covered by executed ticks
 * @param decisionsPerMinute   decisionCount per simulated minute, 0 without ticks
 * @param failureCause         cause of a failed run, otherwise null
 */
public record RunSummary(
        String runId,
        RunStatus status,
        int patientCount,
        int agentCount,
        long decisionCount,
        long messageCount,
        long alertCount,
        long suppressedAlertCount,
        long decisionTimeouts,
        long decisionFailures,
        long rejectedDecisions,
        long feedFailures,
        long eventCount,
        long ticksExecuted,
        Instant startedAt,
        Instant finishedAt,
        Duration elapsed,
        double decisionsPerMinute,
        String failureCause
) {

    /**
     * Takes a summary of the run's current counters. A failed run reports zero counts.
     */
    public static RunSummary of(SimulationRun run) {
        RunStatus status = run.status();
        if (status == RunStatus.FAILED) {
            return new RunSummary(run.runId(), status, run.patientCount(), run.agentCount(),
                    0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                    run.startedAt(), run.finishedAt(), Duration.ZERO, 0.0, run.failureCause());
        }
        Duration elapsed = run.simulatedElapsed();
        long decisions = run.decisions();
        return new RunSummary(
                run.runId(),
                status,
                run.patientCount(),
                run.agentCount(),
                decisions,
                run.messages(),
                run.alerts(),
                run.suppressedAlerts(),
                run.decisionTimeouts(),
                run.decisionFailures(),
                run.rejectedDecisions(),
                run.feedFailures(),
                run.events(),
                run.ticksExecuted(),
                run.startedAt(),
                run.finishedAt(),
                elapsed,
                decisionsPerMinute(decisions, elapsed),
                null
        );
    }

    static double decisionsPerMinute(long decisions, Duration elapsed) {
        if (elapsed.isZero()) {
            return 0.0;
        }
        double minutes = elapsed.toMillis() / 60_000.0;
        return decisions / minutes;
    }
}
