package com.carecore.simulator.report;

import com.carecore.engine.run.RunStatus;
import com.carecore.engine.run.RunSummary;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time status of an active run, written periodically as {@code status_report.json}.
 *
 * @param timestamp      when the report was taken
 * @param runId          run identifier
 * @param status         run status
 * @param uptimeMinutes  whole minutes since the run started
 * @param ticksExecuted  ticks executed so far
 * @param decisionCount  decisions committed so far
 * @param messageCount   inter-agent messages so far
 * @param alertCount     alerts emitted so far
 * @param activePatients patients in the census
 * @param activeAgents   agent runtimes still running
 */
public record StatusReport(
        Instant timestamp,
        String runId,
        RunStatus status,
        long uptimeMinutes,
        long ticksExecuted,
        long decisionCount,
        long messageCount,
        long alertCount,
        int activePatients,
        int activeAgents
) {

    public static StatusReport of(RunSummary summary, int activeAgents, Instant now) {
        Duration uptime = summary.startedAt() == null || now.isBefore(summary.startedAt())
                ? Duration.ZERO
                : Duration.between(summary.startedAt(), now);
        return new StatusReport(now, summary.runId(), summary.status(), uptime.toMinutes(),
                summary.ticksExecuted(), summary.decisionCount(), summary.messageCount(), summary.alertCount(),
                summary.patientCount(), activeAgents);
    }
}
