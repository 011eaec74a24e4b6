package com.carecore.simulator.report;

import com.carecore.engine.coordination.DecisionRecord;
import com.carecore.engine.run.RunSummary;
import com.carecore.eventmodel.EventSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the end-of-run reports, {@code final_report.json} with the run summary and
 * {@code decision_log.json} with every decision record in commit order, and the periodic
 * {@code status_report.json} of an active run.
 *
 * <p>Files are written to a temporary sibling and moved into place, so a reader never sees a
 * partial report.
 */
public class RunReportWriter {

    public static final String FINAL_REPORT = "final_report.json";
    public static final String DECISION_LOG = "decision_log.json";
    public static final String STATUS_REPORT = "status_report.json";

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    private final Path directory;

    public RunReportWriter(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
    }

    /**
     * Writes both reports, replacing those of an earlier run.
     *
     * @return path of the final report
     * @throws UncheckedIOException if the directory or a file cannot be written
     */
    public Path write(RunSummary summary, List<DecisionRecord> decisions) {
        try {
            Files.createDirectories(directory);
            Path report = writeJson(FINAL_REPORT, summary);
            writeJson(DECISION_LOG, decisions);
            log.info("Run {} report written to {}: status={}, decisions={}, decisionsPerMinute={}",
                    summary.runId(), report, summary.status(), summary.decisionCount(),
                    String.format("%.1f", summary.decisionsPerMinute()));
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run report to " + directory, e);
        }
    }

    /**
     * Writes the status report of an active run, replacing the previous one.
     *
     * @return path of the status report
     * @throws UncheckedIOException if the directory or the file cannot be written
     */
    public Path writeStatus(StatusReport status) {
        try {
            Files.createDirectories(directory);
            Path report = writeJson(STATUS_REPORT, status);
            log.info("Run {} status: {} ticks, {} decisions, {} messages, {} patients, {} agents active",
                    status.runId(), status.ticksExecuted(), status.decisionCount(), status.messageCount(),
                    status.activePatients(), status.activeAgents());
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write status report to " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    private Path writeJson(String fileName, Object value) throws IOException {
        Path target = directory.resolve(fileName);
        Path temp = directory.resolve(fileName + ".tmp");
        Files.writeString(temp, EventSerializer.toPrettyJson(value), StandardCharsets.UTF_8);
        return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
