package com.carecore.simulator.run;

import com.carecore.engine.EngineSettings;
import com.carecore.engine.IcuEngine;
import com.carecore.engine.NotFoundException;
import com.carecore.engine.agent.AgentRuntime;
import com.carecore.engine.clock.Pacer;
import com.carecore.engine.run.RunStatus;
import com.carecore.engine.run.RunSummary;
import com.carecore.observability.MetricFactory;
import com.carecore.observability.SpanHelper;
import com.carecore.simulator.config.SimulationProperties;
import com.carecore.simulator.feed.SyntheticDataFeed;
import com.carecore.simulator.report.RunReportWriter;
import com.carecore.simulator.report.StatusReport;
import jakarta.annotation.PreDestroy;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Builds and starts simulation runs and keeps the latest one queryable after it finishes.
 *
 * <p>One run at a time. When {@code carecore.simulation.auto-start} is set, a run starts as soon as
 * the application is ready. The reports are written when a run completes or fails; while a run is
 * active a status report is written every {@code carecore.simulation.status-interval} (ISO-8601,
 * default {@code PT30S}).
 */
@Service
public class SimulationLauncher implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationLauncher.class);

    private final SimulationProperties properties;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final RunReportWriter reportWriter;
    private final AtomicReference<IcuEngine> current = new AtomicReference<>();

    public SimulationLauncher(SimulationProperties properties, MetricFactory metrics, SpanHelper spans,
                              RunReportWriter reportWriter) {
        this.properties = properties;
        this.metrics = metrics;
        this.spans = spans;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.autoStart()) {
            start();
        } else {
            log.info("Auto-start disabled, no simulation run started");
        }
    }

    /**
     * Starts a new run of the configured duration on a background clock thread.
     *
     * @return completes with the final summary once the reports are written
     * @throws RunConflictException if a run is still active
     */
    public CompletableFuture<RunSummary> start() {
        return start(null);
    }

    /**
     * Starts a new run on a background clock thread.
     *
     * @param duration run length, or null for the configured duration
     * @return completes with the final summary once the reports are written
     * @throws RunConflictException     if a run is still active
     * @throws IllegalArgumentException if the duration is not positive
     */
    public synchronized CompletableFuture<RunSummary> start(Duration duration) {
        IcuEngine previous = current.get();
        if (previous != null && !previous.status().isTerminal()) {
            throw new RunConflictException(previous.runId(),
                    "Run " + previous.runId() + " is still " + previous.status());
        }
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException("duration must be positive, got " + duration);
        }

        EngineSettings settings = properties.toEngineSettings();
        if (duration != null) {
            settings = settings.withDuration(duration, settings.tickInterval());
        }
        Pacer pacer = Pacer.system();
        IcuEngine engine = IcuEngine.builder()
                .settings(settings)
                .dataFeed(new SyntheticDataFeed(properties.patientCount(), properties.seed(),
                        properties.labProbability(), pacer::now))
                .metrics(metrics)
                .spans(spans)
                .pacer(pacer)
                .build();
        current.set(engine);
        log.info("Starting run {}: patients={}, duration={}, tickInterval={}, seed={}",
                engine.runId(), properties.patientCount(), settings.duration(), settings.tickInterval(),
                properties.seed());

        return engine.start().thenApply(summary -> {
            reportWriter.write(summary, engine.decisionLog().all());
            return summary;
        }).whenComplete((summary, error) -> {
            if (error != null) {
                log.error("Run {} ended without a report", engine.runId(), error);
            }
        });
    }

    /** The latest run, active or finished. */
    public Optional<IcuEngine> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * The latest run.
     *
     * @throws NotFoundException if no run has been started
     */
    public IcuEngine requireCurrent() {
        return current().orElseThrow(() -> new NotFoundException("Run", "current"));
    }

    /**
     * Asks the active run to end after its current tick.
     *
     * @return the run asked to stop, empty when no run is active
     */
    public Optional<IcuEngine> stop() {
        IcuEngine engine = current.get();
        if (engine == null || engine.status().isTerminal()) {
            return Optional.empty();
        }
        log.info("Stopping run {}", engine.runId());
        engine.stop();
        return Optional.of(engine);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Writes {@code status_report.json} for the active run.
     *
     * @return the report path, empty when no run is active
     */
    @Scheduled(fixedDelayString = "${carecore.simulation.status-interval:PT30S}",
            initialDelayString = "${carecore.simulation.status-interval:PT30S}")
    public Optional<Path> writeStatusReport() {
        IcuEngine engine = current.get();
        if (engine == null || engine.status() != RunStatus.RUNNING) {
            return Optional.empty();
        }
        int activeAgents = (int) engine.runtimes().stream().filter(AgentRuntime::isActive).count();
        try {
            return Optional.of(reportWriter.writeStatus(StatusReport.of(engine.summary(), activeAgents, Instant.now())));
        } catch (UncheckedIOException e) {
            log.warn("Status report of run {} not written: {}", engine.runId(), e.getMessage());
            return Optional.empty();
        }
    }
}
