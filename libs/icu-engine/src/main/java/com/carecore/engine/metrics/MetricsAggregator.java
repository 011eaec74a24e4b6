package com.carecore.engine.metrics;

import com.carecore.engine.EngineUnit;
import com.carecore.engine.bus.EventFilter;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.coordination.CommittedDecision;
import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.Alert;
import com.carecore.engine.run.RunSummary;
import com.carecore.engine.run.SimulationRun;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.CorrelationContext;
import com.carecore.observability.CorrelationContextHolder;
import com.carecore.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Counts bus traffic into the run's counters and Micrometer, and produces the run summary.
 *
 * <p>Subscribes to every event, so it is the one place where decisions, messages, alerts and
 * total events are tallied.
 */
public final class MetricsAggregator implements EngineUnit {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    public static final String UNIT_NAME = "metrics-aggregator";

    private final SimulationRun run;
    private final MetricFactory metrics;
    private final Subscription subscription;

    public MetricsAggregator(MessageBus bus, SimulationRun run, MetricFactory metrics) {
        this.run = run;
        this.metrics = metrics;
        this.subscription = bus.subscribe(UNIT_NAME, EventFilter.all());
    }

    @Override
    public String name() {
        return UNIT_NAME;
    }

    @Override
    public int pending() {
        return subscription.pending();
    }

    @Override
    public void run() {
        CorrelationContextHolder.set(CorrelationContext.forUnit(run.runId(), UNIT_NAME));
        try {
            while (true) {
                Optional<EventEnvelope<?>> next = subscription.next();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    record(next.get());
                } catch (RuntimeException e) {
                    log.error("Failed to record event {}", next.get().eventId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Metrics aggregator interrupted");
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    /** Tallies one event. */
    public void record(EventEnvelope<?> event) {
        run.recordEvent();
        EventType type = event.type();
        switch (type) {
            case DECISION_COMMITTED -> {
                run.recordDecision();
                if (event.payload() instanceof CommittedDecision committed) {
                    metrics.counter("icu.decisions.by_role", "Committed decisions per role",
                            "role", committed.decision().role().value()).increment();
                }
            }
            case AGENT_MESSAGE_SENT -> {
                run.recordMessage();
                if (event.payload() instanceof AgentMessage message) {
                    metrics.counter("icu.agent.messages", "Inter-agent messages",
                            "kind", message.kind().name()).increment();
                }
            }
            case ALERT_RAISED -> {
                run.recordAlert();
                if (event.payload() instanceof Alert alert) {
                    metrics.counter("icu.alerts.by_severity", "Alerts per severity",
                            "severity", alert.severity().value()).increment();
                }
            }
            default -> {
                // counted as an event only
            }
        }
    }

    /** Summary of the run's counters as of now. */
    public RunSummary summary() {
        return RunSummary.of(run);
    }

    /** Logs and returns the final summary. Called by the clock once the units have drained. */
    public RunSummary finalizeRun() {
        RunSummary summary = summary();
        log.info("Run {} {}: {} ticks, {} decisions ({} /min), {} messages, {} alerts ({} suppressed), "
                        + "{} timeouts, {} events",
                summary.runId(), summary.status(), summary.ticksExecuted(), summary.decisionCount(),
                String.format("%.2f", summary.decisionsPerMinute()), summary.messageCount(), summary.alertCount(),
                summary.suppressedAlertCount(), summary.decisionTimeouts(), summary.eventCount());
        return summary;
    }
}
