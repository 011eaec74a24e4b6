package com.carecore.engine.alert;

import com.carecore.engine.EngineUnit;
import com.carecore.engine.bus.BusClosedException;
import com.carecore.engine.bus.EventFilter;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.event.LabResultEvent;
import com.carecore.engine.event.ProducerSequence;
import com.carecore.engine.event.VitalUpdateEvent;
import com.carecore.engine.model.Alert;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.Measurement;
import com.carecore.engine.model.VitalSign;
import com.carecore.engine.run.SimulationRun;
import com.carecore.eventmodel.EventEntity;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventFactory;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.CorrelationContext;
import com.carecore.observability.CorrelationContextHolder;
import com.carecore.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Evaluates threshold rules on vital and lab updates and publishes deduplicated alerts.
 */
public final class AlertEngine implements EngineUnit {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    public static final String UNIT_NAME = "alert-engine";
    static final int RECENT_ALERTS_KEPT = 200;

    private final MessageBus bus;
    private final AlertRuleSet ruleSet;
    private final SimulationRun run;
    private final CooldownTable cooldowns;
    private final Subscription subscription;
    private final ProducerSequence sequence = new ProducerSequence();
    private final Deque<Alert> recent = new ConcurrentLinkedDeque<>();
    private final Counter raisedCounter;
    private final Counter suppressedCounter;

    public AlertEngine(MessageBus bus, AlertRuleSet ruleSet, SimulationRun run, MetricFactory metrics) {
        this.bus = bus;
        this.ruleSet = ruleSet;
        this.run = run;
        this.cooldowns = new CooldownTable(ruleSet.cooldown());
        this.raisedCounter = metrics.counter("icu.alerts.raised", "Alerts emitted");
        this.suppressedCounter = metrics.counter("icu.alerts.suppressed", "Alerts suppressed by cooldown");
        this.subscription = bus.subscribe(UNIT_NAME,
                EventFilter.types(EventType.VITALS_UPDATED, EventType.LAB_RESULTED));
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
        log.info("Alert engine started with {} rules", ruleSet.rules().size());
        try {
            while (true) {
                Optional<EventEnvelope<?>> next = subscription.next();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    handle(next.get());
                } catch (BusClosedException e) {
                    log.debug("Bus closed while publishing alerts: {}", e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Failed to evaluate event {}", next.get().eventId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Alert engine interrupted");
        } finally {
            log.info("Alert engine stopped");
            CorrelationContextHolder.clear();
        }
    }

    /**
     * Evaluates one event and publishes the resulting alerts, highest severity first.
     *
     * @return the alerts published
     */
    public List<Alert> handle(EventEnvelope<?> event) throws InterruptedException {
        List<Alert> alerts;
        Object payload = event.payload();
        if (payload instanceof VitalUpdateEvent vitals) {
            alerts = evaluateVitals(vitals);
        } else if (payload instanceof LabResultEvent lab) {
            alerts = evaluateLab(lab);
        } else {
            return List.of();
        }
        for (Alert alert : alerts) {
            EventEnvelope<Alert> alertEvent = EventFactory.createChild(event, EventType.ALERT_RAISED, UNIT_NAME,
                    EventEntity.patient(alert.patientId(), sequence.next()), alert);
            bus.publish(alertEvent);
        }
        return alerts;
    }

    /** Applies every vital rule, dedups, and returns the alerts to emit sorted by severity. */
    public List<Alert> evaluateVitals(VitalUpdateEvent update) {
        List<Alert> alerts = new ArrayList<>();
        for (Map.Entry<VitalSign, Measurement> reading : update.vitals().readings().entrySet()) {
            Measurement measurement = reading.getValue();
            for (AlertRule rule : ruleSet.rulesFor(AlertRule.Source.VITAL, reading.getKey().key())) {
                evaluate(rule, update.patientId(), measurement.value(), measurement.measuredAt())
                        .ifPresent(alerts::add);
            }
        }
        alerts.sort(Comparator.comparing(Alert::severity).reversed());
        return alerts;
    }

    public List<Alert> evaluateLab(LabResultEvent update) {
        LabResult lab = update.result();
        List<Alert> alerts = new ArrayList<>();
        for (AlertRule rule : ruleSet.rulesFor(AlertRule.Source.LAB, lab.testName())) {
            evaluate(rule, update.patientId(), lab.value(), lab.resultedAt()).ifPresent(alerts::add);
        }
        alerts.sort(Comparator.comparing(Alert::severity).reversed());
        return alerts;
    }

    private Optional<Alert> evaluate(AlertRule rule, String patientId, double value, Instant at) {
        if (!rule.isBreachedBy(value)) {
            return Optional.empty();
        }
        String dedupKey = rule.dedupKey(patientId, value);
        if (!cooldowns.tryFire(dedupKey, at)) {
            run.recordSuppressedAlert();
            suppressedCounter.increment();
            log.debug("Suppressed alert {} (cooldown)", dedupKey);
            return Optional.empty();
        }
        Alert alert = new Alert(UUID.randomUUID().toString(), patientId, rule.ruleId(), rule.parameter(),
                value, rule.severity(), at, dedupKey);
        raisedCounter.increment();
        remember(alert);
        log.info("Alert {} for patient {}: {}={} ({})", rule.ruleId(), patientId, rule.parameter(), value,
                rule.severity().value());
        return Optional.of(alert);
    }

    private void remember(Alert alert) {
        recent.addFirst(alert);
        while (recent.size() > RECENT_ALERTS_KEPT) {
            recent.pollLast();
        }
    }

    /** Most recent emitted alerts, newest first. */
    public List<Alert> recentAlerts(int limit) {
        List<Alert> alerts = new ArrayList<>();
        for (Alert alert : recent) {
            if (alerts.size() >= limit) {
                break;
            }
            alerts.add(alert);
        }
        return alerts;
    }

    public AlertRuleSet ruleSet() {
        return ruleSet;
    }
}
