package com.carecore.engine.coordination;

import com.carecore.engine.EngineUnit;
import com.carecore.engine.bus.BusClosedException;
import com.carecore.engine.bus.EventFilter;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.event.DecisionSupersededEvent;
import com.carecore.engine.event.ProducerSequence;
import com.carecore.engine.model.Decision;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientStateStore;
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

import java.time.Clock;
import java.util.Optional;

/**
 * Sole writer of the {@link DecisionLog}: validates proposed decisions, commits them, and
 * announces commits and changes of authority on the bus.
 */
public final class DecisionCoordinator implements EngineUnit {

    private static final Logger log = LoggerFactory.getLogger(DecisionCoordinator.class);

    public static final String UNIT_NAME = "decision-coordinator";

    private final MessageBus bus;
    private final PatientStateStore store;
    private final SimulationRun run;
    private final DecisionLog decisionLog;
    private final Subscription subscription;
    private final Clock clock;
    private final ProducerSequence sequence = new ProducerSequence();
    private final Counter committedCounter;
    private final Counter supersededCounter;
    private final Counter rejectedCounter;

    public DecisionCoordinator(MessageBus bus, PatientStateStore store, ArbitrationPolicy policy,
                               SimulationRun run, MetricFactory metrics) {
        this(bus, store, policy, run, metrics, Clock.systemUTC());
    }

    public DecisionCoordinator(MessageBus bus, PatientStateStore store, ArbitrationPolicy policy,
                               SimulationRun run, MetricFactory metrics, Clock clock) {
        this.bus = bus;
        this.store = store;
        this.run = run;
        this.clock = clock;
        this.decisionLog = new DecisionLog(policy);
        this.committedCounter = metrics.counter("icu.decisions.committed", "Decisions committed to the log");
        this.supersededCounter = metrics.counter("icu.decisions.superseded", "Decisions that lost authority");
        this.rejectedCounter = metrics.counter("icu.decisions.rejected", "Decisions for unknown patients");
        this.subscription = bus.subscribe(UNIT_NAME, EventFilter.types(EventType.DECISION_PROPOSED));
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
        log.info("Decision coordinator started");
        try {
            while (true) {
                Optional<EventEnvelope<?>> next = subscription.next();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    handle(next.get());
                } catch (BusClosedException e) {
                    log.debug("Bus closed while announcing commit of event {}", next.get().eventId());
                } catch (RuntimeException e) {
                    log.error("Failed to commit decision event {}", next.get().eventId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Decision coordinator interrupted");
        } finally {
            log.info("Decision coordinator stopped with {} committed decisions", decisionLog.size());
            CorrelationContextHolder.clear();
        }
    }

    /**
     * Commits the decision carried by a {@code DecisionProposed} event.
     *
     * @return the arbitration outcome, or empty if the decision was rejected
     */
    public Optional<ArbitrationOutcome> handle(EventEnvelope<?> event) throws InterruptedException {
        if (!(event.payload() instanceof Decision decision)) {
            log.warn("Ignoring {} without a decision payload", event.eventType());
            return Optional.empty();
        }
        if (!store.contains(decision.patientId())) {
            run.recordRejectedDecision();
            rejectedCounter.increment();
            log.warn("Rejected decision {}: unknown patient {}", decision.decisionId(), decision.patientId());
            return Optional.empty();
        }
        ArbitrationOutcome outcome = decisionLog.append(decision, clock.instant());
        committedCounter.increment();
        bus.publish(EventFactory.createChild(event, EventType.DECISION_COMMITTED, UNIT_NAME,
                EventEntity.patient(decision.patientId(), sequence.next()), outcome.entry()));

        if (outcome.displacedId().isPresent()) {
            supersededCounter.increment();
            log.info("Decision {} supersedes {} for patient {} in tick {}", decision.decisionId(),
                    outcome.displacedId().get(), decision.patientId(), decision.tick());
            bus.publish(EventFactory.createChild(event, EventType.DECISION_SUPERSEDED, UNIT_NAME,
                    EventEntity.patient(decision.patientId(), sequence.next()),
                    new DecisionSupersededEvent(decision.patientId(), decision.tick(), decision.kind().domain(),
                            outcome.displacedId().get(), decision.decisionId())));
        } else if (!outcome.authoritative()) {
            supersededCounter.increment();
            log.info("Decision {} superseded on arrival by {}", decision.decisionId(), outcome.authoritativeId());
        }
        return Optional.of(outcome);
    }

    public DecisionLog decisionLog() {
        return decisionLog;
    }
}
