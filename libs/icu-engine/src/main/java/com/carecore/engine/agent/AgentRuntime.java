package com.carecore.engine.agent;

import com.carecore.engine.EngineUnit;
import com.carecore.engine.bus.BusClosedException;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.event.MedicationChangeEvent;
import com.carecore.engine.event.ProducerSequence;
import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Decision;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.Medication;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.MessageDraft;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientNotFoundException;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.eventmodel.EventEntity;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventFactory;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.CorrelationContext;
import com.carecore.observability.CorrelationContextHolder;
import com.carecore.observability.MetricFactory;
import com.carecore.observability.SpanHelper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Runs one {@link ClinicalAgent} as an engine unit: perceive, reason, act.
 *
 * <ol>
 *   <li><b>Perceive</b>: pull the next event the agent observes, strictly in arrival order.</li>
 *   <li><b>Reason</b>: call the agent on the runtime's single worker thread with the patient's
 *       snapshot, bounded by the decision timeout. A timeout or exception means no action for this
 *       event. A call that ignores cancellation keeps the worker busy, so the calls queued behind
 *       it time out as well.</li>
 *   <li><b>Act</b>: stamp and publish the decision and/or message; apply medication start/stop
 *       orders to the patient state store.</li>
 * </ol>
 */
public final class AgentRuntime implements EngineUnit {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    private final ClinicalAgent agent;
    private final AgentRole role;
    private final MessageBus bus;
    private final PatientStateStore store;
    private final SimulationRun run;
    private final Duration decisionTimeout;
    private final SpanHelper spans;
    private final Subscription subscription;
    private final ExecutorService reasoningPool;
    private final CorrelationContext unitContext;

    private final ProducerSequence eventSequence = new ProducerSequence();
    private final ProducerSequence messageSequence = new ProducerSequence();

    private final Timer reasoningTimer;
    private final Counter timeoutCounter;
    private final Counter failureCounter;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong decisions = new AtomicLong();
    private final AtomicLong messages = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong responses = new AtomicLong();
    private final AtomicLong responseNanos = new AtomicLong();
    private final DoubleAdder confidenceSum = new DoubleAdder();
    private volatile Instant lastDecisionAt;
    private volatile boolean active;

    public AgentRuntime(ClinicalAgent agent, MessageBus bus, PatientStateStore store, SimulationRun run,
                        Duration decisionTimeout, MetricFactory metrics, SpanHelper spans) {
        if (decisionTimeout == null || decisionTimeout.isNegative() || decisionTimeout.isZero()) {
            throw new IllegalArgumentException("decisionTimeout must be positive");
        }
        this.agent = agent;
        this.role = agent.role();
        this.bus = bus;
        this.store = store;
        this.run = run;
        this.decisionTimeout = decisionTimeout;
        this.spans = spans;
        this.unitContext = CorrelationContext.forUnit(run.runId(), role.unitName()).withRole(role.value());
        this.reasoningTimer = metrics.timer("icu.agent.reasoning", "Decision function latency", "role", role.value());
        this.timeoutCounter = metrics.counter("icu.agent.timeouts", "Decision function timeouts", "role", role.value());
        this.failureCounter = metrics.counter("icu.agent.failures", "Decision function failures", "role", role.value());
        this.reasoningPool = Executors.newSingleThreadExecutor(reasonerThreads(role));
        this.subscription = bus.subscribe(role.unitName(), agent::observes);
    }

    @Override
    public String name() {
        return role.unitName();
    }

    @Override
    public int pending() {
        return subscription.pending();
    }

    public AgentRole role() {
        return role;
    }

    public String agentId() {
        return role.agentId();
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public void run() {
        active = true;
        CorrelationContextHolder.set(unitContext);
        log.info("Agent {} started", agentId());
        try {
            while (true) {
                Optional<EventEnvelope<?>> next = subscription.next();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    process(next.get());
                } catch (BusClosedException e) {
                    log.debug("Bus closed, dropping outcome of event {}", next.get().eventId());
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                    log.error("Agent {} failed to act on event {}", agentId(), next.get().eventId(), e);
                } finally {
                    CorrelationContextHolder.set(unitContext);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Agent {} interrupted", agentId());
        } finally {
            active = false;
            reasoningPool.shutdownNow();
            log.info("Agent {} stopped after {} events, {} decisions", agentId(), processed.get(), decisions.get());
            CorrelationContextHolder.clear();
        }
    }

    /**
     * Handles one event end to end. Runs on the unit thread; exposed for single-threaded tests.
     */
    void process(EventEnvelope<?> event) throws InterruptedException {
        processed.incrementAndGet();
        String patientId = event.entityId();
        CorrelationContext eventContext = unitContext.withEvent(event.correlationId(), patientId);
        CorrelationContextHolder.set(eventContext);

        PatientSnapshot snapshot;
        try {
            snapshot = store.get(patientId);
        } catch (PatientNotFoundException e) {
            failures.incrementAndGet();
            log.warn("Skipping event {}: {}", event.eventId(), e.getMessage());
            return;
        }

        AgentOutcome outcome;
        try {
            outcome = reason(event, snapshot, eventContext);
        } catch (DecisionTimeoutException e) {
            timeouts.incrementAndGet();
            timeoutCounter.increment();
            run.recordDecisionTimeout();
            log.warn("{}", e.getMessage());
            return;
        } catch (ExecutionException e) {
            failures.incrementAndGet();
            failureCounter.increment();
            run.recordDecisionFailure();
            log.warn("Decision function of {} failed on event {}", role.value(), event.eventId(), e.getCause());
            return;
        }
        act(event, patientId, outcome);
    }

    private AgentOutcome reason(EventEnvelope<?> event, PatientSnapshot snapshot, CorrelationContext context)
            throws InterruptedException, ExecutionException {
        Callable<AgentOutcome> task = () -> CorrelationContextHolder.callWithContext(context,
                () -> spans.withSpan("agent.reason", SpanKind.INTERNAL,
                        Map.of("event.type", event.eventType()),
                        () -> agent.decide(event, snapshot)));
        long started = System.nanoTime();
        Future<AgentOutcome> future = reasoningPool.submit(task);
        try {
            AgentOutcome outcome = future.get(decisionTimeout.toNanos(), TimeUnit.NANOSECONDS);
            return outcome == null ? AgentOutcome.none() : outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DecisionTimeoutException(role, event.eventId(), decisionTimeout);
        } finally {
            long elapsed = System.nanoTime() - started;
            reasoningTimer.record(elapsed, TimeUnit.NANOSECONDS);
            responses.incrementAndGet();
            responseNanos.addAndGet(elapsed);
        }
    }

    private void act(EventEnvelope<?> event, String patientId, AgentOutcome outcome) throws InterruptedException {
        Instant now = Instant.now();
        if (outcome.decision().isPresent()) {
            Decision decision = Decision.from(outcome.decision().get(), patientId, role, now, event.tick());
            bus.publish(EventFactory.createChild(event, EventType.DECISION_PROPOSED, name(),
                    EventEntity.patient(patientId, eventSequence.next()), decision));
            decisions.incrementAndGet();
            confidenceSum.add(decision.confidence());
            lastDecisionAt = now;
            log.info("{} proposed {} ({}) for patient {}", agentId(), decision.kind(), decision.urgency().value(),
                    patientId);
            applyMedicationOrder(event, decision);
        }
        if (outcome.message().isPresent()) {
            MessageDraft draft = outcome.message().get();
            AgentMessage message = new AgentMessage(UUID.randomUUID().toString(), role, draft.recipient(),
                    draft.kind(), patientId, draft.payload(), now, messageSequence.next());
            bus.publish(EventFactory.createChild(event, EventType.AGENT_MESSAGE_SENT, name(),
                    EventEntity.patient(patientId, eventSequence.next()), message));
            messages.incrementAndGet();
            log.debug("{} sent {} #{} to {}", agentId(), message.kind(), message.sequence(),
                    message.isBroadcast() ? "all" : message.recipient().value());
        }
    }

    /** MEDICATION_ORDER decisions with action start/stop change the patient's active medications. */
    private void applyMedicationOrder(EventEnvelope<?> trigger, Decision decision) throws InterruptedException {
        if (decision.kind() != DecisionKind.MEDICATION_ORDER) {
            return;
        }
        MedicationChange.Action action;
        String requested = decision.detail("action");
        if ("start".equalsIgnoreCase(requested)) {
            action = MedicationChange.Action.START;
        } else if ("stop".equalsIgnoreCase(requested)) {
            action = MedicationChange.Action.STOP;
        } else {
            return;
        }
        Map<String, String> details = decision.details();
        Medication medication = new Medication(
                "order-" + decision.decisionId(),
                decision.detail("drug"),
                parseDose(details.get("dose")),
                details.getOrDefault("doseUnit", "mg"),
                details.getOrDefault("route", "IV"),
                details.getOrDefault("frequency", "once"),
                decision.decidedAt(),
                role.value());
        MedicationChange change = new MedicationChange(action, medication);
        store.applyMedicationChange(decision.patientId(), change);
        bus.publish(EventFactory.createChild(trigger, EventType.MEDICATION_CHANGED, name(),
                EventEntity.patient(decision.patientId(), eventSequence.next()),
                new MedicationChangeEvent(decision.patientId(), change, role.value())));
    }

    private static double parseDose(String dose) {
        if (dose == null || dose.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(dose);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable dose '{}'", dose);
            return 0.0;
        }
    }

    public AgentStatus status() {
        long decided = decisions.get();
        long answered = responses.get();
        return new AgentStatus(
                agentId(),
                role,
                active,
                processed.get(),
                decided,
                messages.get(),
                timeouts.get(),
                failures.get(),
                answered == 0 ? 0.0 : responseNanos.get() / (double) answered / 1_000_000.0,
                decided == 0 ? 0.0 : confidenceSum.sum() / decided,
                lastDecisionAt
        );
    }

    static String reasonerThreadPrefix(AgentRole role) {
        return role.unitName() + "-reasoner-";
    }

    private static ThreadFactory reasonerThreads(AgentRole role) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, reasonerThreadPrefix(role) + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
