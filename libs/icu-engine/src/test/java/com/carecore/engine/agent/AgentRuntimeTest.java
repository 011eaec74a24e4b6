package com.carecore.engine.agent;

import static com.carecore.engine.EngineFixtures.T0;
import static com.carecore.engine.EngineFixtures.demographics;
import static org.assertj.core.api.Assertions.assertThat;

import com.carecore.engine.bus.EventFilter;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.event.MedicationChangeEvent;
import com.carecore.engine.event.VitalUpdateEvent;
import com.carecore.engine.model.AgentMessage;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Decision;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.MessageDraft;
import com.carecore.engine.model.MessageKind;
import com.carecore.engine.model.Urgency;
import com.carecore.engine.model.VitalSign;
import com.carecore.engine.model.VitalSigns;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.eventmodel.EventEntity;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventFactory;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.CorrelationContext;
import com.carecore.observability.CorrelationContextHolder;
import com.carecore.observability.MetricFactory;
import com.carecore.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.MDC;

@DisplayName("AgentRuntime")
class AgentRuntimeTest {

    private static final String PATIENT = "PATIENT_0001";
    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private SimpleMeterRegistry registry;
    private MetricFactory metrics;
    private MessageBus bus;
    private PatientStateStore store;
    private SimulationRun run;
    private Subscription observer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricFactory(registry, "runtime-test");
        bus = new MessageBus(256, metrics);
        store = new PatientStateStore();
        store.admit(PATIENT, demographics());
        run = new SimulationRun("run-1", Duration.ofMinutes(1), Duration.ofSeconds(1));
        observer = bus.subscribe("observer", EventFilter.types(EventType.DECISION_PROPOSED,
                EventType.AGENT_MESSAGE_SENT, EventType.MEDICATION_CHANGED));
    }

    @AfterEach
    void clearContext() {
        CorrelationContextHolder.clear();
    }

    private AgentRuntime runtime(ClinicalAgent agent) {
        return new AgentRuntime(agent, bus, store, run, TIMEOUT, metrics, SpanHelper.noop());
    }

    private static EventEnvelope<VitalUpdateEvent> vitals(String patientId, long tick) {
        var update = new VitalUpdateEvent(patientId, VitalSigns.of(T0, Map.of(VitalSign.HEART_RATE, 80.0)), T0);
        return EventFactory.create(EventType.VITALS_UPDATED, "clock", "run-1",
                EventEntity.patient(patientId, tick + 1), tick, T0, update);
    }

    private List<EventEnvelope<?>> published() throws InterruptedException {
        List<EventEnvelope<?>> events = new ArrayList<>();
        while (true) {
            var next = observer.poll(Duration.ZERO);
            if (next.isEmpty()) {
                return events;
            }
            events.add(next.get());
        }
    }

    @Nested
    @DisplayName("act")
    class Act {

        @Test
        @DisplayName("publishes the decision stamped with role, patient and tick")
        void publishesDecision() throws Exception {
            var runtime = runtime(new PhysicianAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                    DecisionKind.CLINICAL_ASSESSMENT, Urgency.ROUTINE, 0.6, Map.of("assessment", "stable"), "ok"))));
            var trigger = vitals(PATIENT, 3);

            runtime.process(trigger);

            var events = published();
            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.type()).isEqualTo(EventType.DECISION_PROPOSED);
                assertThat(event.producer()).isEqualTo("agent-physician");
                assertThat(event.causationId()).isEqualTo(trigger.eventId());
                var decision = (Decision) event.payload();
                assertThat(decision.role()).isEqualTo(AgentRole.PHYSICIAN);
                assertThat(decision.patientId()).isEqualTo(PATIENT);
                assertThat(decision.tick()).isEqualTo(3);
            });
            var status = runtime.status();
            assertThat(status.decisionsMade()).isEqualTo(1);
            assertThat(status.eventsProcessed()).isEqualTo(1);
            assertThat(status.averageConfidence()).isEqualTo(0.6);
            assertThat(status.agentId()).isEqualTo("PHYSICIAN_001");
        }

        @Test
        @DisplayName("numbers messages per sender with strictly increasing sequence")
        void messageSequence() throws Exception {
            var runtime = runtime(new NurseAgent((event, snapshot) -> AgentOutcome.send(
                    MessageDraft.to(AgentRole.PHYSICIAN, MessageKind.CONSULT_REQUEST, Map.of("question", "Fluids?")))));

            for (int tick = 0; tick < 3; tick++) {
                runtime.process(vitals(PATIENT, tick));
            }

            assertThat(published())
                    .extracting(event -> ((AgentMessage) event.payload()).sequence())
                    .containsExactly(1L, 2L, 3L);
            assertThat(runtime.status().messagesSent()).isEqualTo(3);
        }

        @Test
        @DisplayName("applies medication start orders to the store and announces them")
        void appliesMedicationOrder() throws Exception {
            var runtime = runtime(new PhysicianAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                    DecisionKind.MEDICATION_ORDER, Urgency.HIGH, 0.9,
                    Map.of("drug", "Heparin", "action", "start", "dose", "5000", "doseUnit", "units"), "DVT"))));

            runtime.process(vitals(PATIENT, 0));

            var snapshot = store.get(PATIENT);
            assertThat(snapshot.isOnDrug("heparin")).isTrue();
            assertThat(snapshot.medications().get(0).dose()).isEqualTo(5000.0);
            assertThat(published()).extracting(EventEnvelope::type)
                    .containsExactly(EventType.DECISION_PROPOSED, EventType.MEDICATION_CHANGED);
        }

        @Test
        @DisplayName("medication changes it publishes carry the ordering role as source")
        void medicationSource() throws Exception {
            var runtime = runtime(new PhysicianAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                    DecisionKind.MEDICATION_ORDER, Urgency.HIGH, 0.9, Map.of("drug", "Aspirin", "action", "stop"),
                    "bleeding risk"))));

            runtime.process(vitals(PATIENT, 0));

            var change = published().get(1);
            assertThat(((MedicationChangeEvent) change.payload()).source()).isEqualTo("physician");
        }

        @Test
        @DisplayName("non start/stop medication orders leave the store untouched")
        void reviewOrder() throws Exception {
            var runtime = runtime(new PharmacistAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                    DecisionKind.MEDICATION_ORDER, Urgency.ELEVATED, 0.8,
                    Map.of("drug", "Digoxin", "action", "review_dose"), "K+"))));

            runtime.process(vitals(PATIENT, 0));

            assertThat(store.get(PATIENT).version()).isZero();
            assertThat(published()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("reasoning failures")
    class Failures {

        @Test
        @DisplayName("a decision function that overruns the timeout produces nothing and is counted")
        void timeout() throws Exception {
            var runtime = runtime(new NurseAgent((event, snapshot) -> {
                Thread.sleep(5_000);
                return AgentOutcome.decide(new DecisionProposal(DecisionKind.NURSING_INTERVENTION,
                        Urgency.ROUTINE, 0.5, Map.of("intervention", "late"), "late"));
            }));

            runtime.process(vitals(PATIENT, 0));

            assertThat(published()).isEmpty();
            assertThat(runtime.status().timeouts()).isEqualTo(1);
            assertThat(run.decisionTimeouts()).isEqualTo(1);
            assertThat(registry.get("icu.agent.timeouts").tag("role", "nurse").counter().count()).isEqualTo(1.0);
        }

        @Test
        @Timeout(30)
        @DisplayName("a decision function that ignores cancellation holds one worker, not one per event")
        void stuckFunctionHoldsOneWorker() throws Exception {
            long before = liveReasoners(AgentRole.NURSE);
            var runtime = new AgentRuntime(new NurseAgent((event, snapshot) -> {
                long until = System.nanoTime() + Duration.ofSeconds(3).toNanos();
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                return AgentOutcome.none();
            }), bus, store, run, Duration.ofMillis(10), metrics, SpanHelper.noop());

            for (int tick = 0; tick < 100; tick++) {
                runtime.process(vitals(PATIENT, tick));
            }

            assertThat(runtime.status().timeouts()).isEqualTo(100);
            assertThat(liveReasoners(AgentRole.NURSE)).isLessThanOrEqualTo(before + 1);
            assertThat(published()).isEmpty();
        }

        @Test
        @DisplayName("an exception from the decision function is counted as a failure")
        void failure() throws Exception {
            var runtime = runtime(new PharmacistAgent((event, snapshot) -> {
                throw new IllegalStateException("formulary unavailable");
            }));

            runtime.process(vitals(PATIENT, 0));
            runtime.process(vitals(PATIENT, 1));

            assertThat(published()).isEmpty();
            assertThat(runtime.status().failures()).isEqualTo(2);
            assertThat(run.decisionFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("an event for an unknown patient is skipped")
        void unknownPatient() throws Exception {
            var runtime = runtime(new PhysicianAgent());

            runtime.process(vitals("PATIENT_0404", 0));

            assertThat(published()).isEmpty();
            assertThat(runtime.status().failures()).isEqualTo(1);
        }

        @Test
        @DisplayName("a null outcome means no action")
        void nullOutcome() throws Exception {
            var runtime = runtime(new PhysicianAgent((event, snapshot) -> null));

            runtime.process(vitals(PATIENT, 0));

            assertThat(published()).isEmpty();
            assertThat(runtime.status().failures()).isZero();
        }
    }

    @Nested
    @DisplayName("tracing")
    class Tracing {

        private InMemorySpanExporter exporter;
        private SpanHelper spans;

        @BeforeEach
        void tracer() {
            exporter = InMemorySpanExporter.create();
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                    .build();
            spans = new SpanHelper(OpenTelemetrySdk.builder().setTracerProvider(provider).build()
                    .getTracer("runtime-test"));
        }

        @Test
        @DisplayName("reasoning runs in an agent.reason span with role, patient and run attributes")
        void reasoningSpan() throws Exception {
            Map<String, String> mdcSeen = new HashMap<>();
            var runtime = new AgentRuntime(new PhysicianAgent((event, snapshot) -> {
                mdcSeen.put("role", MDC.get(CorrelationContext.MDC_ROLE));
                mdcSeen.put("patient", MDC.get(CorrelationContext.MDC_PATIENT_ID));
                mdcSeen.put("run", MDC.get(CorrelationContext.MDC_RUN_ID));
                return AgentOutcome.none();
            }), bus, store, run, TIMEOUT, metrics, spans);
            var trigger = vitals(PATIENT, 2);

            runtime.process(trigger);

            assertThat(exporter.getFinishedSpanItems()).singleElement().satisfies(span -> {
                assertThat(span.getName()).isEqualTo("agent.reason");
                assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
                assertThat(attribute(span, "agent.role")).isEqualTo("physician");
                assertThat(attribute(span, "patient.id")).isEqualTo(PATIENT);
                assertThat(attribute(span, "run.id")).isEqualTo("run-1");
                assertThat(attribute(span, "engine.unit")).isEqualTo("agent-physician");
                assertThat(attribute(span, "event.type")).isEqualTo(trigger.eventType());
            });
            assertThat(mdcSeen)
                    .containsEntry("role", "physician")
                    .containsEntry("patient", PATIENT)
                    .containsEntry("run", "run-1");
        }

        @Test
        @DisplayName("a failing decision function ends its span with ERROR")
        void failingReasoningSpan() throws Exception {
            var runtime = new AgentRuntime(new PharmacistAgent((event, snapshot) -> {
                throw new IllegalStateException("formulary unavailable");
            }), bus, store, run, TIMEOUT, metrics, spans);

            runtime.process(vitals(PATIENT, 0));

            assertThat(exporter.getFinishedSpanItems()).singleElement()
                    .satisfies(span -> assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR));
        }

        private String attribute(SpanData span, String key) {
            return span.getAttributes().get(AttributeKey.stringKey(key));
        }
    }

    private static long liveReasoners(AgentRole role) {
        String prefix = AgentRuntime.reasonerThreadPrefix(role);
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.isAlive() && thread.getName().startsWith(prefix))
                .count();
    }

    @Test
    @DisplayName("an agent never observes its own messages")
    void noSelfDelivery() {
        var nurse = new NurseAgent();
        var broadcast = new AgentMessage("m-1", AgentRole.NURSE, null, MessageKind.HANDOFF_NOTE, PATIENT,
                Map.of("note", "stable overnight"), T0, 1);
        var event = EventFactory.create(EventType.AGENT_MESSAGE_SENT, "agent-nurse", "run-1",
                EventEntity.patient(PATIENT, 1), 0, broadcast);

        assertThat(nurse.observes(event)).isFalse();
        assertThat(new PhysicianAgent().observes(event)).isTrue();
        assertThat(new PharmacistAgent().observes(event)).isTrue();
    }

    @Test
    @DisplayName("an agent only observes its declared event types")
    void observedTypes() {
        assertThat(new PharmacistAgent().observes(vitals(PATIENT, 0))).isFalse();
        assertThat(new NurseAgent().observes(vitals(PATIENT, 0))).isTrue();
    }
}
