package com.carecore.engine;

import static com.carecore.engine.EngineFixtures.T0;
import static com.carecore.engine.EngineFixtures.medication;
import static com.carecore.engine.EngineFixtures.patientId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.carecore.engine.agent.AgentOutcome;
import com.carecore.engine.agent.AgentRuntime;
import com.carecore.engine.agent.NurseAgent;
import com.carecore.engine.agent.PharmacistAgent;
import com.carecore.engine.agent.PhysicianAgent;
import com.carecore.engine.bus.EventFilter;
import com.carecore.engine.bus.Subscription;
import com.carecore.engine.clock.Pacer;
import com.carecore.engine.coordination.ArbitrationGroup;
import com.carecore.engine.coordination.DecisionRecord;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.DecisionKind;
import com.carecore.engine.model.DecisionProposal;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.MessageDraft;
import com.carecore.engine.model.MessageKind;
import com.carecore.engine.model.Urgency;
import com.carecore.engine.run.RunStatus;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.HealthStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@DisplayName("IcuEngine")
class IcuEngineTest {

    private static final EngineSettings FIVE_MINUTES_OF_SECONDS =
            EngineSettings.defaults().withDuration(Duration.ofMinutes(5), Duration.ofSeconds(1));

    private ManualPacer pacer;
    private ExecutorService watchers;

    @BeforeEach
    void setUp() {
        pacer = new ManualPacer(T0);
        watchers = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        watchers.shutdownNow();
    }

    private IcuEngine.Builder engine(EngineSettings settings, ScriptedFeed feed) {
        return IcuEngine.builder()
                .settings(settings)
                .dataFeed(feed)
                .metrics(EngineFixtures.metrics())
                .pacer(pacer)
                .runId("run-test");
    }

    /** Counts events of one type on a subscription drained until the bus closes, checking per-producer order. */
    private CompletableFuture<Long> observer(IcuEngine engine, EventType type) {
        Subscription subscription = engine.bus().subscribe("observer", EventFilter.types(type));
        return CompletableFuture.supplyAsync(() -> {
            long count = 0;
            Map<String, Long> lastSequence = new HashMap<>();
            try {
                while (true) {
                    var next = subscription.next();
                    if (next.isEmpty()) {
                        return count;
                    }
                    EventEnvelope<?> event = next.get();
                    long previous = lastSequence.getOrDefault(event.producer(), 0L);
                    if (event.entity().sequence() <= previous) {
                        throw new IllegalStateException("Out of order event from " + event.producer());
                    }
                    lastSequence.put(event.producer(), event.entity().sequence());
                    count++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }, watchers);
    }

    @Nested
    @DisplayName("full run")
    class FullRun {

        @Test
        @Timeout(120)
        @DisplayName("10 patients for 5 minutes at 1 s ticks complete 300 ticks and deliver 3000 vital updates")
        void fullRun() throws Exception {
            var feed = new ScriptedFeed(10, ScriptedFeed.deterioratingVitals(), pacer::now);
            var engine = engine(FIVE_MINUTES_OF_SECONDS, feed).build();
            var vitals = observer(engine, EventType.VITALS_UPDATED);

            var summary = engine.run();

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.ticksExecuted()).isEqualTo(300);
            assertThat(summary.patientCount()).isEqualTo(10);
            assertThat(summary.agentCount()).isEqualTo(3);
            assertThat(summary.elapsed()).isEqualTo(Duration.ofMinutes(5));
            assertThat(vitals.get(30, TimeUnit.SECONDS)).isEqualTo(3000);
            assertThat(summary.decisionCount()).isPositive();
            assertThat(summary.decisionsPerMinute())
                    .isCloseTo(summary.decisionCount() / 5.0, Offset.offset(1e-9));
            assertThat(summary.decisionCount()).isEqualTo(engine.decisionLog().size());
            assertThat(summary.alertCount()).isPositive();
            assertThat(summary.suppressedAlertCount()).isPositive();
        }

        @Test
        @Timeout(60)
        @DisplayName("every arbitration group ends with exactly one authoritative decision")
        void oneAuthoritativePerGroup() {
            var feed = new ScriptedFeed(3, ScriptedFeed.deterioratingVitals(), pacer::now);
            var engine = engine(EngineSettings.defaults().withDuration(Duration.ofSeconds(20), Duration.ofSeconds(1)),
                    feed).build();

            engine.run();

            Map<ArbitrationGroup, List<DecisionRecord>> groups = engine.decisionLog().all().stream()
                    .collect(Collectors.groupingBy(record -> ArbitrationGroup.of(record.decision())));
            assertThat(groups).isNotEmpty();
            groups.values().forEach(records ->
                    assertThat(records).filteredOn(DecisionRecord::isAuthoritative).hasSize(1));
        }

        @Test
        @Timeout(60)
        @DisplayName("stable patients produce no alerts and no decisions")
        void stablePatients() {
            var feed = new ScriptedFeed(4, ScriptedFeed.stableVitals(), pacer::now);
            var engine = engine(EngineSettings.defaults().withDuration(Duration.ofSeconds(30), Duration.ofSeconds(1)),
                    feed).build();

            var summary = engine.run();

            assertThat(summary.alertCount()).isZero();
            assertThat(summary.decisionCount()).isZero();
            assertThat(summary.eventCount()).isEqualTo(4 * 30);
        }
    }

    @Nested
    @DisplayName("agent failures")
    class AgentFailures {

        @Test
        @Timeout(60)
        @DisplayName("a nurse that always times out makes no decisions and does not hold up the others")
        void nurseTimesOut() {
            var feed = new ScriptedFeed(3, ScriptedFeed.deterioratingVitals(), pacer::now);
            var settings = EngineSettings.defaults()
                    .withDuration(Duration.ofSeconds(10), Duration.ofSeconds(1))
                    .withDecisionTimeout(Duration.ofMillis(20));
            var engine = engine(settings, feed)
                    .agent(new NurseAgent((event, snapshot) -> {
                        Thread.sleep(2_000);
                        return AgentOutcome.none();
                    }))
                    .build();

            var summary = engine.run();

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.decisionTimeouts()).isPositive();
            assertThat(engine.decisionLog().all())
                    .extracting(record -> record.decision().role())
                    .doesNotContain(AgentRole.NURSE)
                    .contains(AgentRole.PHYSICIAN);
            assertThat(engine.query().agent("nurse").decisionsMade()).isZero();
            assertThat(engine.health().checkAll().checks().get("agent-nurse").status())
                    .isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @Timeout(60)
        @DisplayName("a throwing physician is counted and the run still completes")
        void physicianThrows() {
            var feed = new ScriptedFeed(2, ScriptedFeed.deterioratingVitals(), pacer::now);
            var engine = engine(EngineSettings.defaults().withDuration(Duration.ofSeconds(5), Duration.ofSeconds(1)),
                    feed)
                    .agent(new PhysicianAgent((event, snapshot) -> {
                        throw new IllegalStateException("model unavailable");
                    }))
                    .build();

            var summary = engine.run();

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.decisionFailures()).isPositive();
            assertThat(engine.decisionLog().all())
                    .extracting(record -> record.decision().role())
                    .doesNotContain(AgentRole.PHYSICIAN);
        }
    }

    @Test
    @Timeout(60)
    @DisplayName("interacting medications lead to a pharmacist alert and a physician stop order")
    void medicationInteraction() {
        var feed = new ScriptedFeed(1, ScriptedFeed.stableVitals(), pacer::now)
                .withMedicationChange(patientId(1), MedicationChange.start(medication("MED_1", "Warfarin")))
                .withMedicationChange(patientId(1), MedicationChange.start(medication("MED_2", "Aspirin")));
        var engine = engine(EngineSettings.defaults().withDuration(Duration.ofSeconds(5), Duration.ofSeconds(1)),
                feed).build();

        var summary = engine.run();

        var records = engine.decisionLog().forPatient(patientId(1));
        assertThat(records).anySatisfy(record -> {
            assertThat(record.decision().role()).isEqualTo(AgentRole.PHARMACIST);
            assertThat(record.decision().kind()).isEqualTo(DecisionKind.DRUG_INTERACTION_ALERT);
        });
        var stopOrders = records.stream()
                .map(DecisionRecord::decision)
                .filter(d -> d.kind() == DecisionKind.MEDICATION_ORDER && "stop".equals(d.detail("action")))
                .collect(Collectors.toList());
        assertThat(stopOrders).isNotEmpty();
        var snapshot = engine.query().patient(patientId(1));
        stopOrders.forEach(order -> assertThat(snapshot.isOnDrug(order.detail("drug"))).isFalse());
        assertThat(summary.messageCount()).isPositive();
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("an empty census fails setup with zero ticks and decisions")
        void emptyCensus() {
            var engine = engine(FIVE_MINUTES_OF_SECONDS, new ScriptedFeed(0, ScriptedFeed.stableVitals(), pacer::now))
                    .build();

            var summary = engine.run();

            assertThat(summary.status()).isEqualTo(RunStatus.FAILED);
            assertThat(summary.ticksExecuted()).isZero();
            assertThat(summary.decisionCount()).isZero();
            assertThat(summary.failureCause()).contains("Census is empty");
            assertThat(engine.bus().isClosed()).isTrue();
        }

        @Test
        @Timeout(30)
        @DisplayName("an engine runs only once")
        void singleUse() {
            var engine = engine(EngineSettings.defaults().withDuration(Duration.ofSeconds(2), Duration.ofSeconds(1)),
                    new ScriptedFeed(1, ScriptedFeed.stableVitals(), pacer::now)).build();
            engine.run();

            assertThatThrownBy(engine::run).isInstanceOf(IllegalStateException.class);
            assertThat(engine.status()).isEqualTo(RunStatus.COMPLETED);
        }

        @Test
        @Timeout(30)
        @DisplayName("a background run can be stopped early and still completes")
        void stopEarly() throws Exception {
            var ticks = new AtomicLong();
            var slowPacer = new Pacer() {
                @Override
                public Instant now() {
                    return pacer.now();
                }

                @Override
                public void sleep(Duration duration) throws InterruptedException {
                    ticks.incrementAndGet();
                    pacer.sleep(duration);
                    Thread.sleep(5);
                }
            };
            var engine = IcuEngine.builder()
                    .settings(EngineSettings.defaults().withDuration(Duration.ofHours(1), Duration.ofSeconds(1)))
                    .dataFeed(new ScriptedFeed(1, ScriptedFeed.stableVitals(), slowPacer::now))
                    .pacer(slowPacer)
                    .build();

            var future = engine.start();
            while (ticks.get() < 3) {
                Thread.sleep(5);
            }
            engine.stop();
            var summary = future.get(20, TimeUnit.SECONDS);

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.ticksExecuted()).isBetween(3L, 3599L);
        }

        @Test
        @Timeout(60)
        @DisplayName("agents that keep filling each other's queues cannot hang the run")
        void saturatedBusEndsRun() {
            var settings = new EngineSettings(Duration.ofSeconds(50), Duration.ofSeconds(1), Duration.ofSeconds(1),
                    2, 0, Duration.ofMillis(50), Duration.ofMillis(500), null, null);
            var engine = engine(settings, new ScriptedFeed(5, ScriptedFeed.deterioratingVitals(), pacer::now))
                    .agent(new PhysicianAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                            DecisionKind.MEDICATION_ORDER, Urgency.HIGH, 0.9,
                            Map.of("drug", "Warfarin", "action", "stop"), "Bleeding risk"))))
                    .agent(new PharmacistAgent((event, snapshot) -> AgentOutcome.send(new MessageDraft(
                            AgentRole.PHYSICIAN, MessageKind.MEDICATION_QUERY,
                            Map.of("drug", "Warfarin", "concern", "Stop order received")))))
                    .build();

            var summary = engine.run();

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.ticksExecuted()).isBetween(1L, 50L);
            assertThat(engine.bus().isClosed()).isTrue();
            assertThat(engine.runtimes()).noneMatch(AgentRuntime::isActive);
        }

        @Test
        @Timeout(30)
        @DisplayName("stop ends a run whose bus is saturated")
        void stopSaturatedRun() throws Exception {
            var settings = new EngineSettings(Duration.ofHours(1), Duration.ofSeconds(1), Duration.ofSeconds(1),
                    1, 0, Duration.ofMillis(50), Duration.ofSeconds(5), null, null);
            var engine = engine(settings, new ScriptedFeed(5, ScriptedFeed.deterioratingVitals(), pacer::now))
                    .agent(new NurseAgent((event, snapshot) -> {
                        Thread.sleep(200);
                        return AgentOutcome.none();
                    }))
                    .build();

            var future = engine.start();
            Thread.sleep(300);
            engine.stop();
            var summary = future.get(20, TimeUnit.SECONDS);

            assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(summary.ticksExecuted()).isLessThan(3600L);
        }

        @Test
        @DisplayName("rejects two agents for the same role")
        void duplicateRole() {
            var builder = engine(FIVE_MINUTES_OF_SECONDS, new ScriptedFeed(1, ScriptedFeed.stableVitals(), pacer::now))
                    .agent(new NurseAgent())
                    .agent(new NurseAgent((event, snapshot) -> AgentOutcome.decide(new DecisionProposal(
                            DecisionKind.NURSING_INTERVENTION, Urgency.ROUTINE, 0.5, Map.of("intervention", "x"), ""))));

            assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("NURSE");
        }

        @Test
        @DisplayName("requires a data feed")
        void requiresFeed() {
            assertThatThrownBy(() -> IcuEngine.builder().build()).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
