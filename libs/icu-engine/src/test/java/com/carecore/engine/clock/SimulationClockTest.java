package com.carecore.engine.clock;

import static com.carecore.engine.EngineFixtures.T0;
import static com.carecore.engine.EngineFixtures.patientId;
import static org.assertj.core.api.Assertions.assertThat;

import com.carecore.engine.EngineFixtures;
import com.carecore.engine.EngineSettings;
import com.carecore.engine.ManualPacer;
import com.carecore.engine.ScriptedFeed;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.feed.DataFeed;
import com.carecore.engine.metrics.MetricsAggregator;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.PatientAdmission;
import com.carecore.engine.model.VitalSigns;
import com.carecore.engine.run.RunStatus;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.observability.MetricFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@DisplayName("SimulationClock")
@Timeout(30)
class SimulationClockTest {

    private static final EngineSettings TEN_SECONDS =
            EngineSettings.defaults().withDuration(Duration.ofSeconds(10), Duration.ofSeconds(1));

    private MetricFactory metrics;
    private SimulationRun run;
    private PatientStateStore store;
    private MessageBus bus;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        metrics = EngineFixtures.metrics();
        run = new SimulationRun("run-clock", TEN_SECONDS.duration(), TEN_SECONDS.tickInterval());
        store = new PatientStateStore();
        bus = new MessageBus(64, metrics);
        aggregator = new MetricsAggregator(bus, run, metrics);
    }

    private SimulationClock clock(DataFeed feed, Pacer pacer) {
        return new SimulationClock(run, TEN_SECONDS, store, bus, feed, List.of(aggregator), aggregator, pacer, metrics);
    }

    @Test
    @DisplayName("a feed failure for one patient skips only that patient")
    void feedFailureSkipsPatient() {
        var pacer = new ManualPacer(T0);
        var scripted = new ScriptedFeed(3, ScriptedFeed.stableVitals(), pacer::now);
        DataFeed flaky = new DataFeed() {
            @Override
            public List<PatientAdmission> admissions() {
                return scripted.admissions();
            }

            @Override
            public VitalSigns generateVitals(String patientId) {
                if (patientId.equals(patientId(2))) {
                    throw new IllegalStateException("monitor offline");
                }
                return scripted.generateVitals(patientId);
            }

            @Override
            public Optional<LabResult> generateLab(String patientId) {
                return Optional.empty();
            }
        };

        var summary = clock(flaky, pacer).run();

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(summary.ticksExecuted()).isEqualTo(10);
        assertThat(run.feedFailures()).isEqualTo(10);
        assertThat(summary.feedFailures()).isEqualTo(10);
        assertThat(summary.eventCount()).isEqualTo(20);
        assertThat(store.get(patientId(2)).version()).isZero();
    }

    @Test
    @DisplayName("a census that cannot be read fails the run during setup")
    void admissionsThrow() {
        DataFeed broken = new DataFeed() {
            @Override
            public List<PatientAdmission> admissions() {
                throw new IllegalStateException("ADT feed unreachable");
            }

            @Override
            public VitalSigns generateVitals(String patientId) {
                return VitalSigns.empty();
            }

            @Override
            public Optional<LabResult> generateLab(String patientId) {
                return Optional.empty();
            }
        };

        var summary = clock(broken, new ManualPacer(T0)).run();

        assertThat(summary.status()).isEqualTo(RunStatus.FAILED);
        assertThat(summary.ticksExecuted()).isZero();
        assertThat(summary.failureCause()).contains("census");
        assertThat(bus.isClosed()).isTrue();
    }

    @Test
    @DisplayName("stops at the configured duration when ticks overrun their interval")
    void wallClockBound() {
        var virtual = new ManualPacer(T0);
        Pacer overrunning = new Pacer() {
            @Override
            public Instant now() {
                return virtual.now();
            }

            @Override
            public void sleep(Duration duration) {
                virtual.sleep(Duration.ofSeconds(3));
            }
        };

        var summary = clock(new ScriptedFeed(1, ScriptedFeed.stableVitals(), virtual::now), overrunning).run();

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(summary.ticksExecuted()).isEqualTo(4);
    }

    @Test
    @DisplayName("labs and medication changes are applied to the store before they are published")
    void labsApplied() {
        var pacer = new ManualPacer(T0);
        var feed = new ScriptedFeed(1, ScriptedFeed.stableVitals(), pacer::now)
                .withLab(patientId(1), EngineFixtures.potassium(4.4, T0));

        var summary = clock(feed, pacer).run();

        assertThat(store.get(patientId(1)).lab("potassium")).isPresent();
        assertThat(summary.eventCount()).isEqualTo(11);
    }
}
