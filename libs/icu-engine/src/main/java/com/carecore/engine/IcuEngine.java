package com.carecore.engine;

import com.carecore.engine.agent.AgentRuntime;
import com.carecore.engine.agent.ClinicalAgent;
import com.carecore.engine.agent.NurseAgent;
import com.carecore.engine.agent.PharmacistAgent;
import com.carecore.engine.agent.PhysicianAgent;
import com.carecore.engine.alert.AlertEngine;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.clock.Pacer;
import com.carecore.engine.clock.SimulationClock;
import com.carecore.engine.coordination.ArbitrationPolicy;
import com.carecore.engine.coordination.DecisionCoordinator;
import com.carecore.engine.coordination.DecisionLog;
import com.carecore.engine.feed.DataFeed;
import com.carecore.engine.metrics.MetricsAggregator;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.query.IcuQueryService;
import com.carecore.engine.run.RunStatus;
import com.carecore.engine.run.RunSummary;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.observability.ComponentHealth;
import com.carecore.observability.HealthCheckRegistry;
import com.carecore.observability.MetricFactory;
import com.carecore.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One fully wired simulation run: store, bus, alert engine, agent runtimes, coordinator,
 * metrics aggregator and clock.
 *
 * <p>An engine is single use, like its clock. Build a new one for every run.
 *
 * <pre>{@code
 * IcuEngine engine = IcuEngine.builder()
 *         .settings(settings)
 *         .dataFeed(feed)
 *         .metrics(new MetricFactory(registry, "icu-simulator"))
 *         .build();
 * RunSummary summary = engine.run();
 * }</pre>
 */
public final class IcuEngine {

    private final SimulationRun run;
    private final EngineSettings settings;
    private final PatientStateStore store;
    private final MessageBus bus;
    private final AlertEngine alertEngine;
    private final List<AgentRuntime> runtimes;
    private final DecisionCoordinator coordinator;
    private final MetricsAggregator aggregator;
    private final SimulationClock clock;
    private final HealthCheckRegistry health;
    private final IcuQueryService query;

    private IcuEngine(Builder builder) {
        this.settings = builder.settings;
        MetricFactory metrics = builder.metrics.forRun(builder.runId);
        this.run = new SimulationRun(builder.runId, settings.duration(), settings.tickInterval());
        this.store = new PatientStateStore();
        this.bus = new MessageBus(settings.busCapacity(), metrics);
        this.alertEngine = new AlertEngine(bus, settings.alertRules(), run, metrics);

        List<AgentRuntime> agentRuntimes = new ArrayList<>();
        for (ClinicalAgent agent : builder.resolvedAgents) {
            agentRuntimes.add(new AgentRuntime(agent, bus, store, run, settings.decisionTimeout(), metrics,
                    builder.spans));
        }
        this.runtimes = List.copyOf(agentRuntimes);
        this.coordinator = new DecisionCoordinator(bus, store, new ArbitrationPolicy(settings.rolePriority()), run,
                metrics);
        this.aggregator = new MetricsAggregator(bus, run, metrics);

        List<EngineUnit> units = new ArrayList<>();
        units.add(alertEngine);
        units.addAll(runtimes);
        units.add(coordinator);
        units.add(aggregator);
        this.clock = new SimulationClock(run, settings, store, bus, builder.dataFeed, units, aggregator,
                builder.pacer, metrics);

        this.health = new HealthCheckRegistry();
        registerHealthChecks();
        this.query = new IcuQueryService(store, runtimes, coordinator.decisionLog(), alertEngine, run, health);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Runs the simulation on the calling thread. */
    public RunSummary run() {
        return clock.run();
    }

    /** Runs the simulation on a background clock thread. */
    public CompletableFuture<RunSummary> start() {
        return clock.start();
    }

    /** Ends the run after the current tick. */
    public void stop() {
        clock.requestStop();
    }

    public String runId() {
        return run.runId();
    }

    public RunStatus status() {
        return run.status();
    }

    public RunSummary summary() {
        return aggregator.summary();
    }

    public IcuQueryService query() {
        return query;
    }

    public EngineSettings settings() {
        return settings;
    }

    public PatientStateStore store() {
        return store;
    }

    public MessageBus bus() {
        return bus;
    }

    public DecisionLog decisionLog() {
        return coordinator.decisionLog();
    }

    public List<AgentRuntime> runtimes() {
        return runtimes;
    }

    public HealthCheckRegistry health() {
        return health;
    }

    private void registerHealthChecks() {
        health.register("message-bus", () -> CompletableFuture.completedFuture(busHealth()));
        health.register("patient-store", () -> CompletableFuture.completedFuture(store.size() > 0
                ? ComponentHealth.healthy("patient-store", 0)
                : ComponentHealth.degraded("patient-store", "No patients admitted", 0)));
        for (AgentRuntime runtime : runtimes) {
            health.register(runtime.name(), () -> CompletableFuture.completedFuture(agentHealth(runtime)));
        }
    }

    private ComponentHealth busHealth() {
        if (bus.isClosed()) {
            return run.status() == RunStatus.RUNNING
                    ? ComponentHealth.unhealthy("message-bus", "Closed while the run is active", 0)
                    : ComponentHealth.healthy("message-bus", 0);
        }
        int backlog = bus.totalBacklog();
        int saturation = bus.capacity() * Math.max(1, bus.subscriptions().size()) / 2;
        return backlog > saturation
                ? ComponentHealth.degraded("message-bus", "Backlog " + backlog + " events", 0)
                : ComponentHealth.healthy("message-bus", 0);
    }

    private ComponentHealth agentHealth(AgentRuntime runtime) {
        if (run.status() == RunStatus.RUNNING && !runtime.isActive()) {
            return ComponentHealth.unhealthy(runtime.name(), "Runtime not running", 0);
        }
        long timeouts = runtime.status().timeouts();
        return timeouts > 0
                ? ComponentHealth.degraded(runtime.name(), timeouts + " decision timeouts", 0)
                : ComponentHealth.healthy(runtime.name(), 0);
    }

    /** Builder for {@link IcuEngine}. Only the data feed is required. */
    public static final class Builder {

        private EngineSettings settings = EngineSettings.defaults();
        private DataFeed dataFeed;
        private MetricFactory metrics;
        private SpanHelper spans = SpanHelper.noop();
        private Pacer pacer = Pacer.system();
        private final List<ClinicalAgent> agents = new ArrayList<>();
        private List<ClinicalAgent> resolvedAgents;
        private String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);

        private Builder() {
        }

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder dataFeed(DataFeed dataFeed) {
            this.dataFeed = dataFeed;
            return this;
        }

        public Builder metrics(MetricFactory metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder spans(SpanHelper spans) {
            this.spans = spans;
            return this;
        }

        public Builder pacer(Pacer pacer) {
            this.pacer = pacer;
            return this;
        }

        /** Adds an agent. Roles without an added agent get one with default reasoning. */
        public Builder agent(ClinicalAgent agent) {
            this.agents.add(agent);
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public IcuEngine build() {
            if (settings == null) {
                throw new IllegalArgumentException("settings must not be null");
            }
            if (dataFeed == null) {
                throw new IllegalArgumentException("dataFeed must not be null");
            }
            if (metrics == null) {
                metrics = new MetricFactory(new SimpleMeterRegistry(), "icu-engine");
            }
            if (spans == null || pacer == null) {
                throw new IllegalArgumentException("spans and pacer must not be null");
            }
            resolvedAgents = resolveAgents();
            return new IcuEngine(this);
        }

        /** The configured agents, completed with a default agent for every role not configured. */
        private List<ClinicalAgent> resolveAgents() {
            List<ClinicalAgent> resolved = new ArrayList<>(agents);
            Set<AgentRole> roles = EnumSet.noneOf(AgentRole.class);
            for (ClinicalAgent agent : agents) {
                if (!roles.add(agent.role())) {
                    throw new IllegalArgumentException("Only one agent per role, duplicate " + agent.role());
                }
            }
            for (ClinicalAgent defaultAgent : List.of(new PhysicianAgent(), new NurseAgent(), new PharmacistAgent())) {
                if (!roles.contains(defaultAgent.role())) {
                    resolved.add(defaultAgent);
                }
            }
            return List.copyOf(resolved);
        }
    }
}
