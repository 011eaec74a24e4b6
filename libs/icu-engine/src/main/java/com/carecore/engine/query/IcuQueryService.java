package com.carecore.engine.query;

import com.carecore.engine.agent.AgentNotFoundException;
import com.carecore.engine.agent.AgentRuntime;
import com.carecore.engine.agent.AgentStatus;
import com.carecore.engine.alert.AlertEngine;
import com.carecore.engine.coordination.DecisionLog;
import com.carecore.engine.coordination.DecisionRecord;
import com.carecore.engine.model.AgentRole;
import com.carecore.engine.model.Alert;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.run.RunSummary;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientNotFoundException;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.observability.HealthCheckRegistry;
import com.carecore.observability.HealthResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view over a running or finished engine. Safe to call from any thread.
 */
public final class IcuQueryService {

    private final PatientStateStore store;
    private final List<AgentRuntime> runtimes;
    private final DecisionLog decisionLog;
    private final AlertEngine alertEngine;
    private final SimulationRun run;
    private final HealthCheckRegistry health;

    public IcuQueryService(PatientStateStore store, List<AgentRuntime> runtimes, DecisionLog decisionLog,
                           AlertEngine alertEngine, SimulationRun run, HealthCheckRegistry health) {
        this.store = store;
        this.runtimes = List.copyOf(runtimes);
        this.decisionLog = decisionLog;
        this.alertEngine = alertEngine;
        this.run = run;
        this.health = health;
    }

    /** Every admitted patient, in admission order. */
    public List<PatientSnapshot> patients() {
        return store.snapshots();
    }

    /**
     * @throws PatientNotFoundException if the patient is not admitted
     */
    public PatientSnapshot patient(String patientId) {
        return store.get(patientId);
    }

    public List<AgentStatus> agents() {
        return runtimes.stream().map(AgentRuntime::status).collect(Collectors.toList());
    }

    /**
     * Looks an agent up by role value ("nurse") or agent id ("NURSE_001").
     *
     * @throws AgentNotFoundException if no runtime matches
     */
    public AgentStatus agent(String roleOrId) {
        for (AgentRuntime runtime : runtimes) {
            if (runtime.agentId().equalsIgnoreCase(roleOrId)) {
                return runtime.status();
            }
        }
        AgentRole role = AgentRole.fromString(roleOrId).orElseThrow(() -> new AgentNotFoundException(roleOrId));
        return agent(role);
    }

    public AgentStatus agent(AgentRole role) {
        return runtimes.stream()
                .filter(runtime -> runtime.role() == role)
                .findFirst()
                .map(AgentRuntime::status)
                .orElseThrow(() -> new AgentNotFoundException(role.value()));
    }

    /** The most recent {@code limit} committed decisions, oldest first. */
    public List<DecisionRecord> decisionLogTail(int limit) {
        return decisionLog.tail(limit);
    }

    /**
     * @throws PatientNotFoundException if the patient is not admitted
     */
    public List<DecisionRecord> decisions(String patientId) {
        if (!store.contains(patientId)) {
            throw new PatientNotFoundException(patientId);
        }
        return decisionLog.forPatient(patientId);
    }

    /** The most recent {@code limit} alerts, newest first. */
    public List<Alert> recentAlerts(int limit) {
        return alertEngine.recentAlerts(limit);
    }

    public RunSummary runState() {
        return RunSummary.of(run);
    }

    public HealthResult health() {
        return health.checkAll();
    }
}
