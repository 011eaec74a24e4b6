package com.carecore.simulator.api;

import com.carecore.engine.IcuEngine;
import com.carecore.engine.agent.AgentStatus;
import com.carecore.engine.coordination.DecisionRecord;
import com.carecore.engine.model.Alert;
import com.carecore.engine.model.PatientSnapshot;
import com.carecore.engine.query.IcuQueryService;
import com.carecore.engine.run.RunSummary;
import com.carecore.observability.HealthResult;
import com.carecore.observability.HealthStatus;
import com.carecore.simulator.run.RunConflictException;
import com.carecore.simulator.run.SimulationLauncher;
import java.time.Duration;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * View of the latest simulation run, plus starting and stopping runs. Every read endpoint answers
 * 404 before the first run; starting while a run is active, or stopping when none is, answers 409.
 */
@RestController
@RequestMapping("/api/v1")
public class IcuController {

    static final int MAX_LIMIT = 1000;
    static final int MAX_DURATION_MINUTES = 24 * 60;

    private final SimulationLauncher launcher;

    public IcuController(SimulationLauncher launcher) {
        this.launcher = launcher;
    }

    @GetMapping("/patients")
    public List<PatientSnapshot> patients() {
        return query().patients();
    }

    @GetMapping("/patients/{patientId}")
    public PatientSnapshot patient(@PathVariable String patientId) {
        return query().patient(patientId);
    }

    @GetMapping("/patients/{patientId}/decisions")
    public List<DecisionRecord> patientDecisions(@PathVariable String patientId) {
        return query().decisions(patientId);
    }

    @GetMapping("/agents")
    public List<AgentStatus> agents() {
        return query().agents();
    }

    /** Looks an agent up by role ("nurse") or agent id ("NURSE_001"). */
    @GetMapping("/agents/{roleOrId}")
    public AgentStatus agent(@PathVariable String roleOrId) {
        return query().agent(roleOrId);
    }

    @GetMapping("/decisions")
    public List<DecisionRecord> decisions(@RequestParam(defaultValue = "50") int limit) {
        return query().decisionLogTail(checkLimit(limit));
    }

    @GetMapping("/alerts")
    public List<Alert> alerts(@RequestParam(defaultValue = "50") int limit) {
        return query().recentAlerts(checkLimit(limit));
    }

    @GetMapping("/run")
    public RunSummary run() {
        return query().runState();
    }

    /** Engine health; 503 when any component is unhealthy. */
    @GetMapping("/health")
    public ResponseEntity<HealthResult> health() {
        HealthResult result = query().health();
        HttpStatus status = result.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /** Starts a run; {@code durationMinutes} overrides the configured duration. */
    @PostMapping("/simulation/start")
    public ResponseEntity<RunSummary> start(@RequestParam(required = false) Integer durationMinutes) {
        Duration duration = null;
        if (durationMinutes != null) {
            if (durationMinutes < 1 || durationMinutes > MAX_DURATION_MINUTES) {
                throw new IllegalArgumentException("durationMinutes must be between 1 and " + MAX_DURATION_MINUTES
                        + ", got " + durationMinutes);
            }
            duration = Duration.ofMinutes(durationMinutes);
        }
        launcher.start(duration);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(launcher.requireCurrent().summary());
    }

    /** Asks the active run to end after its current tick. */
    @PostMapping("/simulation/stop")
    public ResponseEntity<RunSummary> stop() {
        IcuEngine engine = launcher.stop()
                .orElseThrow(() -> new RunConflictException(null, "No active run to stop"));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(engine.summary());
    }

    private IcuQueryService query() {
        return launcher.requireCurrent().query();
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return limit;
    }
}
