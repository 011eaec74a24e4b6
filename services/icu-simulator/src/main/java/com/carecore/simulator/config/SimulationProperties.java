package com.carecore.simulator.config;

import com.carecore.engine.EngineSettings;
import com.carecore.engine.alert.AlertRuleSet;
import com.carecore.engine.model.AgentRole;
import com.carecore.simulator.feed.SyntheticDataFeed;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Simulation settings bound from {@code carecore.simulation.*}.
 *
 * <pre>
 * carecore:
 *   simulation:
 *     patient-count: 10
 *     duration: 5m
 *     tick-interval: 5s
 *     role-priority: [physician, pharmacist, nurse]
 *     seed: 42
 *     report-directory: ./data/reports
 *     auto-start: true
 * </pre>
 *
 * <p>Unset or non-positive values take the engine defaults, so the compact constructor runs before
 * Bean Validation sees the record.
 *
 * @param patientCount     patients admitted at run start
 * @param duration         simulated run length
 * @param tickInterval     simulated time per tick
 * @param decisionTimeout  budget per decision-function call (defaults to the tick interval)
 * @param busCapacity      queue capacity per bus subscriber
 * @param backlogThreshold pending events tolerated across units before the next tick
 * @param barrierTimeout   longest wait for the backlog to fall below the threshold
 * @param alertCooldown    minimum time between two alerts with the same dedup key
 * @param rolePriority     arbitration tie-break order, highest first
 * @param seed             random seed of the synthetic feed; null for a fresh seed every run
 * @param labProbability   chance per patient and tick of a lab result
 * @param reportDirectory  where {@code final_report.json} is written
 * @param autoStart        start a run when the application is ready
 */
@ConfigurationProperties(prefix = "carecore.simulation")
@Validated
public record SimulationProperties(
        @Positive int patientCount,
        Duration duration,
        Duration tickInterval,
        Duration decisionTimeout,
        int busCapacity,
        int backlogThreshold,
        Duration barrierTimeout,
        Duration alertCooldown,
        List<String> rolePriority,
        Long seed,
        @DecimalMin("0.0") @DecimalMax("1.0") Double labProbability,
        @NotBlank String reportDirectory,
        boolean autoStart) {

    public static final int DEFAULT_PATIENT_COUNT = 10;
    public static final String DEFAULT_REPORT_DIRECTORY = "./data/reports";

    public SimulationProperties {
        if (patientCount <= 0) {
            patientCount = DEFAULT_PATIENT_COUNT;
        }
        duration = positiveOr(duration, EngineSettings.DEFAULT_DURATION);
        tickInterval = positiveOr(tickInterval, EngineSettings.DEFAULT_TICK_INTERVAL);
        decisionTimeout = positiveOr(decisionTimeout, tickInterval);
        if (backlogThreshold < 0) {
            backlogThreshold = EngineSettings.DEFAULT_BACKLOG_THRESHOLD;
        }
        barrierTimeout = positiveOr(barrierTimeout, EngineSettings.DEFAULT_BARRIER_TIMEOUT);
        alertCooldown = positiveOr(alertCooldown, AlertRuleSet.DEFAULT_COOLDOWN);
        rolePriority = rolePriority == null ? List.of() : List.copyOf(rolePriority);
        if (labProbability == null) {
            labProbability = SyntheticDataFeed.DEFAULT_LAB_PROBABILITY;
        }
        if (reportDirectory == null || reportDirectory.isBlank()) {
            reportDirectory = DEFAULT_REPORT_DIRECTORY;
        }
    }

    /**
     * Engine configuration for one run.
     *
     * @throws IllegalArgumentException if a role priority entry names no known role
     */
    public EngineSettings toEngineSettings() {
        List<AgentRole> roles = new ArrayList<>();
        for (String name : rolePriority) {
            roles.add(AgentRole.fromString(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown agent role in role-priority: " + name)));
        }
        return new EngineSettings(duration, tickInterval, decisionTimeout, busCapacity, backlogThreshold,
                barrierTimeout, null, AlertRuleSet.defaults(alertCooldown), roles);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
