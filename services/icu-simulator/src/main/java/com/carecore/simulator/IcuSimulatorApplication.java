package com.carecore.simulator;

import com.carecore.simulator.config.SimulationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CareCore ICU simulator.
 *
 * <p>Runs one multi-agent ICU simulation at a time on synthetic patient data, writes
 * {@code final_report.json} when it ends, a periodic {@code status_report.json} while it runs,
 * and serves the run's state under {@code /api/v1}, where runs can also be started and stopped.
 * Actuator exposes health, metrics and Prometheus endpoints.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(SimulationProperties.class)
public class IcuSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IcuSimulatorApplication.class, args);
    }
}
