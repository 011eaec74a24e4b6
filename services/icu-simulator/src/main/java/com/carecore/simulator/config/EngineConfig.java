package com.carecore.simulator.config;

import com.carecore.observability.MetricFactory;
import com.carecore.observability.SpanHelper;
import com.carecore.simulator.report.RunReportWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans shared by every simulation run.
 *
 * <p>Engine meters go to the Spring-managed {@link MeterRegistry}, so they appear under
 * {@code /actuator/metrics} and {@code /actuator/prometheus}. Spans go to whatever OpenTelemetry
 * SDK is installed globally; without one they are no-ops.
 */
@Configuration
public class EngineConfig {

    @Bean
    public MetricFactory metricFactory(
            MeterRegistry registry, @Value("${spring.application.name:icu-simulator}") String serviceName) {
        return new MetricFactory(registry, serviceName);
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(SpanHelper.INSTRUMENTATION_NAME));
    }

    @Bean
    public RunReportWriter runReportWriter(SimulationProperties properties) {
        return new RunReportWriter(Path.of(properties.reportDirectory()));
    }
}
