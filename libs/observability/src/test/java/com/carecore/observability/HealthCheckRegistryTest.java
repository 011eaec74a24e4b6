package com.carecore.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HealthCheckRegistry}: registration, worst-status aggregation, timeouts and
 * failing checks.
 */
@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private HealthCheckRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HealthCheckRegistry();
    }

    private static HealthCheck fixed(ComponentHealth health) {
        return () -> CompletableFuture.completedFuture(health);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should reject non-positive timeout")
        void shouldRejectNonPositiveTimeout() {
            assertThatThrownBy(() -> new HealthCheckRegistry(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should register, replace and deregister by name")
        void shouldManageChecks() {
            registry.register("message-bus", fixed(ComponentHealth.healthy("message-bus", 0)));
            registry.register("message-bus", fixed(ComponentHealth.unhealthy("message-bus", "closed", 0)));

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.checkAll().checks().get("message-bus").status())
                    .isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(registry.deregister("message-bus")).isTrue();
            assertThat(registry.deregister("message-bus")).isFalse();
        }

        @Test
        @DisplayName("should reject null name or check")
        void shouldRejectNulls() {
            assertThatThrownBy(() -> registry.register(null, fixed(null)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("x", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("checkAll")
    class CheckAll {

        @Test
        @DisplayName("should be HEALTHY when empty")
        void healthyWhenEmpty() {
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should report DEGRADED when the worst check is degraded")
        void degraded() {
            registry.register("store", fixed(ComponentHealth.healthy("store", 0)));
            registry.register("agent-nurse", fixed(ComponentHealth.degraded("agent-nurse", "timeouts", 0)));

            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should prefer UNHEALTHY over DEGRADED")
        void unhealthyWins() {
            registry.register("a", fixed(ComponentHealth.degraded("a", "slow", 0)));
            registry.register("b", fixed(ComponentHealth.unhealthy("b", "down", 0)));

            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("should report a slow check as UNHEALTHY")
        void timeout() {
            var shortTimeout = new HealthCheckRegistry(50);
            shortTimeout.register("slow", CompletableFuture::new);

            HealthResult result = shortTimeout.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("slow").message()).contains("Timeout");
        }

        @Test
        @DisplayName("should report throwing and failed checks as UNHEALTHY")
        void failures() {
            registry.register("throws", () -> {
                throw new IllegalStateException("exploded");
            });
            registry.register("failed", () -> CompletableFuture.failedFuture(new RuntimeException("x")));

            HealthResult result = registry.checkAll();

            assertThat(result.checks().get("throws").status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("failed").status()).isEqualTo(HealthStatus.UNHEALTHY);
        }
    }
}
