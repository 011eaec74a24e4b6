package com.carecore.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Checks the health of one engine component.
 * <p>
 * Engine components are in-process, so most checks complete immediately:
 * <pre>{@code
 * HealthCheck busCheck = () -> CompletableFuture.completedFuture(
 *         bus.isClosed()
 *                 ? ComponentHealth.unhealthy("message-bus", "closed", 0)
 *                 : ComponentHealth.healthy("message-bus", 0));
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs a health check and returns the result asynchronously.
     */
    CompletableFuture<ComponentHealth> check();
}
