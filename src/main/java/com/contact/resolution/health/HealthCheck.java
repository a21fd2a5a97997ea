package com.contact.resolution.health;

/**
 * A single named health check run by the {@link DriftMonitor}.
 */
public interface HealthCheck {

    String getName();

    /**
     * Performs the check. Implementations report their own failures as a status
     * rather than throwing where they can.
     */
    HealthStatus check();
}
