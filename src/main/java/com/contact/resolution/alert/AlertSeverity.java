package com.contact.resolution.alert;

import com.contact.resolution.health.HealthStatus;

/**
 * Severity of an outbound operational alert.
 */
public enum AlertSeverity {
    WARNING,
    CRITICAL;

    /**
     * Maps a degraded health status to an alert severity.
     *
     * @throws IllegalArgumentException if the status is OK
     */
    public static AlertSeverity from(HealthStatus.Status status) {
        return switch (status) {
            case WARNING -> WARNING;
            case CRITICAL -> CRITICAL;
            case OK -> throw new IllegalArgumentException("No alert severity for OK");
        };
    }
}
