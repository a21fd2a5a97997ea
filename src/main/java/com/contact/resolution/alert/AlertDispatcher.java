package com.contact.resolution.alert;

import java.util.Map;

/**
 * Outbound notification channel for degraded health.
 *
 * <p>Delivery is best-effort. Implementations may throw {@link AlertDispatchException};
 * callers log it and carry on.</p>
 */
public interface AlertDispatcher {

    /**
     * Sends an alert.
     *
     * @param severity how bad it is
     * @param summary  one line per degraded check
     * @param details  structured context, serialized as-is
     * @throws AlertDispatchException if the alert could not be delivered
     */
    void send(AlertSeverity severity, String summary, Map<String, Object> details);
}
