package com.contact.resolution.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Default dispatcher that writes alerts to the log.
 */
public class LoggingAlertDispatcher implements AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

    @Override
    public void send(AlertSeverity severity, String summary, Map<String, Object> details) {
        if (severity == AlertSeverity.CRITICAL) {
            log.error("alert severity={} summary={} details={}", severity, summary, details);
        } else {
            log.warn("alert severity={} summary={} details={}", severity, summary, details);
        }
    }
}
