/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.sink;

import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.Severity;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes each alert to the log, CRITICAL alerts at SEVERE and the rest at WARNING.
 */
public final class LoggingAlertSink implements AlertSink {

    private static final Logger logger = Logger.getLogger(LoggingAlertSink.class.getName());

    @Override
    public void publish(Alert alert) {
        Level level = alert.severity() == Severity.CRITICAL ? Level.SEVERE : Level.WARNING;
        if (!logger.isLoggable(level)) {
            return;
        }
        StringBuilder message = new StringBuilder()
                .append("ALERT TRIGGERED ").append(alert.alertId())
                .append("\n  Severity: ").append(alert.severity())
                .append("\n  Type:     ").append(alert.title())
                .append("\n  Message:  ").append(alert.description())
                .append("\n  Service:  ").append(alert.sourceId())
                .append("\n  Event at: ").append(alert.eventTimestamp());
        alert.offendingAddress().ifPresent(ip -> message.append("\n  Source:   ").append(ip));
        logger.log(level, message.toString());
    }
}
