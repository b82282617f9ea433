/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.actions;

import com.vigil.alerting.api.ActionExecutor;
import com.vigil.alerting.api.exception.ActionExecutionException;
import com.vigil.alerting.api.model.Alert;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Simulated remediation: logs what a real executor would do, optionally pausing to
 * mimic the latency of the underlying infrastructure call.
 */
public final class LoggingActionExecutor implements ActionExecutor {

    private static final Logger logger = Logger.getLogger(LoggingActionExecutor.class.getName());

    private final Duration simulatedLatency;

    public LoggingActionExecutor() {
        this(Duration.ZERO);
    }

    public LoggingActionExecutor(Duration simulatedLatency) {
        if (simulatedLatency.isNegative()) {
            throw new IllegalArgumentException("simulatedLatency must not be negative: " + simulatedLatency);
        }
        this.simulatedLatency = simulatedLatency;
    }

    @Override
    public void scaleOut(String sourceId) {
        perform("Scaling out " + sourceId + " by one instance", sourceId + " scaled out");
    }

    @Override
    public void blockSource(String ip) {
        perform("Blocking address " + ip + " at the edge firewall", ip + " blocked");
    }

    @Override
    public void restart(String sourceId) {
        perform("Restarting " + sourceId + " to clear transient errors", sourceId + " restarted");
    }

    @Override
    public void captureDiagnosticsAndRestart(String sourceId) {
        perform("Capturing heap dump for " + sourceId + " and restarting",
                "diagnostics for " + sourceId + " captured, service restarted");
    }

    @Override
    public void notify(Alert alert) {
        logger.info(() -> "ACTION: notifying operators of " + alert.title() + " on " + alert.sourceId()
                + " (" + alert.alertId() + ")");
    }

    private void perform(String action, String result) {
        logger.info(() -> "AUTO-REMEDIATION: " + action + "...");
        if (!simulatedLatency.isZero()) {
            try {
                Thread.sleep(simulatedLatency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionExecutionException("Interrupted: " + action, e);
            }
        }
        logger.info(() -> "SUCCESS: " + result);
    }
}
