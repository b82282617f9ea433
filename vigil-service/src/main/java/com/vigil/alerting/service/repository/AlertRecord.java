/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertStatus;

import java.time.Instant;

/**
 * A stored alert with its lifecycle state.
 *
 * @param sequenceId     monotonically increasing insertion number, starting at 1
 * @param acknowledgedAt last time the alert moved to ACKNOWLEDGED, or null
 * @param suppressedAt   last time the alert moved to SUPPRESSED, or null
 */
public record AlertRecord(
        long sequenceId,
        Alert alert,
        AlertStatus status,
        Instant acknowledgedAt,
        Instant suppressedAt,
        Instant updatedAt) {

    static AlertRecord open(long sequenceId, Alert alert, Instant now) {
        return new AlertRecord(sequenceId, alert, AlertStatus.OPEN, null, null, now);
    }

    AlertRecord withStatus(AlertStatus target, Instant now) {
        return new AlertRecord(
                sequenceId,
                alert,
                target,
                target == AlertStatus.ACKNOWLEDGED ? now : acknowledgedAt,
                target == AlertStatus.SUPPRESSED ? now : suppressedAt,
                now);
    }

    public String alertId() {
        return alert.alertId();
    }
}
