/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Canonical alert produced by the engine when a detection rule fires.
 *
 * <p>Alerts are created exactly once per firing and never mutated. The
 * {@code alertId} is globally unique and never reused.
 *
 * @param alertId        unique identifier, {@code "alert-"} followed by 32 hex characters
 * @param category       rule that fired
 * @param severity       alert severity
 * @param description    human readable detail, e.g. {@code "CPU usage at 95.00%"}
 * @param sourceId       source of the triggering event
 * @param correlationId  correlation id of the triggering event, may be null
 * @param offendingIp    network origin to block, only set for brute force alerts
 * @param eventTimestamp timestamp of the triggering event
 * @param createdAt      time the alert was created
 */
public record Alert(
        String alertId,
        AlertCategory category,
        Severity severity,
        String description,
        String sourceId,
        String correlationId,
        String offendingIp,
        Instant eventTimestamp,
        Instant createdAt) {

    public String title() {
        return category.displayName();
    }

    public Optional<String> offendingAddress() {
        return Optional.ofNullable(offendingIp);
    }
}
