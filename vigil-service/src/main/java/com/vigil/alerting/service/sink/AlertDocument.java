/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.sink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.alerting.api.model.Alert;

import java.time.Instant;

/**
 * Wire form of an alert for the JSON-lines sink.
 */
public record AlertDocument(
        @JsonProperty("alert_id") String alertId,
        @JsonProperty("alert_type") String alertType,
        @JsonProperty("category") String category,
        @JsonProperty("severity") String severity,
        @JsonProperty("description") String description,
        @JsonProperty("source_service") String sourceService,
        @JsonProperty("source_trace_id") String sourceTraceId,
        @JsonProperty("offending_ip") String offendingIp,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("alert_generated_at") Instant alertGeneratedAt) {

    public static AlertDocument from(Alert alert) {
        return new AlertDocument(
                alert.alertId(),
                alert.title(),
                alert.category().name(),
                alert.severity().name(),
                alert.description(),
                alert.sourceId(),
                alert.correlationId(),
                alert.offendingIp(),
                alert.eventTimestamp(),
                alert.createdAt());
    }
}
