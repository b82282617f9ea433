/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

import java.util.Map;

/**
 * Point-in-time counters of an alerting engine.
 */
public record EngineStats(
        long eventsProcessed,
        long eventsRejected,
        Map<AlertCategory, Long> alertsRaised,
        long activeAnomalyModels,
        boolean errorRateAlertActive) {

    public EngineStats {
        alertsRaised = Map.copyOf(alertsRaised);
    }

    public long totalAlerts() {
        return alertsRaised.values().stream().mapToLong(Long::longValue).sum();
    }
}
