/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view over the stored alerts.
 *
 * @param topSource       source with the most alerts, or null when empty
 * @param alertsOverTime  alert counts per creation minute, oldest first, at most 20 buckets
 */
public record AlertSummary(
        long totalAlerts,
        long criticalAlerts,
        long openAlerts,
        long acknowledgedAlerts,
        long suppressedAlerts,
        String topSource,
        long topSourceAlerts,
        List<MinuteBucket> alertsOverTime) {

    public AlertSummary {
        alertsOverTime = List.copyOf(alertsOverTime);
    }

    public record MinuteBucket(Instant minute, long count) {
    }
}
