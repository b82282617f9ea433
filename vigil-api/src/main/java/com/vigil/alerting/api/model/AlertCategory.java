/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

/**
 * Canonical identifiers of the detection rules that can raise an alert.
 */
public enum AlertCategory {
    HIGH_CPU_UTILIZATION("High CPU Utilization"),
    HIGH_MEMORY_UTILIZATION("High Memory Utilization"),
    ML_ANOMALY("ML Anomaly Detected"),
    BRUTE_FORCE("Potential Brute Force Attack"),
    HIGH_ERROR_RATE("High Error Rate");

    private final String displayName;

    AlertCategory(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Human readable alert title, e.g. {@code "High Error Rate"}.
     */
    public String displayName() {
        return displayName;
    }
}
