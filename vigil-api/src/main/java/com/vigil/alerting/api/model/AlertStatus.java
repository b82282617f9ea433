/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of a stored alert. Managed by the alert sink, never by the engine.
 */
public enum AlertStatus {
    OPEN,
    ACKNOWLEDGED,
    SUPPRESSED;

    /**
     * Case-insensitive lookup.
     *
     * @param value status name, e.g. {@code "acknowledged"}
     * @return matching status, or empty for null/unknown input
     */
    public static Optional<AlertStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
