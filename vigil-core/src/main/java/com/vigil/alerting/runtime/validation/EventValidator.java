/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.validation;

import com.vigil.alerting.api.exception.EventValidationException;
import com.vigil.alerting.api.model.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structural checks applied to every event before it reaches engine state.
 *
 * <p>All violations are collected and reported together.
 */
public final class EventValidator {

    /**
     * @throws EventValidationException listing every violation
     */
    public void validate(Event event) {
        List<String> violations = violations(event);
        if (!violations.isEmpty()) {
            throw new EventValidationException(violations);
        }
    }

    public List<String> violations(Event event) {
        if (event == null) {
            return List.of("event is null");
        }
        List<String> violations = new ArrayList<>();
        if (event.timestamp() == null) {
            violations.add("timestamp is required");
        }
        if (event.sourceId() == null || event.sourceId().isBlank()) {
            violations.add("source_id must not be blank");
        }
        if (event.category() == null || event.category().isBlank()) {
            violations.add("category must not be blank");
        }
        if (event.level() == null) {
            violations.add("level is required");
        }
        Map<String, Double> fields = event.numericFields();
        if (fields == null) {
            violations.add("numeric_fields is required");
        } else {
            for (Map.Entry<String, Double> entry : fields.entrySet()) {
                if (entry.getKey() == null) {
                    violations.add("numeric_fields contains a null key");
                } else if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                    violations.add("numeric_fields." + entry.getKey() + " must be a finite number, got "
                            + entry.getValue());
                }
            }
        }
        return violations;
    }
}
