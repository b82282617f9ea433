/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.exception;

import java.util.List;

/**
 * Thrown when an incoming event is malformed. The event is rejected before it
 * touches any window, model or hysteresis state.
 */
public class EventValidationException extends RuntimeException {

    private final List<String> violations;

    public EventValidationException(List<String> violations) {
        super("Invalid event: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public EventValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
