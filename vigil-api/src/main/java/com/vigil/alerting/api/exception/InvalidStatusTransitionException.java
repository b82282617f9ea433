/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.exception;

/**
 * Thrown when an alert status update names a state outside
 * {@link com.vigil.alerting.api.model.AlertStatus}.
 */
public class InvalidStatusTransitionException extends RuntimeException {

    private final String targetStatus;

    public InvalidStatusTransitionException(String targetStatus) {
        super("Unsupported status: " + targetStatus);
        this.targetStatus = targetStatus;
    }

    public String getTargetStatus() {
        return targetStatus;
    }
}
