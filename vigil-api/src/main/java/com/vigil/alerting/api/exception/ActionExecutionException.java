/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.exception;

/**
 * Raised by an {@link com.vigil.alerting.api.ActionExecutor} when a remediation step fails.
 */
public class ActionExecutionException extends RuntimeException {

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
