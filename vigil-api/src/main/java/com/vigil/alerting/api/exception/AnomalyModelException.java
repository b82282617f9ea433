/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.exception;

/**
 * Raised by an outlier detector that cannot fit or score the current sample buffer.
 */
public class AnomalyModelException extends RuntimeException {

    public AnomalyModelException(String message) {
        super(message);
    }

    public AnomalyModelException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnomalyModelException(Throwable cause) {
        super(cause);
    }
}
