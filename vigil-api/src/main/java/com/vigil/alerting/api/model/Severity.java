/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

/**
 * Severity assigned to a raised alert.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
