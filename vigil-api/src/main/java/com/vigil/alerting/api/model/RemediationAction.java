/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

/**
 * Named remediation steps an {@link com.vigil.alerting.api.ActionExecutor} can perform.
 */
public enum RemediationAction {
    /** Add capacity to the affected service. */
    SCALE_OUT,
    /** Block the offending network address. */
    BLOCK_SOURCE,
    /** Restart the affected service. */
    RESTART,
    /** Capture a heap/diagnostic dump, then restart. */
    CAPTURE_DIAGNOSTICS_AND_RESTART,
    /** Generic operator notification. */
    NOTIFY
}
