/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api;

import com.vigil.alerting.api.model.Alert;

/**
 * Performs remediation actions against the real environment.
 *
 * <p>Implementations may block and may throw; the dispatcher captures failures
 * into an {@link com.vigil.alerting.api.model.ActionOutcome} and never retries.
 */
public interface ActionExecutor {

    void scaleOut(String sourceId);

    void blockSource(String ip);

    void restart(String sourceId);

    void captureDiagnosticsAndRestart(String sourceId);

    void notify(Alert alert);
}
