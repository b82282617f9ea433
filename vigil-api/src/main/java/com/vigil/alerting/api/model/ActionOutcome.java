/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

import java.time.Duration;

/**
 * Result of dispatching the remediation action of one alert.
 *
 * @param alertId  alert the action was dispatched for
 * @param action   action that was chosen
 * @param target   service or address the action applied to
 * @param success  whether the executor completed without error
 * @param error    failure description, null on success
 * @param duration time spent in the executor
 */
public record ActionOutcome(
        String alertId,
        RemediationAction action,
        String target,
        boolean success,
        String error,
        Duration duration) {

    public static ActionOutcome succeeded(String alertId, RemediationAction action, String target, Duration duration) {
        return new ActionOutcome(alertId, action, target, true, null, duration);
    }

    public static ActionOutcome failed(String alertId, RemediationAction action, String target,
                                       String error, Duration duration) {
        return new ActionOutcome(alertId, action, target, false, error, duration);
    }
}
