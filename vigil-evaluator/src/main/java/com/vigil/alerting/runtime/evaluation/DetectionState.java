/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.runtime.window.TimeWindow;

/**
 * Cross-event state shared by the detection rules: the global event and error
 * windows, the authentication-failure window and the error-rate hysteresis flag.
 *
 * <p>Not thread-safe. The engine mutates it only while holding its lock.
 */
public final class DetectionState {

    private final TimeWindow allEvents = new TimeWindow();
    private final TimeWindow errorEvents = new TimeWindow();
    private final TimeWindow authFailures = new TimeWindow();
    private boolean errorRateAlertActive;

    public TimeWindow allEvents() {
        return allEvents;
    }

    public TimeWindow errorEvents() {
        return errorEvents;
    }

    public TimeWindow authFailures() {
        return authFailures;
    }

    public boolean isErrorRateAlertActive() {
        return errorRateAlertActive;
    }

    public void setErrorRateAlertActive(boolean active) {
        this.errorRateAlertActive = active;
    }

    public void reset() {
        allEvents.clear();
        errorEvents.clear();
        authFailures.clear();
        errorRateAlertActive = false;
    }

    @Override
    public String toString() {
        return "DetectionState{events=" + allEvents.count()
                + ", errors=" + errorEvents.count()
                + ", authFailures=" + authFailures.count()
                + ", errorRateAlertActive=" + errorRateAlertActive + '}';
    }
}
