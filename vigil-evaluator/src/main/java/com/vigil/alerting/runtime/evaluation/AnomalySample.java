/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.api.model.AnomalyVerdict;

/**
 * The (cpu, memory) pair an event contributed to its source's anomaly model and
 * the verdict the model gave for it.
 */
public record AnomalySample(double cpuPct, double memoryPct, AnomalyVerdict verdict) {

    /** The event carried neither metric; the model was not touched. */
    public static final AnomalySample ABSENT = new AnomalySample(Double.NaN, Double.NaN, AnomalyVerdict.NONE);

    public boolean isPresent() {
        return this != ABSENT;
    }
}
