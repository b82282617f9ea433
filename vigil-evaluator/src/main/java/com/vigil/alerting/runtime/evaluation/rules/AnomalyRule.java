/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation.rules;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.runtime.evaluation.AnomalySample;
import com.vigil.alerting.runtime.evaluation.DetectionRule;
import com.vigil.alerting.runtime.evaluation.RuleContext;
import com.vigil.alerting.runtime.evaluation.RuleFiring;

import java.util.Locale;
import java.util.Optional;

/**
 * Raises a warning when the source's anomaly model flagged the event's sample.
 * Only fills an empty slot.
 */
public final class AnomalyRule implements DetectionRule {

    @Override
    public String name() {
        return "ml-anomaly";
    }

    @Override
    public Optional<RuleFiring> evaluate(RuleContext context) {
        AnomalySample sample = context.anomaly();
        if (context.slotTaken() || !sample.verdict().isAnomaly()) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT,
                "ML model detected anomaly (score %.2f) [CPU %.1f%%, Mem %.1f%%] for %s",
                sample.verdict().score(), sample.cpuPct(), sample.memoryPct(), context.event().sourceId());
        return Optional.of(RuleFiring.of(AlertCategory.ML_ANOMALY, Severity.WARNING, description));
    }
}
