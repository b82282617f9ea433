/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation.rules;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.runtime.evaluation.DetectionRule;
import com.vigil.alerting.runtime.evaluation.RuleContext;
import com.vigil.alerting.runtime.evaluation.RuleFiring;
import com.vigil.alerting.runtime.window.TimeWindow;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Counts authentication failures across all sources in a sliding window and fires
 * once the count reaches the limit. The window is emptied after firing so one burst
 * raises one alert. Overrides whatever already holds the slot.
 */
public final class BruteForceRule implements DetectionRule {

    private final String authFailureCategory;
    private final int failureLimit;
    private final Duration window;

    public BruteForceRule(EngineConfig config) {
        this.authFailureCategory = config.getAuthFailureCategory();
        this.failureLimit = config.getAuthFailureCount();
        this.window = config.getAuthFailureWindow();
    }

    @Override
    public String name() {
        return "brute-force";
    }

    @Override
    public Optional<RuleFiring> evaluate(RuleContext context) {
        Event event = context.event();
        if (!authFailureCategory.equals(event.category())) {
            return Optional.empty();
        }

        TimeWindow failures = context.state().authFailures();
        failures.evictOlderThan(event.timestamp(), window);
        failures.append(event.timestamp());
        if (failures.count() < failureLimit) {
            return Optional.empty();
        }

        failures.clear();
        String description = String.format(Locale.ROOT, "%d failed login attempts in %ds",
                failureLimit, window.toSeconds());
        return Optional.of(new RuleFiring(AlertCategory.BRUTE_FORCE, Severity.CRITICAL, description,
                event.originIp()));
    }
}
