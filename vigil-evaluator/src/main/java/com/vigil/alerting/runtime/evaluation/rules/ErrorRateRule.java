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
import com.vigil.alerting.runtime.evaluation.DetectionState;
import com.vigil.alerting.runtime.evaluation.RuleContext;
import com.vigil.alerting.runtime.evaluation.RuleFiring;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Error share over a sliding window of all events, with hysteresis.
 *
 * <p>Every event is appended to the global window, and error events to the error
 * window, before the rate is computed. Below {@code minSamples} events nothing
 * changes. At or above the threshold the first crossing fires, provided the slot is
 * free; the flag is raised either way, so a crossing swallowed by another alert does
 * not fire on the next event. Falling below the threshold clears the flag.
 */
public final class ErrorRateRule implements DetectionRule {

    private final Set<String> errorCategories;
    private final double threshold;
    private final Duration window;
    private final int minSamples;

    public ErrorRateRule(EngineConfig config) {
        this.errorCategories = config.getErrorCategories();
        this.threshold = config.getErrorRateThreshold();
        this.window = config.getErrorRateWindow();
        this.minSamples = config.getErrorRateMinSamples();
    }

    @Override
    public String name() {
        return "error-rate";
    }

    @Override
    public Optional<RuleFiring> evaluate(RuleContext context) {
        Event event = context.event();
        DetectionState state = context.state();

        state.allEvents().append(event.timestamp());
        state.allEvents().evictOlderThan(event.timestamp(), window);
        if (errorCategories.contains(event.category())) {
            state.errorEvents().append(event.timestamp());
        }
        state.errorEvents().evictOlderThan(event.timestamp(), window);

        int total = state.allEvents().count();
        if (total < minSamples) {
            return Optional.empty();
        }

        double rate = (double) state.errorEvents().count() / total;
        if (rate < threshold) {
            state.setErrorRateAlertActive(false);
            return Optional.empty();
        }

        boolean alreadyActive = state.isErrorRateAlertActive();
        state.setErrorRateAlertActive(true);
        if (alreadyActive || context.slotTaken()) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT, "Error rate %.2f%% over last %d events in %ds",
                rate * 100.0, total, window.toSeconds());
        return Optional.of(RuleFiring.of(AlertCategory.HIGH_ERROR_RATE, Severity.ERROR, description));
    }
}
