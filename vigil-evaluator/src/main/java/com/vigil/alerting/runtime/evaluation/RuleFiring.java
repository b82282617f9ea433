/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.Severity;

import java.util.Objects;

/**
 * A rule's decision to raise an alert, before an {@code Alert} is built from it.
 *
 * @param offendingIp set only by rules that blame a network origin
 */
public record RuleFiring(AlertCategory category, Severity severity, String description, String offendingIp) {

    public RuleFiring {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }

    public static RuleFiring of(AlertCategory category, Severity severity, String description) {
        return new RuleFiring(category, severity, description, null);
    }
}
