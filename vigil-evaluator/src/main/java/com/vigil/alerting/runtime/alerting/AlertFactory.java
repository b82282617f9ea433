/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.alerting;

import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.runtime.evaluation.RuleFiring;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds {@link Alert}s from rule firings.
 *
 * <p>Ids are {@code alert-} followed by a random UUID in hex without dashes. The
 * creation time comes from the clock, never from the event.
 */
public final class AlertFactory {

    static final String ID_PREFIX = "alert-";

    private final Clock clock;

    public AlertFactory() {
        this(Clock.systemUTC());
    }

    public AlertFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Alert create(RuleFiring firing, Event source) {
        return create(firing.category(), firing.severity(), firing.description(), source, firing.offendingIp());
    }

    public Alert create(AlertCategory category,
                        Severity severity,
                        String description,
                        Event source,
                        String offendingIp) {
        Objects.requireNonNull(source, "source event must not be null");
        return new Alert(
                newId(),
                category,
                severity,
                description,
                source.sourceId(),
                source.correlationId(),
                offendingIp,
                source.timestamp(),
                clock.instant());
    }

    private static String newId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
