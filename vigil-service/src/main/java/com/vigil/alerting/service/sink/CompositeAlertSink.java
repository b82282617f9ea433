/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.sink;

import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.model.Alert;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans an alert out to several sinks.
 *
 * <p>Every sink is tried even if an earlier one throws. If any failed, an
 * {@link IllegalStateException} carrying the failures as suppressed exceptions is
 * thrown after the last sink.
 */
public final class CompositeAlertSink implements AlertSink {

    private static final Logger logger = Logger.getLogger(CompositeAlertSink.class.getName());

    private final List<AlertSink> sinks;

    public CompositeAlertSink(List<AlertSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static CompositeAlertSink of(AlertSink... sinks) {
        return new CompositeAlertSink(List.of(sinks));
    }

    @Override
    public void publish(Alert alert) {
        List<RuntimeException> failures = new ArrayList<>();
        for (AlertSink sink : sinks) {
            try {
                sink.publish(alert);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Sink " + sink.getClass().getSimpleName()
                        + " failed for " + alert.alertId(), e);
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            IllegalStateException error = new IllegalStateException(
                    failures.size() + " of " + sinks.size() + " sinks failed for " + alert.alertId());
            failures.forEach(error::addSuppressed);
            throw error;
        }
    }

    public int size() {
        return sinks.size();
    }
}
