/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api;

import com.vigil.alerting.api.model.Alert;

/**
 * Receives every alert the engine raises (storage, notification, fan-out).
 *
 * <p>Failures thrown from {@link #publish(Alert)} are logged by the engine and
 * never un-create the alert.
 */
@FunctionalInterface
public interface AlertSink {

    void publish(Alert alert);
}
