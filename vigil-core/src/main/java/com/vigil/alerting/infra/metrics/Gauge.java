/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics;

/**
 * Last-value-wins measurement. Thread-safe.
 */
public interface Gauge {

    void set(double value);

    double value();
}
