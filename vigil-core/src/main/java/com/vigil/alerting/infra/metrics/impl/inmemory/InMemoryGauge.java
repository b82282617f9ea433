/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores the raw bits of the last value in an {@link AtomicLong}.
 */
final class InMemoryGauge implements Gauge {

    private final String key;
    private final AtomicLong bits = new AtomicLong(Double.doubleToRawLongBits(0.0));

    InMemoryGauge(String key) {
        this.key = key;
    }

    @Override
    public void set(double newValue) {
        bits.set(Double.doubleToRawLongBits(newValue));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{key='%s', value=%.2f}", key, value());
    }
}
