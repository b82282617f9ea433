/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.prometheus;

import com.vigil.alerting.infra.metrics.Gauge;

/**
 * Bridges {@link Gauge} to a Prometheus gauge child.
 *
 * <p>Used for values that go up and down, such as the number of live anomaly
 * models or the error-rate hysteresis flag (0 or 1). Last write wins.
 */
final class PrometheusGaugeAdapter implements Gauge {

    private final io.prometheus.client.Gauge.Child gauge;

    /**
     * @param gauge       the Prometheus gauge (parent, not yet bound to labels)
     * @param labelValues one value per label name, in declaration order
     * @throws IllegalArgumentException if labelValues is null or does not match the label names
     */
    PrometheusGaugeAdapter(io.prometheus.client.Gauge gauge, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.gauge = gauge.labels(labelValues);
    }

    @Override
    public void set(double value) {
        gauge.set(value);
    }

    @Override
    public double value() {
        return gauge.get();
    }

    public void increment() {
        gauge.inc();
    }

    public void decrement() {
        gauge.dec();
    }

    io.prometheus.client.Gauge.Child getPrometheusGauge() {
        return gauge;
    }

    @Override
    public String toString() {
        return String.format("PrometheusGaugeAdapter{value=%.2f}", value());
    }
}
