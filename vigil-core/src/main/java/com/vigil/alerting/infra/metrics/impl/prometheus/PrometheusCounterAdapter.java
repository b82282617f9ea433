/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.prometheus;

import com.vigil.alerting.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to a Prometheus counter child.
 *
 * <p>Each label value combination gets its own adapter:
 * <pre>{@code
 * io.prometheus.client.Counter alerts = io.prometheus.client.Counter.build()
 *     .name("alerts_raised_total")
 *     .help("Alerts raised")
 *     .labelNames("category")
 *     .register();
 *
 * Counter bruteForce = new PrometheusCounterAdapter(alerts, new String[]{"brute_force"});
 * bruteForce.increment();   // alerts_raised_total{category="brute_force"}
 * }</pre>
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    /**
     * @param counter     the Prometheus counter (parent, not yet bound to labels)
     * @param labelValues one value per label name, in declaration order
     * @throws IllegalArgumentException if labelValues is null or does not match the label names
     */
    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    /**
     * @throws IllegalArgumentException if amount is negative
     */
    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        // Prometheus stores doubles; counters only ever hold whole numbers here
        return (long) counter.get();
    }

    io.prometheus.client.Counter.Child getPrometheusCounter() {
        return counter;
    }

    @Override
    public String toString() {
        return String.format("PrometheusCounterAdapter{value=%d}", count());
    }
}
