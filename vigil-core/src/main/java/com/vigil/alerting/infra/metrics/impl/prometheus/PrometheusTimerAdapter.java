/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.prometheus;

import com.vigil.alerting.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram child. Durations are observed in seconds.
 *
 * <h3>PromQL Queries:</h3>
 * <pre>
 * # P99 event processing latency
 * histogram_quantile(0.99, rate(event_processing_seconds_bucket[5m]))
 *
 * # Events per second
 * rate(event_processing_seconds_count[5m])
 * </pre>
 *
 * <p>{@link #percentile(double)} is not supported; percentiles are computed server side.
 */
final class PrometheusTimerAdapter implements Timer {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / NANOS_PER_SECOND);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are calculated by the Prometheus server. "
                        + "Use histogram_quantile(%.2f, rate(metric_name_bucket[5m])), "
                        + "or InMemoryTimer for client-side percentiles.",
                percentile));
    }

    /**
     * @return number of observations so far
     */
    public long count() {
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }

    /**
     * @return sum of all observations in seconds
     */
    public double sum() {
        return histogram.get().sum;
    }

    io.prometheus.client.Histogram.Child getPrometheusHistogram() {
        return histogram;
    }

    @Override
    public String toString() {
        return String.format("PrometheusTimerAdapter{count=%d, sum=%.6fs}", count(), sum());
    }
}
