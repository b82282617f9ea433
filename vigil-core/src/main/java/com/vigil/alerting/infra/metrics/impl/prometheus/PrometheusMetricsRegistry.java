/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.prometheus;

import com.vigil.alerting.infra.metrics.Counter;
import com.vigil.alerting.infra.metrics.Gauge;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Prometheus implementation of {@link MetricsRegistry}. Thread-safe.
 *
 * <p>One collector is registered per metric name; each tag value combination is a
 * child of that collector.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS =
            {0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0};

    private final CollectorRegistry registry;
    private final Map<String, Collector> collectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    public CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Counter parent = collector(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(parent, labelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Gauge parent = collector(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(parent, labelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Histogram parent = collector(name, n ->
                    io.prometheus.client.Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Latency of " + n)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(parent, labelValues(tags));
        });
    }

    @SuppressWarnings("unchecked")
    private <C extends Collector> C collector(String name, Function<String, C> factory) {
        return (C) collectors.computeIfAbsent(name, factory::apply);
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String key(String name, String[] tags) {
        return name + Arrays.toString(tags);
    }

    private static String[] labelNames(String[] tags) {
        requirePairs(tags);
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        requirePairs(tags);
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private static void requirePairs(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + Arrays.toString(tags));
        }
    }
}
