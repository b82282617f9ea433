/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.Counter;
import com.vigil.alerting.infra.metrics.Gauge;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for tests and local runs.
 *
 * <p>Each distinct name and tag combination gets its own instrument:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * AlertEngine engine = AlertEngine.builder().metrics(metrics).build();
 *
 * engine.process(event);
 *
 * assertThat(metrics.getCounterValue("events_processed_total")).isEqualTo(1L);
 * assertThat(metrics.getCounterValue("alerts_raised_total", "category", "brute_force")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    static String key(String name, String... tags) {
        if (tags.length == 0) {
            return name;
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + String.join(",", tags));
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
