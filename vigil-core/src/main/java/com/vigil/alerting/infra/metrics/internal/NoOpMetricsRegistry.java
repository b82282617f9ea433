/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.internal;

import com.vigil.alerting.infra.metrics.Counter;
import com.vigil.alerting.infra.metrics.Gauge;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Registry used when no {@link com.vigil.alerting.infra.metrics.api.MetricsRegistryProvider}
 * is on the class path, and by components built without one (a standalone
 * {@code ActionDispatcher}, for instance).
 *
 * <p>The single instance doubles as every instrument it hands out: engine counters
 * such as {@code events_processed_total} stay at zero, {@code error_rate_alert_active}
 * reads 0.0, and timers still run the timed work and rethrow its failure.
 */
enum NoOpMetricsRegistry implements MetricsRegistry, Counter, Gauge, Timer {
    INSTANCE;

    @Override
    public Counter counter(String name, String... tags) {
        return this;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return this;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return this;
    }

    @Override
    public void increment() {
    }

    @Override
    public void increment(long amount) {
    }

    @Override
    public long count() {
        return 0L;
    }

    @Override
    public void set(double value) {
    }

    @Override
    public double value() {
        return 0.0;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        return callable.call();
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
    }

    @Override
    public Duration percentile(double percentile) {
        return Duration.ZERO;
    }

    @Override
    public String toString() {
        return "NoOpMetricsRegistry";
    }
}
