/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration so tests can assert on counts and percentiles.
 */
final class InMemoryTimer implements Timer {

    private final String key;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String key) {
        this.key = key;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    /**
     * Linear interpolation between the two closest ranks.
     */
    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double index = (sorted.size() - 1) * p;
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted.get(lower);
        }
        long lowerNanos = sorted.get(lower).toNanos();
        long upperNanos = sorted.get(upper).toNanos();
        return Duration.ofNanos(lowerNanos + (long) ((upperNanos - lowerNanos) * (index - lower)));
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{key='%s', count=%d, p99=%s}",
                key, recordings.size(), percentile(0.99));
    }
}
