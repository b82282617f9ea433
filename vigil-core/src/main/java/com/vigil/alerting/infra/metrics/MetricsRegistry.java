/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics;

import com.vigil.alerting.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Components take a registry in their constructor; {@link #getInstance()} is the
 * process-wide default discovered via {@link java.util.ServiceLoader}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("alerts_raised_total", "category", "brute_force").increment();
 * }</pre>
 *
 * <p>Tags are flattened key-value pairs. The same name must always be used with the
 * same tag keys.
 */
public interface MetricsRegistry {

    /**
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter bound to the given tag values
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry.
     *
     * <p>Falls back to no-op if no provider is found.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * Registry that records nothing.
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
