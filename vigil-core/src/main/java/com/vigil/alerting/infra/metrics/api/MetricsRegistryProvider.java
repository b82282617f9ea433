/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.api;

import com.vigil.alerting.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.vigil.alerting.infra.metrics.api.MetricsRegistryProvider}.
 * The provider with the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    /**
     * @return registry instance (must be thread-safe)
     */
    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
