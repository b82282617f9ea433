/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registered from test resources so tests win over Prometheus.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
