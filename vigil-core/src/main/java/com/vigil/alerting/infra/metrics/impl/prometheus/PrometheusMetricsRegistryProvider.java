/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.prometheus;

import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed provider, registered in {@code META-INF/services}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
