/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.internal;

import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry NO_OP = NoOpMetricsRegistry.INSTANCE;

    public static final MetricsRegistry INSTANCE = discover();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    private static MetricsRegistry discover() {
        ServiceLoader<MetricsRegistryProvider> loader =
                ServiceLoader.load(MetricsRegistryProvider.class);

        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.info("No metrics provider found, using no-op registry");
            return NO_OP;
        }
        logger.info(String.format("Using metrics provider: %s (priority: %d)",
                provider.name(), provider.priority()));
        return provider.create();
    }
}
