/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.anomaly;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.vigil.alerting.api.AnomalyModel;
import com.vigil.alerting.api.OutlierDetector;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.infra.metrics.Gauge;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Tracer;

import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Lazily creates and holds one {@link AnomalyModel} per source id.
 *
 * <p>Backed by a Caffeine cache bounded by {@code anomaly.max.sources}; with a
 * non-zero {@code anomaly.idle.expiry.s} a model that has not seen a sample for that
 * long is dropped and rebuilt from scratch on the source's next event.
 */
public final class AnomalyModelRegistry {

    private static final Logger logger = Logger.getLogger(AnomalyModelRegistry.class.getName());

    private final Cache<String, AnomalyModel> models;
    private final EngineConfig config;
    private final MetricsRegistry metrics;
    private final Tracer tracer;
    private final Supplier<OutlierDetector> detectorFactory;
    private final Gauge activeModels;

    public AnomalyModelRegistry(EngineConfig config, MetricsRegistry metrics, Tracer tracer) {
        this(config, metrics, tracer, detectorFactory(config));
    }

    public AnomalyModelRegistry(EngineConfig config,
                                MetricsRegistry metrics,
                                Tracer tracer,
                                Supplier<OutlierDetector> detectorFactory) {
        this.config = config;
        this.metrics = metrics;
        this.tracer = tracer;
        this.detectorFactory = detectorFactory;
        this.activeModels = metrics.gauge("anomaly_models_active");

        Caffeine<String, AnomalyModel> builder = Caffeine.newBuilder()
                .maximumSize(config.getAnomalyMaxSources())
                .executor(Runnable::run)
                .removalListener((String key, AnomalyModel value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        logger.fine(() -> "Dropped anomaly model for " + key + " (" + cause + ")");
                    }
                });
        if (!config.getAnomalyIdleExpiry().isZero()) {
            builder.expireAfterAccess(config.getAnomalyIdleExpiry());
        }
        this.models = builder.build();
    }

    /**
     * Returns the model for a source, creating it on first sight.
     */
    public AnomalyModel modelFor(String sourceId) {
        AnomalyModel model = models.get(sourceId, this::create);
        activeModels.set(models.estimatedSize());
        return model;
    }

    public long activeModels() {
        models.cleanUp();
        return models.estimatedSize();
    }

    public void clear() {
        models.invalidateAll();
        models.cleanUp();
        activeModels.set(0);
    }

    private AnomalyModel create(String sourceId) {
        logger.fine(() -> "Creating anomaly model for " + sourceId);
        return new RollingAnomalyModel(
                sourceId,
                detectorFactory.get(),
                config.getAnomalyWindowSize(),
                config.getAnomalyMinFitSamples(),
                config.getAnomalyRetrainPeriod(),
                metrics,
                tracer);
    }

    /**
     * Detector supplier for the configured algorithm.
     */
    public static Supplier<OutlierDetector> detectorFactory(EngineConfig config) {
        return switch (config.getAnomalyDetector()) {
            case RANDOM_CUT_FOREST -> () -> new RandomCutForestDetector(config.getAnomalyTrees(),
                    config.getAnomalySampleSize(), config.getAnomalySeed(), config.getAnomalyScoreThreshold());
            case Z_SCORE -> () -> new ZScoreDetector(config.getAnomalyZScoreThreshold());
        };
    }
}
