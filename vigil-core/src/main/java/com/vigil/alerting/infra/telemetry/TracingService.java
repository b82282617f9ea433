/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry tracer for the alerting engine.
 *
 * <p>Spans are exported asynchronously by a batch processor so the per-event path
 * never blocks on export.
 *
 * <p>Configuration via environment variables (system properties with the same
 * name are used as fallback):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code otlp} or {@code logging} (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default depends on environment)</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 */
public final class TracingService {

    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.vigil.alerting";
    private static final String DEFAULT_SERVICE_NAME = "vigil-alerting";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    /**
     * Double-checked lazy initialization.
     */
    public static TracingService getInstance() {
        TracingService current = instance;
        if (current == null) {
            synchronized (LOCK) {
                current = instance;
                if (current == null) {
                    current = initialize();
                    instance = current;
                }
            }
        }
        return current;
    }

    /**
     * A tracing service that records nothing. Used by tests and benchmarks.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }
        try {
            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource())
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                            .setMaxQueueSize(8192)
                            .setMaxExportBatchSize(512)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, env=%s, sampler=%s",
                    getServiceName(), getEnvironment(), sampler.getDescription()));

            TracingService service = new TracingService(sdk, tracerProvider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
                .put(SERVICE_NAME, getServiceName())
                .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                .build()));
    }

    private static Sampler configureSampler() {
        String defaultRatio = switch (getEnvironment().toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        String raw = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio);
        double ratio;
        try {
            ratio = Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + raw + "', using " + defaultRatio);
            ratio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        if ("otlp".equals(exporterType)) {
            String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    /**
     * Drains buffered spans. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public void flush() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error flushing spans", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", getEnvOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String getEnvironment() {
        return getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
