/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service;

import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.exception.EventValidationException;
import com.vigil.alerting.api.model.EngineStats;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.EventLevel;
import com.vigil.alerting.engine.AlertEngine;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.vigil.alerting.infra.telemetry.TracingService;
import com.vigil.alerting.service.actions.LoggingActionExecutor;
import com.vigil.alerting.service.ingest.SourcePartitionedIngestor;
import com.vigil.alerting.service.repository.AlertSummary;
import com.vigil.alerting.service.repository.EventLogRepository;
import com.vigil.alerting.service.repository.InMemoryAlertRepository;
import com.vigil.alerting.service.repository.InMemoryEventLogRepository;
import com.vigil.alerting.service.sink.CompositeAlertSink;
import com.vigil.alerting.service.sink.JsonLinesAlertSink;
import com.vigil.alerting.service.sink.LoggingAlertSink;
import com.vigil.alerting.service.source.EventDocument;
import com.vigil.alerting.service.source.JsonLinesEventReader;
import com.vigil.alerting.service.source.SyntheticEventGenerator;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Runs the alerting engine against simulated traffic or a recorded JSON-lines file.
 *
 * <p>Configured through system properties:
 * <ul>
 *   <li>{@code vigil.config} engine properties file (default {@code engine.properties})</li>
 *   <li>{@code vigil.input} replay this JSON-lines file instead of simulating</li>
 *   <li>{@code vigil.duration.seconds} stop the simulation after this long (default: run until stopped)</li>
 *   <li>{@code vigil.min.interval.ms} / {@code vigil.max.interval.ms} delay between simulated events</li>
 *   <li>{@code vigil.seed} seed for the simulator</li>
 *   <li>{@code vigil.alerts.out} append alerts as JSON lines to this file</li>
 *   <li>{@code vigil.metrics.out} write Prometheus text-format metrics here on exit</li>
 *   <li>{@code vigil.action.latency.ms} simulated remediation latency (default 0)</li>
 *   <li>{@code vigil.ingest.lanes} parallel lanes for replay (default 4)</li>
 * </ul>
 */
public class VigilApplication {
    private static final Logger logger = Logger.getLogger(VigilApplication.class.getName());

    private final Settings settings;
    private final InMemoryAlertRepository repository = new InMemoryAlertRepository();
    private final EventLogRepository eventLog = new InMemoryEventLogRepository();
    private final List<AutoCloseable> closeables = new ArrayList<>();
    private volatile boolean running = true;

    private AlertEngine engine;

    VigilApplication(Settings settings) {
        this.settings = settings;
    }

    public static void main(String[] args) {
        configureLogging();
        VigilApplication app = new VigilApplication(Settings.from(System.getProperties()));
        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            try {
                main.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        try {
            app.run();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    void run() throws IOException, InterruptedException {
        logger.info("Starting Vigil alerting engine");
        EngineConfig config = settings.configPath()
                .map(EngineConfig::loadFromProperties)
                .orElseGet(EngineConfig::loadDefault);
        TracingService tracing = TracingService.getInstance();
        MetricsRegistry metrics = MetricsRegistry.getInstance();
        logger.info("Tracing " + (tracing.isEnabled() ? "enabled" : "disabled"));

        List<AlertSink> sinks = new ArrayList<>(List.of(repository, new LoggingAlertSink()));
        if (settings.alertsOut().isPresent()) {
            JsonLinesAlertSink jsonSink = JsonLinesAlertSink.appendingTo(settings.alertsOut().get());
            closeables.add(jsonSink);
            sinks.add(jsonSink);
        }

        engine = AlertEngine.builder()
                .config(config)
                .metrics(metrics)
                .tracer(tracing.getTracer())
                .sink(new CompositeAlertSink(sinks))
                .actionExecutor(new LoggingActionExecutor(settings.actionLatency()))
                .build();

        try {
            if (settings.input().isPresent()) {
                replay(settings.input().get());
            } else {
                simulate();
            }
        } finally {
            report();
            writeMetrics(metrics);
            engine.close();
            closeAll();
            tracing.flush();
        }
    }

    void stop() {
        running = false;
    }

    InMemoryAlertRepository repository() {
        return repository;
    }

    EventLogRepository eventLog() {
        return eventLog;
    }

    Optional<EngineStats> stats() {
        return Optional.ofNullable(engine).map(AlertEngine::stats);
    }

    private void simulate() throws InterruptedException {
        Random jitter = settings.seed().map(Random::new).orElseGet(Random::new);
        SyntheticEventGenerator generator = settings.seed()
                .map(seed -> new SyntheticEventGenerator(seed, Clock.systemUTC()))
                .orElseGet(SyntheticEventGenerator::new);
        long deadline = settings.duration()
                .map(d -> System.nanoTime() + d.toNanos())
                .orElse(Long.MAX_VALUE);

        settings.duration().ifPresent(d -> logger.info("Running simulation for " + d.toSeconds() + "s"));
        while (running && System.nanoTime() < deadline) {
            EventDocument document = generator.nextDocument();
            Event event = document.toEvent();
            if (event.level() != EventLevel.INFO) {
                logger.info(() -> "[" + document.timestamp() + "] " + document.level() + ": " + document.message());
            }
            engine.process(event);
            eventLog.record(event);

            long minMs = settings.minInterval().toMillis();
            long maxMs = settings.maxInterval().toMillis();
            Thread.sleep(minMs + (maxMs > minMs ? (long) (jitter.nextDouble() * (maxMs - minMs)) : 0L));
        }
        logger.info(running ? "Time limit reached" : "Simulation stopped");
    }

    private void replay(Path input) {
        JsonLinesEventReader reader = new JsonLinesEventReader();
        List<Event> events = reader.readAll(input);

        List<CompletableFuture<?>> pending = new ArrayList<>(events.size());
        try (SourcePartitionedIngestor ingestor = new SourcePartitionedIngestor(engine, settings.ingestLanes())) {
            for (Event event : events) {
                if (!running) {
                    break;
                }
                pending.add(ingestor.submit(event).thenApply(result -> {
                    eventLog.record(event);
                    return result;
                }).exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof EventValidationException) {
                        logger.warning(cause.getMessage());
                    } else {
                        logger.log(Level.SEVERE, "Event processing failed", cause);
                    }
                    return Optional.empty();
                }));
            }
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
        }
        logger.info("Replayed " + pending.size() + " events from " + input);
    }

    private void report() {
        EngineStats stats = engine.stats();
        AlertSummary summary = repository.summary();
        logger.info(String.format(
                "Processed %d events (%d rejected, %d logged), raised %d alerts: %s; %d critical, %d open; top source %s (%d); %d anomaly models",
                stats.eventsProcessed(), stats.eventsRejected(), eventLog.count(), stats.totalAlerts(), stats.alertsRaised(),
                summary.criticalAlerts(), summary.openAlerts(),
                summary.topSource(), summary.topSourceAlerts(), stats.activeAnomalyModels()));
    }

    private void writeMetrics(MetricsRegistry metrics) throws IOException {
        if (settings.metricsOut().isEmpty()) {
            return;
        }
        CollectorRegistry registry = metrics instanceof PrometheusMetricsRegistry prometheus
                ? prometheus.getCollectorRegistry()
                : CollectorRegistry.defaultRegistry;
        Path out = settings.metricsOut().get();
        try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            TextFormat.write004(writer, registry.metricFamilySamples());
        }
        logger.info("Metrics written to " + out.toAbsolutePath());
    }

    private void closeAll() {
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to close " + closeable, e);
            }
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = VigilApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    /**
     * Launch settings read from system properties.
     */
    record Settings(
            Optional<String> configPath,
            Optional<Path> input,
            Optional<Duration> duration,
            Duration minInterval,
            Duration maxInterval,
            Optional<Long> seed,
            Optional<Path> alertsOut,
            Optional<Path> metricsOut,
            Duration actionLatency,
            int ingestLanes) {

        static Settings from(Properties props) {
            Duration min = Duration.ofMillis(Math.max(10L, longValue(props, "vigil.min.interval.ms", 100L)));
            Duration max = Duration.ofMillis(longValue(props, "vigil.max.interval.ms", 500L));
            if (max.compareTo(min) < 0) {
                max = min;
            }
            int lanes = (int) longValue(props, "vigil.ingest.lanes", 4L);
            if (lanes < 1) {
                throw new IllegalArgumentException("vigil.ingest.lanes must be >= 1: " + lanes);
            }
            return new Settings(
                    text(props, "vigil.config"),
                    text(props, "vigil.input").map(Path::of),
                    text(props, "vigil.duration.seconds").map(v -> Duration.ofSeconds(parse("vigil.duration.seconds", v))),
                    min,
                    max,
                    text(props, "vigil.seed").map(v -> parse("vigil.seed", v)),
                    text(props, "vigil.alerts.out").map(Path::of),
                    text(props, "vigil.metrics.out").map(Path::of),
                    Duration.ofMillis(longValue(props, "vigil.action.latency.ms", 0L)),
                    lanes);
        }

        private static Optional<String> text(Properties props, String key) {
            String value = props.getProperty(key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        private static long longValue(Properties props, String key, long defaultValue) {
            return text(props, key).map(v -> parse(key, v)).orElse(defaultValue);
        }

        private static long parse(String key, String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
            }
        }
    }
}
