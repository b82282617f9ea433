/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.benchmarks;

import com.vigil.alerting.api.ActionExecutor;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.engine.AlertEngine;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.infra.config.EngineConfig.AnomalyDetectorType;
import com.vigil.alerting.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.vigil.alerting.service.source.SyntheticEventGenerator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event processing throughput of the full engine: validation, windows, per-source
 * anomaly models, rules, alert creation and a no-op action executor.
 *
 * <p>Usage:
 * <pre>
 * mvn clean package -pl vigil-benchmarks -am -DskipTests
 * java -jar vigil-benchmarks/target/benchmarks.jar EngineThroughputBenchmark
 * </pre>
 *
 * <p>{@code -Dbench.quick=true} shortens warmup and measurement when run via {@link #main}.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class EngineThroughputBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");
    private static final int EVENT_POOL_SIZE = 20_000;

    @Param({"RANDOM_CUT_FOREST", "Z_SCORE"})
    private String detector;

    private AlertEngine engine;
    private List<Event> eventPool;
    private final AtomicInteger eventIndex = new AtomicInteger();

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.vigil.alerting").setLevel(java.util.logging.Level.OFF);
        java.util.logging.Logger.getLogger("io.opentelemetry").setLevel(java.util.logging.Level.OFF);

        EngineConfig config = EngineConfig.builder()
                .anomalyDetector(AnomalyDetectorType.valueOf(detector))
                .anomalySeed(42L)
                .actionTimeout(Duration.ZERO)
                .build();
        engine = AlertEngine.builder()
                .config(config)
                .metrics(new InMemoryMetricsRegistry())
                .tracer(NOOP_TRACER)
                .actionExecutor(new NoOpActionExecutor())
                .build();
        eventPool = generateEvents(EVENT_POOL_SIZE);
    }

    @Setup(Level.Iteration)
    public void setupIteration() {
        eventIndex.set(0);
    }

    @TearDown(Level.Trial)
    public void teardownTrial() {
        System.out.printf("%n[%s] %s%n", detector, engine.stats());
        engine.close();
    }

    /**
     * Single-threaded processing, one event per operation.
     */
    @Benchmark
    public Optional<Alert> process_single() {
        return engine.process(nextEvent());
    }

    /**
     * Batches of 100 events.
     */
    @Benchmark
    public void process_batch100(Blackhole bh) {
        for (int i = 0; i < 100; i++) {
            bh.consume(engine.process(nextEvent()));
        }
    }

    /**
     * Four producers contending for the rule lock. Per-source order is not kept here.
     */
    @Benchmark
    @Threads(4)
    public Optional<Alert> process_concurrent() {
        return engine.process(nextEvent());
    }

    private Event nextEvent() {
        return eventPool.get(Math.floorMod(eventIndex.getAndIncrement(), eventPool.size()));
    }

    private static List<Event> generateEvents(int count) {
        Instant start = Instant.parse("2025-01-01T00:00:00Z");
        SyntheticEventGenerator generator = new SyntheticEventGenerator(42L, Clock.fixed(start, ZoneOffset.UTC));
        List<Event> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Event e = generator.next();
            // 100ms apart so the 60s windows hold a realistic number of events
            events.add(new Event(start.plusMillis(100L * i), e.sourceId(), e.category(), e.level(),
                    e.numericFields(), e.correlationId(), e.originIp()));
        }
        return events;
    }

    private static final class NoOpActionExecutor implements ActionExecutor {
        @Override
        public void scaleOut(String sourceId) {
        }

        @Override
        public void blockSource(String ip) {
        }

        @Override
        public void restart(String sourceId) {
        }

        @Override
        public void captureDiagnosticsAndRestart(String sourceId) {
        }

        @Override
        public void notify(Alert alert) {
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(EngineThroughputBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .build();
        new Runner(options).run();
    }
}
