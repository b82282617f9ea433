/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.engine;

import com.vigil.alerting.api.ActionExecutor;
import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.IAlertEngine;
import com.vigil.alerting.api.OutlierDetector;
import com.vigil.alerting.api.exception.EventValidationException;
import com.vigil.alerting.api.model.ActionOutcome;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.EngineStats;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.RemediationAction;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.infra.metrics.Counter;
import com.vigil.alerting.infra.metrics.Gauge;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;
import com.vigil.alerting.runtime.actions.ActionDispatcher;
import com.vigil.alerting.runtime.alerting.AlertFactory;
import com.vigil.alerting.runtime.anomaly.AnomalyModelRegistry;
import com.vigil.alerting.runtime.evaluation.AnomalySample;
import com.vigil.alerting.runtime.evaluation.RuleEvaluator;
import com.vigil.alerting.runtime.evaluation.RuleFiring;
import com.vigil.alerting.runtime.validation.EventValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The event processing and alerting engine.
 *
 * <h2>Per-event flow</h2>
 * <ol>
 *   <li>Validate; a rejected event touches no state.</li>
 *   <li>Feed the source's anomaly model (per-source lock only).</li>
 *   <li>Update the shared windows and run the rules under the engine lock.</li>
 *   <li>On a firing: build the alert, dispatch its remediation, publish it.</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@link #process(Event)} may be called from several threads. Events of one source
 * must still arrive in order, which callers guarantee by routing each source to a
 * single thread. Dispatch and publishing happen outside the engine lock.
 *
 * <p>Sink failures are logged and counted and never undo the alert; action failures
 * end up in the {@link ActionOutcome} and never reach the caller.
 */
public final class AlertEngine implements IAlertEngine, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AlertEngine.class);

    // ════════════════════════════════════════════════════════════════════════════════
    // INSTANCE FIELDS
    // ════════════════════════════════════════════════════════════════════════════════

    private final EngineConfig config;
    private final EventValidator validator;
    private final RuleEvaluator evaluator;
    private final AlertFactory alertFactory;
    private final ActionDispatcher dispatcher;
    private final AlertSink sink;
    private final Tracer tracer;

    /** Guards the rule windows and the error-rate flag. */
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong eventsRejected = new AtomicLong();
    private final Map<AlertCategory, AtomicLong> alertsRaised = new EnumMap<>(AlertCategory.class);
    private volatile boolean errorRateAlertActive;

    private final MetricsRegistry metrics;
    private final Counter processedCounter;
    private final Counter rejectedCounter;
    private final Counter sinkFailures;
    private final Gauge errorRateGauge;
    private final Timer processingTimer;

    // ════════════════════════════════════════════════════════════════════════════════
    // CONSTRUCTORS
    // ════════════════════════════════════════════════════════════════════════════════

    private AlertEngine(Builder builder) {
        this.config = builder.config;
        this.metrics = builder.metrics;
        this.tracer = builder.tracer;
        this.sink = builder.sink;
        this.validator = new EventValidator();
        this.alertFactory = new AlertFactory(builder.clock);

        Supplier<OutlierDetector> detectors = builder.detectorFactory != null
                ? builder.detectorFactory
                : AnomalyModelRegistry.detectorFactory(config);
        this.evaluator = new RuleEvaluator(config, new AnomalyModelRegistry(config, metrics, tracer, detectors));
        this.dispatcher = new ActionDispatcher(builder.executor, builder.actionOverrides,
                config.getActionTimeout(), metrics, tracer);

        for (AlertCategory category : AlertCategory.values()) {
            alertsRaised.put(category, new AtomicLong());
        }
        this.processedCounter = metrics.counter("events_processed_total");
        this.rejectedCounter = metrics.counter("events_rejected_total");
        this.sinkFailures = metrics.counter("sink_failures_total");
        this.errorRateGauge = metrics.gauge("error_rate_alert_active");
        this.processingTimer = metrics.timer("event_processing");

        logger.info("AlertEngine initialized: {}", config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // IAlertEngine INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public Optional<Alert> process(Event event) {
        try {
            validator.validate(event);
        } catch (EventValidationException e) {
            eventsRejected.incrementAndGet();
            rejectedCounter.increment();
            logger.debug("Rejected event: {}", e.getMessage());
            throw e;
        }

        Span span = tracer.spanBuilder("process-event").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("event.source", event.sourceId());
            span.setAttribute("event.category", event.category());

            AnomalySample anomaly = evaluator.observeAnomaly(event);

            Optional<RuleFiring> firing;
            lock.lock();
            try {
                firing = evaluator.evaluate(event, anomaly);
                errorRateAlertActive = evaluator.state().isErrorRateAlertActive();
            } finally {
                lock.unlock();
            }
            eventsProcessed.incrementAndGet();
            processedCounter.increment();
            errorRateGauge.set(errorRateAlertActive ? 1.0 : 0.0);

            if (firing.isEmpty()) {
                return Optional.empty();
            }

            Alert alert = alertFactory.create(firing.get(), event);
            alertsRaised.get(alert.category()).incrementAndGet();
            metrics.counter("alerts_raised_total", "category", alert.category().name().toLowerCase(Locale.ROOT))
                    .increment();
            span.setAttribute("alert.id", alert.alertId());
            span.setAttribute("alert.category", alert.category().name());
            logger.info("{} [{}] {} (source={}, id={})", alert.title(), alert.severity(), alert.description(),
                    alert.sourceId(), alert.alertId());

            ActionOutcome outcome = dispatcher.dispatch(alert);
            if (!outcome.success()) {
                span.setAttribute("action.failed", true);
            }
            publish(alert);
            return Optional.of(alert);

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Event processing failed");
            throw e;
        } finally {
            processingTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    @Override
    public EngineStats stats() {
        Map<AlertCategory, Long> raised = new EnumMap<>(AlertCategory.class);
        alertsRaised.forEach((category, count) -> raised.put(category, count.get()));
        return new EngineStats(
                eventsProcessed.get(),
                eventsRejected.get(),
                raised,
                evaluator.anomalyModels().activeModels(),
                errorRateAlertActive);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LIFECYCLE AND ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        dispatcher.close();
        logger.info("AlertEngine closed after {} events", eventsProcessed.get());
    }

    private void publish(Alert alert) {
        try {
            sink.publish(alert);
        } catch (RuntimeException e) {
            sinkFailures.increment();
            logger.error("Alert sink failed for {}: {}", alert.alertId(), e.getMessage(), e);
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private MetricsRegistry metrics = MetricsRegistry.getInstance();
        private Tracer tracer = OpenTelemetry.noop().getTracer("com.vigil.alerting");
        private AlertSink sink = alert -> { };
        private ActionExecutor executor;
        private Clock clock = Clock.systemUTC();
        private Supplier<OutlierDetector> detectorFactory;
        private final Map<AlertCategory, RemediationAction> actionOverrides = new EnumMap<>(AlertCategory.class);

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder sink(AlertSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder actionExecutor(ActionExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Replaces the detector chosen by {@code anomaly.detector}.
         */
        public Builder detectorFactory(Supplier<OutlierDetector> detectorFactory) {
            this.detectorFactory = detectorFactory;
            return this;
        }

        public Builder action(AlertCategory category, RemediationAction action) {
            this.actionOverrides.put(category, action);
            return this;
        }

        public AlertEngine build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(metrics, "metrics must not be null");
            Objects.requireNonNull(tracer, "tracer must not be null");
            Objects.requireNonNull(sink, "sink must not be null");
            Objects.requireNonNull(executor, "actionExecutor must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            return new AlertEngine(this);
        }
    }
}
